package com.flamingo.ai.scriptrag.search.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** SQL text with positional {@code ?} parameters. Parameters may be null. */
public record SqlQuery(String sql, List<Object> params) {

  public SqlQuery {
    params = Collections.unmodifiableList(new ArrayList<>(params));
  }

  public Object[] paramArray() {
    return params.toArray();
  }
}
