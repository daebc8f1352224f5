package com.flamingo.ai.scriptrag.search.query;

import com.flamingo.ai.scriptrag.search.model.SearchQuery;

/** Translates a {@link SearchQuery} into SQL for the screenplay schema. */
public interface QueryBuilder {

  /** One page of scene rows, honouring limit and offset. */
  SqlQuery buildSearchQuery(SearchQuery query);

  /** Single row with column {@code total}: distinct scenes matching the filters. */
  SqlQuery buildCountQuery(SearchQuery query);

  /** One page of bible chunk rows. */
  SqlQuery buildBibleSearchQuery(SearchQuery query);

  /** Single row with column {@code total}: bible chunks matching the filters. */
  SqlQuery buildBibleCountQuery(SearchQuery query);
}
