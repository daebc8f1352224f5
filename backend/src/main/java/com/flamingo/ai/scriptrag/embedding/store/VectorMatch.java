package com.flamingo.ai.scriptrag.embedding.store;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * A single similarity hit.
 *
 * @param entityId id of the matched entity
 * @param score similarity score, higher is closer
 * @param metadata metadata stored with the vector, never null
 */
public record VectorMatch(long entityId, double score, Map<String, Object> metadata) {

  public VectorMatch {
    metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(metadata));
  }
}
