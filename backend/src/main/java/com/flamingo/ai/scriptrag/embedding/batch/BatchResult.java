package com.flamingo.ai.scriptrag.embedding.batch;

import java.util.Map;

/**
 * Outcome for one {@link BatchItem}: either an embedding or an error, never both.
 *
 * @param id the item id
 * @param embedding the vector, null on failure
 * @param error failure description, null on success
 * @param metadata the item's metadata
 */
public record BatchResult(
    String id, float[] embedding, String error, Map<String, Object> metadata) {

  public BatchResult {
    if ((embedding == null) == (error == null)) {
      throw new IllegalArgumentException("BatchResult needs exactly one of embedding or error");
    }
  }

  public static BatchResult success(BatchItem item, float[] embedding) {
    return new BatchResult(item.id(), embedding, null, item.metadata());
  }

  public static BatchResult failure(BatchItem item, String error) {
    return new BatchResult(
        item.id(), null, error == null ? "Unknown error" : error, item.metadata());
  }

  public boolean isSuccess() {
    return embedding != null;
  }
}
