package com.flamingo.ai.scriptrag.embedding.batch;

import java.util.Map;

/**
 * One text queued for embedding.
 *
 * @param id caller-chosen identifier echoed back on the result
 * @param text the text to embed
 * @param metadata optional caller metadata, may be null
 */
public record BatchItem(String id, String text, Map<String, Object> metadata) {

  public BatchItem(String id, String text) {
    this(id, text, null);
  }
}
