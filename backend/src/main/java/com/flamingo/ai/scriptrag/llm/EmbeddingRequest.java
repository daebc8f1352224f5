package com.flamingo.ai.scriptrag.llm;

import java.util.List;

/**
 * Request for one or more embeddings.
 *
 * @param model embedding model name
 * @param input texts to embed, in order
 * @param dimensions requested output dimensions, or null for the model default
 */
public record EmbeddingRequest(String model, List<String> input, Integer dimensions) {

  public EmbeddingRequest {
    input = List.copyOf(input);
  }
}
