package com.flamingo.ai.scriptrag.llm;

import java.util.List;

/**
 * Provider reply. {@code data} holds one entry per successfully embedded input.
 *
 * @param model model that served the request
 * @param data embeddings, each tagged with the index of its input
 * @param usage token accounting, may be null
 */
public record EmbeddingResponse(String model, List<EmbeddingData> data, Usage usage) {

  public EmbeddingResponse {
    data = data == null ? List.of() : List.copyOf(data);
  }

  /**
   * @param index position of the input this embedding belongs to
   * @param embedding the vector
   */
  public record EmbeddingData(int index, float[] embedding) {}

  public record Usage(int promptTokens, int totalTokens) {}
}
