package com.flamingo.ai.scriptrag.embedding.dimension;

/**
 * Known properties of an embedding model.
 *
 * @param name model name as sent to the provider
 * @param dimensions default output dimensions
 * @param maxTokens input token limit, or null if unknown
 * @param supportsCustomDimensions whether the provider accepts a {@code dimensions} parameter
 * @param minCustomDimensions lower bound for custom dimensions, or null
 * @param maxCustomDimensions upper bound for custom dimensions, or null
 */
public record ModelInfo(
    String name,
    int dimensions,
    Integer maxTokens,
    boolean supportsCustomDimensions,
    Integer minCustomDimensions,
    Integer maxCustomDimensions) {

  public static ModelInfo fixed(String name, int dimensions) {
    return new ModelInfo(name, dimensions, null, false, null, null);
  }
}
