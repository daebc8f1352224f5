package com.flamingo.ai.scriptrag.exception;

/** Exception thrown when the embedding provider reports an error or returns no vector. */
public class EmbeddingGenerationException extends RuntimeException {

  private final String userMessage;

  public EmbeddingGenerationException(String message) {
    super(message);
    this.userMessage = "Embedding service is temporarily unavailable. Please try again later.";
  }

  public EmbeddingGenerationException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Embedding service is temporarily unavailable. Please try again later.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
