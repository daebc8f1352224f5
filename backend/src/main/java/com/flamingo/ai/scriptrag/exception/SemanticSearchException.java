package com.flamingo.ai.scriptrag.exception;

/** Exception thrown when semantic enhancement of search results fails. */
public class SemanticSearchException extends RuntimeException {

  public SemanticSearchException(String message) {
    super(message);
  }

  public SemanticSearchException(String message, Throwable cause) {
    super(message, cause);
  }
}
