package com.flamingo.ai.scriptrag.exception;

/** Thrown by vector stores that do not offer similarity search. */
public class UnsupportedSearchException extends UnsupportedOperationException {

  public UnsupportedSearchException(String storeName) {
    super(storeName + " does not support similarity search");
  }
}
