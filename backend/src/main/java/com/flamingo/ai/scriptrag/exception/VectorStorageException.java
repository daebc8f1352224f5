package com.flamingo.ai.scriptrag.exception;

/** Exception thrown when persisting or removing an embedding fails at the storage layer. */
public class VectorStorageException extends RuntimeException {

  public VectorStorageException(String message) {
    super(message);
  }

  public VectorStorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
