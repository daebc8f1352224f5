package com.flamingo.ai.scriptrag.exception;

/** Exception thrown when a stored embedding payload is structurally invalid. */
public class EmbeddingDecodeException extends RuntimeException {

  /** Structural defect found in the payload. */
  public enum Reason {
    TOO_SHORT,
    ZERO_DIMENSION,
    DIMENSION_TOO_LARGE,
    SIZE_MISMATCH
  }

  private final Reason reason;

  public EmbeddingDecodeException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public Reason getReason() {
    return reason;
  }
}
