package com.flamingo.ai.scriptrag.exception;

/**
 * Exception thrown when the structural search path cannot run at all, e.g. the script database is
 * unreachable or the query builder rejects the query.
 */
public class SearchException extends RuntimeException {

  private static final String DEFAULT_USER_MESSAGE =
      "Script search is unavailable. Check the database configuration.";

  private final String userMessage;

  public SearchException(String message, Throwable cause) {
    this(message, DEFAULT_USER_MESSAGE, cause);
  }

  public SearchException(String message, String userMessage, Throwable cause) {
    super(message, cause);
    this.userMessage = userMessage;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
