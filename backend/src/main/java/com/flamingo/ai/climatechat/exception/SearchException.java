package com.flamingo.ai.climatechat.exception;

/** Exception thrown when the document index or the embedding service cannot be queried. */
public class SearchException extends RuntimeException {

  private final String userMessage;

  public SearchException(String message) {
    super(message);
    this.userMessage = "Search is temporarily unavailable. Please try again.";
  }

  public SearchException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Search is temporarily unavailable. Please try again.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
