package com.flamingo.ai.climatechat.exception;

/** Exception thrown when the generation model fails to produce an answer. */
public class LlmServiceException extends RuntimeException {

  private final boolean rateLimited;
  private final String userMessage;

  public LlmServiceException(String message) {
    this(message, null, false);
  }

  public LlmServiceException(String message, Throwable cause) {
    this(message, cause, isRateLimit(cause));
  }

  private LlmServiceException(String message, Throwable cause, boolean rateLimited) {
    super(message, cause);
    this.rateLimited = rateLimited;
    this.userMessage =
        rateLimited
            ? "Service is temporarily busy. Please try again in a moment."
            : "AI service is temporarily unavailable. Please try again later.";
  }

  private static boolean isRateLimit(Throwable cause) {
    return cause != null
        && cause.getMessage() != null
        && (cause.getMessage().contains("429") || cause.getMessage().contains("rate limit"));
  }

  public boolean isRateLimited() {
    return rateLimited;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
