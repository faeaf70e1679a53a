package com.flamingo.ai.climatechat.exception;

/** Thrown when an answer is requested without any usable supporting document. */
public class NoEvidenceException extends RuntimeException {

  public NoEvidenceException(String message) {
    super(message);
  }

  public String getUserMessage() {
    return "I couldn't find enough information to answer that question. Please try rephrasing it.";
  }
}
