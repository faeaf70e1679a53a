package com.flamingo.ai.climatechat.exception;

/** Thrown when text cannot be translated between the user's language and the pivot language. */
public class TranslationException extends RuntimeException {

  private final String sourceLanguage;
  private final String targetLanguage;

  public TranslationException(
      String sourceLanguage, String targetLanguage, String message, Throwable cause) {
    super(message, cause);
    this.sourceLanguage = sourceLanguage;
    this.targetLanguage = targetLanguage;
  }

  public String getSourceLanguage() {
    return sourceLanguage;
  }

  public String getTargetLanguage() {
    return targetLanguage;
  }

  public String getUserMessage() {
    return "Sorry, I couldn't translate your message. Please try again or ask in English.";
  }
}
