package com.flamingo.ai.climatechat.exception;

import java.util.List;

/** Thrown when a language name cannot be resolved to a supported language code. */
public class UnsupportedLanguageException extends RuntimeException {

  private final String languageName;
  private final List<String> availableLanguages;

  public UnsupportedLanguageException(String languageName, List<String> availableLanguages) {
    super(
        "Unsupported language: '"
            + languageName
            + "'. Available languages: "
            + String.join(", ", availableLanguages));
    this.languageName = languageName;
    this.availableLanguages = List.copyOf(availableLanguages);
  }

  public String getLanguageName() {
    return languageName;
  }

  public List<String> getAvailableLanguages() {
    return availableLanguages;
  }
}
