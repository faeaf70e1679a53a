package com.flamingo.ai.climatechat.domain.enums;

/** Speaker of a line in a formatted conversation transcript. */
public enum MessageRole {
  /** Message from the user. */
  USER("User"),

  /** Message from the assistant. */
  ASSISTANT("Assistant");

  private final String label;

  MessageRole(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
