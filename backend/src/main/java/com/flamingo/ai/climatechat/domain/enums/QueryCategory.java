package com.flamingo.ai.climatechat.domain.enums;

import java.util.Locale;
import java.util.Optional;

/** Topic classification of a query in conversational context. */
public enum QueryCategory {
  ON_TOPIC("on-topic"),
  OFF_TOPIC("off-topic"),
  HARMFUL("harmful");

  private final String label;

  QueryCategory(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  public static Optional<QueryCategory> fromLabel(String label) {
    if (label == null) {
      return Optional.empty();
    }
    String normalized = label.trim().toLowerCase(Locale.ROOT);
    for (QueryCategory category : values()) {
      if (category.label.equals(normalized)) {
        return Optional.of(category);
      }
    }
    return Optional.empty();
  }
}
