package com.flamingo.ai.climatechat.domain.model;

import java.util.Locale;

/**
 * A user query fixed for the duration of one pipeline run.
 *
 * @param raw the text as submitted
 * @param languageCode the resolved ISO 639 language code
 * @param normalized trimmed, lower-cased text used for cache keys
 */
public record Query(String raw, String languageCode, String normalized) {

  public static Query of(String raw, String languageCode) {
    return new Query(raw, languageCode, normalize(raw));
  }

  public static String normalize(String text) {
    return text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
  }

  /** Cache key in the form {@code <code>:<normalized query>}. */
  public String cacheKey() {
    return languageCode + ":" + normalized;
  }
}
