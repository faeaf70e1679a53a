package com.flamingo.ai.climatechat.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One completed question/answer exchange. History is an ordered list of turns owned by the caller;
 * the pipeline only reads it.
 *
 * @param query the question as the user asked it
 * @param answer the answer returned for that question
 * @param languageCode ISO 639 code of the language the exchange happened in
 * @param timestamp when the turn was completed
 */
public record ConversationTurn(
    String query, String answer, String languageCode, Instant timestamp) {

  public ConversationTurn {
    Objects.requireNonNull(query, "query");
    Objects.requireNonNull(answer, "answer");
    languageCode = languageCode == null ? "en" : languageCode;
    timestamp = timestamp == null ? Instant.now() : timestamp;
  }

  public static ConversationTurn of(String query, String answer, String languageCode) {
    return new ConversationTurn(query, answer, languageCode, Instant.now());
  }
}
