package com.flamingo.ai.climatechat.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;
import java.util.List;

/** A previously computed answer stored under a {@code language:query} key. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CacheEntry(
    String answer, List<Citation> citations, Double faithfulness, Metadata metadata) {

  /** Faithfulness reported for entries written without a score. */
  public static final double DEFAULT_FAITHFULNESS = 0.8;

  public CacheEntry {
    citations = citations == null ? List.of() : List.copyOf(citations);
  }

  public double faithfulnessOrDefault() {
    return faithfulness == null ? DEFAULT_FAITHFULNESS : faithfulness;
  }

  /** Bookkeeping stored alongside the answer. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Metadata(
      Instant cachedAt, String languageCode, long processingTimeMs, boolean requiredTranslation) {}
}
