package com.flamingo.ai.climatechat.service.guard;

/**
 * Outcome of the topic/safety gate. A rejection is a normal result, not an error.
 *
 * @param passed whether the query may proceed
 * @param reason which rule decided
 * @param score confidence behind the decision (similarity or classifier score; 1.0 for keyword
 *     rules)
 */
public record TopicCheckResult(boolean passed, Reason reason, double score) {

  /** Why the gate decided as it did. */
  public enum Reason {
    HARMFUL_CONTENT("harmful_content"),
    MISINFORMATION("misinformation"),
    SEMANTIC_SIMILARITY("semantic_similarity"),
    CLIMATE_RELATED("climate_related"),
    NOT_CLIMATE_RELATED("not_climate_related"),
    /** The classifier failed and the query was let through. */
    CLASSIFIER_UNAVAILABLE("classifier_unavailable");

    private final String code;

    Reason(String code) {
      this.code = code;
    }

    public String code() {
      return code;
    }
  }

  public static TopicCheckResult pass(Reason reason, double score) {
    return new TopicCheckResult(true, reason, score);
  }

  public static TopicCheckResult reject(Reason reason, double score) {
    return new TopicCheckResult(false, reason, score);
  }
}
