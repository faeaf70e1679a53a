package com.flamingo.ai.climatechat.service.rag.query;

import com.flamingo.ai.climatechat.domain.enums.QueryCategory;

/**
 * Outcome of conversational classification and rewriting.
 *
 * @param category how the query was classified in context
 * @param query the query to retrieve with: rewritten when on-topic, the original otherwise
 * @param reasoning the classifier's explanation, if any
 * @param rewritten whether {@code query} differs from what the user typed
 */
public record ContextRewriteResult(
    QueryCategory category, String query, String reasoning, boolean rewritten) {

  public static ContextRewriteResult rewritten(String query, String reasoning) {
    return new ContextRewriteResult(QueryCategory.ON_TOPIC, query, reasoning, true);
  }

  public static ContextRewriteResult unchanged(String query, String reasoning) {
    return new ContextRewriteResult(QueryCategory.ON_TOPIC, query, reasoning, false);
  }

  public static ContextRewriteResult rejected(
      QueryCategory category, String query, String reasoning) {
    return new ContextRewriteResult(category, query, reasoning, false);
  }

  public boolean accepted() {
    return category == QueryCategory.ON_TOPIC;
  }
}
