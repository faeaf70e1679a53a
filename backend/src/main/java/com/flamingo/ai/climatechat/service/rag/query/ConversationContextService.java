package com.flamingo.ai.climatechat.service.rag.query;

import com.flamingo.ai.climatechat.domain.model.ConversationTurn;
import java.util.List;

/**
 * Resolves queries that depend on earlier turns. Classifies the query in context and, when it is
 * on-topic, rewrites it into a standalone question for retrieval.
 */
public interface ConversationContextService {

  /**
   * Classifies and, if on-topic, rewrites a query.
   *
   * @param history prior turns, oldest first
   * @param query the query in the pivot language
   * @return an on-topic result carrying the query to use, or an off-topic/harmful rejection
   */
  ContextRewriteResult classifyAndRewrite(List<ConversationTurn> history, String query);
}
