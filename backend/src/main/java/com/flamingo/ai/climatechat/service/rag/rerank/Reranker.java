package com.flamingo.ai.climatechat.service.rag.rerank;

import com.flamingo.ai.climatechat.domain.model.Document;
import java.util.List;

/**
 * Second-pass relevance ordering of retrieved documents. Ordering is best-effort: implementations
 * never fail the caller and fall back to the incoming order when scoring is unavailable.
 */
public interface Reranker {

  /**
   * Reranks documents by relevance to the query and returns the top K.
   *
   * @param query the search query
   * @param documents candidates in retrieval order
   * @param topK number of results to return
   * @return at most topK documents carrying their relevance scores, best first
   */
  List<Document> rerank(String query, List<Document> documents, int topK);
}
