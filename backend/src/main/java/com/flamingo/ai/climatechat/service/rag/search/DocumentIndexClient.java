package com.flamingo.ai.climatechat.service.rag.search;

import java.util.List;

/** Similarity search against the external document index. */
public interface DocumentIndexClient {

  /**
   * Runs a single combined dense + sparse similarity query.
   *
   * @param query the weighted query vectors
   * @param topK maximum number of matches
   * @return matches in descending score order, empty when nothing matches
   */
  List<IndexMatch> search(HybridQuery query, int topK);
}
