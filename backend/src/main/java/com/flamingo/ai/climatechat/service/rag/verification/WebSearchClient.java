package com.flamingo.ai.climatechat.service.rag.verification;

import java.util.List;

/** Alternate evidence source queried when retrieved documents fail to support an answer. */
public interface WebSearchClient {

  /**
   * Searches the web.
   *
   * @param query the search query
   * @param maxResults maximum number of results
   * @return results, possibly empty
   */
  List<WebSearchResult> search(String query, int maxResults);
}
