package com.flamingo.ai.climatechat.service.rag.search;

import java.util.Map;

/** One raw hit from the document index: its id, blended similarity score and stored fields. */
public record IndexMatch(String id, double score, Map<String, Object> metadata) {

  public IndexMatch {
    metadata = metadata == null ? Map.of() : metadata;
  }
}
