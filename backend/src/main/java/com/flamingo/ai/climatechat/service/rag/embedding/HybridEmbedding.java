package com.flamingo.ai.climatechat.service.rag.embedding;

import java.util.List;

/** Dense and sparse representation of the same text. */
public record HybridEmbedding(List<Float> dense, SparseVector sparse) {

  public HybridEmbedding {
    dense = List.copyOf(dense);
  }
}
