package com.flamingo.ai.climatechat.service.rag.search;

import com.flamingo.ai.climatechat.service.rag.embedding.HybridEmbedding;
import com.flamingo.ai.climatechat.service.rag.embedding.SparseVector;
import java.util.List;

/**
 * A dense and a sparse query vector blended by a hybrid weight {@code alpha}: the dense side counts
 * with weight {@code alpha}, the sparse side with {@code 1 - alpha}.
 *
 * <p>Sparse weights are pre-multiplied by {@code 1 - alpha}. The dense vector is kept as embedded
 * and its weight travels in {@link #denseWeight()}, because a cosine-similarity index normalizes
 * vector length away; the index client applies it as the dense clause's score multiplier.
 */
public record HybridQuery(List<Float> dense, double denseWeight, SparseVector sparse) {

  public HybridQuery {
    dense = List.copyOf(dense);
  }

  /**
   * Weights an embedding for hybrid search.
   *
   * @throws IllegalArgumentException if {@code alpha} is outside {@code [0, 1]}
   */
  public static HybridQuery weighted(HybridEmbedding embedding, double alpha) {
    requireValidAlpha(alpha);
    return new HybridQuery(embedding.dense(), alpha, embedding.sparse().scale(1 - alpha));
  }

  public static void requireValidAlpha(double alpha) {
    if (Double.isNaN(alpha) || alpha < 0 || alpha > 1) {
      throw new IllegalArgumentException("Alpha must be between 0 and 1, got " + alpha);
    }
  }

  public boolean usesDense() {
    return denseWeight > 0 && !dense.isEmpty();
  }

  public boolean usesSparse() {
    return denseWeight < 1 && !sparse.isEmpty();
  }
}
