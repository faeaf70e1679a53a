package com.flamingo.ai.climatechat.service.guard;

import com.flamingo.ai.climatechat.config.RagConfig;
import com.flamingo.ai.climatechat.service.rag.embedding.EmbeddingService;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Cosine similarity between a query and a curated set of on-topic exemplar questions. Exemplar
 * embeddings are computed on first use and kept for the life of the process.
 */
@Component
@Slf4j
public class TopicExemplarMatcher {

  private final EmbeddingService embeddingService;
  private final RagConfig ragConfig;

  private volatile List<List<Float>> exemplarEmbeddings;

  public TopicExemplarMatcher(EmbeddingService embeddingService, RagConfig ragConfig) {
    this.embeddingService = embeddingService;
    this.ragConfig = ragConfig;
  }

  public boolean isEnabled() {
    RagConfig.Gate.Semantic semantic = ragConfig.getGate().getSemantic();
    return semantic.isEnabled() && !semantic.getExemplars().isEmpty();
  }

  /**
   * Highest cosine similarity between the query and any exemplar.
   *
   * @throws RuntimeException when embeddings cannot be computed
   */
  public double maxSimilarity(String query) {
    List<Float> queryEmbedding = embeddingService.embedDense(query);
    double best = 0.0;
    for (List<Float> exemplar : exemplars()) {
      best = Math.max(best, cosine(queryEmbedding, exemplar));
    }
    return best;
  }

  private List<List<Float>> exemplars() {
    List<List<Float>> embeddings = exemplarEmbeddings;
    if (embeddings == null) {
      synchronized (this) {
        embeddings = exemplarEmbeddings;
        if (embeddings == null) {
          embeddings = new ArrayList<>();
          for (String exemplar : ragConfig.getGate().getSemantic().getExemplars()) {
            embeddings.add(embeddingService.embedDense(exemplar));
          }
          exemplarEmbeddings = List.copyOf(embeddings);
          log.info("Embedded {} topic exemplars", embeddings.size());
        }
      }
    }
    return embeddings;
  }

  static double cosine(List<Float> a, List<Float> b) {
    int length = Math.min(a.size(), b.size());
    double dot = 0.0;
    double normA = 0.0;
    double normB = 0.0;
    for (int i = 0; i < length; i++) {
      dot += a.get(i) * b.get(i);
      normA += a.get(i) * a.get(i);
      normB += b.get(i) * b.get(i);
    }
    if (normA == 0.0 || normB == 0.0) {
      return 0.0;
    }
    return dot / (Math.sqrt(normA) * Math.sqrt(normB));
  }
}
