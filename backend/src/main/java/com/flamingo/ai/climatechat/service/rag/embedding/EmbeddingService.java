package com.flamingo.ai.climatechat.service.rag.embedding;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Produces query embeddings: dense vectors from the LangChain4j embedding model and sparse token
 * weights from the TEI sparse encoder. Failures propagate; callers decide how to degrade.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  // Queries are short; anything longer is almost certainly pasted text
  private static final int MAX_CHARS_PER_EMBEDDING = 5000;

  private final EmbeddingModel embeddingModel;
  private final TeiSparseEmbeddingClient sparseEmbeddingClient;
  private final MeterRegistry meterRegistry;

  /**
   * Embeds a query into a dense vector only.
   *
   * @param text the text to embed
   * @return embedding vector
   */
  @Timed(value = "embedding.dense", description = "Time to embed text densely")
  @CircuitBreaker(name = "embedding")
  @Retry(name = "embedding")
  public List<Float> embedDense(String text) {
    return dense(text);
  }

  /**
   * Embeds a query into both its dense and sparse representations.
   *
   * @param query the query text
   * @return dense and sparse vectors for the same input
   */
  @Timed(value = "embedding.hybrid", description = "Time to embed query for hybrid search")
  @CircuitBreaker(name = "embedding")
  @Retry(name = "embedding")
  public HybridEmbedding embedHybrid(String query) {
    List<Float> dense = dense(query);
    SparseVector sparse = sparseEmbeddingClient.embedSparse(truncate(query));
    log.debug(
        "Hybrid embedding computed: dense dims={}, sparse tokens={}",
        dense.size(),
        sparse.indices().size());
    meterRegistry.counter("embedding.requests.success", "type", "hybrid").increment();
    return new HybridEmbedding(dense, sparse);
  }

  private List<Float> dense(String text) {
    Response<Embedding> response = embeddingModel.embed(truncate(text));
    return toFloatList(response.content().vector());
  }

  private String truncate(String text) {
    if (text.length() <= MAX_CHARS_PER_EMBEDDING) {
      return text;
    }
    log.warn(
        "Text too long for embedding, truncating from {} chars to {} chars",
        text.length(),
        MAX_CHARS_PER_EMBEDDING);
    return text.substring(0, MAX_CHARS_PER_EMBEDDING);
  }

  private List<Float> toFloatList(float[] vector) {
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }
}
