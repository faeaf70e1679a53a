package com.flamingo.ai.climatechat.service.rag.rerank;

import com.flamingo.ai.climatechat.config.RagConfig;
import com.flamingo.ai.climatechat.domain.model.Document;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Cross-encoder reranker backed by a TEI rerank endpoint. */
@Service
@RequiredArgsConstructor
@Slf4j
public class TeiCrossEncoderReranker implements Reranker {

  private final TeiRerankerClient teiRerankerClient;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "rag.reranker.tei", description = "Time for TEI cross-encoder reranking")
  @CircuitBreaker(name = "tei", fallbackMethod = "rerankFallback")
  @Retry(name = "tei")
  public List<Document> rerank(String query, List<Document> documents, int topK) {
    if (documents.isEmpty()) {
      log.debug("No candidates to rerank");
      return List.of();
    }

    List<Document> candidates = candidates(documents);
    log.debug("TEI reranking {} candidates for query: {}", candidates.size(), query);

    List<String> texts = candidates.stream().map(Document::content).toList();
    List<TeiRerankerClient.RerankResult> results = teiRerankerClient.rerank(query, texts);

    List<Document> reranked =
        results.stream()
            .filter(r -> r.index() >= 0 && r.index() < candidates.size())
            .map(r -> candidates.get(r.index()).withScore(r.score()))
            .sorted(Comparator.comparingDouble(Document::score).reversed())
            .limit(topK)
            .toList();

    meterRegistry.counter("rag.reranker.tei.invocations").increment();
    log.debug(
        "TEI reranking complete, top score: {}",
        reranked.isEmpty() ? "N/A" : String.format("%.3f", reranked.get(0).score()));

    return reranked;
  }

  /** Keeps the retrieval order when the cross-encoder cannot be reached. */
  @SuppressWarnings("unused")
  List<Document> rerankFallback(String query, List<Document> documents, int topK, Throwable t) {
    log.warn("TEI reranker unavailable, keeping retrieval order: {}", t.getMessage());
    meterRegistry.counter("rag.reranker.tei.fallback").increment();
    return documents.stream().limit(topK).toList();
  }

  private List<Document> candidates(List<Document> documents) {
    int max = ragConfig.getReranking().getMaxCandidates();
    return documents.size() > max ? documents.subList(0, max) : documents;
  }
}
