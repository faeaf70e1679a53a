package com.flamingo.ai.climatechat.service.rag.rerank;

import com.flamingo.ai.climatechat.config.RagConfig;
import java.time.Duration;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/** HTTP client for the cross-encoder served by TEI (Text Embeddings Inference). */
@Component
@Slf4j
public class TeiRerankerClient {

  private final WebClient webClient;
  private final int readTimeoutMs;
  private final boolean rawScores;
  private final boolean truncate;

  public TeiRerankerClient(RagConfig ragConfig) {
    RagConfig.Reranking.Tei tei = ragConfig.getReranking().getTei();
    this.readTimeoutMs = tei.getReadTimeoutMs();
    this.rawScores = tei.isRawScores();
    this.truncate = tei.isTruncate();
    this.webClient =
        WebClient.builder()
            .baseUrl(tei.getBaseUrl())
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(2 * 1024 * 1024))
            .build();
    log.info(
        "TEI reranker client initialized: baseUrl={}, model={}",
        tei.getBaseUrl(),
        tei.getModelId());
  }

  /**
   * Calls TEI /rerank to score texts against a query.
   *
   * @param query the search query
   * @param texts the candidate texts to score
   * @return one result per scored text, referring to it by position
   */
  public List<RerankResult> rerank(String query, List<String> texts) {
    var request = new TeiRerankRequest(query, texts, rawScores, truncate);
    return webClient
        .post()
        .uri("/rerank")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(request)
        .retrieve()
        .bodyToFlux(RerankResult.class)
        .collectList()
        .timeout(Duration.ofMillis(readTimeoutMs))
        .block();
  }

  record TeiRerankRequest(String query, List<String> texts, boolean raw_scores, boolean truncate) {}

  /** TEI rerank response element. */
  public record RerankResult(int index, double score) {}
}
