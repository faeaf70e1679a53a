package com.flamingo.ai.climatechat.service.rag.embedding;

import com.flamingo.ai.climatechat.config.RagConfig;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * HTTP client for the TEI {@code /embed_sparse} endpoint serving a SPLADE-style lexical encoder.
 */
@Component
@Slf4j
public class TeiSparseEmbeddingClient {

  private static final ParameterizedTypeReference<List<List<SparseValue>>> RESPONSE_TYPE =
      new ParameterizedTypeReference<>() {};

  private final WebClient webClient;
  private final int readTimeoutMs;

  public TeiSparseEmbeddingClient(RagConfig ragConfig) {
    RagConfig.Embedding embedding = ragConfig.getEmbedding();
    this.readTimeoutMs = embedding.getReadTimeoutMs();
    this.webClient =
        WebClient.builder()
            .baseUrl(embedding.getSparseBaseUrl())
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(2 * 1024 * 1024))
            .build();
    log.info("TEI sparse embedding client initialized: baseUrl={}", embedding.getSparseBaseUrl());
  }

  /**
   * Encodes one text into token weights.
   *
   * @param text the text to encode
   * @return the sparse vector, empty when the encoder returns no active tokens
   */
  public SparseVector embedSparse(String text) {
    List<List<SparseValue>> response =
        webClient
            .post()
            .uri("/embed_sparse")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(new SparseEmbedRequest(text, true))
            .retrieve()
            .bodyToMono(RESPONSE_TYPE)
            .timeout(Duration.ofMillis(readTimeoutMs))
            .block();

    if (response == null || response.isEmpty()) {
      return SparseVector.empty();
    }

    List<Integer> indices = new ArrayList<>();
    List<Float> values = new ArrayList<>();
    for (SparseValue value : response.get(0)) {
      indices.add(value.index());
      values.add(value.value());
    }
    return new SparseVector(indices, values);
  }

  record SparseEmbedRequest(String inputs, boolean truncate) {}

  /** TEI sparse embedding response element. */
  public record SparseValue(int index, float value) {}
}
