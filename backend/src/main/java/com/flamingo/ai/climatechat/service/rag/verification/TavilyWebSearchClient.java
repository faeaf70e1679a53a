package com.flamingo.ai.climatechat.service.rag.verification;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.flamingo.ai.climatechat.config.RagConfig;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import java.time.Duration;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/** Web search through the Tavily search API. */
@Component
@Slf4j
public class TavilyWebSearchClient implements WebSearchClient {

  private final WebClient webClient;
  private final int readTimeoutMs;

  public TavilyWebSearchClient(RagConfig ragConfig) {
    RagConfig.WebSearch webSearch = ragConfig.getWebSearch();
    this.readTimeoutMs = webSearch.getReadTimeoutMs();
    this.webClient =
        WebClient.builder()
            .baseUrl(webSearch.getBaseUrl())
            .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + webSearch.getApiKey())
            .build();
    log.info("Tavily web search client initialized: baseUrl={}", webSearch.getBaseUrl());
  }

  @Override
  @CircuitBreaker(name = "websearch")
  @Retry(name = "websearch")
  public List<WebSearchResult> search(String query, int maxResults) {
    TavilyResponse response =
        webClient
            .post()
            .uri("/search")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(new TavilyRequest(query, maxResults, "basic"))
            .retrieve()
            .bodyToMono(TavilyResponse.class)
            .timeout(Duration.ofMillis(readTimeoutMs))
            .block();

    if (response == null || response.results() == null) {
      return List.of();
    }
    return response.results().stream()
        .map(r -> new WebSearchResult(r.title(), r.url(), r.content()))
        .toList();
  }

  record TavilyRequest(String query, int max_results, String search_depth) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record TavilyResponse(List<TavilyResult> results) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record TavilyResult(String title, String url, String content, Double score) {}
}
