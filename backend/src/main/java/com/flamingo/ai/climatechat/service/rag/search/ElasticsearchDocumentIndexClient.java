package com.flamingo.ai.climatechat.service.rag.search;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import com.flamingo.ai.climatechat.config.RagConfig;
import com.flamingo.ai.climatechat.exception.SearchException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Hybrid search over an Elasticsearch index with a {@code dense_vector} field (cosine similarity)
 * and a {@code sparse_vector} field. Elasticsearch sums the scores of the kNN clause and the query
 * clause, so one request yields {@code alpha * dense + (1 - alpha) * sparse}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ElasticsearchDocumentIndexClient implements DocumentIndexClient {

  private final ElasticsearchClient elasticsearchClient;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "elasticsearch.hybrid_search", description = "Time for hybrid search")
  @CircuitBreaker(name = "elasticsearch")
  @Retry(name = "elasticsearch")
  @SuppressWarnings("rawtypes")
  public List<IndexMatch> search(HybridQuery query, int topK) {
    if (!query.usesDense() && !query.usesSparse()) {
      log.warn("Hybrid query has neither dense nor sparse terms, skipping index call");
      return List.of();
    }

    SearchRequest request = buildSearchRequest(query, topK);
    try {
      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      List<IndexMatch> matches = toMatches(response.hits().hits());
      log.debug(
          "[hybridSearch] index={} denseWeight={} sparseTokens={} returned={}",
          indexName(),
          query.denseWeight(),
          query.sparse().indices().size(),
          matches.size());
      meterRegistry.counter("document_index.hybrid_search").increment();
      return matches;
    } catch (IOException e) {
      log.error("Hybrid search failed for {}: {}", indexName(), e.getMessage(), e);
      throw new SearchException("Hybrid search failed", e);
    }
  }

  SearchRequest buildSearchRequest(HybridQuery query, int topK) {
    RagConfig.Retrieval retrieval = ragConfig.getRetrieval();
    RagConfig.Retrieval.Elasticsearch es = retrieval.getElasticsearch();

    return SearchRequest.of(
        s -> {
          s.index(es.getIndexName())
              .size(topK)
              .source(src -> src.filter(f -> f.excludes(es.getDenseField(), es.getSparseField())));
          if (query.usesDense()) {
            s.knn(
                k ->
                    k.field(es.getDenseField())
                        .queryVector(query.dense())
                        .k(topK)
                        .numCandidates(topK * retrieval.getNumCandidatesMultiplier())
                        .boost((float) query.denseWeight()));
          }
          if (query.usesSparse()) {
            s.query(
                q ->
                    q.sparseVector(
                        sv ->
                            sv.field(es.getSparseField())
                                .queryVector(query.sparse().toTokenWeights())));
          }
          return s;
        });
  }

  @SuppressWarnings({"rawtypes", "unchecked"})
  private List<IndexMatch> toMatches(List<Hit<Map>> hits) {
    List<IndexMatch> matches = new ArrayList<>(hits.size());
    for (Hit<Map> hit : hits) {
      Map<String, Object> source = hit.source();
      if (source == null) {
        continue;
      }
      double score = hit.score() != null ? hit.score() : 0.0;
      matches.add(new IndexMatch(hit.id(), score, source));
    }
    return matches;
  }

  private String indexName() {
    return ragConfig.getRetrieval().getElasticsearch().getIndexName();
  }
}
