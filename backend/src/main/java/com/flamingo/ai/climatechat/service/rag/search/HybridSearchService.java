package com.flamingo.ai.climatechat.service.rag.search;

import com.flamingo.ai.climatechat.config.RagConfig;
import com.flamingo.ai.climatechat.domain.model.Document;
import com.flamingo.ai.climatechat.exception.SearchException;
import com.flamingo.ai.climatechat.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.climatechat.service.rag.embedding.HybridEmbedding;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Hybrid retrieval: embeds the query densely and sparsely, runs one blended similarity search and
 * turns the raw matches into clean, title-deduplicated documents.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HybridSearchService {

  private final EmbeddingService embeddingService;
  private final DocumentIndexClient documentIndexClient;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  public List<Document> retrieve(String query) {
    return retrieve(query, ragConfig.getRetrieval().getTopK());
  }

  public List<Document> retrieve(String query, int topK) {
    return retrieve(query, topK, ragConfig.getRetrieval().getAlpha());
  }

  /**
   * Retrieves candidate documents for a query.
   *
   * @param query the search query
   * @param topK number of index matches to request
   * @param alpha dense weight in {@code [0, 1]}; the sparse side gets {@code 1 - alpha}
   * @return cleaned documents in descending score order, possibly empty
   * @throws IllegalArgumentException if alpha is out of range
   * @throws SearchException if the embedding service or the index cannot be reached
   */
  @Timed(value = "rag.search", description = "Time for hybrid search")
  public List<Document> retrieve(String query, int topK, double alpha) {
    HybridQuery.requireValidAlpha(alpha);
    log.debug("Hybrid search: query='{}', topK={}, alpha={}", query, topK, alpha);

    HybridEmbedding embedding;
    try {
      embedding = embeddingService.embedHybrid(query);
    } catch (RuntimeException e) {
      meterRegistry.counter("rag.search.failure", "stage", "embedding").increment();
      throw new SearchException("Failed to embed query for retrieval", e);
    }

    List<IndexMatch> matches;
    try {
      matches = documentIndexClient.search(HybridQuery.weighted(embedding, alpha), topK);
    } catch (SearchException e) {
      meterRegistry.counter("rag.search.failure", "stage", "index").increment();
      throw e;
    } catch (RuntimeException e) {
      meterRegistry.counter("rag.search.failure", "stage", "index").increment();
      throw new SearchException("Document index query failed", e);
    }

    if (matches.isEmpty()) {
      log.info("No index matches for query '{}'", query);
      return List.of();
    }

    List<Document> documents = toDocuments(matches);
    meterRegistry.counter("rag.search.success").increment();
    log.debug("Retrieved {} documents from {} matches", documents.size(), matches.size());
    return documents;
  }

  /** Deduplicates by title (first wins), cleans content and drops near-empty passages. */
  List<Document> toDocuments(List<IndexMatch> matches) {
    int minLength = ragConfig.getRetrieval().getMinContentLength();
    Set<String> seenTitles = new HashSet<>();
    List<Document> documents = new ArrayList<>();

    for (IndexMatch match : matches) {
      Map<String, Object> metadata = match.metadata();
      String title = stringValue(metadata.get("title"));
      if (seenTitles.contains(title)) {
        log.debug("Skipping duplicate title '{}'", title);
        continue;
      }

      String content = DocumentContentCleaner.clean(stringValue(metadata.get("chunk_text")));
      if (content.length() < minLength) {
        log.debug("Skipping '{}' with {} chars of content", title, content.length());
        continue;
      }
      seenTitles.add(title);

      documents.add(
          new Document(
              title,
              content,
              firstValue(metadata.get("url")),
              match.score(),
              keywords(metadata),
              stringValue(metadata.get("section_title")),
              stringValue(metadata.get("segment_id"))));
    }

    documents.sort(Comparator.comparingDouble(Document::score).reversed());
    return documents;
  }

  private static List<String> keywords(Map<String, Object> metadata) {
    List<String> keywords = new ArrayList<>();
    for (String field : List.of("doc_keywords", "segment_keywords")) {
      Object value = metadata.get(field);
      if (value instanceof Collection<?> values) {
        values.forEach(v -> keywords.add(String.valueOf(v)));
      } else if (value != null) {
        keywords.add(value.toString());
      }
    }
    return keywords;
  }

  private static String firstValue(Object value) {
    if (value instanceof Collection<?> values) {
      return values.isEmpty() ? "" : String.valueOf(values.iterator().next());
    }
    return stringValue(value);
  }

  private static String stringValue(Object value) {
    return value == null ? "" : value.toString();
  }
}
