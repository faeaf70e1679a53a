package com.flamingo.ai.climatechat.service.rag.verification;

import com.flamingo.ai.climatechat.config.RagConfig;
import com.flamingo.ai.climatechat.domain.model.ConversationTurn;
import com.flamingo.ai.climatechat.domain.model.Document;
import com.flamingo.ai.climatechat.service.rag.generation.AnswerGenerationService;
import com.flamingo.ai.climatechat.service.rag.generation.GeneratedAnswer;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Second attempt at an answer from web search results, used when the primary answer is poorly
 * grounded. Never throws: any problem means no fallback answer.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebSearchFallbackService {

  static final String FALLBACK_INSTRUCTIONS =
      "Please provide accurate information based on the search results. "
          + "Always cite your sources. Ensure strict factual accuracy.";

  private final WebSearchClient webSearchClient;
  private final AnswerGenerationService answerGenerationService;
  private final FaithfulnessService faithfulnessService;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Searches the web, regenerates an answer from the results and scores it.
   *
   * @param query the query to search for and answer
   * @param history prior turns, oldest first
   * @return the scored fallback answer, or empty if none could be produced
   */
  @Timed(value = "rag.fallback", description = "Time for web search fallback")
  public Optional<VerifiedAnswer> attempt(String query, List<ConversationTurn> history) {
    RagConfig.WebSearch config = ragConfig.getWebSearch();
    if (!config.isEnabled()) {
      log.debug("Web search fallback disabled");
      return Optional.empty();
    }

    try {
      List<WebSearchResult> results = webSearchClient.search(query, config.getMaxResults());
      List<Document> documents = toDocuments(results);
      if (documents.isEmpty()) {
        log.info("Web search returned no usable results for '{}'", query);
        meterRegistry.counter("rag.fallback.empty").increment();
        return Optional.empty();
      }

      GeneratedAnswer answer =
          answerGenerationService.generate(query, documents, history, FALLBACK_INSTRUCTIONS);
      double score =
          faithfulnessService.score(
              query, answer.answer(), answer.documents().stream().map(Document::content).toList());
      log.info(
          "Web search fallback produced answer from {} results, faithfulness {}",
          documents.size(),
          String.format("%.3f", score));
      meterRegistry.counter("rag.fallback.success").increment();
      return Optional.of(new VerifiedAnswer(answer, score));
    } catch (RuntimeException e) {
      log.warn("Web search fallback unavailable: {}", e.getMessage());
      meterRegistry.counter("rag.fallback.error").increment();
      return Optional.empty();
    }
  }

  private static List<Document> toDocuments(List<WebSearchResult> results) {
    if (results == null) {
      return List.of();
    }
    return results.stream()
        .filter(r -> r.content() != null && !r.content().isBlank())
        .map(
            r ->
                Document.of(
                    r.title() == null || r.title().isBlank() ? r.url() : r.title(),
                    r.content(),
                    r.url(),
                    0.0))
        .toList();
  }
}
