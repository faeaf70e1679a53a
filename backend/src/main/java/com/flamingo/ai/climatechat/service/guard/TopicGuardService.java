package com.flamingo.ai.climatechat.service.guard;

import com.flamingo.ai.climatechat.config.RagConfig;
import com.flamingo.ai.climatechat.domain.model.ConversationTurn;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Topic and safety gate. Decides in three tiers, stopping at the first decisive one:
 *
 * <ol>
 *   <li>keyword rules for harmful intent and misinformation framing (reject);
 *   <li>optional similarity to on-topic exemplars (accept when high enough);
 *   <li>the topic classifier (accept or reject).
 * </ol>
 *
 * <p>Infrastructure errors never block a query: if the classifier fails the query passes.
 */
@Service
@Slf4j
public class TopicGuardService {

  private final TopicClassifierClient classifierClient;
  private final TopicExemplarMatcher exemplarMatcher;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;
  private final KeywordRules harmfulRules;
  private final KeywordRules misinformationRules;

  public TopicGuardService(
      TopicClassifierClient classifierClient,
      TopicExemplarMatcher exemplarMatcher,
      RagConfig ragConfig,
      MeterRegistry meterRegistry) {
    this.classifierClient = classifierClient;
    this.exemplarMatcher = exemplarMatcher;
    this.ragConfig = ragConfig;
    this.meterRegistry = meterRegistry;
    this.harmfulRules = new KeywordRules(ragConfig.getGate().getHarmfulPhrases());
    this.misinformationRules = new KeywordRules(ragConfig.getGate().getMisinformationPhrases());
  }

  public TopicCheckResult check(String query) {
    return check(query, List.of());
  }

  /**
   * Checks whether a query may be answered.
   *
   * @param query the query in the pivot language
   * @param history prior turns, oldest first; may be empty
   * @return the gate decision
   */
  @Timed(value = "rag.gate", description = "Time for topic/safety gate")
  public TopicCheckResult check(String query, List<ConversationTurn> history) {
    Optional<String> harmful = harmfulRules.firstMatch(query);
    if (harmful.isPresent()) {
      log.warn("Harmful content detected (rule '{}') in query: {}", harmful.get(), query);
      return record(TopicCheckResult.reject(TopicCheckResult.Reason.HARMFUL_CONTENT, 1.0));
    }

    Optional<String> denial = misinformationRules.firstMatch(query);
    if (denial.isPresent()) {
      log.warn("Potential misinformation detected (rule '{}') in query: {}", denial.get(), query);
      return record(TopicCheckResult.reject(TopicCheckResult.Reason.MISINFORMATION, 1.0));
    }

    String classifierInput = withLastQuestion(query, history);

    if (exemplarMatcher.isEnabled()) {
      Optional<TopicCheckResult> semantic = checkSemantic(classifierInput);
      if (semantic.isPresent()) {
        return record(semantic.get());
      }
    }

    return record(classify(classifierInput));
  }

  private Optional<TopicCheckResult> checkSemantic(String text) {
    RagConfig.Gate.Semantic semantic = ragConfig.getGate().getSemantic();
    try {
      double similarity = exemplarMatcher.maxSimilarity(text);
      if (similarity >= semantic.getAcceptThreshold()) {
        log.debug("Query accepted by exemplar similarity {}", String.format("%.3f", similarity));
        return Optional.of(
            TopicCheckResult.pass(TopicCheckResult.Reason.SEMANTIC_SIMILARITY, similarity));
      }
      if (similarity >= semantic.getAmbiguousFloor()) {
        log.debug(
            "Exemplar similarity {} is ambiguous, deferring to classifier",
            String.format("%.3f", similarity));
      }
    } catch (RuntimeException e) {
      log.warn("Exemplar similarity unavailable, deferring to classifier: {}", e.getMessage());
    }
    return Optional.empty();
  }

  private TopicCheckResult classify(String text) {
    RagConfig.Gate.Classifier classifier = ragConfig.getGate().getClassifier();
    try {
      TopicClassification result = classifierClient.classify(text);
      if (classifier.getPositiveLabel().equalsIgnoreCase(result.label())
          && result.score() > classifier.getThreshold()) {
        return TopicCheckResult.pass(TopicCheckResult.Reason.CLIMATE_RELATED, result.score());
      }
      log.info(
          "Query classified off-topic: label={}, score={}",
          result.label(),
          String.format("%.3f", result.score()));
      return TopicCheckResult.reject(TopicCheckResult.Reason.NOT_CLIMATE_RELATED, result.score());
    } catch (RuntimeException e) {
      log.warn("Topic classifier unavailable, letting query through: {}", e.getMessage());
      meterRegistry.counter("rag.gate.classifier.error").increment();
      return TopicCheckResult.pass(TopicCheckResult.Reason.CLASSIFIER_UNAVAILABLE, 0.0);
    }
  }

  /** Short follow-ups are judged together with the question they follow. */
  private String withLastQuestion(String query, List<ConversationTurn> history) {
    if (history == null || history.isEmpty()) {
      return query;
    }
    return history.get(history.size() - 1).query() + " " + query;
  }

  private TopicCheckResult record(TopicCheckResult result) {
    if (!result.passed()) {
      meterRegistry.counter("rag.gate.rejected", "reason", result.reason().code()).increment();
    }
    return result;
  }
}
