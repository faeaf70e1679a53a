package com.flamingo.ai.climatechat.service.rag.query;

import com.flamingo.ai.climatechat.agent.QueryClassificationAgent;
import com.flamingo.ai.climatechat.agent.QueryRewriteAgent;
import com.flamingo.ai.climatechat.config.RagConfig;
import com.flamingo.ai.climatechat.domain.enums.QueryCategory;
import com.flamingo.ai.climatechat.domain.model.ConversationTurn;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Model-backed context manager. An unparseable classification counts as off-topic, and so does a
 * classification model that cannot be reached. The keyword heuristic is consulted in that case
 * only to log whether a follow-up was lost.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationContextServiceImpl implements ConversationContextService {

  static final Pattern CLASSIFICATION =
      Pattern.compile("Classification:\\s*(on-topic|off-topic|harmful)", Pattern.CASE_INSENSITIVE);

  private static final Pattern REASONING =
      Pattern.compile(
          "Reasoning:\\s*(.+?)\\s*(?=Classification:|$)",
          Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

  private final QueryClassificationAgent classificationAgent;
  private final QueryRewriteAgent rewriteAgent;
  private final FollowUpHeuristic followUpHeuristic;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "rag.context.rewrite", description = "Time for conversational query rewrite")
  public ContextRewriteResult classifyAndRewrite(List<ConversationTurn> history, String query) {
    List<ConversationTurn> window =
        ConversationHistoryFormatter.recent(history, ragConfig.getContext().getHistoryWindow());
    String transcript = ConversationHistoryFormatter.format(window);

    String response;
    try {
      response = classificationAgent.classify(transcript, query);
    } catch (RuntimeException e) {
      log.warn("Query classification unavailable: {}", e.getMessage());
      meterRegistry.counter("rag.context.classification.error").increment();
      return heuristicFallback(window, query);
    }

    QueryCategory category = parseCategory(response).orElse(null);
    String reasoning = parseReasoning(response);
    if (category == null) {
      log.warn("Could not parse classification, treating as off-topic: '{}'", response);
      meterRegistry.counter("rag.context.classification.unparsed").increment();
      return ContextRewriteResult.rejected(QueryCategory.OFF_TOPIC, query, reasoning);
    }

    meterRegistry.counter("rag.context.classified", "category", category.label()).increment();
    if (category != QueryCategory.ON_TOPIC) {
      log.info("Query '{}' classified as {} in context: {}", query, category.label(), reasoning);
      return ContextRewriteResult.rejected(category, query, reasoning);
    }

    return rewrite(transcript, query, reasoning);
  }

  private ContextRewriteResult rewrite(String transcript, String query, String reasoning) {
    try {
      String rewritten = cleanRewrite(rewriteAgent.rewrite(transcript, query));
      if (rewritten.isBlank()) {
        log.warn("Rewrite returned nothing, using original query");
        return ContextRewriteResult.unchanged(query, reasoning);
      }
      rewritten = limitLength(rewritten);
      log.info("Rewrote query '{}' → '{}'", query, rewritten);
      return ContextRewriteResult.rewritten(rewritten, reasoning);
    } catch (RuntimeException e) {
      log.warn("Query rewrite failed, using original query: {}", e.getMessage());
      meterRegistry.counter("rag.context.rewrite.error").increment();
      return ContextRewriteResult.unchanged(query, reasoning);
    }
  }

  private ContextRewriteResult heuristicFallback(List<ConversationTurn> window, String query) {
    FollowUpSignal signal = followUpHeuristic.detect(query, window);
    log.info(
        "Rejecting unclassified query (heuristic followUp={}, confidence={})",
        signal.followUp(),
        signal.confidence());
    return ContextRewriteResult.rejected(
        QueryCategory.OFF_TOPIC, query, "classification unavailable");
  }

  static Optional<QueryCategory> parseCategory(String response) {
    if (response == null) {
      return Optional.empty();
    }
    Matcher matcher = CLASSIFICATION.matcher(response);
    return matcher.find() ? QueryCategory.fromLabel(matcher.group(1)) : Optional.empty();
  }

  private static String parseReasoning(String response) {
    if (response == null) {
      return "";
    }
    Matcher matcher = REASONING.matcher(response);
    return matcher.find() ? matcher.group(1).trim() : "";
  }

  private static String cleanRewrite(String text) {
    if (text == null) {
      return "";
    }
    String cleaned = text.trim();
    if (cleaned.regionMatches(true, 0, "Rewritten question:", 0, 19)) {
      cleaned = cleaned.substring(19).trim();
    }
    if (cleaned.length() >= 2 && cleaned.startsWith("\"") && cleaned.endsWith("\"")) {
      cleaned = cleaned.substring(1, cleaned.length() - 1).trim();
    }
    return cleaned;
  }

  private String limitLength(String text) {
    int max = ragConfig.getContext().getMaxQueryLength();
    return text.length() > max ? text.substring(0, max) : text;
  }
}
