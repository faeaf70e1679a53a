package com.flamingo.ai.climatechat.service.rag.verification;

import com.flamingo.ai.climatechat.agent.FaithfulnessAgent;
import com.flamingo.ai.climatechat.config.RagConfig;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Scores how well an answer is supported by the passages it was generated from (0.0 = unsupported,
 * 1.0 = fully supported). Scoring problems yield the configured neutral score instead of an error.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FaithfulnessService {

  /** First number in the reply, optionally written as a fraction such as {@code 8/10}. */
  private static final Pattern NUMBER =
      Pattern.compile(
          "(?<![\\d.])(\\d+(?:\\.\\d+)?|\\.\\d+)(?:\\s*/\\s*(\\d+(?:\\.\\d+)?))?");
  private static final String CONTEXT_SEPARATOR = "\n\n---\n\n";

  private final FaithfulnessAgent faithfulnessAgent;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Scores an answer against its contexts.
   *
   * @param question the question that was answered
   * @param answer the generated answer
   * @param contexts passage texts the answer was grounded on
   * @return a score in {@code [0, 1]}
   */
  @Timed(value = "rag.faithfulness", description = "Time for faithfulness scoring")
  public double score(String question, String answer, List<String> contexts) {
    RagConfig.Faithfulness config = ragConfig.getFaithfulness();
    if (question == null
        || question.isBlank()
        || answer == null
        || answer.isBlank()
        || contexts == null
        || contexts.isEmpty()) {
      log.warn("Missing inputs for faithfulness scoring, using neutral score");
      return config.getNeutralScore();
    }

    String context =
        String.join(
            CONTEXT_SEPARATOR,
            contexts.stream()
                .filter(c -> c != null && !c.isBlank())
                .limit(config.getMaxContexts())
                .map(c -> truncateWords(c, config.getMaxContextWords()))
                .toList());

    try {
      String response = faithfulnessAgent.score(question, answer, context);
      double score = parseScore(response);
      log.debug("Faithfulness score: {}", String.format("%.3f", score));
      meterRegistry.counter("rag.faithfulness.scored").increment();
      return score;
    } catch (RuntimeException e) {
      log.warn("Faithfulness scoring failed, using neutral score: {}", e.getMessage());
      meterRegistry.counter("rag.faithfulness.error").increment();
      return config.getNeutralScore();
    }
  }

  static double parseScore(String response) {
    if (response == null) {
      throw new IllegalArgumentException("Empty faithfulness response");
    }
    Matcher matcher = NUMBER.matcher(response);
    if (!matcher.find()) {
      throw new IllegalArgumentException("No score in faithfulness response: " + response);
    }
    double score = Double.parseDouble(matcher.group(1));
    if (matcher.group(2) != null) {
      double scale = Double.parseDouble(matcher.group(2));
      if (scale <= 0) {
        throw new IllegalArgumentException("Invalid score scale in response: " + response);
      }
      score = score / scale;
    }
    return Math.max(0.0, Math.min(1.0, score));
  }

  static String truncateWords(String text, int maxWords) {
    String[] words = text.trim().split("\\s+");
    if (words.length <= maxWords) {
      return text.trim();
    }
    return String.join(" ", List.of(words).subList(0, maxWords)) + "...";
  }
}
