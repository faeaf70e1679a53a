package com.flamingo.ai.climatechat.service.rag.query;

import com.flamingo.ai.climatechat.domain.model.ConversationTurn;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Keyword heuristic for spotting follow-up questions without calling a model. Used only when the
 * classification model is unavailable.
 */
@Component
public class FollowUpHeuristic {

  private static final Set<String> REFERENCE_WORDS =
      Set.of("it", "its", "they", "them", "their", "this", "that", "these", "those");

  private static final Set<String> CONTINUATION_WORDS =
      Set.of(
          "else", "more", "also", "elaborate", "why", "how", "explain", "further", "another",
          "again");

  private static final int SHORT_QUERY_WORDS = 5;

  public FollowUpSignal detect(String query, List<ConversationTurn> history) {
    if (history == null || history.isEmpty() || query == null || query.isBlank()) {
      return new FollowUpSignal(false, 0.0);
    }

    List<String> words =
        Arrays.stream(query.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}']+"))
            .filter(w -> !w.isEmpty())
            .toList();
    boolean references = words.stream().anyMatch(REFERENCE_WORDS::contains);
    boolean continues = words.stream().anyMatch(CONTINUATION_WORDS::contains);
    boolean isShort = words.size() <= SHORT_QUERY_WORDS;

    if (references && continues) {
      return new FollowUpSignal(true, 0.8);
    }
    if (references) {
      return new FollowUpSignal(true, isShort ? 0.7 : 0.6);
    }
    if (continues && isShort) {
      return new FollowUpSignal(true, 0.6);
    }
    return new FollowUpSignal(false, continues ? 0.3 : 0.1);
  }
}
