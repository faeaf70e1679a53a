package com.flamingo.ai.climatechat.service.rag.query;

import com.flamingo.ai.climatechat.domain.enums.MessageRole;
import com.flamingo.ai.climatechat.domain.model.ConversationTurn;
import java.util.List;

/** Renders conversation turns as a role-tagged transcript, oldest turn first. */
public final class ConversationHistoryFormatter {

  static final String EMPTY_HISTORY = "(no previous conversation)";

  private ConversationHistoryFormatter() {}

  public static String format(List<ConversationTurn> turns) {
    if (turns == null || turns.isEmpty()) {
      return EMPTY_HISTORY;
    }
    StringBuilder sb = new StringBuilder();
    for (ConversationTurn turn : turns) {
      sb.append(MessageRole.USER.label()).append(": ").append(turn.query()).append("\n");
      sb.append(MessageRole.ASSISTANT.label()).append(": ").append(turn.answer()).append("\n");
    }
    return sb.toString().trim();
  }

  /** The last {@code window} turns, keeping their order. */
  public static List<ConversationTurn> recent(List<ConversationTurn> turns, int window) {
    if (turns == null || turns.isEmpty()) {
      return List.of();
    }
    int from = Math.max(0, turns.size() - window);
    return List.copyOf(turns.subList(from, turns.size()));
  }
}
