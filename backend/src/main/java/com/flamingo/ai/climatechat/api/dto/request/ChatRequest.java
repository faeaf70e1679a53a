package com.flamingo.ai.climatechat.api.dto.request;

import com.flamingo.ai.climatechat.domain.model.ConversationTurn;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for asking a climate question. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatRequest {

  /** Turns kept from the client's history; older ones are dropped. */
  public static final int MAX_HISTORY_TURNS = 5;

  @NotNull(message = "Query is required")
  @Size(max = 5000, message = "Query must not exceed 5000 characters")
  private String query;

  /** Language name or ISO code; English when absent. */
  @Builder.Default private String language = "english";

  @Valid
  @Size(max = 50, message = "History must not exceed 50 turns")
  @Builder.Default
  private List<HistoryTurnRequest> history = new ArrayList<>();

  /**
   * Converts the loosely shaped client history into turns, skipping entries without both a query
   * and an answer and keeping the most recent ones.
   */
  public List<ConversationTurn> toTurns() {
    if (history == null) {
      return List.of();
    }
    List<ConversationTurn> turns =
        history.stream()
            .filter(t -> t != null && hasText(t.getQuery()) && hasText(t.getAnswer()))
            .map(t -> ConversationTurn.of(t.getQuery().trim(), t.getAnswer(), t.getLanguage()))
            .toList();
    int from = Math.max(0, turns.size() - MAX_HISTORY_TURNS);
    return turns.subList(from, turns.size());
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
