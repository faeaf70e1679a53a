package com.flamingo.ai.climatechat.api.dto.request;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One earlier exchange as sent by the client. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HistoryTurnRequest {

  @Size(max = 5000, message = "History query must not exceed 5000 characters")
  private String query;

  @Size(max = 20000, message = "History answer must not exceed 20000 characters")
  private String answer;

  /** ISO code of the language the turn was held in. */
  private String language;
}
