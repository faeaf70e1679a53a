package com.flamingo.ai.climatechat.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.climatechat.service.pipeline.PipelineResult;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a pipeline run. Failures carry a reason code and a user-facing message. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatResponse {

  private boolean success;
  private String answer;
  private List<CitationResponse> citations;
  private Double faithfulnessScore;
  private Boolean cacheHit;
  private Boolean fallbackUsed;
  private String languageCode;
  private String reason;
  private String message;

  /** Milliseconds per pipeline stage. */
  private Map<String, Long> timings;

  public static ChatResponse from(PipelineResult result) {
    if (result instanceof PipelineResult.Success success) {
      return ChatResponse.builder()
          .success(true)
          .answer(success.answer())
          .citations(success.citations().stream().map(CitationResponse::from).toList())
          .faithfulnessScore(success.faithfulness())
          .cacheHit(success.cacheHit())
          .fallbackUsed(success.fallbackUsed())
          .languageCode(success.turn().languageCode())
          .timings(toMillis(success.timings()))
          .build();
    }
    PipelineResult.Failure failure = (PipelineResult.Failure) result;
    return ChatResponse.builder()
        .success(false)
        .reason(failure.reason().code())
        .message(failure.message())
        .timings(toMillis(failure.timings()))
        .build();
  }

  private static Map<String, Long> toMillis(Map<String, Duration> timings) {
    Map<String, Long> millis = new LinkedHashMap<>();
    timings.forEach((stage, duration) -> millis.put(stage, duration.toMillis()));
    return millis;
  }
}
