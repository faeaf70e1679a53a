package com.flamingo.ai.climatechat.service.pipeline;

import com.flamingo.ai.climatechat.domain.model.Citation;
import com.flamingo.ai.climatechat.domain.model.ConversationTurn;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/** Outcome of one pipeline run: an answer or a typed failure. */
public sealed interface PipelineResult {

  boolean success();

  Map<String, Duration> timings();

  /**
   * A verified answer.
   *
   * @param answer answer text in the user's language
   * @param citations documents the answer was grounded on
   * @param faithfulness grounding score of the answer
   * @param cacheHit whether the answer came from the response cache
   * @param fallbackUsed whether the answer came from the web search fallback
   * @param turn the exchange for the caller to append to its history
   * @param timings elapsed time per stage
   */
  record Success(
      String answer,
      List<Citation> citations,
      double faithfulness,
      boolean cacheHit,
      boolean fallbackUsed,
      ConversationTurn turn,
      Map<String, Duration> timings)
      implements PipelineResult {

    public Success {
      citations = List.copyOf(citations);
    }

    @Override
    public boolean success() {
      return true;
    }
  }

  /**
   * A run that produced no answer.
   *
   * @param reason typed cause
   * @param message user-facing text
   * @param stage stage at which the run stopped
   * @param timings elapsed time per stage
   */
  record Failure(
      FailureReason reason, String message, String stage, Map<String, Duration> timings)
      implements PipelineResult {

    @Override
    public boolean success() {
      return false;
    }
  }
}
