package com.flamingo.ai.climatechat.service.pipeline;

import java.time.Duration;

/** Point in time by which a request must finish. */
public final class PipelineDeadline {

  private final long deadlineNanos;

  private PipelineDeadline(long deadlineNanos) {
    this.deadlineNanos = deadlineNanos;
  }

  public static PipelineDeadline after(Duration timeout) {
    return new PipelineDeadline(System.nanoTime() + timeout.toNanos());
  }

  public Duration remaining() {
    long left = deadlineNanos - System.nanoTime();
    return left > 0 ? Duration.ofNanos(left) : Duration.ZERO;
  }

  public boolean isExpired() {
    return remaining().isZero();
  }
}
