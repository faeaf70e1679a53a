package com.flamingo.ai.climatechat.service.pipeline;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Per-request record of how long each pipeline stage took, in the order stages first ran. Stages
 * may record from worker threads.
 */
public final class PipelineTrace {

  private final Map<String, Duration> stages = new LinkedHashMap<>();
  private volatile String currentStage = "start";

  public <T> T time(String stage, Supplier<T> work) {
    enter(stage);
    long start = System.nanoTime();
    try {
      return work.get();
    } finally {
      record(stage, Duration.ofNanos(System.nanoTime() - start));
    }
  }

  public void enter(String stage) {
    currentStage = stage;
  }

  public String currentStage() {
    return currentStage;
  }

  public synchronized void record(String stage, Duration duration) {
    stages.merge(stage, duration, Duration::plus);
  }

  public synchronized Map<String, Duration> snapshot() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(stages));
  }
}
