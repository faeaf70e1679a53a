package com.flamingo.ai.climatechat.service.pipeline;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Single-flight map: concurrent callers with the same key share the first caller's computation and
 * all receive its result.
 */
@Component
@Slf4j
public class InFlightRequests {

  private final ConcurrentMap<String, CompletableFuture<PipelineResult>> inFlight =
      new ConcurrentHashMap<>();

  public PipelineResult run(
      String key, PipelineDeadline deadline, Supplier<PipelineResult> computation)
      throws TimeoutException, InterruptedException {
    return run(key, deadline, computation, UnaryOperator.identity());
  }

  /**
   * Runs the computation unless one is already running for the key, in which case waits for it.
   *
   * @param forJoiner applied to the shared result before it is handed to a caller that joined
   *     another caller's computation
   * @throws TimeoutException if the shared computation does not finish before the deadline
   */
  public PipelineResult run(
      String key,
      PipelineDeadline deadline,
      Supplier<PipelineResult> computation,
      UnaryOperator<PipelineResult> forJoiner)
      throws TimeoutException, InterruptedException {
    CompletableFuture<PipelineResult> mine = new CompletableFuture<>();
    CompletableFuture<PipelineResult> existing = inFlight.putIfAbsent(key, mine);
    if (existing != null) {
      log.debug("Joining in-flight computation for '{}'", key);
      return forJoiner.apply(await(existing, deadline));
    }

    try {
      PipelineResult result = computation.get();
      mine.complete(result);
      return result;
    } catch (RuntimeException e) {
      mine.completeExceptionally(e);
      throw e;
    } finally {
      inFlight.remove(key, mine);
    }
  }

  int size() {
    return inFlight.size();
  }

  private PipelineResult await(CompletableFuture<PipelineResult> future, PipelineDeadline deadline)
      throws TimeoutException, InterruptedException {
    try {
      return future.get(deadline.remaining().toMillis(), TimeUnit.MILLISECONDS);
    } catch (ExecutionException e) {
      if (e.getCause() instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new IllegalStateException("Shared computation failed", e.getCause());
    }
  }
}
