package com.flamingo.ai.climatechat.service.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("InFlightRequests Tests")
class InFlightRequestsTest {

  private static final PipelineResult RESULT =
      new PipelineResult.Success("answer", List.of(), 0.9, false, false, null, Map.of());

  private InFlightRequests inFlightRequests;
  private ExecutorService executor;

  @BeforeEach
  void setUp() {
    inFlightRequests = new InFlightRequests();
    executor = Executors.newFixedThreadPool(2);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  @DisplayName("Should share one computation between concurrent callers of the same key")
  void shouldShareComputation() throws Exception {
    CountDownLatch started = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    AtomicInteger computations = new AtomicInteger();

    Future<PipelineResult> leader =
        executor.submit(
            () ->
                inFlightRequests.run(
                    "en:what is climate change?",
                    PipelineDeadline.after(Duration.ofSeconds(5)),
                    () -> {
                      computations.incrementAndGet();
                      started.countDown();
                      awaitQuietly(release);
                      return RESULT;
                    }));
    assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

    Future<PipelineResult> follower =
        executor.submit(
            () ->
                inFlightRequests.run(
                    "en:what is climate change?",
                    PipelineDeadline.after(Duration.ofSeconds(5)),
                    () -> {
                      computations.incrementAndGet();
                      return RESULT;
                    }));
    Thread.sleep(100);
    release.countDown();

    assertThat(leader.get(5, TimeUnit.SECONDS)).isSameAs(RESULT);
    assertThat(follower.get(5, TimeUnit.SECONDS)).isSameAs(RESULT);
    assertThat(computations).hasValue(1);
    assertThat(inFlightRequests.size()).isZero();
  }

  @Test
  @DisplayName("Should adapt the shared result for joiners only")
  void shouldAdaptSharedResultForJoiners() throws Exception {
    CountDownLatch started = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    PipelineResult joinerView =
        new PipelineResult.Success("answer", List.of(), 0.9, false, false, null, Map.of());

    Future<PipelineResult> leader =
        executor.submit(
            () ->
                inFlightRequests.run(
                    "key",
                    PipelineDeadline.after(Duration.ofSeconds(5)),
                    () -> {
                      started.countDown();
                      awaitQuietly(release);
                      return RESULT;
                    },
                    shared -> joinerView));
    assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

    Future<PipelineResult> follower =
        executor.submit(
            () ->
                inFlightRequests.run(
                    "key",
                    PipelineDeadline.after(Duration.ofSeconds(5)),
                    () -> RESULT,
                    shared -> joinerView));
    Thread.sleep(100);
    release.countDown();

    assertThat(leader.get(5, TimeUnit.SECONDS)).isSameAs(RESULT);
    assertThat(follower.get(5, TimeUnit.SECONDS)).isSameAs(joinerView);
  }

  @Test
  @DisplayName("Should compute again once the previous computation finished")
  void shouldNotReuseFinishedComputation() throws Exception {
    AtomicInteger computations = new AtomicInteger();
    PipelineDeadline deadline = PipelineDeadline.after(Duration.ofSeconds(5));

    inFlightRequests.run("key", deadline, () -> {
      computations.incrementAndGet();
      return RESULT;
    });
    inFlightRequests.run("key", deadline, () -> {
      computations.incrementAndGet();
      return RESULT;
    });

    assertThat(computations).hasValue(2);
  }

  @Test
  @DisplayName("Should release the key when the computation throws")
  void shouldReleaseKeyOnFailure() {
    PipelineDeadline deadline = PipelineDeadline.after(Duration.ofSeconds(5));

    assertThatThrownBy(
            () ->
                inFlightRequests.run(
                    "key",
                    deadline,
                    () -> {
                      throw new IllegalStateException("boom");
                    }))
        .isInstanceOf(IllegalStateException.class);
    assertThat(inFlightRequests.size()).isZero();
  }

  @Test
  @DisplayName("Should time out a joiner whose deadline passes first")
  void shouldTimeOutJoiner() throws Exception {
    CountDownLatch started = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    executor.submit(
        () ->
            inFlightRequests.run(
                "key",
                PipelineDeadline.after(Duration.ofSeconds(5)),
                () -> {
                  started.countDown();
                  awaitQuietly(release);
                  return RESULT;
                }));
    assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

    try {
      assertThatThrownBy(
              () ->
                  inFlightRequests.run(
                      "key", PipelineDeadline.after(Duration.ofMillis(50)), () -> RESULT))
          .isInstanceOf(TimeoutException.class);
    } finally {
      release.countDown();
    }
  }

  private static void awaitQuietly(CountDownLatch latch) {
    try {
      latch.await(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
