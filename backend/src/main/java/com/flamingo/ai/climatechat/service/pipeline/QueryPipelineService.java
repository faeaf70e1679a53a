package com.flamingo.ai.climatechat.service.pipeline;

import com.flamingo.ai.climatechat.config.RagConfig;
import com.flamingo.ai.climatechat.domain.enums.QueryCategory;
import com.flamingo.ai.climatechat.domain.model.CacheEntry;
import com.flamingo.ai.climatechat.domain.model.ConversationTurn;
import com.flamingo.ai.climatechat.domain.model.Document;
import com.flamingo.ai.climatechat.domain.model.Query;
import com.flamingo.ai.climatechat.exception.LlmServiceException;
import com.flamingo.ai.climatechat.exception.NoEvidenceException;
import com.flamingo.ai.climatechat.exception.PipelineTimeoutException;
import com.flamingo.ai.climatechat.exception.SearchException;
import com.flamingo.ai.climatechat.exception.TranslationException;
import com.flamingo.ai.climatechat.exception.UnsupportedLanguageException;
import com.flamingo.ai.climatechat.service.cache.ResponseCache;
import com.flamingo.ai.climatechat.service.guard.TopicCheckResult;
import com.flamingo.ai.climatechat.service.guard.TopicGuardService;
import com.flamingo.ai.climatechat.service.rag.generation.AnswerGenerationService;
import com.flamingo.ai.climatechat.service.rag.generation.GeneratedAnswer;
import com.flamingo.ai.climatechat.service.rag.query.ContextRewriteResult;
import com.flamingo.ai.climatechat.service.rag.query.ConversationContextService;
import com.flamingo.ai.climatechat.service.rag.query.ConversationHistoryFormatter;
import com.flamingo.ai.climatechat.service.rag.rerank.Reranker;
import com.flamingo.ai.climatechat.service.rag.search.HybridSearchService;
import com.flamingo.ai.climatechat.service.rag.verification.FaithfulnessService;
import com.flamingo.ai.climatechat.service.rag.verification.VerifiedAnswer;
import com.flamingo.ai.climatechat.service.rag.verification.WebSearchFallbackService;
import com.flamingo.ai.climatechat.service.translation.LanguageRegistry;
import com.flamingo.ai.climatechat.service.translation.TranslationService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs one climate question through the whole answering pipeline: language resolution, input
 * checks, cache, translation, topic gate, conversational rewrite, hybrid retrieval, reranking,
 * generation, faithfulness check with web search fallback, translation back and cache store.
 *
 * <p>Never throws. Every outcome, including timeouts and dependency failures, is a {@link
 * PipelineResult}. Outbound calls run on the pipeline executor and are bounded by the request
 * deadline.
 */
@Service
@Slf4j
public class QueryPipelineService {

  static final String NORMALIZATION = "normalization";
  static final String VALIDATION = "validation";
  static final String CACHE_LOOKUP = "cache_lookup";
  static final String TRANSLATION = "translation";
  static final String ROUTING = "routing";
  static final String CONTEXT_REWRITE = "context_rewrite";
  static final String RETRIEVAL = "retrieval";
  static final String GENERATION = "generation";
  static final String QUALITY_CHECK = "quality_check";
  static final String FALLBACK = "fallback";
  static final String TRANSLATION_OUT = "translation_out";
  static final String CACHE_STORE = "cache_store";
  static final String TOTAL = "total";

  private final LanguageRegistry languageRegistry;
  private final ResponseCache responseCache;
  private final TranslationService translationService;
  private final TopicGuardService topicGuardService;
  private final ConversationContextService conversationContextService;
  private final HybridSearchService hybridSearchService;
  private final Reranker reranker;
  private final AnswerGenerationService answerGenerationService;
  private final FaithfulnessService faithfulnessService;
  private final WebSearchFallbackService webSearchFallbackService;
  private final InFlightRequests inFlightRequests;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;
  private final Executor executor;

  public QueryPipelineService(
      LanguageRegistry languageRegistry,
      ResponseCache responseCache,
      TranslationService translationService,
      TopicGuardService topicGuardService,
      ConversationContextService conversationContextService,
      HybridSearchService hybridSearchService,
      Reranker reranker,
      AnswerGenerationService answerGenerationService,
      FaithfulnessService faithfulnessService,
      WebSearchFallbackService webSearchFallbackService,
      InFlightRequests inFlightRequests,
      RagConfig ragConfig,
      MeterRegistry meterRegistry,
      @Qualifier("pipelineExecutor") Executor executor) {
    this.languageRegistry = languageRegistry;
    this.responseCache = responseCache;
    this.translationService = translationService;
    this.topicGuardService = topicGuardService;
    this.conversationContextService = conversationContextService;
    this.hybridSearchService = hybridSearchService;
    this.reranker = reranker;
    this.answerGenerationService = answerGenerationService;
    this.faithfulnessService = faithfulnessService;
    this.webSearchFallbackService = webSearchFallbackService;
    this.inFlightRequests = inFlightRequests;
    this.ragConfig = ragConfig;
    this.meterRegistry = meterRegistry;
    this.executor = executor;
  }

  public PipelineResult process(
      String query, String languageName, List<ConversationTurn> history) {
    Duration timeout = Duration.ofSeconds(ragConfig.getPipeline().getDefaultDeadlineSeconds());
    return process(query, languageName, history, PipelineDeadline.after(timeout));
  }

  /**
   * Answers a query.
   *
   * @param rawQuery the query as the user typed it
   * @param languageName language name or ISO code the query is written in
   * @param history prior turns, oldest first; may be empty
   * @param deadline time by which the run must finish
   * @return the answer or a typed failure
   */
  @Timed(value = "rag.pipeline", description = "Time for a full pipeline run")
  public PipelineResult process(
      String rawQuery,
      String languageName,
      List<ConversationTurn> history,
      PipelineDeadline deadline) {
    long start = System.nanoTime();
    PipelineTrace trace = new PipelineTrace();

    PipelineResult result;
    try {
      List<ConversationTurn> turns =
          history == null ? List.of() : history.stream().filter(Objects::nonNull).toList();
      result = run(rawQuery == null ? "" : rawQuery, languageName, turns, deadline, trace, start);
    } catch (PipelineTimeoutException e) {
      log.warn("Pipeline timed out at stage '{}': {}", e.getStage(), e.getMessage());
      result = failure(FailureReason.TIMEOUT, e.getStage(), trace, start);
    } catch (UnsupportedLanguageException e) {
      log.info("Unsupported language '{}'", e.getLanguageName());
      result =
          failure(FailureReason.UNSUPPORTED_LANGUAGE, e.getMessage(), NORMALIZATION, trace, start);
    } catch (TranslationException e) {
      log.error(
          "Translation {} -> {} failed at stage '{}'",
          e.getSourceLanguage(),
          e.getTargetLanguage(),
          trace.currentStage(),
          e);
      result = stageFailure(FailureReason.TRANSLATION_ERROR, e.getUserMessage(), trace, start);
    } catch (NoEvidenceException e) {
      log.warn("No evidence at stage '{}': {}", trace.currentStage(), e.getMessage());
      result = stageFailure(FailureReason.NO_EVIDENCE, e.getUserMessage(), trace, start);
    } catch (SearchException e) {
      log.error("Retrieval failed at stage '{}'", trace.currentStage(), e);
      result = stageFailure(FailureReason.RETRIEVAL_ERROR, e.getUserMessage(), trace, start);
    } catch (LlmServiceException e) {
      log.error(
          "Generation failed at stage '{}' (rateLimited={})",
          trace.currentStage(),
          e.isRateLimited(),
          e);
      result = stageFailure(FailureReason.GENERATION_ERROR, e.getUserMessage(), trace, start);
    } catch (RuntimeException e) {
      log.error("Unexpected error at stage '{}'", trace.currentStage(), e);
      result = failure(FailureReason.INTERNAL_ERROR, trace.currentStage(), trace, start);
    }

    if (result instanceof PipelineResult.Failure failure) {
      meterRegistry
          .counter("rag.pipeline.failure", "reason", failure.reason().code())
          .increment();
    } else {
      meterRegistry.counter("rag.pipeline.success").increment();
    }
    return result;
  }

  private PipelineResult run(
      String rawQuery,
      String languageName,
      List<ConversationTurn> history,
      PipelineDeadline deadline,
      PipelineTrace trace,
      long start) {
    Query query =
        trace.time(NORMALIZATION, () -> Query.of(rawQuery, languageRegistry.resolve(languageName)));

    Optional<FailureReason> invalid = trace.time(VALIDATION, () -> validate(query));
    if (invalid.isPresent()) {
      log.info("Query rejected by validation: {}", invalid.get().code());
      return failure(invalid.get(), VALIDATION, trace, start);
    }

    String cacheKey = query.cacheKey();
    Optional<CacheEntry> cached = trace.time(CACHE_LOOKUP, () -> lookup(cacheKey));
    if (cached.isPresent()) {
      log.info("Cache hit for '{}'", cacheKey);
      CacheEntry entry = cached.get();
      return new PipelineResult.Success(
          entry.answer(),
          entry.citations(),
          entry.faithfulnessOrDefault(),
          true,
          false,
          ConversationTurn.of(query.raw().trim(), entry.answer(), query.languageCode()),
          finish(trace, start));
    }

    if (!ragConfig.getPipeline().isSingleFlight()) {
      return answer(query, history, deadline, trace, start);
    }
    try {
      return inFlightRequests.run(
          cacheKey,
          deadline,
          () -> answer(query, history, deadline, trace, start),
          shared -> asOwnResult(shared, query, trace, start));
    } catch (TimeoutException e) {
      throw new PipelineTimeoutException(trace.currentStage(), "Shared computation timed out");
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new PipelineTimeoutException(trace.currentStage(), "Interrupted");
    }
  }

  private PipelineResult answer(
      Query query,
      List<ConversationTurn> history,
      PipelineDeadline deadline,
      PipelineTrace trace,
      long start) {
    String pivot = ragConfig.getPipeline().getPivotLanguage();
    boolean translated = !pivot.equalsIgnoreCase(query.languageCode());
    String userQuery = query.raw().trim();

    String pivotQuery =
        translated
            ? runStage(
                TRANSLATION,
                deadline,
                trace,
                () -> translationService.translate(userQuery, query.languageCode(), pivot))
            : userQuery;

    String retrievalQuery = pivotQuery;
    List<Document> documents;
    if (history.isEmpty()) {
      CompletableFuture<TopicCheckResult> gate =
          submit(ROUTING, trace, () -> topicGuardService.check(pivotQuery, history));
      CompletableFuture<List<Document>> retrieval =
          submit(RETRIEVAL, trace, () -> retrieveAndRerank(pivotQuery));
      TopicCheckResult check;
      try {
        check = await(ROUTING, gate, deadline, trace);
      } catch (RuntimeException e) {
        retrieval.cancel(true);
        throw e;
      }
      if (!check.passed()) {
        retrieval.cancel(true);
        return gateRejection(check, trace, start);
      }
      documents = await(RETRIEVAL, retrieval, deadline, trace);
    } else {
      TopicCheckResult check =
          runStage(ROUTING, deadline, trace, () -> topicGuardService.check(pivotQuery, history));
      if (!check.passed()) {
        return gateRejection(check, trace, start);
      }

      ContextRewriteResult context =
          runStage(
              CONTEXT_REWRITE,
              deadline,
              trace,
              () -> conversationContextService.classifyAndRewrite(history, pivotQuery));
      if (!context.accepted()) {
        FailureReason reason =
            context.category() == QueryCategory.HARMFUL
                ? FailureReason.HARMFUL
                : FailureReason.OFF_TOPIC;
        log.info("Query rejected in conversation context as {}", reason.code());
        return failure(reason, CONTEXT_REWRITE, trace, start);
      }
      retrievalQuery = context.query();
      String searchQuery = retrievalQuery;
      documents = runStage(RETRIEVAL, deadline, trace, () -> retrieveAndRerank(searchQuery));
    }

    if (documents.isEmpty()) {
      log.info("No documents retrieved for '{}'", retrievalQuery);
      return failure(FailureReason.NO_EVIDENCE, RETRIEVAL, trace, start);
    }

    String generationQuery = retrievalQuery;
    List<ConversationTurn> window =
        ConversationHistoryFormatter.recent(history, ragConfig.getContext().getHistoryWindow());
    GeneratedAnswer primary =
        runStage(
            GENERATION,
            deadline,
            trace,
            () -> answerGenerationService.generate(generationQuery, documents, window));

    double primaryScore =
        runStage(
            QUALITY_CHECK,
            deadline,
            trace,
            () ->
                faithfulnessService.score(
                    generationQuery,
                    primary.answer(),
                    primary.documents().stream().map(Document::content).toList()));
    log.debug("Primary answer faithfulness {}", String.format("%.3f", primaryScore));

    VerifiedAnswer chosen = new VerifiedAnswer(primary, primaryScore);
    boolean fallbackUsed = false;
    if (primaryScore < ragConfig.getFaithfulness().getFallbackThreshold()) {
      Optional<VerifiedAnswer> fallback = attemptFallback(generationQuery, window, deadline, trace);
      if (fallback.isPresent() && fallback.get().faithfulness() > primaryScore) {
        log.info(
            "Using web search answer (faithfulness {} over {})",
            String.format("%.3f", fallback.get().faithfulness()),
            String.format("%.3f", primaryScore));
        meterRegistry.counter("rag.faithfulness.fallback").increment();
        chosen = fallback.get();
        fallbackUsed = true;
      }
    }

    String pivotAnswer = chosen.answer().answer();
    String finalAnswer =
        translated
            ? runStage(
                TRANSLATION_OUT,
                deadline,
                trace,
                () -> translationService.translate(pivotAnswer, pivot, query.languageCode()))
            : pivotAnswer;

    VerifiedAnswer result = chosen;
    trace.time(
        CACHE_STORE,
        () ->
            store(
                query.cacheKey(),
                new CacheEntry(
                    finalAnswer,
                    result.answer().citations(),
                    result.faithfulness(),
                    new CacheEntry.Metadata(
                        Instant.now(),
                        query.languageCode(),
                        Duration.ofNanos(System.nanoTime() - start).toMillis(),
                        translated))));

    return new PipelineResult.Success(
        finalAnswer,
        result.answer().citations(),
        result.faithfulness(),
        false,
        fallbackUsed,
        ConversationTurn.of(userQuery, finalAnswer, query.languageCode()),
        finish(trace, start));
  }

  /** Re-issues a result computed for another caller under this caller's query and timings. */
  private static PipelineResult asOwnResult(
      PipelineResult shared, Query query, PipelineTrace trace, long start) {
    if (shared instanceof PipelineResult.Success success) {
      return new PipelineResult.Success(
          success.answer(),
          success.citations(),
          success.faithfulness(),
          success.cacheHit(),
          success.fallbackUsed(),
          ConversationTurn.of(query.raw().trim(), success.answer(), query.languageCode()),
          finish(trace, start));
    }
    PipelineResult.Failure failure = (PipelineResult.Failure) shared;
    return new PipelineResult.Failure(
        failure.reason(), failure.message(), failure.stage(), finish(trace, start));
  }

  private Optional<FailureReason> validate(Query query) {
    int length = query.raw().trim().length();
    RagConfig.Pipeline pipeline = ragConfig.getPipeline();
    if (length < pipeline.getMinQueryLength()) {
      return Optional.of(FailureReason.TOO_SHORT);
    }
    if (length > pipeline.getMaxQueryLength()) {
      return Optional.of(FailureReason.TOO_LONG);
    }
    return Optional.empty();
  }

  private Optional<CacheEntry> lookup(String key) {
    try {
      return responseCache.get(key);
    } catch (RuntimeException e) {
      log.warn("Cache lookup failed for '{}', continuing without cache: {}", key, e.getMessage());
      return Optional.empty();
    }
  }

  private boolean store(String key, CacheEntry entry) {
    try {
      boolean stored = responseCache.put(key, entry);
      if (!stored) {
        log.warn("Answer for '{}' was not cached", key);
      }
      return stored;
    } catch (RuntimeException e) {
      log.warn("Cache store failed for '{}': {}", key, e.getMessage());
      return false;
    }
  }

  private List<Document> retrieveAndRerank(String query) {
    List<Document> candidates = hybridSearchService.retrieve(query);
    if (candidates.isEmpty()) {
      return candidates;
    }
    return reranker.rerank(query, candidates, ragConfig.getReranking().getTopK());
  }

  private Optional<VerifiedAnswer> attemptFallback(
      String query, List<ConversationTurn> window, PipelineDeadline deadline, PipelineTrace trace) {
    try {
      return runStage(
          FALLBACK, deadline, trace, () -> webSearchFallbackService.attempt(query, window));
    } catch (PipelineTimeoutException e) {
      log.warn("Web search fallback timed out, keeping primary answer");
      return Optional.empty();
    }
  }

  private PipelineResult gateRejection(
      TopicCheckResult check, PipelineTrace trace, long start) {
    FailureReason reason =
        switch (check.reason()) {
          case HARMFUL_CONTENT -> FailureReason.HARMFUL_CONTENT;
          case MISINFORMATION -> FailureReason.MISINFORMATION;
          default -> FailureReason.NOT_CLIMATE_RELATED;
        };
    log.info("Query rejected by topic gate: {}", reason.code());
    return failure(reason, ROUTING, trace, start);
  }

  private <T> T runStage(
      String stage, PipelineDeadline deadline, PipelineTrace trace, Supplier<T> work) {
    return await(stage, submit(stage, trace, work), deadline, trace);
  }

  private <T> CompletableFuture<T> submit(String stage, PipelineTrace trace, Supplier<T> work) {
    return CompletableFuture.supplyAsync(
        () -> {
          long started = System.nanoTime();
          try {
            return work.get();
          } finally {
            trace.record(stage, Duration.ofNanos(System.nanoTime() - started));
          }
        },
        executor);
  }

  /** Waits for a stage, bounded by the remaining deadline and the per-call ceiling. */
  private <T> T await(
      String stage, CompletableFuture<T> future, PipelineDeadline deadline, PipelineTrace trace) {
    trace.enter(stage);
    Duration ceiling = Duration.ofSeconds(ragConfig.getPipeline().getExternalCallTimeoutSeconds());
    Duration remaining = deadline.remaining();
    Duration budget = remaining.compareTo(ceiling) < 0 ? remaining : ceiling;
    try {
      return future.get(budget.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new PipelineTimeoutException(
          stage, "Stage did not finish within " + budget.toMillis() + " ms");
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new PipelineTimeoutException(stage, "Interrupted while waiting");
    } catch (ExecutionException e) {
      if (e.getCause() instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new IllegalStateException("Stage '" + stage + "' failed", e.getCause());
    }
  }

  private PipelineResult.Failure failure(
      FailureReason reason, String stage, PipelineTrace trace, long start) {
    return failure(reason, reason.message(), stage, trace, start);
  }

  private PipelineResult.Failure stageFailure(
      FailureReason reason, String message, PipelineTrace trace, long start) {
    return failure(reason, message, trace.currentStage(), trace, start);
  }

  private PipelineResult.Failure failure(
      FailureReason reason, String message, String stage, PipelineTrace trace, long start) {
    return new PipelineResult.Failure(reason, message, stage, finish(trace, start));
  }

  private static Map<String, Duration> finish(PipelineTrace trace, long start) {
    trace.record(TOTAL, Duration.ofNanos(System.nanoTime() - start));
    return trace.snapshot();
  }
}
