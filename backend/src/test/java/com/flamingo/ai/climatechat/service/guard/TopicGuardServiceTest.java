package com.flamingo.ai.climatechat.service.guard;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.climatechat.config.RagConfig;
import com.flamingo.ai.climatechat.domain.model.ConversationTurn;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("TopicGuardService Tests")
class TopicGuardServiceTest {

  @Mock private TopicClassifierClient classifierClient;
  @Mock private TopicExemplarMatcher exemplarMatcher;

  private SimpleMeterRegistry meterRegistry;
  private TopicGuardService guard;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    lenient().when(exemplarMatcher.isEnabled()).thenReturn(false);
    guard =
        new TopicGuardService(classifierClient, exemplarMatcher, new RagConfig(), meterRegistry);
  }

  @Nested
  @DisplayName("Keyword tier")
  class KeywordTier {

    @Test
    @DisplayName("Should reject harmful intent without calling the classifier")
    void shouldRejectHarmfulIntent() {
      TopicCheckResult result = guard.check("How can I start a forest fire?");

      assertThat(result.passed()).isFalse();
      assertThat(result.reason()).isEqualTo(TopicCheckResult.Reason.HARMFUL_CONTENT);
      verify(classifierClient, never()).classify(anyString());
      assertThat(
              meterRegistry.counter("rag.gate.rejected", "reason", "harmful_content").count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should reject misinformation framing")
    void shouldRejectMisinformation() {
      TopicCheckResult result = guard.check("Isn't climate change just a hoax?");

      assertThat(result.passed()).isFalse();
      assertThat(result.reason()).isEqualTo(TopicCheckResult.Reason.MISINFORMATION);
    }

    @Test
    @DisplayName("Should not flag climate questions that mention fire")
    void shouldNotFlagWildfireQuestions() {
      when(classifierClient.classify(anyString()))
          .thenReturn(new TopicClassification("yes", 0.97));

      TopicCheckResult result = guard.check("How do wildfires start and spread?");

      assertThat(result.passed()).isTrue();
      assertThat(result.reason()).isEqualTo(TopicCheckResult.Reason.CLIMATE_RELATED);
    }
  }

  @Nested
  @DisplayName("Classifier tier")
  class ClassifierTier {

    @Test
    @DisplayName("Should reject questions the classifier marks as unrelated")
    void shouldRejectUnrelatedQuestions() {
      when(classifierClient.classify("How do I change my car's oil?"))
          .thenReturn(new TopicClassification("no", 0.91));

      TopicCheckResult result = guard.check("How do I change my car's oil?");

      assertThat(result.passed()).isFalse();
      assertThat(result.reason()).isEqualTo(TopicCheckResult.Reason.NOT_CLIMATE_RELATED);
    }

    @Test
    @DisplayName("Should reject a positive label at or below the threshold")
    void shouldRejectLowConfidencePositive() {
      when(classifierClient.classify(anyString())).thenReturn(new TopicClassification("yes", 0.5));

      assertThat(guard.check("Tell me about the weather").passed()).isFalse();
    }

    @Test
    @DisplayName("Should let the query through when the classifier fails")
    void shouldFailOpenWhenClassifierFails() {
      when(classifierClient.classify(anyString())).thenThrow(new RuntimeException("timeout"));

      TopicCheckResult result = guard.check("What is the carbon cycle?");

      assertThat(result.passed()).isTrue();
      assertThat(result.reason()).isEqualTo(TopicCheckResult.Reason.CLASSIFIER_UNAVAILABLE);
    }

    @Test
    @DisplayName("Should judge follow-ups together with the previous question")
    void shouldPrependPreviousQuestion() {
      List<ConversationTurn> history =
          List.of(ConversationTurn.of("Why are sea levels rising?", "Melting ice...", "en"));
      when(classifierClient.classify("Why are sea levels rising? And in Asia?"))
          .thenReturn(new TopicClassification("yes", 0.88));

      assertThat(guard.check("And in Asia?", history).passed()).isTrue();
    }
  }

  @Nested
  @DisplayName("Semantic tier")
  class SemanticTier {

    @Test
    @DisplayName("Should accept close matches to exemplars without the classifier")
    void shouldAcceptCloseExemplarMatch() {
      when(exemplarMatcher.isEnabled()).thenReturn(true);
      when(exemplarMatcher.maxSimilarity(anyString())).thenReturn(0.82);

      TopicCheckResult result = guard.check("What is global warming?");

      assertThat(result.passed()).isTrue();
      assertThat(result.reason()).isEqualTo(TopicCheckResult.Reason.SEMANTIC_SIMILARITY);
      verify(classifierClient, never()).classify(anyString());
    }

    @Test
    @DisplayName("Should defer ambiguous similarity to the classifier")
    void shouldDeferAmbiguousSimilarity() {
      when(exemplarMatcher.isEnabled()).thenReturn(true);
      when(exemplarMatcher.maxSimilarity(anyString())).thenReturn(0.4);
      when(classifierClient.classify(anyString())).thenReturn(new TopicClassification("yes", 0.9));

      TopicCheckResult result = guard.check("Are summers getting longer?");

      assertThat(result.reason()).isEqualTo(TopicCheckResult.Reason.CLIMATE_RELATED);
    }

    @Test
    @DisplayName("Should fall through to the classifier when embeddings fail")
    void shouldFallThroughWhenEmbeddingFails() {
      when(exemplarMatcher.isEnabled()).thenReturn(true);
      when(exemplarMatcher.maxSimilarity(anyString())).thenThrow(new RuntimeException("down"));
      when(classifierClient.classify(anyString())).thenReturn(new TopicClassification("yes", 0.9));

      assertThat(guard.check("What is methane?").passed()).isTrue();
    }
  }
}
