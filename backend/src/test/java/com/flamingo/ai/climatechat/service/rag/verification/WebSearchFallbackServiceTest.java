package com.flamingo.ai.climatechat.service.rag.verification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.climatechat.config.RagConfig;
import com.flamingo.ai.climatechat.domain.model.Citation;
import com.flamingo.ai.climatechat.domain.model.Document;
import com.flamingo.ai.climatechat.service.rag.generation.AnswerGenerationService;
import com.flamingo.ai.climatechat.service.rag.generation.GeneratedAnswer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("WebSearchFallbackService Tests")
class WebSearchFallbackServiceTest {

  @Mock private WebSearchClient webSearchClient;
  @Mock private AnswerGenerationService answerGenerationService;
  @Mock private FaithfulnessService faithfulnessService;

  private RagConfig ragConfig;
  private WebSearchFallbackService service;

  @BeforeEach
  void setUp() {
    ragConfig = new RagConfig();
    service =
        new WebSearchFallbackService(
            webSearchClient,
            answerGenerationService,
            faithfulnessService,
            ragConfig,
            new SimpleMeterRegistry());
  }

  @Test
  @DisplayName("Should regenerate from search results with accuracy instructions and rescore")
  @SuppressWarnings("unchecked")
  void shouldRegenerateAndRescore() {
    when(webSearchClient.search("What is a carbon sink?", 5))
        .thenReturn(
            List.of(
                new WebSearchResult(
                    "", "https://example.org/sinks", "Forests and oceans absorb CO2."),
                new WebSearchResult("Empty", "https://example.org/empty", " ")));
    Document synthesized =
        Document.of(
            "https://example.org/sinks",
            "Forests and oceans absorb CO2.",
            "https://example.org/sinks",
            0.0);
    GeneratedAnswer regenerated =
        new GeneratedAnswer(
            "A carbon sink absorbs more carbon than it releases.",
            List.of(Citation.from(synthesized)),
            List.of(synthesized));
    when(answerGenerationService.generate(
            eq("What is a carbon sink?"),
            anyList(),
            anyList(),
            eq(WebSearchFallbackService.FALLBACK_INSTRUCTIONS)))
        .thenReturn(regenerated);
    when(faithfulnessService.score(anyString(), anyString(), anyList())).thenReturn(0.4);

    Optional<VerifiedAnswer> result = service.attempt("What is a carbon sink?", List.of());

    assertThat(result).isPresent();
    assertThat(result.get().faithfulness()).isEqualTo(0.4);
    assertThat(result.get().answer()).isSameAs(regenerated);

    ArgumentCaptor<List<Document>> documents = ArgumentCaptor.forClass(List.class);
    verify(answerGenerationService)
        .generate(anyString(), documents.capture(), anyList(), anyString());
    assertThat(documents.getValue())
        .singleElement()
        .satisfies(d -> assertThat(d.title()).isEqualTo("https://example.org/sinks"));
  }

  @Test
  @DisplayName("Should return empty when search finds nothing")
  void shouldReturnEmptyWhenNoResults() {
    when(webSearchClient.search(anyString(), anyInt())).thenReturn(List.of());

    assertThat(service.attempt("q", List.of())).isEmpty();
    verifyNoInteractions(answerGenerationService);
  }

  @Test
  @DisplayName("Should return empty when search fails")
  void shouldReturnEmptyWhenSearchFails() {
    when(webSearchClient.search(anyString(), anyInt()))
        .thenThrow(new RuntimeException("401 Unauthorized"));

    assertThat(service.attempt("q", List.of())).isEmpty();
  }

  @Test
  @DisplayName("Should not search when disabled")
  void shouldNotSearchWhenDisabled() {
    ragConfig.getWebSearch().setEnabled(false);

    assertThat(service.attempt("q", List.of())).isEmpty();
    verifyNoInteractions(webSearchClient);
  }
}
