package com.flamingo.ai.climatechat.service.rag.verification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.climatechat.agent.FaithfulnessAgent;
import com.flamingo.ai.climatechat.config.RagConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("FaithfulnessService Tests")
class FaithfulnessServiceTest {

  @Mock private FaithfulnessAgent faithfulnessAgent;

  private FaithfulnessService service;

  @BeforeEach
  void setUp() {
    service =
        new FaithfulnessService(faithfulnessAgent, new RagConfig(), new SimpleMeterRegistry());
  }

  @Test
  @DisplayName("Should return the parsed model score")
  void shouldReturnParsedScore() {
    when(faithfulnessAgent.score(anyString(), anyString(), anyString())).thenReturn("0.85");

    assertThat(service.score("q", "answer", List.of("context"))).isEqualTo(0.85);
  }

  @Test
  @DisplayName("Should return the neutral score when inputs are missing")
  void shouldReturnNeutralForMissingInputs() {
    assertThat(service.score("q", "", List.of("context"))).isEqualTo(0.5);
    assertThat(service.score("q", "answer", List.of())).isEqualTo(0.5);
    verifyNoInteractions(faithfulnessAgent);
  }

  @Test
  @DisplayName("Should return the neutral score when the model fails")
  void shouldReturnNeutralWhenModelFails() {
    when(faithfulnessAgent.score(anyString(), anyString(), anyString()))
        .thenThrow(new RuntimeException("timeout"));

    assertThat(service.score("q", "answer", List.of("context"))).isEqualTo(0.5);
  }

  @Test
  @DisplayName("Should return the neutral score when the reply has no number")
  void shouldReturnNeutralForUnparseableReply() {
    when(faithfulnessAgent.score(anyString(), anyString(), anyString()))
        .thenReturn("The answer is well supported.");

    assertThat(service.score("q", "answer", List.of("context"))).isEqualTo(0.5);
  }

  @Test
  @DisplayName("Should send at most five contexts, each truncated to 450 words")
  void shouldLimitContexts() {
    when(faithfulnessAgent.score(anyString(), anyString(), anyString())).thenReturn("0.7");
    String longContext =
        IntStream.range(0, 600).mapToObj(i -> "w" + i).collect(Collectors.joining(" "));
    List<String> contexts = List.of(longContext, "c2", "c3", "c4", "c5", "c6");

    service.score("q", "answer", contexts);

    ArgumentCaptor<String> context = ArgumentCaptor.forClass(String.class);
    verify(faithfulnessAgent).score(eq("q"), eq("answer"), context.capture());
    String[] parts = context.getValue().split("\n\n---\n\n");
    assertThat(parts).hasSize(5);
    assertThat(parts[0].split(" ")).hasSize(450);
    assertThat(parts[0]).endsWith("w449...");
    assertThat(context.getValue()).doesNotContain("c6");
  }

  @ParameterizedTest
  @CsvSource({"0.42,0.42", "Score: 0.9,0.9", "1.7,1.0", "0,0.0"})
  @DisplayName("Should parse and clamp scores")
  void shouldParseAndClamp(String reply, double expected) {
    assertThat(FaithfulnessService.parseScore(reply)).isEqualTo(expected);
  }

  @ParameterizedTest
  @CsvSource({".05,0.05", "0.05,0.05", "Score: .05,0.05", "8/10,0.8", "Score: 3 / 4,0.75"})
  @DisplayName("Should read bare decimals and fractions without inflating them")
  void shouldParseBareDecimalsAndFractions(String reply, double expected) {
    assertThat(FaithfulnessService.parseScore(reply)).isCloseTo(expected, within(1e-9));
  }

  @Test
  @DisplayName("Should keep a bare decimal reply below the fallback threshold")
  void shouldKeepBareDecimalLow() {
    when(faithfulnessAgent.score(anyString(), anyString(), anyString())).thenReturn(".05");

    double score = service.score("What is climate change?", "answer", List.of("context"));

    assertThat(score).isLessThan(new RagConfig().getFaithfulness().getFallbackThreshold());
  }
}
