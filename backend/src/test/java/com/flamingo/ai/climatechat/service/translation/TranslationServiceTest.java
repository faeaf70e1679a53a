package com.flamingo.ai.climatechat.service.translation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.climatechat.agent.TranslationAgent;
import com.flamingo.ai.climatechat.exception.TranslationException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("TranslationService Tests")
class TranslationServiceTest {

  @Mock private TranslationAgent translationAgent;

  private TranslationService service;

  @BeforeEach
  void setUp() {
    service =
        new TranslationService(translationAgent, new LanguageRegistry(), new SimpleMeterRegistry());
  }

  @Test
  @DisplayName("Should translate using display names")
  void shouldTranslateUsingDisplayNames() {
    when(translationAgent.translate("¿Qué es el cambio climático?", "Spanish", "English"))
        .thenReturn(" What is climate change? ");

    assertThat(service.translate("¿Qué es el cambio climático?", "es", "en"))
        .isEqualTo("What is climate change?");
  }

  @Test
  @DisplayName("Should return the text unchanged for the same language")
  void shouldSkipSameLanguage() {
    assertThat(service.translate("Hello", "en", "en")).isEqualTo("Hello");
    verifyNoInteractions(translationAgent);
  }

  @Test
  @DisplayName("Should raise TranslationException when the model fails")
  void shouldRaiseWhenModelFails() {
    when(translationAgent.translate(anyString(), anyString(), anyString()))
        .thenThrow(new RuntimeException("boom"));

    assertThatThrownBy(() -> service.translate("Bonjour", "fr", "en"))
        .isInstanceOf(TranslationException.class)
        .satisfies(
            e -> {
              TranslationException te = (TranslationException) e;
              assertThat(te.getSourceLanguage()).isEqualTo("fr");
              assertThat(te.getTargetLanguage()).isEqualTo("en");
            });
  }

  @Test
  @DisplayName("Should raise TranslationException for an empty translation")
  void shouldRaiseForEmptyTranslation() {
    when(translationAgent.translate(anyString(), anyString(), anyString())).thenReturn("");

    assertThatThrownBy(() -> service.translate("Hallo", "de", "en"))
        .isInstanceOf(TranslationException.class);
  }
}
