package com.flamingo.ai.climatechat.service.translation;

import com.flamingo.ai.climatechat.agent.TranslationAgent;
import com.flamingo.ai.climatechat.exception.TranslationException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Translates queries into the pivot language and answers back. Calls are not retried. */
@Service
@RequiredArgsConstructor
@Slf4j
public class TranslationService {

  private final TranslationAgent translationAgent;
  private final LanguageRegistry languageRegistry;
  private final MeterRegistry meterRegistry;

  /**
   * Translates text between two languages.
   *
   * @param text the text to translate
   * @param fromCode source language code
   * @param toCode target language code
   * @return the translation; the input itself when both languages are the same
   * @throws TranslationException if the translation model fails or returns nothing
   */
  @Timed(value = "rag.translation", description = "Time to translate text")
  public String translate(String text, String fromCode, String toCode) {
    if (text == null || text.isBlank() || fromCode.equals(toCode)) {
      return text;
    }

    String translated;
    try {
      translated =
          translationAgent.translate(
              text, languageRegistry.displayName(fromCode), languageRegistry.displayName(toCode));
    } catch (RuntimeException e) {
      meterRegistry.counter("rag.translation.error").increment();
      throw new TranslationException(
          fromCode, toCode, "Translation " + fromCode + "→" + toCode + " failed", e);
    }

    if (translated == null || translated.isBlank()) {
      meterRegistry.counter("rag.translation.error").increment();
      throw new TranslationException(
          fromCode, toCode, "Translation " + fromCode + "→" + toCode + " returned nothing", null);
    }

    log.debug("Translated {} chars {}→{}", text.length(), fromCode, toCode);
    return translated.trim();
  }
}
