package com.flamingo.ai.climatechat.service.translation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.climatechat.exception.UnsupportedLanguageException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("LanguageRegistry Tests")
class LanguageRegistryTest {

  private final LanguageRegistry registry = new LanguageRegistry();

  @ParameterizedTest
  @CsvSource({
    "English,en",
    "  spanish ,es",
    "Mandarin,zh",
    "brazilian portuguese,pt",
    "Farsi,fa",
    "tagalog,fil",
    "fr,fr"
  })
  @DisplayName("Should resolve names, variations and codes")
  void shouldResolve(String name, String code) {
    assertThat(registry.resolve(name)).isEqualTo(code);
  }

  @Test
  @DisplayName("Should list available languages when a name is unknown")
  void shouldRejectUnknownLanguage() {
    assertThatThrownBy(() -> registry.resolve("Klingon"))
        .isInstanceOf(UnsupportedLanguageException.class)
        .hasMessageContaining("Klingon")
        .hasMessageContaining("english")
        .satisfies(
            e ->
                assertThat(((UnsupportedLanguageException) e).getAvailableLanguages())
                    .contains("spanish", "swahili"));
  }

  @Test
  @DisplayName("Should return capitalized display names")
  void shouldReturnDisplayNames() {
    assertThat(registry.displayName("es")).isEqualTo("Spanish");
    assertThat(registry.displayName("xx")).isEqualTo("xx");
  }

  @Test
  @DisplayName("Should list languages alphabetically")
  void shouldListLanguagesAlphabetically() {
    assertThat(registry.supportedLanguages()).isSorted().contains("english", "zulu");
  }
}
