package com.flamingo.ai.climatechat.service.translation;

import com.flamingo.ai.climatechat.exception.UnsupportedLanguageException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Static table of supported languages. Resolves user-facing language names (and common
 * alternative names) to ISO 639 codes.
 */
@Component
public class LanguageRegistry {

  private static final Map<String, String> NAME_TO_CODE = buildNames();
  private static final Map<String, String> VARIATIONS = buildVariations();
  private static final Map<String, String> CODE_TO_NAME = buildDisplayNames();

  /**
   * Resolves a language name or code.
   *
   * @param languageName e.g. "Spanish", "mandarin" or "es"
   * @return the ISO 639 code
   * @throws UnsupportedLanguageException listing the supported names
   */
  public String resolve(String languageName) {
    String key = languageName == null ? "" : languageName.trim().toLowerCase(Locale.ROOT);
    String code = NAME_TO_CODE.get(key);
    if (code == null) {
      code = VARIATIONS.get(key);
    }
    if (code == null && CODE_TO_NAME.containsKey(key)) {
      code = key;
    }
    if (code == null) {
      throw new UnsupportedLanguageException(languageName, supportedLanguages());
    }
    return code;
  }

  /** English name of a language, capitalized, e.g. "Spanish" for {@code es}. */
  public String displayName(String code) {
    String name = CODE_TO_NAME.get(code);
    if (name == null) {
      return code;
    }
    return Character.toUpperCase(name.charAt(0)) + name.substring(1);
  }

  /** Supported language names in alphabetical order. */
  public List<String> supportedLanguages() {
    List<String> names = new ArrayList<>(NAME_TO_CODE.keySet());
    Collections.sort(names);
    return names;
  }

  private static Map<String, String> buildDisplayNames() {
    Map<String, String> codes = new LinkedHashMap<>();
    NAME_TO_CODE.forEach((name, code) -> codes.putIfAbsent(code, name));
    return Collections.unmodifiableMap(codes);
  }

  private static Map<String, String> buildVariations() {
    Map<String, String> variations = new LinkedHashMap<>();
    variations.put("mandarin", "zh");
    variations.put("mandarin chinese", "zh");
    variations.put("chinese mandarin", "zh");
    variations.put("simplified chinese", "zh");
    variations.put("traditional chinese", "zh");
    variations.put("standard chinese", "zh");
    variations.put("brazilian portuguese", "pt");
    variations.put("portuguese brazilian", "pt");
    variations.put("castilian", "es");
    variations.put("castellano", "es");
    variations.put("farsi", "fa");
    variations.put("tagalog", "fil");
    return Collections.unmodifiableMap(variations);
  }

  private static Map<String, String> buildNames() {
    Map<String, String> names = new LinkedHashMap<>();
    names.put("afrikaans", "af");
    names.put("amharic", "am");
    names.put("arabic", "ar");
    names.put("azerbaijani", "az");
    names.put("belarusian", "be");
    names.put("bengali", "bn");
    names.put("bulgarian", "bg");
    names.put("catalan", "ca");
    names.put("cebuano", "ceb");
    names.put("czech", "cs");
    names.put("welsh", "cy");
    names.put("danish", "da");
    names.put("german", "de");
    names.put("greek", "el");
    names.put("english", "en");
    names.put("esperanto", "eo");
    names.put("spanish", "es");
    names.put("estonian", "et");
    names.put("basque", "eu");
    names.put("persian", "fa");
    names.put("finnish", "fi");
    names.put("filipino", "fil");
    names.put("french", "fr");
    names.put("western frisian", "fy");
    names.put("irish", "ga");
    names.put("scots gaelic", "gd");
    names.put("galician", "gl");
    names.put("gujarati", "gu");
    names.put("hausa", "ha");
    names.put("hebrew", "he");
    names.put("hindi", "hi");
    names.put("croatian", "hr");
    names.put("hungarian", "hu");
    names.put("armenian", "hy");
    names.put("indonesian", "id");
    names.put("igbo", "ig");
    names.put("icelandic", "is");
    names.put("italian", "it");
    names.put("japanese", "ja");
    names.put("javanese", "jv");
    names.put("georgian", "ka");
    names.put("kazakh", "kk");
    names.put("khmer", "km");
    names.put("kannada", "kn");
    names.put("korean", "ko");
    names.put("kurdish", "ku");
    names.put("kyrgyz", "ky");
    names.put("latin", "la");
    names.put("luxembourgish", "lb");
    names.put("lao", "lo");
    names.put("lithuanian", "lt");
    names.put("latvian", "lv");
    names.put("malagasy", "mg");
    names.put("macedonian", "mk");
    names.put("malayalam", "ml");
    names.put("mongolian", "mn");
    names.put("marathi", "mr");
    names.put("malay", "ms");
    names.put("maltese", "mt");
    names.put("burmese", "my");
    names.put("nepali", "ne");
    names.put("dutch", "nl");
    names.put("norwegian", "no");
    names.put("nyanja", "ny");
    names.put("odia", "or");
    names.put("punjabi", "pa");
    names.put("polish", "pl");
    names.put("pashto", "ps");
    names.put("portuguese", "pt");
    names.put("romanian", "ro");
    names.put("russian", "ru");
    names.put("sindhi", "sd");
    names.put("sinhala", "si");
    names.put("slovak", "sk");
    names.put("slovenian", "sl");
    names.put("samoan", "sm");
    names.put("shona", "sn");
    names.put("somali", "so");
    names.put("albanian", "sq");
    names.put("serbian", "sr");
    names.put("sesotho", "st");
    names.put("sundanese", "su");
    names.put("swedish", "sv");
    names.put("swahili", "sw");
    names.put("tamil", "ta");
    names.put("telugu", "te");
    names.put("tajik", "tg");
    names.put("thai", "th");
    names.put("turkish", "tr");
    names.put("ukrainian", "uk");
    names.put("urdu", "ur");
    names.put("uzbek", "uz");
    names.put("vietnamese", "vi");
    names.put("xhosa", "xh");
    names.put("yiddish", "yi");
    names.put("yoruba", "yo");
    names.put("chinese", "zh");
    names.put("zulu", "zu");
    return Collections.unmodifiableMap(names);
  }
}
