package com.flamingo.ai.climatechat.service.guard;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Phrase rules matched on whole words. A multi-word phrase also matches when up to {@value
 * #MAX_GAP} other words sit between its words, so "start a fire" catches "start a forest fire".
 */
final class KeywordRules {

  static final int MAX_GAP = 2;

  private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}']+");

  private final List<List<String>> phrases;

  KeywordRules(List<String> phrases) {
    this.phrases = new ArrayList<>();
    for (String phrase : phrases) {
      List<String> words = words(phrase);
      if (!words.isEmpty()) {
        this.phrases.add(words);
      }
    }
  }

  /** Returns the first configured phrase found in the text. */
  Optional<String> firstMatch(String text) {
    List<String> words = words(text);
    for (List<String> phrase : phrases) {
      if (contains(words, phrase)) {
        return Optional.of(String.join(" ", phrase));
      }
    }
    return Optional.empty();
  }

  private static boolean contains(List<String> words, List<String> phrase) {
    for (int start = 0; start < words.size(); start++) {
      if (words.get(start).equals(phrase.get(0)) && matchesFrom(words, phrase, start)) {
        return true;
      }
    }
    return false;
  }

  private static boolean matchesFrom(List<String> words, List<String> phrase, int start) {
    int position = start;
    for (int i = 1; i < phrase.size(); i++) {
      int found = -1;
      int limit = Math.min(words.size() - 1, position + 1 + MAX_GAP);
      for (int j = position + 1; j <= limit; j++) {
        if (words.get(j).equals(phrase.get(i))) {
          found = j;
          break;
        }
      }
      if (found < 0) {
        return false;
      }
      position = found;
    }
    return true;
  }

  static List<String> words(String text) {
    List<String> words = new ArrayList<>();
    if (text == null) {
      return words;
    }
    Matcher matcher = WORD.matcher(text.toLowerCase(Locale.ROOT).replace('’', '\''));
    while (matcher.find()) {
      words.add(matcher.group());
    }
    return words;
  }
}
