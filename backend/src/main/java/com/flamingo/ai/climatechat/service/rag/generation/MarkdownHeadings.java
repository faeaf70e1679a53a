package com.flamingo.ai.climatechat.service.rag.generation;

import java.util.regex.Pattern;

/** Repairs markdown headings written as {@code ##Title} so renderers recognise them. */
final class MarkdownHeadings {

  private static final Pattern HEADING_WITHOUT_SPACE =
      Pattern.compile("^([ \\t]*#{1,6})(?=[^#\\s])", Pattern.MULTILINE);

  private MarkdownHeadings() {}

  static String normalize(String text) {
    return HEADING_WITHOUT_SPACE.matcher(text).replaceAll("$1 ");
  }
}
