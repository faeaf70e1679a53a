package com.flamingo.ai.climatechat.domain.model;

/** Structured reference tying an answer back to one of the documents it was generated from. */
public record Citation(String title, String url, String content, String snippet) {

  public static final int SNIPPET_LENGTH = 200;

  /** Builds a citation whose snippet is the first {@value #SNIPPET_LENGTH} characters. */
  public static Citation from(Document document) {
    String content = document.content();
    String snippet =
        content.length() > SNIPPET_LENGTH ? content.substring(0, SNIPPET_LENGTH) + "..." : content;
    return new Citation(document.title(), document.url(), content, snippet);
  }
}
