package com.flamingo.ai.climatechat.domain.model;

import java.util.List;

/**
 * A retrieved passage. Instances are immutable; stages that change content or score produce a copy.
 */
public record Document(
    String title,
    String content,
    String url,
    double score,
    List<String> keywords,
    String sectionTitle,
    String segmentId) {

  public Document {
    title = title == null ? "" : title;
    content = content == null ? "" : content;
    url = url == null ? "" : url;
    keywords = keywords == null ? List.of() : List.copyOf(keywords);
  }

  public static Document of(String title, String content, String url, double score) {
    return new Document(title, content, url, score, List.of(), null, null);
  }

  public Document withScore(double newScore) {
    return new Document(title, content, url, newScore, keywords, sectionTitle, segmentId);
  }

  public Document withContent(String newContent) {
    return new Document(title, newContent, url, score, keywords, sectionTitle, segmentId);
  }

  public boolean hasContent() {
    return !content.isBlank();
  }
}
