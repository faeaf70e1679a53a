package com.flamingo.ai.climatechat.service.guard;

/** Binary topic classifier deciding whether a text is about the climate domain. */
public interface TopicClassifierClient {

  /**
   * Classifies a text.
   *
   * @param text the text to classify
   * @return the most likely label with its score
   * @throws RuntimeException when the classifier cannot be reached
   */
  TopicClassification classify(String text);
}
