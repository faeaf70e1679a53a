package com.flamingo.ai.climatechat.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent translating user queries and answers. */
public interface TranslationAgent {

  @SystemMessage(
      """
        You are a professional translator. Translate the text faithfully, keeping its meaning,
        tone and markdown formatting. Keep URLs, numbers and proper names unchanged.
        Return ONLY the translation.
        """)
  @UserMessage(
      """
        Translate the following text from {{source}} to {{target}}:

        {{text}}
        """)
  String translate(
      @V("text") String text,
      @V("source") String sourceLanguage,
      @V("target") String targetLanguage);
}
