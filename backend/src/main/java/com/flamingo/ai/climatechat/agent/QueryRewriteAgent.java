package com.flamingo.ai.climatechat.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent that turns a context-dependent follow-up into a standalone English question. */
public interface QueryRewriteAgent {

  @SystemMessage(
      """
        You are a query rewriter. Rewrite the user query as a standalone question in English
        based on the conversation history. Replace pronouns and vague references ("they", "it",
        "that", "what else") with the people, places and topics they refer to. Keep the user's
        intent. Return ONLY the rewritten question, with no preamble or quotes.
        """)
  @UserMessage(
      """
        Conversation History:
        {{history}}

        User Query: "{{query}}"

        Rewritten question:
        """)
  String rewrite(@V("history") String history, @V("query") String query);
}
