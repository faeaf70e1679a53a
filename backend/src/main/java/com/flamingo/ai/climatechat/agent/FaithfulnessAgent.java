package com.flamingo.ai.climatechat.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent scoring how well an answer is grounded in the passages it was generated from. */
public interface FaithfulnessAgent {

  @SystemMessage(
      """
        You are a fact-checking expert. Judge whether every claim in the answer is supported by
        the provided context passages.

        Scoring Guidelines:
        - 1.0: Every claim is directly stated in or entailed by the context
        - 0.7-0.9: Nearly all claims are supported; minor details are unsupported
        - 0.4-0.6: Some claims are supported, others are not found in the context
        - 0.1-0.3: Few claims are supported by the context
        - 0.0: The answer contradicts the context or is unrelated to it

        Return ONLY the numeric score (e.g., 0.8). Do not include explanations.
        """)
  @UserMessage(
      """
        Question: {{question}}

        Context:
        {{context}}

        Answer: {{answer}}

        Score:
        """)
  String score(
      @V("question") String question, @V("answer") String answer, @V("context") String context);
}
