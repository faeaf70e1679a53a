package com.flamingo.ai.climatechat.config;

import com.flamingo.ai.climatechat.agent.FaithfulnessAgent;
import com.flamingo.ai.climatechat.agent.QueryClassificationAgent;
import com.flamingo.ai.climatechat.agent.QueryRewriteAgent;
import com.flamingo.ai.climatechat.agent.TranslationAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for reusable AI agents using LangChain4j AI Services.
 *
 * <p>Pattern: Define agent interfaces with @SystemMessage/@UserMessage, build concrete
 * implementations using AiServices.builder().
 */
@Configuration
public class AiAgentConfig {

  /** Conversational topic classifier used before rewriting follow-up questions. */
  @Bean
  public QueryClassificationAgent queryClassificationAgent(ChatModel chatModel) {
    return AiServices.builder(QueryClassificationAgent.class).chatModel(chatModel).build();
  }

  @Bean
  public QueryRewriteAgent queryRewriteAgent(ChatModel chatModel) {
    return AiServices.builder(QueryRewriteAgent.class).chatModel(chatModel).build();
  }

  /** Grounding scorer for generated answers. */
  @Bean
  public FaithfulnessAgent faithfulnessAgent(ChatModel chatModel) {
    return AiServices.builder(FaithfulnessAgent.class).chatModel(chatModel).build();
  }

  @Bean
  public TranslationAgent translationAgent(ChatModel chatModel) {
    return AiServices.builder(TranslationAgent.class).chatModel(chatModel).build();
  }
}
