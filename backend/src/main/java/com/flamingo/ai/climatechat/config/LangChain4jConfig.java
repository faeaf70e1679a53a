package com.flamingo.ai.climatechat.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/** Configuration for LangChain4j models. */
@Configuration
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.chat-model.model-name:gpt-4o-mini}")
  private String chatModelName;

  @Value("${langchain4j.openai.embedding-model.model-name:text-embedding-3-small}")
  private String embeddingModelName;

  @Value("${langchain4j.openai.embedding-model.dimensions:1024}")
  private int embeddingDimensions;

  @Value("${rag.pipeline.external-call-timeout-seconds:300}")
  private long timeoutSeconds;

  /**
   * Deterministic model for classification, rewriting, translation and scoring. These calls are
   * never retried by the client.
   */
  @Bean
  @Primary
  public ChatModel chatModel() {
    validateApiKey();

    return OpenAiChatModel.builder()
        .apiKey(openAiApiKey)
        .modelName(chatModelName)
        .temperature(0.0)
        .maxCompletionTokens(512)
        .timeout(Duration.ofSeconds(timeoutSeconds))
        .maxRetries(0)
        .logRequests(false)
        .logResponses(false)
        .build();
  }

  /** Model used to write answers. */
  @Bean
  public ChatModel generationChatModel(RagConfig ragConfig) {
    validateApiKey();

    RagConfig.Generation generation = ragConfig.getGeneration();
    return OpenAiChatModel.builder()
        .apiKey(openAiApiKey)
        .modelName(chatModelName)
        .temperature(generation.getTemperature())
        .maxCompletionTokens(generation.getMaxTokens())
        .timeout(Duration.ofSeconds(timeoutSeconds))
        .maxRetries(0)
        .logRequests(false)
        .logResponses(false)
        .build();
  }

  @Bean
  public EmbeddingModel embeddingModel() {
    validateApiKey();

    return OpenAiEmbeddingModel.builder()
        .apiKey(openAiApiKey)
        .modelName(embeddingModelName)
        .dimensions(embeddingDimensions)
        .timeout(Duration.ofSeconds(30))
        .build();
  }

  private void validateApiKey() {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required. Set OPENAI_API_KEY environment variable.");
    }
  }
}
