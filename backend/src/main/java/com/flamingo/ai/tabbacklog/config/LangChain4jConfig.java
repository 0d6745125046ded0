package com.flamingo.ai.tabbacklog.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the LangChain4j chat model used by enrichment. Any OpenAI-compatible endpoint
 * works, including local servers, by pointing {@code base-url} at it.
 */
@Configuration
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String apiKey;

  @Value("${langchain4j.openai.base-url:https://api.openai.com/v1}")
  private String baseUrl;

  @Value("${langchain4j.openai.chat-model.model-name:gpt-4o-mini}")
  private String modelName;

  @Value("${langchain4j.openai.chat-model.max-tokens:1024}")
  private int maxTokens;

  @Value("${langchain4j.openai.chat-model.temperature:0.7}")
  private double temperature;

  @Value("${langchain4j.openai.chat-model.timeout-seconds:60}")
  private int timeoutSeconds;

  @Bean
  public ChatModel chatModel() {
    validateApiKey();

    return OpenAiChatModel.builder()
        .baseUrl(baseUrl)
        .apiKey(apiKey)
        .modelName(modelName)
        .maxTokens(maxTokens)
        .temperature(temperature)
        .timeout(Duration.ofSeconds(timeoutSeconds))
        .responseFormat("json_object")
        .logRequests(false)
        .logResponses(false)
        .build();
  }

  /** Identifier of the configured model, reported with every enrichment. */
  @Bean
  public String enrichmentModelName() {
    return modelName;
  }

  private void validateApiKey() {
    if (apiKey == null || apiKey.isBlank()) {
      throw new IllegalStateException(
          "LLM API key is required. Set LLM_API_KEY (any value for local servers).");
    }
  }
}
