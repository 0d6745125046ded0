package com.flamingo.ai.tabbacklog.config;

import com.flamingo.ai.tabbacklog.agent.TabEnrichmentAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Builds the LangChain4j AI service that backs the enrichment predictor. */
@Configuration
public class AiAgentConfig {

  /**
   * Enrichment agent. Returns the model's raw JSON text so that a malformed reply can be kept for
   * diagnosis instead of being lost inside a parsing exception.
   */
  @Bean
  public TabEnrichmentAgent tabEnrichmentAgent(ChatModel chatModel) {
    return AiServices.builder(TabEnrichmentAgent.class).chatModel(chatModel).build();
  }
}
