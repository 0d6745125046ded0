package com.flamingo.ai.tabbacklog.config;

import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Resilience4j components guarding the model endpoint. */
@Configuration
public class ResilienceConfig {

  /** Caps concurrent enrichments across all tabs and callers. */
  @Bean
  public Bulkhead enrichmentBulkhead(PipelineConfig pipelineConfig) {
    PipelineConfig.Enrichment enrichment = pipelineConfig.getEnrichment();
    BulkheadConfig config =
        BulkheadConfig.custom()
            .maxConcurrentCalls(Math.max(1, enrichment.getConcurrency()))
            .maxWaitDuration(Duration.ofMillis(Math.max(0, enrichment.getMaxWaitMs())))
            .build();
    return Bulkhead.of("enrichment", config);
  }
}
