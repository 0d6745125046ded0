package com.flamingo.ai.tabbacklog.config;

import java.util.concurrent.Executor;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Executors that bound the parallelism of batch stage runs. */
@Configuration
@RequiredArgsConstructor
public class AsyncConfig {

  private final PipelineConfig pipelineConfig;

  @Bean(name = "extractionExecutor")
  public Executor extractionExecutor() {
    int threads = Math.max(1, pipelineConfig.getExtraction().getConcurrency());
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(1000);
    executor.setThreadNamePrefix("extract-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "enrichmentExecutor")
  public Executor enrichmentExecutor() {
    int threads = Math.max(1, pipelineConfig.getEnrichment().getConcurrency());
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(1000);
    executor.setThreadNamePrefix("enrich-");
    executor.initialize();
    return executor;
  }
}
