package com.flamingo.ai.tabbacklog.config;

import com.flamingo.ai.tabbacklog.service.extraction.ExtractorRegistry;
import com.flamingo.ai.tabbacklog.service.extraction.GenericHtmlExtractor;
import com.flamingo.ai.tabbacklog.service.extraction.TwitterExtractor;
import com.flamingo.ai.tabbacklog.service.extraction.YouTubeExtractor;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the extractors in dispatch order: most specific first, generic HTML last. */
@Configuration
public class ExtractionConfig {

  @Bean
  public ExtractorRegistry extractorRegistry(
      YouTubeExtractor youTube, TwitterExtractor twitter, GenericHtmlExtractor generic) {
    return new ExtractorRegistry(List.of(youTube, twitter, generic));
  }
}
