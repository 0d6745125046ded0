package com.flamingo.ai.tabbacklog.service.extraction;

import com.flamingo.ai.tabbacklog.exception.NoExtractorMatchException;
import com.flamingo.ai.tabbacklog.service.extraction.model.ParsedPage;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Ordered list of site extractors. A URL goes to the first extractor that matches it; the order
 * is fixed at construction and is the only thing that decides routing.
 */
@Slf4j
public class ExtractorRegistry {

  private final List<SiteExtractor> extractors;

  public ExtractorRegistry(List<SiteExtractor> extractors) {
    if (extractors == null || extractors.isEmpty()) {
      throw new IllegalArgumentException("At least one extractor is required");
    }
    this.extractors = List.copyOf(extractors);
    log.info("Extractor registry initialized with {}", extractorNames());
  }

  /** First extractor that matches the URL, if any. */
  public Optional<SiteExtractor> selectExtractor(String url) {
    return extractors.stream().filter(extractor -> extractor.matches(url)).findFirst();
  }

  /**
   * First extractor that matches the URL.
   *
   * @throws NoExtractorMatchException if none does
   */
  public SiteExtractor route(String url) {
    return selectExtractor(url).orElseThrow(() -> new NoExtractorMatchException(url));
  }

  /** Extracts a page with the extractor that {@link #route(String)} picks. */
  public ParsedPage extract(String url, String html) {
    SiteExtractor extractor = route(url);
    log.debug("Extracting {} with {}", url, extractor.name());
    return extractor.extract(url, html);
  }

  /** Names of the registered extractors in dispatch order. */
  public List<String> extractorNames() {
    return extractors.stream().map(SiteExtractor::name).toList();
  }
}
