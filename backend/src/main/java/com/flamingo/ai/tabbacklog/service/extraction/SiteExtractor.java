package com.flamingo.ai.tabbacklog.service.extraction;

import com.flamingo.ai.tabbacklog.service.extraction.model.ParsedPage;

/**
 * Turns the raw page of one class of site into normalized content.
 *
 * <p>Implementations are stateless and registered in an {@link ExtractorRegistry}, which routes a
 * URL to the first extractor whose {@link #matches(String)} returns true.
 */
public interface SiteExtractor {

  /** Site kind recorded on the extracted content. */
  String name();

  /** Returns true if this extractor handles the given URL. */
  boolean matches(String url);

  /**
   * Extracts content from a page.
   *
   * @param url the page URL
   * @param html the fetched page markup, possibly empty
   * @return the normalized content
   */
  ParsedPage extract(String url, String html);
}
