package com.flamingo.ai.tabbacklog.service.extraction.model;

import java.util.Collections;
import java.util.Map;

/**
 * Normalized content produced by a site extractor.
 *
 * @param siteKind extractor that produced the page (youtube, twitter, generic_html)
 * @param title page title, if any
 * @param textFull extracted body text, if any
 * @param wordCount whitespace-delimited word count of {@code textFull}
 * @param videoSeconds video duration, only known for video pages
 * @param metadata extractor-specific details
 */
public record ParsedPage(
    String siteKind,
    String title,
    String textFull,
    int wordCount,
    Integer videoSeconds,
    Map<String, Object> metadata) {

  public ParsedPage {
    metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(metadata);
  }

  /** True when neither a title nor any text could be extracted. */
  public boolean isEmpty() {
    return (title == null || title.isBlank()) && (textFull == null || textFull.isBlank());
  }
}
