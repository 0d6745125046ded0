package com.flamingo.ai.tabbacklog.service.enrichment;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Content handed to the enrichment engine.
 *
 * @param url page URL
 * @param title page title, if known
 * @param siteKind extractor that produced the content
 * @param text extracted text, if any
 * @param wordCount word count of the full text
 * @param videoSeconds video duration, null for non-video pages
 */
public record EnrichmentRequest(
    @NotBlank String url,
    String title,
    @NotBlank String siteKind,
    String text,
    @PositiveOrZero int wordCount,
    @PositiveOrZero Integer videoSeconds) {}
