package com.flamingo.ai.tabbacklog.service.enrichment;

import com.flamingo.ai.tabbacklog.agent.TabEnrichmentAgent;
import com.flamingo.ai.tabbacklog.agent.dto.EnrichmentOutput;
import com.flamingo.ai.tabbacklog.config.PipelineConfig;
import com.flamingo.ai.tabbacklog.domain.enums.ContentType;
import com.flamingo.ai.tabbacklog.domain.enums.Priority;
import com.flamingo.ai.tabbacklog.exception.EnrichmentValidationException;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Calls the enrichment predictor until it returns a reply that passes validation, up to a fixed
 * number of attempts. Attempts run one after another and share nothing but the request.
 */
@Component
@Slf4j
public class EnrichmentEngine {

  static final int MAX_TAGS = 10;
  static final int MAX_PROJECTS = 5;
  static final String UNTITLED = "Untitled";
  static final String NO_CONTENT = "No content available";
  static final String TRUNCATION_MARKER = "... [truncated]";

  private final TabEnrichmentAgent agent;
  private final EnrichmentOutputParser outputParser;
  private final PipelineConfig pipelineConfig;
  private final MeterRegistry meterRegistry;
  private final String modelName;

  public EnrichmentEngine(
      TabEnrichmentAgent agent,
      EnrichmentOutputParser outputParser,
      PipelineConfig pipelineConfig,
      MeterRegistry meterRegistry,
      @Qualifier("enrichmentModelName") String modelName) {
    this.agent = agent;
    this.outputParser = outputParser;
    this.pipelineConfig = pipelineConfig;
    this.meterRegistry = meterRegistry;
    this.modelName = modelName;
  }

  /** Enriches with the configured attempt budget. */
  public EnrichmentOutcome enrich(EnrichmentRequest request) {
    return enrich(request, pipelineConfig.getEnrichment().getMaxRetries());
  }

  /**
   * Enriches one page.
   *
   * @param request the page to enrich
   * @param maxRetries maximum number of predictor calls, at least 1
   * @return the result, or the last failure once all attempts are used
   */
  public EnrichmentOutcome enrich(EnrichmentRequest request, int maxRetries) {
    if (maxRetries < 1) {
      throw new IllegalArgumentException("maxRetries must be at least 1");
    }

    String title = isBlank(request.title()) ? UNTITLED : request.title();
    String text = truncate(request.text());
    int videoSeconds = request.videoSeconds() == null ? 0 : request.videoSeconds();
    log.debug("Enriching {} with {} chars of text", request.url(), text.length());

    String lastError = null;
    String lastRawOutput = null;
    int attempts = 0;

    while (attempts < maxRetries) {
      attempts++;
      String raw = null;
      try {
        raw =
            agent.enrich(
                request.url(), title, request.siteKind(), text, request.wordCount(), videoSeconds);
        EnrichmentOutput output = outputParser.parse(raw);
        meterRegistry.counter("enrichment.success").increment();
        return EnrichmentOutcome.success(toResult(output, request), attempts);
      } catch (EnrichmentValidationException e) {
        lastError = e.getMessage();
        lastRawOutput = e.getRawOutput() != null ? e.getRawOutput() : lastRawOutput;
      } catch (RuntimeException e) {
        lastError = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        lastRawOutput = raw != null ? raw : lastRawOutput;
      }

      meterRegistry.counter("enrichment.attempt.failure").increment();
      log.warn(
          "Enrichment attempt {}/{} failed for {}: {}",
          attempts,
          maxRetries,
          request.url(),
          lastError);

      if (attempts < maxRetries && !pauseBeforeRetry()) {
        break;
      }
    }

    meterRegistry.counter("enrichment.exhausted").increment();
    return EnrichmentOutcome.exhausted(attempts, lastError, lastRawOutput);
  }

  private EnrichmentResult toResult(EnrichmentOutput output, EnrichmentRequest request) {
    return new EnrichmentResult(
        output.summary(),
        ContentType.fromValue(output.contentType()),
        clamp(output.tags(), MAX_TAGS),
        clamp(output.projects(), MAX_PROJECTS),
        output.estReadMinutes(),
        Priority.fromValue(output.priority()),
        request.videoSeconds(),
        modelName);
  }

  private static List<String> clamp(List<String> values, int max) {
    if (values == null) {
      return List.of();
    }
    return values.stream().filter(Objects::nonNull).limit(max).toList();
  }

  private String truncate(String text) {
    if (isBlank(text)) {
      return NO_CONTENT;
    }
    int max = pipelineConfig.getEnrichment().getMaxTextChars();
    if (text.length() > max) {
      return text.substring(0, max) + TRUNCATION_MARKER;
    }
    return text;
  }

  /** Returns false if the thread was interrupted while waiting. */
  private boolean pauseBeforeRetry() {
    long delay = pipelineConfig.getEnrichment().getRetryDelayMs();
    if (delay <= 0) {
      return true;
    }
    try {
      Thread.sleep(delay);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted between enrichment attempts");
      return false;
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
