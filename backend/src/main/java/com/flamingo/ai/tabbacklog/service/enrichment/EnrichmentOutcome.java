package com.flamingo.ai.tabbacklog.service.enrichment;

import com.flamingo.ai.tabbacklog.exception.EnrichmentExhaustedException;

/**
 * Result of a bounded enrichment run: either a result, or the failure of the last attempt together
 * with the last raw model output seen.
 *
 * @param result the enrichment, null when every attempt failed
 * @param attempts predictor calls made
 * @param lastError message of the last failed attempt, null on success
 * @param rawOutput last raw model output of a failed attempt, if one was captured
 */
public record EnrichmentOutcome(
    EnrichmentResult result, int attempts, String lastError, String rawOutput) {

  public static EnrichmentOutcome success(EnrichmentResult result, int attempts) {
    return new EnrichmentOutcome(result, attempts, null, null);
  }

  public static EnrichmentOutcome exhausted(int attempts, String lastError, String rawOutput) {
    return new EnrichmentOutcome(null, attempts, lastError, rawOutput);
  }

  public boolean isSuccess() {
    return result != null;
  }

  /**
   * Returns the result.
   *
   * @throws EnrichmentExhaustedException if every attempt failed
   */
  public EnrichmentResult orElseThrow(String url) {
    if (result == null) {
      throw new EnrichmentExhaustedException(url, attempts, lastError, rawOutput);
    }
    return result;
  }
}
