package com.flamingo.ai.tabbacklog.exception;

/** Thrown when every enrichment attempt failed. Carries the last failure and raw model output. */
public class EnrichmentExhaustedException extends RuntimeException {

  private final String url;
  private final int attempts;
  private final String rawOutput;

  public EnrichmentExhaustedException(
      String url, int attempts, String lastError, String rawOutput) {
    super(String.format("Enrichment failed after %d attempts: %s", attempts, lastError));
    this.url = url;
    this.attempts = attempts;
    this.rawOutput = rawOutput;
  }

  public String getUrl() {
    return url;
  }

  public int getAttempts() {
    return attempts;
  }

  public String getRawOutput() {
    return rawOutput;
  }
}
