package com.flamingo.ai.tabbacklog.exception;

/** Thrown when model output does not parse or does not satisfy the enrichment schema. */
public class EnrichmentValidationException extends RuntimeException {

  private final String rawOutput;

  public EnrichmentValidationException(String message, String rawOutput) {
    super(message);
    this.rawOutput = rawOutput;
  }

  public EnrichmentValidationException(String message, String rawOutput, Throwable cause) {
    super(message, cause);
    this.rawOutput = rawOutput;
  }

  /** The model output that failed validation. */
  public String getRawOutput() {
    return rawOutput;
  }
}
