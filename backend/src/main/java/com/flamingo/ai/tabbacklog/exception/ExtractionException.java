package com.flamingo.ai.tabbacklog.exception;

/** Thrown when fetched content yields nothing usable, even after extractor fallbacks. */
public class ExtractionException extends RuntimeException {

  private final String url;

  public ExtractionException(String url, String message) {
    super(message);
    this.url = url;
  }

  public ExtractionException(String url, String message, Throwable cause) {
    super(message, cause);
    this.url = url;
  }

  public String getUrl() {
    return url;
  }
}
