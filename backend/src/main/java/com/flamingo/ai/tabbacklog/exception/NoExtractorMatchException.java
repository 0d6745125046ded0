package com.flamingo.ai.tabbacklog.exception;

/**
 * Thrown when no registered extractor accepts a URL. With the generic extractor registered last
 * this only happens for URLs that are not valid http(s) URLs, or on a misconfigured registry.
 */
public class NoExtractorMatchException extends IllegalStateException {

  private final String url;

  public NoExtractorMatchException(String url) {
    super("No extractor matches URL: " + url);
    this.url = url;
  }

  public String getUrl() {
    return url;
  }
}
