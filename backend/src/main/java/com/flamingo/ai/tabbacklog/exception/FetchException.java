package com.flamingo.ai.tabbacklog.exception;

/** Thrown when a page cannot be downloaded (timeout, transport failure, HTTP error status). */
public class FetchException extends RuntimeException {

  private final String url;
  private final Integer statusCode;

  public FetchException(String url, String message, Throwable cause) {
    super(message, cause);
    this.url = url;
    this.statusCode = null;
  }

  public FetchException(String url, int statusCode) {
    super("Received status " + statusCode);
    this.url = url;
    this.statusCode = statusCode;
  }

  public String getUrl() {
    return url;
  }

  /** HTTP status of the failed response, or null when no response was received. */
  public Integer getStatusCode() {
    return statusCode;
  }
}
