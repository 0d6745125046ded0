package com.flamingo.ai.tabbacklog.exception;

/** Thrown when an enrichment for the same tab is already running. */
public class EnrichmentInProgressException extends RuntimeException {

  private final Long tabId;

  public EnrichmentInProgressException(Long tabId) {
    super("Enrichment already in progress for tab " + tabId);
    this.tabId = tabId;
  }

  public Long getTabId() {
    return tabId;
  }
}
