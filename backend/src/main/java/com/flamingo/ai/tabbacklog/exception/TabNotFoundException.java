package com.flamingo.ai.tabbacklog.exception;

/** Exception thrown when a live tab is not found. */
public class TabNotFoundException extends RuntimeException {

  private final Long tabId;

  public TabNotFoundException(Long tabId) {
    super("Tab not found: " + tabId);
    this.tabId = tabId;
  }

  public Long getTabId() {
    return tabId;
  }
}
