package com.flamingo.ai.tabbacklog.exception;

import com.flamingo.ai.tabbacklog.domain.enums.TabStatus;

/** Thrown when a stage is asked to move a tab along an edge the lifecycle does not have. */
public class InvalidStatusTransitionException extends RuntimeException {

  private final Long tabId;
  private final TabStatus from;
  private final TabStatus to;

  public InvalidStatusTransitionException(Long tabId, TabStatus from, TabStatus to) {
    super(
        String.format(
            "Tab %s cannot move from %s to %s", tabId, from.getValue(), to.getValue()));
    this.tabId = tabId;
    this.from = from;
    this.to = to;
  }

  public Long getTabId() {
    return tabId;
  }

  public TabStatus getFrom() {
    return from;
  }

  public TabStatus getTo() {
    return to;
  }
}
