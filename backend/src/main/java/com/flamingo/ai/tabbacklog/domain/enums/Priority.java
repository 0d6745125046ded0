package com.flamingo.ai.tabbacklog.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Suggested reading priority. */
public enum Priority {
  HIGH("high"),
  MEDIUM("medium"),
  LOW("low");

  private final String value;

  Priority(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  /** Returns the constant for a wire value, or null when absent or unrecognised. */
  public static Priority fromValue(String value) {
    if (value == null) {
      return null;
    }
    for (Priority priority : values()) {
      if (priority.value.equalsIgnoreCase(value.trim())) {
        return priority;
      }
    }
    return null;
  }
}
