package com.flamingo.ai.tabbacklog.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Classification assigned to a tab by enrichment. */
public enum ContentType {
  ARTICLE("article"),
  VIDEO("video"),
  PAPER("paper"),
  CODE_REPO("code_repo"),
  REFERENCE("reference"),
  MISC("misc");

  private final String value;

  ContentType(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  /** Returns the constant for a wire value, or null if the value is not one of the six kinds. */
  public static ContentType fromValue(String value) {
    if (value == null) {
      return null;
    }
    for (ContentType type : values()) {
      if (type.value.equalsIgnoreCase(value.trim())) {
        return type;
      }
    }
    return null;
  }
}
