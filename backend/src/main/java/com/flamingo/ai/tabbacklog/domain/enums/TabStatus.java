package com.flamingo.ai.tabbacklog.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a saved tab through the pipeline.
 *
 * <p>Forward path: {@code new -> fetch_pending -> parsed -> llm_pending -> enriched}. Each pending
 * stage has an error branch; an error state may re-enter its own pending stage, which is the only
 * backward move allowed.
 */
public enum TabStatus {
  /** Ingested, not yet fetched. */
  NEW("new"),

  /** Page fetch and extraction in progress. */
  FETCH_PENDING("fetch_pending"),

  /** Extracted content is stored. */
  PARSED("parsed"),

  /** Fetch or extraction failed. */
  FETCH_ERROR("fetch_error"),

  /** LLM enrichment in progress. */
  LLM_PENDING("llm_pending"),

  /** Enrichment result is stored. */
  ENRICHED("enriched"),

  /** Enrichment never produced a valid result within the retry budget. */
  LLM_ERROR("llm_error");

  private final String value;

  TabStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  /** Returns true if a tab in this status may move to {@code next}. */
  public boolean canTransitionTo(TabStatus next) {
    return allowedNext().contains(next);
  }

  /** Statuses from which the extraction stage may start. */
  public static Set<TabStatus> extractable() {
    return EnumSet.of(NEW, FETCH_ERROR);
  }

  /** Statuses from which the enrichment stage may start. */
  public static Set<TabStatus> enrichable() {
    return EnumSet.of(PARSED, LLM_ERROR);
  }

  /** Parses the lowercase wire value (or the enum name). */
  public static TabStatus fromValue(String value) {
    for (TabStatus status : values()) {
      if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown tab status: " + value);
  }

  private Set<TabStatus> allowedNext() {
    return switch (this) {
      case NEW, FETCH_ERROR -> EnumSet.of(FETCH_PENDING);
      case FETCH_PENDING -> EnumSet.of(PARSED, FETCH_ERROR);
      case PARSED, LLM_ERROR -> EnumSet.of(LLM_PENDING);
      case LLM_PENDING -> EnumSet.of(ENRICHED, LLM_ERROR);
      case ENRICHED -> EnumSet.noneOf(TabStatus.class);
    };
  }
}
