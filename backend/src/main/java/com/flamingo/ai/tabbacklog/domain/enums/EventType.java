package com.flamingo.ai.tabbacklog.domain.enums;

/** Audit event kinds written to the event log. */
public enum EventType {
  TAB_CREATED("tab_created"),
  TAB_DUPLICATE_SKIPPED("tab_duplicate_skipped"),
  FETCH_STARTED("fetch_started"),
  FETCH_SUCCESS("fetch_success"),
  FETCH_ERROR("fetch_error"),
  LLM_ENRICH_STARTED("llm_enrich_started"),
  LLM_ENRICH_SUCCESS("llm_enrich_success"),
  LLM_ENRICH_ERROR("llm_enrich_error"),
  TAB_PROCESSED("tab_processed"),
  TAB_DELETED("tab_deleted");

  /** Entity type recorded for every tab event. */
  public static final String ENTITY_TAB_ITEM = "tab_item";

  private final String value;

  EventType(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }
}
