package com.flamingo.ai.tabbacklog.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String TAB_NOT_FOUND = "TAB_001";
  public static final String INVALID_TRANSITION = "TAB_002";
  public static final String BOOKMARK_FORMAT = "IMPORT_001";
  public static final String FETCH_ERROR = "EXTRACT_001";
  public static final String EXTRACTION_ERROR = "EXTRACT_002";
  public static final String NO_EXTRACTOR = "EXTRACT_003";
  public static final String ENRICHMENT_EXHAUSTED = "LLM_001";
  public static final String ENRICHMENT_IN_PROGRESS = "LLM_002";
  public static final String ENRICHMENT_BUSY = "LLM_003";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Technical details, e.g. the raw model output of a failed enrichment. */
  private final String details;

  /** Number of attempts made, for retried operations. */
  private final Integer attempts;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
