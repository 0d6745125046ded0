package com.flamingo.ai.tabbacklog.exception;

import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(TabNotFoundException.class)
  public ResponseEntity<ApiError> handleTabNotFound(
      TabNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("tab_not_found");
    String errorId = generateErrorId();
    log.warn("Tab not found [{}]: {}", errorId, ex.getTabId());

    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.TAB_NOT_FOUND)
                .message("Tab not found")
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(InvalidStatusTransitionException.class)
  public ResponseEntity<ApiError> handleInvalidTransition(
      InvalidStatusTransitionException ex, HttpServletRequest request) {

    incrementErrorCounter("invalid_transition");
    String errorId = generateErrorId();
    log.warn("Invalid status transition [{}]: {}", errorId, ex.getMessage());

    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.INVALID_TRANSITION)
                .message(ex.getMessage())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(BookmarkFileFormatException.class)
  public ResponseEntity<ApiError> handleBookmarkFormat(
      BookmarkFileFormatException ex, HttpServletRequest request) {

    incrementErrorCounter("bookmark_format");
    String errorId = generateErrorId();
    log.warn("Unreadable bookmark file [{}]: {}", errorId, ex.getMessage());

    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.BOOKMARK_FORMAT)
                .message(ex.getMessage())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(FetchException.class)
  public ResponseEntity<ApiError> handleFetch(FetchException ex, HttpServletRequest request) {

    incrementErrorCounter("fetch_error");
    String errorId = generateErrorId();
    log.warn("Fetch error [{}] for {}: {}", errorId, ex.getUrl(), ex.getMessage());

    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.FETCH_ERROR)
                .message("Could not fetch " + ex.getUrl())
                .details(ex.getMessage())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(ExtractionException.class)
  public ResponseEntity<ApiError> handleExtraction(
      ExtractionException ex, HttpServletRequest request) {

    incrementErrorCounter("extraction_error");
    String errorId = generateErrorId();
    log.warn("Extraction error [{}] for {}: {}", errorId, ex.getUrl(), ex.getMessage());

    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.EXTRACTION_ERROR)
                .message(ex.getMessage())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(NoExtractorMatchException.class)
  public ResponseEntity<ApiError> handleNoExtractor(
      NoExtractorMatchException ex, HttpServletRequest request) {

    incrementErrorCounter("no_extractor");
    String errorId = generateErrorId();
    log.warn("No extractor [{}] for {}", errorId, ex.getUrl());

    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.NO_EXTRACTOR)
                .message("URL must be an absolute http(s) URL")
                .details(ex.getUrl())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(EnrichmentExhaustedException.class)
  public ResponseEntity<ApiError> handleEnrichmentExhausted(
      EnrichmentExhaustedException ex, HttpServletRequest request) {

    incrementErrorCounter("enrichment_exhausted");
    String errorId = generateErrorId();
    log.error("Enrichment exhausted [{}] for {}: {}", errorId, ex.getUrl(), ex.getMessage());

    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.ENRICHMENT_EXHAUSTED)
                .message(ex.getMessage())
                .details(ex.getRawOutput())
                .attempts(ex.getAttempts())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(EnrichmentInProgressException.class)
  public ResponseEntity<ApiError> handleEnrichmentInProgress(
      EnrichmentInProgressException ex, HttpServletRequest request) {

    incrementErrorCounter("enrichment_in_progress");
    String errorId = generateErrorId();
    log.warn("Enrichment already running [{}] for tab {}", errorId, ex.getTabId());

    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.ENRICHMENT_IN_PROGRESS)
                .message(ex.getMessage())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(BulkheadFullException.class)
  public ResponseEntity<ApiError> handleBulkheadFull(
      BulkheadFullException ex, HttpServletRequest request) {

    incrementErrorCounter("enrichment_busy");
    String errorId = generateErrorId();
    log.warn("Enrichment capacity reached [{}]: {}", errorId, ex.getMessage());

    return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.ENRICHMENT_BUSY)
                .message("Too many enrichments in progress. Please try again later.")
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);

    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.VALIDATION_ERROR)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler({
    IllegalArgumentException.class,
    MethodArgumentTypeMismatchException.class,
    MissingServletRequestParameterException.class,
    MissingServletRequestPartException.class
  })
  public ResponseEntity<ApiError> handleBadRequest(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Bad request [{}]: {}", errorId, ex.getMessage());

    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.VALIDATION_ERROR)
                .message(ex.getMessage())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.INTERNAL_ERROR)
                .message("An unexpected error occurred. Please try again later.")
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
