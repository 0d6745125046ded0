package com.flamingo.ai.tabbacklog.api.rest;

import com.flamingo.ai.tabbacklog.api.dto.request.ExtractHtmlRequest;
import com.flamingo.ai.tabbacklog.api.dto.request.ExtractUrlRequest;
import com.flamingo.ai.tabbacklog.api.dto.response.ParsedPageResponse;
import com.flamingo.ai.tabbacklog.service.extraction.ExtractionService;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for extracting pages that are not stored as tabs. */
@RestController
@RequestMapping("/api/extract")
@RequiredArgsConstructor
public class ExtractionController {

  private final ExtractionService extractionService;

  /** Fetches a URL and extracts its content. */
  @PostMapping
  public ResponseEntity<ParsedPageResponse> extractUrl(
      @Valid @RequestBody ExtractUrlRequest request) {
    return ResponseEntity.ok(
        ParsedPageResponse.fromPage(
            extractionService.extractUrl(request.getUrl(), request.getTimeoutSeconds())));
  }

  /** Extracts supplied HTML. */
  @PostMapping("/html")
  public ResponseEntity<ParsedPageResponse> extractHtml(
      @Valid @RequestBody ExtractHtmlRequest request) {
    return ResponseEntity.ok(
        ParsedPageResponse.fromPage(
            extractionService.extractHtml(request.getUrl(), request.getHtmlContent())));
  }

  /** Lists the registered extractors in dispatch order. */
  @GetMapping("/extractors")
  public ResponseEntity<List<String>> extractors() {
    return ResponseEntity.ok(extractionService.extractorNames());
  }
}
