package com.flamingo.ai.tabbacklog.api.rest;

import com.flamingo.ai.tabbacklog.api.dto.response.EnrichmentResponse;
import com.flamingo.ai.tabbacklog.api.dto.response.EventResponse;
import com.flamingo.ai.tabbacklog.api.dto.response.ImportResponse;
import com.flamingo.ai.tabbacklog.api.dto.response.ParsedPageResponse;
import com.flamingo.ai.tabbacklog.api.dto.response.TabDetailResponse;
import com.flamingo.ai.tabbacklog.api.dto.response.TabResponse;
import com.flamingo.ai.tabbacklog.api.dto.response.TabSummaryResponse;
import com.flamingo.ai.tabbacklog.domain.entity.TabItem;
import com.flamingo.ai.tabbacklog.domain.enums.TabStatus;
import com.flamingo.ai.tabbacklog.service.enrichment.EnrichmentService;
import com.flamingo.ai.tabbacklog.service.extraction.ExtractionService;
import com.flamingo.ai.tabbacklog.service.ingest.ImportStats;
import com.flamingo.ai.tabbacklog.service.ingest.TabImportService;
import com.flamingo.ai.tabbacklog.service.tab.StageRunSummary;
import com.flamingo.ai.tabbacklog.service.tab.TabService;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for the tab backlog: import, stage runs, reads and user actions. */
@RestController
@RequestMapping("/api/tabs")
@RequiredArgsConstructor
public class TabController {

  private final TabImportService tabImportService;
  private final TabService tabService;
  private final ExtractionService extractionService;
  private final EnrichmentService enrichmentService;

  /** Imports a bookmark export for a user. */
  @PostMapping(value = "/import", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<ImportResponse> importBookmarks(
      @RequestParam("file") MultipartFile file,
      @RequestParam UUID userId,
      @RequestParam(required = false) Integer batchSize) {
    return ResponseEntity.ok(
        ImportResponse.fromOutcome(tabImportService.importBookmarks(file, userId, batchSize)));
  }

  /** Counts what an import would read, without storing anything. */
  @PostMapping(value = "/import/preview", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<ImportStats> previewImport(@RequestParam("file") MultipartFile file) {
    return ResponseEntity.ok(tabImportService.preview(file));
  }

  /** Lists a user's live tabs, optionally filtered by status value. */
  @GetMapping
  public ResponseEntity<List<TabResponse>> listTabs(
      @RequestParam UUID userId, @RequestParam(required = false) String status) {
    TabStatus filter = status == null ? null : TabStatus.fromValue(status);
    return ResponseEntity.ok(
        tabService.listTabs(userId, filter).stream().map(TabResponse::fromEntity).toList());
  }

  /** Live tab counts per status. */
  @GetMapping("/summary")
  public ResponseEntity<TabSummaryResponse> summary(@RequestParam UUID userId) {
    Map<String, Long> byStatus = new LinkedHashMap<>();
    long total = 0;
    for (Map.Entry<TabStatus, Long> entry : tabService.countByStatus(userId).entrySet()) {
      byStatus.put(entry.getKey().getValue(), entry.getValue());
      total += entry.getValue();
    }
    return ResponseEntity.ok(
        TabSummaryResponse.builder().userId(userId).total(total).byStatus(byStatus).build());
  }

  /** Gets a tab with its extracted content and enrichment. */
  @GetMapping("/{tabId}")
  public ResponseEntity<TabDetailResponse> getTab(@PathVariable Long tabId) {
    TabItem tab = tabService.getTab(tabId);
    return ResponseEntity.ok(
        TabDetailResponse.builder()
            .tab(TabResponse.fromEntity(tab))
            .content(tabService.getContent(tabId).map(ParsedPageResponse::fromEntity).orElse(null))
            .enrichment(
                tabService.getEnrichment(tabId).map(EnrichmentResponse::fromEntity).orElse(null))
            .enrichmentHistory(
                tabService.getEnrichmentHistory(tabId).stream()
                    .map(EnrichmentResponse::fromHistory)
                    .toList())
            .build());
  }

  /** Gets the audit events of a tab. */
  @GetMapping("/{tabId}/events")
  public ResponseEntity<List<EventResponse>> getEvents(@PathVariable Long tabId) {
    tabService.getTab(tabId);
    return ResponseEntity.ok(
        tabService.getEvents(tabId).stream().map(EventResponse::fromEntity).toList());
  }

  /** Runs or retries extraction for one tab. */
  @PostMapping("/{tabId}/extract")
  public ResponseEntity<TabResponse> extractTab(@PathVariable Long tabId) {
    return ResponseEntity.ok(TabResponse.fromEntity(extractionService.extractTab(tabId)));
  }

  /** Runs or retries enrichment for one tab. */
  @PostMapping("/{tabId}/enrich")
  public ResponseEntity<TabResponse> enrichTab(@PathVariable Long tabId) {
    return ResponseEntity.ok(TabResponse.fromEntity(enrichmentService.enrichTab(tabId)));
  }

  /** Extracts a user's new tabs. */
  @PostMapping("/extract")
  public ResponseEntity<StageRunSummary> extractNewTabs(
      @RequestParam UUID userId, @RequestParam(defaultValue = "20") int limit) {
    return ResponseEntity.ok(extractionService.extractNewTabs(userId, limit));
  }

  /** Enriches a user's parsed tabs. */
  @PostMapping("/enrich")
  public ResponseEntity<StageRunSummary> enrichParsedTabs(
      @RequestParam UUID userId, @RequestParam(defaultValue = "20") int limit) {
    return ResponseEntity.ok(enrichmentService.enrichParsedTabs(userId, limit));
  }

  /** Flags a tab as handled. */
  @PostMapping("/{tabId}/processed")
  public ResponseEntity<TabResponse> markProcessed(@PathVariable Long tabId) {
    return ResponseEntity.ok(TabResponse.fromEntity(tabService.markProcessed(tabId)));
  }

  /** Soft-deletes a tab. */
  @DeleteMapping("/{tabId}")
  public ResponseEntity<Void> deleteTab(@PathVariable Long tabId) {
    tabService.deleteTab(tabId);
    return ResponseEntity.noContent().build();
  }
}
