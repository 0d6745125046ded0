package com.flamingo.ai.tabbacklog.api.rest;

import com.flamingo.ai.tabbacklog.domain.repository.TabItemRepository;
import com.flamingo.ai.tabbacklog.service.extraction.ExtractionService;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks and system info. */
@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
public class HealthController {

  private final ExtractionService extractionService;
  private final TabItemRepository tabItemRepository;

  /** Returns a simple health check response with the extractor lineup. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new HashMap<>();
    health.put("status", "UP");
    health.put("timestamp", LocalDateTime.now());
    health.put("service", "tab-backlog");
    health.put("extractors", extractionService.extractorNames());
    return ResponseEntity.ok(health);
  }

  /** Returns system statistics. */
  @GetMapping("/stats")
  public ResponseEntity<Map<String, Object>> stats() {
    Map<String, Object> stats = new HashMap<>();
    stats.put("totalTabs", tabItemRepository.count());
    stats.put("timestamp", LocalDateTime.now());
    return ResponseEntity.ok(stats);
  }
}
