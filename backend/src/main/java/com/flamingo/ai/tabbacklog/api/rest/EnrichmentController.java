package com.flamingo.ai.tabbacklog.api.rest;

import com.flamingo.ai.tabbacklog.api.dto.request.EnrichRequest;
import com.flamingo.ai.tabbacklog.api.dto.response.EnrichmentResponse;
import com.flamingo.ai.tabbacklog.service.enrichment.EnrichmentResult;
import com.flamingo.ai.tabbacklog.service.enrichment.EnrichmentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for enriching content that is not stored as a tab. */
@RestController
@RequestMapping("/api/enrich")
@RequiredArgsConstructor
public class EnrichmentController {

  private final EnrichmentService enrichmentService;

  @PostMapping
  public ResponseEntity<EnrichmentResponse> enrich(@Valid @RequestBody EnrichRequest request) {
    EnrichmentResult result = enrichmentService.enrich(request.toEnrichmentRequest());
    return ResponseEntity.ok(EnrichmentResponse.fromResult(request.getUrl(), result));
  }
}
