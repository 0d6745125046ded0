package com.flamingo.ai.tabbacklog.api.dto.request;

import com.flamingo.ai.tabbacklog.service.enrichment.EnrichmentRequest;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for enriching content that is not stored as a tab. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnrichRequest {

  @NotBlank(message = "URL is required")
  private String url;

  private String title;

  @NotBlank(message = "Site kind is required")
  private String siteKind;

  private String text;

  @PositiveOrZero private int wordCount;

  @PositiveOrZero private Integer videoSeconds;

  public EnrichmentRequest toEnrichmentRequest() {
    return new EnrichmentRequest(url, title, siteKind, text, wordCount, videoSeconds);
  }
}
