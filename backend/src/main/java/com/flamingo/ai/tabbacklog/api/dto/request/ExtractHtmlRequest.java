package com.flamingo.ai.tabbacklog.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for extracting pre-fetched HTML. The URL still decides the extractor. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractHtmlRequest {

  @NotBlank(message = "URL is required")
  private String url;

  @NotNull(message = "HTML content is required")
  private String htmlContent;
}
