package com.flamingo.ai.tabbacklog.api.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for fetching and extracting a URL. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractUrlRequest {

  @NotBlank(message = "URL is required")
  private String url;

  @Min(value = 1, message = "Timeout must be at least 1 second")
  @Max(value = 120, message = "Timeout must be at most 120 seconds")
  @Builder.Default
  private int timeoutSeconds = 30;
}
