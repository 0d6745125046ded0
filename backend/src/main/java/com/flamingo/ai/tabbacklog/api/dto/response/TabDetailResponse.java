package com.flamingo.ai.tabbacklog.api.dto.response;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A tab together with whatever the pipeline has produced for it so far. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TabDetailResponse {

  private TabResponse tab;
  private ParsedPageResponse content;
  private EnrichmentResponse enrichment;
  private List<EnrichmentResponse> enrichmentHistory;
}
