package com.flamingo.ai.tabbacklog.api.dto.response;

import java.util.Map;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Live tab counts of a user, keyed by status value. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TabSummaryResponse {

  private UUID userId;
  private long total;
  private Map<String, Long> byStatus;
}
