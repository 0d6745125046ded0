package com.flamingo.ai.tabbacklog.api.dto.response;

import com.flamingo.ai.tabbacklog.domain.entity.TabItem;
import com.flamingo.ai.tabbacklog.domain.enums.TabStatus;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for tab data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TabResponse {

  private Long id;
  private UUID userId;
  private String url;
  private String title;
  private String collectionLabel;
  private TabStatus status;
  private String lastError;
  private LocalDateTime errorAt;
  private boolean processed;
  private LocalDateTime processedAt;
  private int importCount;
  private LocalDateTime collectedAt;
  private LocalDateTime createdAt;
  private LocalDateTime updatedAt;

  /** Creates a TabResponse from a TabItem entity. */
  public static TabResponse fromEntity(TabItem tab) {
    return TabResponse.builder()
        .id(tab.getId())
        .userId(tab.getUserId())
        .url(tab.getUrl())
        .title(tab.getTitle())
        .collectionLabel(tab.getCollectionLabel())
        .status(tab.getStatus())
        .lastError(tab.getLastError())
        .errorAt(tab.getErrorAt())
        .processed(tab.isProcessed())
        .processedAt(tab.getProcessedAt())
        .importCount(tab.getImportCount())
        .collectedAt(tab.getCollectedAt())
        .createdAt(tab.getCreatedAt())
        .updatedAt(tab.getUpdatedAt())
        .build();
  }
}
