package com.flamingo.ai.tabbacklog.api.dto.response;

import com.flamingo.ai.tabbacklog.domain.entity.TabEnrichment;
import com.flamingo.ai.tabbacklog.domain.entity.TabEnrichmentHistory;
import com.flamingo.ai.tabbacklog.domain.enums.ContentType;
import com.flamingo.ai.tabbacklog.domain.enums.Priority;
import com.flamingo.ai.tabbacklog.service.enrichment.EnrichmentResult;
import java.time.LocalDateTime;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an enrichment, current or historical. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnrichmentResponse {

  private String url;
  private String summary;
  private ContentType contentType;
  private List<String> tags;
  private List<String> projects;
  private Integer estReadMinutes;
  private Priority priority;
  private Integer videoSeconds;
  private String modelName;
  private Integer attempts;
  private LocalDateTime enrichedAt;

  public static EnrichmentResponse fromResult(String url, EnrichmentResult result) {
    return EnrichmentResponse.builder()
        .url(url)
        .summary(result.summary())
        .contentType(result.contentType())
        .tags(result.tags())
        .projects(result.projects())
        .estReadMinutes(result.estReadMinutes())
        .priority(result.priority())
        .videoSeconds(result.videoSeconds())
        .modelName(result.modelName())
        .build();
  }

  public static EnrichmentResponse fromEntity(TabEnrichment enrichment) {
    return EnrichmentResponse.builder()
        .summary(enrichment.getSummary())
        .contentType(enrichment.getContentType())
        .tags(enrichment.getTags())
        .projects(enrichment.getProjects())
        .estReadMinutes(enrichment.getEstReadMinutes())
        .priority(enrichment.getPriority())
        .videoSeconds(enrichment.getVideoSeconds())
        .modelName(enrichment.getModelName())
        .enrichedAt(enrichment.getUpdatedAt())
        .build();
  }

  public static EnrichmentResponse fromHistory(TabEnrichmentHistory run) {
    return EnrichmentResponse.builder()
        .summary(run.getSummary())
        .contentType(run.getContentType())
        .tags(run.getTags())
        .projects(run.getProjects())
        .estReadMinutes(run.getEstReadMinutes())
        .priority(run.getPriority())
        .modelName(run.getModelName())
        .attempts(run.getAttempts())
        .enrichedAt(run.getRunFinishedAt())
        .build();
  }
}
