package com.flamingo.ai.tabbacklog.service.enrichment;

import com.flamingo.ai.tabbacklog.domain.enums.ContentType;
import com.flamingo.ai.tabbacklog.domain.enums.Priority;
import java.util.List;

/**
 * Validated enrichment of one page. {@code tags} holds at most 10 entries and {@code projects} at
 * most 5, in the order the model produced them.
 */
public record EnrichmentResult(
    String summary,
    ContentType contentType,
    List<String> tags,
    List<String> projects,
    Integer estReadMinutes,
    Priority priority,
    Integer videoSeconds,
    String modelName) {

  public EnrichmentResult {
    tags = tags == null ? List.of() : List.copyOf(tags);
    projects = projects == null ? List.of() : List.copyOf(projects);
  }
}
