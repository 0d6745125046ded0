package com.flamingo.ai.tabbacklog.service.enrichment;

import com.flamingo.ai.tabbacklog.domain.entity.TabItem;
import com.flamingo.ai.tabbacklog.service.tab.StageRunSummary;
import java.util.UUID;

/** Service interface for the enrichment stage. */
public interface EnrichmentService {

  /**
   * Enriches content that is not tied to a stored tab.
   *
   * @param request the content to enrich
   * @return the validated enrichment
   * @throws com.flamingo.ai.tabbacklog.exception.EnrichmentExhaustedException if every attempt
   *     failed
   */
  EnrichmentResult enrich(EnrichmentRequest request);

  /**
   * Runs, or retries after an error, the enrichment stage for one tab. The outcome is recorded on
   * the tab: {@code enriched} on success, {@code llm_error} once attempts are exhausted.
   *
   * @param tabId the tab ID
   * @return the tab after the stage
   * @throws com.flamingo.ai.tabbacklog.exception.EnrichmentInProgressException if the same tab is
   *     already being enriched
   * @throws com.flamingo.ai.tabbacklog.exception.InvalidStatusTransitionException if the tab is
   *     not parsed
   */
  TabItem enrichTab(Long tabId);

  /**
   * Enriches up to {@code limit} parsed tabs of a user, oldest first, in parallel up to the
   * configured concurrency.
   */
  StageRunSummary enrichParsedTabs(UUID userId, int limit);
}
