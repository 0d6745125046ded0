package com.flamingo.ai.tabbacklog.service.extraction;

import com.flamingo.ai.tabbacklog.domain.entity.TabItem;
import com.flamingo.ai.tabbacklog.service.extraction.model.ParsedPage;
import com.flamingo.ai.tabbacklog.service.tab.StageRunSummary;
import java.util.List;
import java.util.UUID;

/** Service interface for the fetch-and-extract stage. */
public interface ExtractionService {

  /**
   * Fetches a URL and extracts it without touching any stored tab.
   *
   * @throws com.flamingo.ai.tabbacklog.exception.FetchException if the page cannot be downloaded
   * @throws com.flamingo.ai.tabbacklog.exception.ExtractionException if nothing usable is found
   */
  ParsedPage extractUrl(String url, int timeoutSeconds);

  /**
   * Extracts pre-fetched markup.
   *
   * @throws com.flamingo.ai.tabbacklog.exception.ExtractionException if nothing usable is found
   */
  ParsedPage extractHtml(String url, String html);

  /**
   * Runs, or retries after an error, the extraction stage for one tab. The outcome is recorded on
   * the tab: {@code parsed} on success, {@code fetch_error} otherwise.
   *
   * @throws com.flamingo.ai.tabbacklog.exception.InvalidStatusTransitionException if the tab is
   *     neither new nor in fetch_error
   */
  TabItem extractTab(Long tabId);

  /** Extracts up to {@code limit} new tabs of a user, oldest first, with bounded parallelism. */
  StageRunSummary extractNewTabs(UUID userId, int limit);

  /** Names of the registered extractors, in dispatch order. */
  List<String> extractorNames();
}
