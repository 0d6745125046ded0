package com.flamingo.ai.tabbacklog.service.tab;

import com.flamingo.ai.tabbacklog.domain.entity.EventLogEntry;
import com.flamingo.ai.tabbacklog.domain.entity.ExtractedContent;
import com.flamingo.ai.tabbacklog.domain.entity.TabEnrichment;
import com.flamingo.ai.tabbacklog.domain.entity.TabEnrichmentHistory;
import com.flamingo.ai.tabbacklog.domain.entity.TabItem;
import com.flamingo.ai.tabbacklog.domain.enums.TabStatus;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/** Service interface for reading tabs and for user actions on them. */
public interface TabService {

  /**
   * Gets a live tab.
   *
   * @throws com.flamingo.ai.tabbacklog.exception.TabNotFoundException if not found or deleted
   */
  TabItem getTab(Long tabId);

  Optional<ExtractedContent> getContent(Long tabId);

  Optional<TabEnrichment> getEnrichment(Long tabId);

  /** Past enrichment runs of a tab, most recent first. */
  List<TabEnrichmentHistory> getEnrichmentHistory(Long tabId);

  /**
   * Lists a user's live tabs, newest first.
   *
   * @param status optional status filter
   */
  List<TabItem> listTabs(UUID userId, TabStatus status);

  /** Live tab counts per status; every status is present, zero when empty. */
  Map<TabStatus, Long> countByStatus(UUID userId);

  /** Audit events of a tab, oldest first. */
  List<EventLogEntry> getEvents(Long tabId);

  /** Flags a tab as handled by the user. */
  TabItem markProcessed(Long tabId);

  /** Soft-deletes a tab, which frees its URL for a later import. */
  void deleteTab(Long tabId);
}
