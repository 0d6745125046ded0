package com.flamingo.ai.tabbacklog.service.tab;

import com.flamingo.ai.tabbacklog.domain.entity.EventLogEntry;
import com.flamingo.ai.tabbacklog.domain.entity.ExtractedContent;
import com.flamingo.ai.tabbacklog.domain.entity.TabEnrichment;
import com.flamingo.ai.tabbacklog.domain.entity.TabEnrichmentHistory;
import com.flamingo.ai.tabbacklog.domain.entity.TabItem;
import com.flamingo.ai.tabbacklog.domain.enums.EventType;
import com.flamingo.ai.tabbacklog.domain.enums.TabStatus;
import com.flamingo.ai.tabbacklog.domain.repository.EventLogRepository;
import com.flamingo.ai.tabbacklog.domain.repository.ExtractedContentRepository;
import com.flamingo.ai.tabbacklog.domain.repository.TabEnrichmentHistoryRepository;
import com.flamingo.ai.tabbacklog.domain.repository.TabEnrichmentRepository;
import com.flamingo.ai.tabbacklog.domain.repository.TabItemRepository;
import com.flamingo.ai.tabbacklog.exception.TabNotFoundException;
import io.micrometer.core.annotation.Timed;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of tab reads and user actions. */
@Service
@RequiredArgsConstructor
@Slf4j
public class TabServiceImpl implements TabService {

  private final TabItemRepository tabItemRepository;
  private final ExtractedContentRepository extractedContentRepository;
  private final TabEnrichmentRepository tabEnrichmentRepository;
  private final TabEnrichmentHistoryRepository tabEnrichmentHistoryRepository;
  private final EventLogRepository eventLogRepository;
  private final EventLogService eventLogService;

  @Override
  @Transactional(readOnly = true)
  public TabItem getTab(Long tabId) {
    return tabItemRepository
        .findByIdAndDeletedAtIsNull(tabId)
        .orElseThrow(() -> new TabNotFoundException(tabId));
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<ExtractedContent> getContent(Long tabId) {
    return extractedContentRepository.findById(tabId);
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<TabEnrichment> getEnrichment(Long tabId) {
    return tabEnrichmentRepository.findById(tabId);
  }

  @Override
  @Transactional(readOnly = true)
  public List<TabEnrichmentHistory> getEnrichmentHistory(Long tabId) {
    return tabEnrichmentHistoryRepository.findByTabIdOrderByRunStartedAtDesc(tabId);
  }

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "tabs.list", description = "Time to list tabs")
  public List<TabItem> listTabs(UUID userId, TabStatus status) {
    if (status == null) {
      return tabItemRepository.findByUserIdAndDeletedAtIsNullOrderByCreatedAtDesc(userId);
    }
    return tabItemRepository.findByUserIdAndStatusAndDeletedAtIsNullOrderByCreatedAtDesc(
        userId, status);
  }

  @Override
  @Transactional(readOnly = true)
  public Map<TabStatus, Long> countByStatus(UUID userId) {
    Map<TabStatus, Long> counts = new EnumMap<>(TabStatus.class);
    for (TabStatus status : TabStatus.values()) {
      counts.put(status, 0L);
    }
    for (Object[] row : tabItemRepository.countByStatus(userId)) {
      counts.put((TabStatus) row[0], ((Number) row[1]).longValue());
    }
    return counts;
  }

  @Override
  @Transactional(readOnly = true)
  public List<EventLogEntry> getEvents(Long tabId) {
    return eventLogRepository.findByEntityTypeAndEntityIdOrderByIdAsc(
        EventType.ENTITY_TAB_ITEM, tabId);
  }

  @Override
  @Transactional
  public TabItem markProcessed(Long tabId) {
    TabItem tab = getTab(tabId);
    tab.markProcessed();
    eventLogService.recordTabEvent(
        tab.getUserId(), EventType.TAB_PROCESSED, tabId, Map.of("url", tab.getUrl()));
    log.info("Tab {} marked processed", tabId);
    return tabItemRepository.save(tab);
  }

  @Override
  @Transactional
  public void deleteTab(Long tabId) {
    TabItem tab = getTab(tabId);
    tab.softDelete();
    tabItemRepository.save(tab);
    eventLogService.recordTabEvent(
        tab.getUserId(), EventType.TAB_DELETED, tabId, Map.of("url", tab.getUrl()));
    log.info("Tab {} deleted", tabId);
  }
}
