package com.flamingo.ai.tabbacklog.service.tab;

import com.flamingo.ai.tabbacklog.domain.entity.ExtractedContent;
import com.flamingo.ai.tabbacklog.domain.entity.TabEnrichment;
import com.flamingo.ai.tabbacklog.domain.entity.TabEnrichmentHistory;
import com.flamingo.ai.tabbacklog.domain.entity.TabItem;
import com.flamingo.ai.tabbacklog.domain.enums.EventType;
import com.flamingo.ai.tabbacklog.domain.enums.TabStatus;
import com.flamingo.ai.tabbacklog.domain.repository.ExtractedContentRepository;
import com.flamingo.ai.tabbacklog.domain.repository.TabEnrichmentHistoryRepository;
import com.flamingo.ai.tabbacklog.domain.repository.TabEnrichmentRepository;
import com.flamingo.ai.tabbacklog.domain.repository.TabItemRepository;
import com.flamingo.ai.tabbacklog.exception.InvalidStatusTransitionException;
import com.flamingo.ai.tabbacklog.exception.TabNotFoundException;
import com.flamingo.ai.tabbacklog.service.enrichment.EnrichmentRequest;
import com.flamingo.ai.tabbacklog.service.enrichment.EnrichmentResult;
import com.flamingo.ai.tabbacklog.service.extraction.model.ParsedPage;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Persists stage transitions of a tab. Each method is one short transaction that changes the tab,
 * writes the stage output and appends the matching event; none of them is held open across a
 * fetch or a model call.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TabLifecycleService {

  private final TabItemRepository tabItemRepository;
  private final ExtractedContentRepository extractedContentRepository;
  private final TabEnrichmentRepository tabEnrichmentRepository;
  private final TabEnrichmentHistoryRepository tabEnrichmentHistoryRepository;
  private final EventLogService eventLogService;

  /**
   * Moves a tab from {@code new} or {@code fetch_error} into {@code fetch_pending}.
   *
   * @return the tab in its pending state
   * @throws TabNotFoundException if there is no live tab with this id
   * @throws InvalidStatusTransitionException if the tab cannot start extraction
   */
  @Transactional
  public TabItem beginExtraction(Long tabId) {
    TabItem tab = loadTab(tabId);
    tab.transitionTo(TabStatus.FETCH_PENDING);
    eventLogService.recordTabEvent(
        tab.getUserId(), EventType.FETCH_STARTED, tabId, Map.of("url", tab.getUrl()));
    return tabItemRepository.save(tab);
  }

  /** Stores extracted content, overwriting any previous extraction, and marks the tab parsed. */
  @Transactional
  public TabItem recordParsed(Long tabId, ParsedPage page) {
    TabItem tab = loadTab(tabId);
    tab.succeed(TabStatus.PARSED);

    ExtractedContent content =
        extractedContentRepository
            .findById(tabId)
            .orElseGet(() -> ExtractedContent.builder().tabId(tabId).build());
    content.setSiteKind(page.siteKind());
    content.setTitle(page.title());
    content.setTextFull(page.textFull());
    content.setWordCount(page.wordCount());
    content.setVideoSeconds(page.videoSeconds());
    content.setMetadata(new LinkedHashMap<>(page.metadata()));
    extractedContentRepository.save(content);

    Map<String, Object> details = new LinkedHashMap<>();
    details.put("site_kind", page.siteKind());
    details.put("word_count", page.wordCount());
    if (Boolean.TRUE.equals(page.metadata().get("fallback_used"))) {
      details.put("fallback_used", true);
    }
    eventLogService.recordTabEvent(tab.getUserId(), EventType.FETCH_SUCCESS, tabId, details);

    log.info("Tab {} parsed as {} ({} words)", tabId, page.siteKind(), page.wordCount());
    return tabItemRepository.save(tab);
  }

  /** Marks a pending extraction as failed. */
  @Transactional
  public TabItem recordFetchError(Long tabId, String error) {
    TabItem tab = loadTab(tabId);
    tab.fail(TabStatus.FETCH_ERROR, error);
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("url", tab.getUrl());
    details.put("error", error);
    eventLogService.recordTabEvent(tab.getUserId(), EventType.FETCH_ERROR, tabId, details);
    log.error("Extraction failed for tab {}: {}", tabId, error);
    return tabItemRepository.save(tab);
  }

  /**
   * Moves a tab from {@code parsed} or {@code llm_error} into {@code llm_pending}.
   *
   * @return the request built from the tab and its extracted content
   * @throws InvalidStatusTransitionException if the tab has not been parsed
   */
  @Transactional
  public EnrichmentRequest beginEnrichment(Long tabId) {
    TabItem tab = loadTab(tabId);
    tab.transitionTo(TabStatus.LLM_PENDING);
    ExtractedContent content =
        extractedContentRepository
            .findById(tabId)
            .orElseThrow(
                () -> new IllegalStateException("Tab " + tabId + " has no extracted content"));
    eventLogService.recordTabEvent(
        tab.getUserId(), EventType.LLM_ENRICH_STARTED, tabId, Map.of("url", tab.getUrl()));
    tabItemRepository.save(tab);
    return new EnrichmentRequest(
        tab.getUrl(),
        content.getTitle() != null ? content.getTitle() : tab.getTitle(),
        content.getSiteKind(),
        content.getTextFull(),
        content.getWordCount(),
        content.getVideoSeconds());
  }

  /** Stores the current enrichment, appends it to the history and marks the tab enriched. */
  @Transactional
  public TabItem recordEnriched(
      Long tabId, EnrichmentResult result, int attempts, LocalDateTime runStartedAt) {
    TabItem tab = loadTab(tabId);
    tab.succeed(TabStatus.ENRICHED);

    TabEnrichment current =
        tabEnrichmentRepository
            .findById(tabId)
            .orElseGet(() -> TabEnrichment.builder().tabId(tabId).build());
    current.setSummary(result.summary());
    current.setContentType(result.contentType());
    current.setTags(result.tags());
    current.setProjects(result.projects());
    current.setEstReadMinutes(result.estReadMinutes());
    current.setPriority(result.priority());
    current.setVideoSeconds(result.videoSeconds());
    current.setModelName(result.modelName());
    tabEnrichmentRepository.save(current);

    tabEnrichmentHistoryRepository.save(
        TabEnrichmentHistory.builder()
            .tabId(tabId)
            .summary(result.summary())
            .contentType(result.contentType())
            .tags(result.tags())
            .projects(result.projects())
            .estReadMinutes(result.estReadMinutes())
            .priority(result.priority())
            .modelName(result.modelName())
            .attempts(attempts)
            .runStartedAt(runStartedAt)
            .runFinishedAt(LocalDateTime.now())
            .build());

    Map<String, Object> details = new LinkedHashMap<>();
    details.put("content_type", result.contentType().getValue());
    details.put("attempts", attempts);
    details.put("model_name", result.modelName());
    eventLogService.recordTabEvent(tab.getUserId(), EventType.LLM_ENRICH_SUCCESS, tabId, details);

    log.info("Tab {} enriched as {} after {} attempt(s)", tabId, result.contentType(), attempts);
    return tabItemRepository.save(tab);
  }

  /** Marks a pending enrichment as failed, keeping the last raw model output in the event log. */
  @Transactional
  public TabItem recordLlmError(Long tabId, String error, int attempts, String rawOutput) {
    TabItem tab = loadTab(tabId);
    tab.fail(TabStatus.LLM_ERROR, error);

    Map<String, Object> details = new LinkedHashMap<>();
    details.put("url", tab.getUrl());
    details.put("error", error);
    details.put("attempts", attempts);
    if (rawOutput != null) {
      details.put("raw_output", rawOutput);
    }
    eventLogService.recordTabEvent(tab.getUserId(), EventType.LLM_ENRICH_ERROR, tabId, details);

    log.error("Enrichment failed for tab {} after {} attempt(s): {}", tabId, attempts, error);
    return tabItemRepository.save(tab);
  }

  private TabItem loadTab(Long tabId) {
    return tabItemRepository
        .findByIdAndDeletedAtIsNull(tabId)
        .orElseThrow(() -> new TabNotFoundException(tabId));
  }
}
