package com.flamingo.ai.tabbacklog.service.enrichment;

import com.flamingo.ai.tabbacklog.domain.entity.TabItem;
import com.flamingo.ai.tabbacklog.domain.enums.TabStatus;
import com.flamingo.ai.tabbacklog.domain.repository.TabItemRepository;
import com.flamingo.ai.tabbacklog.exception.EnrichmentInProgressException;
import com.flamingo.ai.tabbacklog.service.tab.StageRunSummary;
import com.flamingo.ai.tabbacklog.service.tab.TabLifecycleService;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.micrometer.core.annotation.Timed;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

/**
 * Runs the enrichment stage. At most one enrichment per tab is in flight at a time, and all
 * enrichments together are capped by the enrichment bulkhead. No transaction is held while the
 * model is being called.
 */
@Service
@Slf4j
public class EnrichmentServiceImpl implements EnrichmentService {

  private final EnrichmentEngine enrichmentEngine;
  private final TabLifecycleService tabLifecycleService;
  private final TabItemRepository tabItemRepository;
  private final Bulkhead enrichmentBulkhead;
  private final Executor enrichmentExecutor;

  private final Set<Long> inFlight = ConcurrentHashMap.newKeySet();

  public EnrichmentServiceImpl(
      EnrichmentEngine enrichmentEngine,
      TabLifecycleService tabLifecycleService,
      TabItemRepository tabItemRepository,
      Bulkhead enrichmentBulkhead,
      @Qualifier("enrichmentExecutor") Executor enrichmentExecutor) {
    this.enrichmentEngine = enrichmentEngine;
    this.tabLifecycleService = tabLifecycleService;
    this.tabItemRepository = tabItemRepository;
    this.enrichmentBulkhead = enrichmentBulkhead;
    this.enrichmentExecutor = enrichmentExecutor;
  }

  @Override
  @Timed(value = "enrichment.request", description = "Time to enrich ad-hoc content")
  public EnrichmentResult enrich(EnrichmentRequest request) {
    log.info("Enriching {}", request.url());
    EnrichmentOutcome outcome =
        enrichmentBulkhead.executeSupplier(() -> enrichmentEngine.enrich(request));
    return outcome.orElseThrow(request.url());
  }

  @Override
  @Timed(value = "enrichment.tab", description = "Time to enrich one tab")
  public TabItem enrichTab(Long tabId) {
    if (!inFlight.add(tabId)) {
      throw new EnrichmentInProgressException(tabId);
    }
    try {
      return enrichmentBulkhead.executeSupplier(() -> runStage(tabId));
    } finally {
      inFlight.remove(tabId);
    }
  }

  private TabItem runStage(Long tabId) {
    LocalDateTime startedAt = LocalDateTime.now();
    EnrichmentRequest request = tabLifecycleService.beginEnrichment(tabId);

    EnrichmentOutcome outcome;
    try {
      outcome = enrichmentEngine.enrich(request);
    } catch (RuntimeException e) {
      // the tab must not stay in llm_pending
      tabLifecycleService.recordLlmError(tabId, messageOf(e), 0, null);
      throw e;
    }

    if (outcome.isSuccess()) {
      return tabLifecycleService.recordEnriched(
          tabId, outcome.result(), outcome.attempts(), startedAt);
    }
    return tabLifecycleService.recordLlmError(
        tabId, outcome.lastError(), outcome.attempts(), outcome.rawOutput());
  }

  @Override
  @Timed(value = "enrichment.batch", description = "Time to enrich a batch of tabs")
  public StageRunSummary enrichParsedTabs(UUID userId, int limit) {
    List<TabItem> candidates =
        tabItemRepository.findStageCandidates(
            userId, TabStatus.PARSED, PageRequest.of(0, Math.max(1, limit)));
    log.info("Enriching {} parsed tab(s) for user {}", candidates.size(), userId);

    List<CompletableFuture<TabStatus>> futures =
        candidates.stream()
            .map(
                tab ->
                    CompletableFuture.supplyAsync(
                        () -> enrichQuietly(tab.getId()), enrichmentExecutor))
            .toList();
    CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

    int succeeded = 0;
    int failed = 0;
    int skipped = 0;
    for (CompletableFuture<TabStatus> future : futures) {
      TabStatus status = future.join();
      if (status == TabStatus.ENRICHED) {
        succeeded++;
      } else if (status == TabStatus.LLM_ERROR) {
        failed++;
      } else {
        skipped++;
      }
    }
    StageRunSummary summary = new StageRunSummary(candidates.size(), succeeded, failed, skipped);
    log.info("Enrichment batch for user {} finished: {}", userId, summary);
    return summary;
  }

  /** Enriches one tab of a batch; returns null when the tab was skipped. */
  private TabStatus enrichQuietly(Long tabId) {
    try {
      return enrichTab(tabId).getStatus();
    } catch (RuntimeException e) {
      log.warn("Skipped enrichment of tab {}: {}", tabId, messageOf(e));
      return null;
    }
  }

  private static String messageOf(Exception e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }
}
