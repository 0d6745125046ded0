package com.flamingo.ai.tabbacklog.service.extraction;

import com.flamingo.ai.tabbacklog.domain.entity.TabItem;
import com.flamingo.ai.tabbacklog.domain.enums.TabStatus;
import com.flamingo.ai.tabbacklog.domain.repository.TabItemRepository;
import com.flamingo.ai.tabbacklog.exception.ExtractionException;
import com.flamingo.ai.tabbacklog.service.extraction.model.ParsedPage;
import com.flamingo.ai.tabbacklog.service.tab.StageRunSummary;
import com.flamingo.ai.tabbacklog.service.tab.TabLifecycleService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

/**
 * Fetches pages and routes them through the extractor registry. Status changes are committed
 * before and after the network work, never around it.
 */
@Service
@Slf4j
public class ExtractionServiceImpl implements ExtractionService {

  private final ExtractorRegistry extractorRegistry;
  private final PageFetcher pageFetcher;
  private final TabLifecycleService tabLifecycleService;
  private final TabItemRepository tabItemRepository;
  private final MeterRegistry meterRegistry;
  private final Executor extractionExecutor;

  public ExtractionServiceImpl(
      ExtractorRegistry extractorRegistry,
      PageFetcher pageFetcher,
      TabLifecycleService tabLifecycleService,
      TabItemRepository tabItemRepository,
      MeterRegistry meterRegistry,
      @Qualifier("extractionExecutor") Executor extractionExecutor) {
    this.extractorRegistry = extractorRegistry;
    this.pageFetcher = pageFetcher;
    this.tabLifecycleService = tabLifecycleService;
    this.tabItemRepository = tabItemRepository;
    this.meterRegistry = meterRegistry;
    this.extractionExecutor = extractionExecutor;
  }

  @Override
  @Timed(value = "extraction.url", description = "Time to fetch and extract a URL")
  public ParsedPage extractUrl(String url, int timeoutSeconds) {
    log.info("Fetching and extracting {}", url);
    String html = pageFetcher.fetch(url, timeoutSeconds);
    return extractChecked(url, html);
  }

  @Override
  public ParsedPage extractHtml(String url, String html) {
    log.info("Extracting supplied HTML for {}", url);
    return extractChecked(url, html);
  }

  @Override
  @Timed(value = "extraction.tab", description = "Time to extract one tab")
  public TabItem extractTab(Long tabId) {
    TabItem tab = tabLifecycleService.beginExtraction(tabId);
    String url = tab.getUrl();

    ParsedPage page;
    try {
      page = extractChecked(url, pageFetcher.fetch(url));
    } catch (RuntimeException e) {
      meterRegistry.counter("extraction.failure").increment();
      String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
      return tabLifecycleService.recordFetchError(tabId, error);
    }
    return tabLifecycleService.recordParsed(tabId, page);
  }

  @Override
  @Timed(value = "extraction.batch", description = "Time to extract a batch of tabs")
  public StageRunSummary extractNewTabs(UUID userId, int limit) {
    List<TabItem> candidates =
        tabItemRepository.findStageCandidates(
            userId, TabStatus.NEW, PageRequest.of(0, Math.max(1, limit)));
    log.info("Extracting {} new tab(s) for user {}", candidates.size(), userId);

    List<CompletableFuture<TabStatus>> futures =
        candidates.stream()
            .map(
                tab ->
                    CompletableFuture.supplyAsync(
                        () -> extractQuietly(tab.getId()), extractionExecutor))
            .toList();
    CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

    int succeeded = 0;
    int failed = 0;
    int skipped = 0;
    for (CompletableFuture<TabStatus> future : futures) {
      TabStatus status = future.join();
      if (status == TabStatus.PARSED) {
        succeeded++;
      } else if (status == TabStatus.FETCH_ERROR) {
        failed++;
      } else {
        skipped++;
      }
    }
    StageRunSummary summary = new StageRunSummary(candidates.size(), succeeded, failed, skipped);
    log.info("Extraction batch for user {} finished: {}", userId, summary);
    return summary;
  }

  @Override
  public List<String> extractorNames() {
    return extractorRegistry.extractorNames();
  }

  private ParsedPage extractChecked(String url, String html) {
    ParsedPage page = extractorRegistry.extract(url, html);
    if (page.isEmpty()) {
      throw new ExtractionException(url, "No title or text could be extracted");
    }
    meterRegistry.counter("extraction.success", "site_kind", page.siteKind()).increment();
    if (Boolean.TRUE.equals(page.metadata().get("fallback_used"))) {
      meterRegistry.counter("extraction.fallback").increment();
    }
    return page;
  }

  /** Extracts one tab of a batch; returns null when the tab was skipped. */
  private TabStatus extractQuietly(Long tabId) {
    try {
      return extractTab(tabId).getStatus();
    } catch (RuntimeException e) {
      log.warn("Skipped extraction of tab {}: {}", tabId, e.getMessage());
      return null;
    }
  }
}
