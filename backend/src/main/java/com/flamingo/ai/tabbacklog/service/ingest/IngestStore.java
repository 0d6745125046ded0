package com.flamingo.ai.tabbacklog.service.ingest;

import com.flamingo.ai.tabbacklog.config.PipelineConfig;
import com.flamingo.ai.tabbacklog.domain.enums.EventType;
import com.flamingo.ai.tabbacklog.domain.enums.TabStatus;
import com.flamingo.ai.tabbacklog.service.tab.EventLogService;
import io.micrometer.core.instrument.MeterRegistry;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Deduplicating store for imported bookmarks.
 *
 * <p>Candidates are written in batches, one transaction per batch, and batches never overlap.
 * Each row runs inside its own savepoint, so a failing row is rolled back alone and the rest of
 * its batch still commits. Whether a row was inserted or merged into an existing live tab is read
 * from the upsert itself, not from a prior lookup.
 */
@Component
@Slf4j
public class IngestStore {

  static final String EVENT_SOURCE = "firefox_bookmarks_import";

  // import_count is 1 only on the statement that created the row
  private static final String UPSERT_SQL =
      "INSERT INTO tab_item (user_id, url, page_title, window_label, collected_at, status, "
          + "is_processed, import_count, created_at, updated_at) "
          + "VALUES (?, ?, ?, ?, ?, ?, 0, 1, ?, ?) "
          + "ON CONFLICT (user_id, url) WHERE deleted_at IS NULL DO UPDATE SET "
          + "page_title = COALESCE(NULLIF(tab_item.page_title, ''), excluded.page_title), "
          + "window_label = COALESCE(NULLIF(tab_item.window_label, ''), excluded.window_label), "
          + "import_count = tab_item.import_count + 1, "
          + "updated_at = excluded.updated_at "
          + "RETURNING id, import_count";

  private final JdbcTemplate jdbcTemplate;
  private final TransactionTemplate transactionTemplate;
  private final EventLogService eventLogService;
  private final MeterRegistry meterRegistry;
  private final PipelineConfig pipelineConfig;

  private final ReentrantLock batchLock = new ReentrantLock();

  public IngestStore(
      JdbcTemplate jdbcTemplate,
      PlatformTransactionManager transactionManager,
      EventLogService eventLogService,
      MeterRegistry meterRegistry,
      PipelineConfig pipelineConfig) {
    this.jdbcTemplate = jdbcTemplate;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.eventLogService = eventLogService;
    this.meterRegistry = meterRegistry;
    this.pipelineConfig = pipelineConfig;
  }

  /**
   * Ingests candidates for a user.
   *
   * @param candidates bookmarks to store, in order
   * @param userId owner of the tabs
   * @param batchSize candidates per transaction, at least 1
   * @return counts of inserted, duplicate and failed candidates
   */
  public IngestResult ingest(List<BookmarkCandidate> candidates, UUID userId, int batchSize) {
    if (batchSize < 1) {
      throw new IllegalArgumentException("batchSize must be at least 1");
    }
    Tally tally = new Tally(pipelineConfig.getIngest().getMaxErrorMessages());

    for (int from = 0; from < candidates.size(); from += batchSize) {
      List<BookmarkCandidate> batch =
          candidates.subList(from, Math.min(from + batchSize, candidates.size()));
      batchLock.lock();
      try {
        transactionTemplate.executeWithoutResult(status -> ingestBatch(batch, userId, tally));
      } finally {
        batchLock.unlock();
      }
    }

    IngestResult result = tally.toResult();
    log.info(
        "Ingested {} candidate(s) for user {}: {} inserted, {} duplicate(s), {} error(s)",
        result.totalProcessed(),
        userId,
        result.inserted(),
        result.skippedDuplicates(),
        result.errors());
    return result;
  }

  private void ingestBatch(List<BookmarkCandidate> batch, UUID userId, Tally tally) {
    for (BookmarkCandidate candidate : batch) {
      tally.processed++;
      try {
        if (ingestRow(candidate, userId)) {
          tally.inserted++;
          meterRegistry.counter("ingest.inserted").increment();
        } else {
          tally.duplicates++;
          meterRegistry.counter("ingest.duplicates").increment();
        }
      } catch (RuntimeException e) {
        tally.error("Error processing " + candidate.url() + ": " + e.getMessage());
        meterRegistry.counter("ingest.errors").increment();
        log.warn("Failed to ingest {}: {}", candidate.url(), e.getMessage());
      }
    }
  }

  /** Upserts one candidate and logs its event; returns true if a new tab was created. */
  private boolean ingestRow(BookmarkCandidate candidate, UUID userId) {
    Boolean inserted =
        jdbcTemplate.execute(
            (ConnectionCallback<Boolean>)
                con -> {
                  Savepoint savepoint = con.setSavepoint();
                  try {
                    UpsertOutcome outcome = upsert(con, candidate, userId);
                    Map<String, Object> details = new LinkedHashMap<>();
                    details.put("url", candidate.url());
                    details.put("source", EVENT_SOURCE);
                    EventType eventType =
                        outcome.inserted()
                            ? EventType.TAB_CREATED
                            : EventType.TAB_DUPLICATE_SKIPPED;
                    eventLogService.recordTabEvent(userId, eventType, outcome.tabId(), details);
                    con.releaseSavepoint(savepoint);
                    return outcome.inserted();
                  } catch (SQLException | RuntimeException e) {
                    con.rollback(savepoint);
                    throw e;
                  }
                });
    return Boolean.TRUE.equals(inserted);
  }

  private UpsertOutcome upsert(Connection con, BookmarkCandidate candidate, UUID userId)
      throws SQLException {
    Timestamp now = Timestamp.valueOf(LocalDateTime.now());
    LocalDateTime collectedAt =
        candidate.collectedAt() != null ? candidate.collectedAt() : LocalDateTime.now();

    try (PreparedStatement ps = con.prepareStatement(UPSERT_SQL)) {
      ps.setString(1, userId.toString());
      ps.setString(2, candidate.url());
      ps.setString(3, candidate.title());
      ps.setString(4, candidate.collectionLabel());
      ps.setTimestamp(5, Timestamp.valueOf(collectedAt));
      ps.setString(6, TabStatus.NEW.name());
      ps.setTimestamp(7, now);
      ps.setTimestamp(8, now);
      try (ResultSet rs = ps.executeQuery()) {
        if (!rs.next()) {
          throw new SQLException("Upsert returned no row for " + candidate.url());
        }
        return new UpsertOutcome(rs.getLong("id"), rs.getInt("import_count") == 1);
      }
    }
  }

  private record UpsertOutcome(long tabId, boolean inserted) {}

  /** Running totals across batches. */
  private static final class Tally {
    private final int maxMessages;
    private final List<String> messages = new ArrayList<>();
    private int processed;
    private int inserted;
    private int duplicates;
    private int errors;

    Tally(int maxMessages) {
      this.maxMessages = maxMessages;
    }

    void error(String message) {
      errors++;
      if (messages.size() < maxMessages) {
        messages.add(message);
      }
    }

    IngestResult toResult() {
      return new IngestResult(processed, inserted, duplicates, errors, messages);
    }
  }
}
