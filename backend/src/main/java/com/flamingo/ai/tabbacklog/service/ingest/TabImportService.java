package com.flamingo.ai.tabbacklog.service.ingest;

import com.flamingo.ai.tabbacklog.config.PipelineConfig;
import com.flamingo.ai.tabbacklog.exception.BookmarkFileFormatException;
import io.micrometer.core.annotation.Timed;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

/** Imports uploaded bookmark exports into a user's backlog. */
@Service
@RequiredArgsConstructor
@Slf4j
public class TabImportService {

  private final BookmarkImporter bookmarkImporter;
  private final IngestStore ingestStore;
  private final PipelineConfig pipelineConfig;

  /** Result of an import: what was stored and what the file contained. */
  public record ImportOutcome(IngestResult ingest, ImportStats stats) {}

  /**
   * Parses and ingests an export.
   *
   * @param batchSize candidates per transaction, or null for the configured default
   * @throws BookmarkFileFormatException if the upload is not a bookmark export
   */
  @Timed(value = "tabs.import", description = "Time to import a bookmark export")
  public ImportOutcome importBookmarks(MultipartFile file, UUID userId, Integer batchSize) {
    String document = read(file);
    log.info("Importing bookmarks from {} for user {}", file.getOriginalFilename(), userId);

    ImportStats stats = bookmarkImporter.stats(document);
    List<BookmarkCandidate> candidates = bookmarkImporter.parse(document);
    int size = batchSize != null ? batchSize : pipelineConfig.getIngest().getBatchSize();
    IngestResult result = ingestStore.ingest(candidates, userId, size);
    return new ImportOutcome(result, stats);
  }

  /** Counts collections and links in an export without storing anything. */
  public ImportStats preview(MultipartFile file) {
    return bookmarkImporter.stats(read(file));
  }

  private static String read(MultipartFile file) {
    if (file == null || file.isEmpty()) {
      throw new BookmarkFileFormatException("Bookmark file is empty");
    }
    try {
      return new String(file.getBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new BookmarkFileFormatException("Could not read bookmark file: " + e.getMessage(), e);
    }
  }
}
