package com.flamingo.ai.tabbacklog.service.ingest;

import java.util.List;

/**
 * Outcome of an ingest run.
 *
 * @param totalProcessed candidates seen
 * @param inserted new tabs created
 * @param skippedDuplicates candidates that matched an existing live tab
 * @param errors candidates that failed
 * @param errorMessages failure messages, capped for display
 */
public record IngestResult(
    int totalProcessed,
    int inserted,
    int skippedDuplicates,
    int errors,
    List<String> errorMessages) {

  public IngestResult {
    errorMessages = errorMessages == null ? List.of() : List.copyOf(errorMessages);
  }
}
