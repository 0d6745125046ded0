package com.flamingo.ai.tabbacklog.api.dto.response;

import com.flamingo.ai.tabbacklog.service.ingest.ImportStats;
import com.flamingo.ai.tabbacklog.service.ingest.IngestResult;
import com.flamingo.ai.tabbacklog.service.ingest.TabImportService;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a bookmark import. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportResponse {

  private int totalProcessed;
  private int inserted;
  private int skippedDuplicates;
  private int errors;
  private List<String> errorMessages;
  private ImportStats stats;

  public static ImportResponse fromOutcome(TabImportService.ImportOutcome outcome) {
    IngestResult ingest = outcome.ingest();
    return ImportResponse.builder()
        .totalProcessed(ingest.totalProcessed())
        .inserted(ingest.inserted())
        .skippedDuplicates(ingest.skippedDuplicates())
        .errors(ingest.errors())
        .errorMessages(ingest.errorMessages())
        .stats(outcome.stats())
        .build();
  }
}
