package com.flamingo.ai.tabbacklog.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the ingest, extraction and enrichment stages. */
@Configuration
@ConfigurationProperties(prefix = "pipeline")
@Getter
@Setter
public class PipelineConfig {

  private Ingest ingest = new Ingest();
  private Extraction extraction = new Extraction();
  private Enrichment enrichment = new Enrichment();

  @Getter
  @Setter
  public static class Ingest {
    /** Candidates per transaction. */
    private int batchSize = 100;

    /** Bookmark folders whose name starts with this prefix are tab collections. */
    private String collectionPrefix = "Session-";

    /** Label used when a collection folder name is exactly the prefix. */
    private String defaultCollectionLabel = "default";

    /** Upper bound on error messages returned in an ingest result. */
    private int maxErrorMessages = 20;
  }

  @Getter
  @Setter
  public static class Extraction {
    private int fetchTimeoutSeconds = 30;

    private String userAgent =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
            + "(KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

    /** Maximum tabs fetched and extracted in parallel by a batch run. */
    private int concurrency = 4;

    private VideoTool videoTool = new VideoTool();

    /** External video metadata tool (yt-dlp). */
    @Getter
    @Setter
    public static class VideoTool {
      private String executable = "yt-dlp";
      private int timeoutSeconds = 30;
      private int maxOutputBytes = 2 * 1024 * 1024;
    }
  }

  @Getter
  @Setter
  public static class Enrichment {
    /** Predictor calls per tab before giving up. */
    private int maxRetries = 3;

    /** Extracted text beyond this many characters is cut before prompting. */
    private int maxTextChars = 4000;

    /** Maximum enrichments in flight across all tabs. */
    private int concurrency = 2;

    /** Pause between failed attempts. Zero retries immediately. */
    private long retryDelayMs = 0;

    /** How long a caller waits for a free enrichment slot; zero fails fast. */
    private long maxWaitMs = 0;
  }
}
