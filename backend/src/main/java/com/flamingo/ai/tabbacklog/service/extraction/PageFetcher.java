package com.flamingo.ai.tabbacklog.service.extraction;

import com.flamingo.ai.tabbacklog.config.PipelineConfig;
import com.flamingo.ai.tabbacklog.exception.FetchException;
import java.io.IOException;
import java.net.SocketTimeoutException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.HttpStatusException;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;

/** Downloads page markup over HTTP(S). */
@Component
@RequiredArgsConstructor
@Slf4j
public class PageFetcher {

  private static final int MAX_BODY_BYTES = 5 * 1024 * 1024;

  private final PipelineConfig pipelineConfig;

  /** Fetches with the configured timeout. */
  public String fetch(String url) {
    return fetch(url, pipelineConfig.getExtraction().getFetchTimeoutSeconds());
  }

  /**
   * Fetches the page body, following redirects.
   *
   * @throws FetchException on timeout, transport failure or an HTTP error status
   */
  public String fetch(String url, int timeoutSeconds) {
    try {
      return Jsoup.connect(url)
          .userAgent(pipelineConfig.getExtraction().getUserAgent())
          .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
          .header("Accept-Language", "en-US,en;q=0.5")
          .timeout(timeoutSeconds * 1000)
          .followRedirects(true)
          .ignoreContentType(true)
          .maxBodySize(MAX_BODY_BYTES)
          .execute()
          .body();
    } catch (HttpStatusException e) {
      log.warn("HTTP error fetching {}: {}", url, e.getStatusCode());
      throw new FetchException(url, e.getStatusCode());
    } catch (SocketTimeoutException e) {
      log.warn("Timeout fetching {}", url);
      throw new FetchException(
          url, "Request timed out after " + timeoutSeconds + " seconds", e);
    } catch (IOException | IllegalArgumentException e) {
      log.warn("Request error fetching {}: {}", url, e.getMessage());
      throw new FetchException(url, "Request failed: " + e.getMessage(), e);
    }
  }
}
