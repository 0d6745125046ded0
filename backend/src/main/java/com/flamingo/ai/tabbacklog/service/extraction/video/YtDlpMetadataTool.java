package com.flamingo.ai.tabbacklog.service.extraction.video;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.tabbacklog.config.PipelineConfig;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Runs {@code yt-dlp --dump-json} as a subprocess. Output is read on separate threads and capped,
 * so a hung or chatty process cannot block past the configured timeout.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class YtDlpMetadataTool implements VideoMetadataTool {

  private static final int MAX_STDERR_BYTES = 8 * 1024;

  private final PipelineConfig pipelineConfig;
  private final ObjectMapper objectMapper;

  @Override
  public JsonNode fetch(String url) {
    PipelineConfig.Extraction.VideoTool tool = pipelineConfig.getExtraction().getVideoTool();
    List<String> command =
        List.of(
            tool.getExecutable(),
            "--dump-json",
            "--no-download",
            "--no-playlist",
            "--no-warnings",
            url);

    Process process;
    try {
      process = new ProcessBuilder(command).start();
    } catch (IOException e) {
      throw new VideoMetadataException(
          "Could not start " + tool.getExecutable() + ": " + e.getMessage(), e);
    }

    CompletableFuture<byte[]> stdout =
        CompletableFuture.supplyAsync(
            () -> readCapped(process.getInputStream(), tool.getMaxOutputBytes()));
    CompletableFuture<byte[]> stderr =
        CompletableFuture.supplyAsync(() -> readCapped(process.getErrorStream(), MAX_STDERR_BYTES));

    try {
      boolean finished = process.waitFor(Math.max(1, tool.getTimeoutSeconds()), TimeUnit.SECONDS);
      if (!finished) {
        process.destroyForcibly();
        throw new VideoMetadataException(
            "yt-dlp timed out after " + tool.getTimeoutSeconds() + " seconds");
      }

      if (process.exitValue() != 0) {
        String error = new String(stderr.get(5, TimeUnit.SECONDS), StandardCharsets.UTF_8).trim();
        throw new VideoMetadataException("yt-dlp failed: " + error);
      }

      String json = new String(stdout.get(5, TimeUnit.SECONDS), StandardCharsets.UTF_8);
      JsonNode info = objectMapper.readTree(json);
      if (info == null || !info.isObject()) {
        throw new VideoMetadataException("yt-dlp printed no JSON object");
      }
      return info;
    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new VideoMetadataException("Interrupted while waiting for yt-dlp", e);
    } catch (ExecutionException | TimeoutException e) {
      throw new VideoMetadataException("Could not read yt-dlp output: " + e.getMessage(), e);
    } catch (JsonProcessingException e) {
      throw new VideoMetadataException(
          "yt-dlp printed malformed JSON: " + e.getOriginalMessage(), e);
    }
  }

  private static byte[] readCapped(InputStream in, int maxBytes) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (in) {
      byte[] buf = new byte[8192];
      int total = 0;
      int n;
      while ((n = in.read(buf)) >= 0) {
        int toWrite = Math.min(n, maxBytes - total);
        if (toWrite > 0) {
          out.write(buf, 0, toWrite);
          total += toWrite;
        }
        // keep draining past the cap so the process never blocks on a full pipe
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return out.toByteArray();
  }
}
