package com.flamingo.ai.tabbacklog.service.extraction.video;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.tabbacklog.config.PipelineConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("YtDlpMetadataTool")
class YtDlpMetadataToolTest {

  private static final String URL = "https://www.youtube.com/watch?v=abc";

  @TempDir Path tempDir;

  private PipelineConfig pipelineConfig;
  private YtDlpMetadataTool tool;

  @BeforeEach
  void setUp() {
    pipelineConfig = new PipelineConfig();
    pipelineConfig.getExtraction().getVideoTool().setTimeoutSeconds(5);
    tool = new YtDlpMetadataTool(pipelineConfig, new ObjectMapper());
  }

  @Test
  void shouldThrow_whenExecutableIsMissing() {
    pipelineConfig
        .getExtraction()
        .getVideoTool()
        .setExecutable(tempDir.resolve("no-such-tool").toString());

    assertThatThrownBy(() -> tool.fetch(URL))
        .isInstanceOf(VideoMetadataException.class)
        .hasMessageStartingWith("Could not start");
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void shouldParseJson_whenToolSucceeds() throws IOException {
    useScript("echo '{\"id\": \"abc\", \"title\": \"T\", \"duration\": 61}'");

    JsonNode info = tool.fetch(URL);

    assertThat(info.get("id").asText()).isEqualTo("abc");
    assertThat(info.get("duration").asInt()).isEqualTo(61);
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void shouldReportStderr_whenToolExitsNonZero() throws IOException {
    useScript("echo 'ERROR: video unavailable' >&2\nexit 3");

    assertThatThrownBy(() -> tool.fetch(URL))
        .isInstanceOf(VideoMetadataException.class)
        .hasMessage("yt-dlp failed: ERROR: video unavailable");
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void shouldThrow_whenOutputIsNotJson() throws IOException {
    useScript("echo 'not json at all'");

    assertThatThrownBy(() -> tool.fetch(URL))
        .isInstanceOf(VideoMetadataException.class)
        .hasMessageContaining("malformed JSON");
  }

  @ParameterizedTest
  @ValueSource(strings = {"exit 0", "echo null", "echo '[]'", "echo '\"just a string\"'"})
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void shouldThrow_whenToolSucceedsWithoutJsonObject(String body) throws IOException {
    useScript(body);

    assertThatThrownBy(() -> tool.fetch(URL))
        .isInstanceOf(VideoMetadataException.class)
        .hasMessage("yt-dlp printed no JSON object");
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void shouldKillProcess_whenToolOutlivesTimeout() throws IOException {
    pipelineConfig.getExtraction().getVideoTool().setTimeoutSeconds(1);
    useScript("exec sleep 30");

    long started = System.nanoTime();
    assertThatThrownBy(() -> tool.fetch(URL))
        .isInstanceOf(VideoMetadataException.class)
        .hasMessage("yt-dlp timed out after 1 seconds");
    assertThat((System.nanoTime() - started) / 1_000_000_000L).isLessThan(10);
  }

  private void useScript(String body) throws IOException {
    Path script = tempDir.resolve("fake-yt-dlp.sh");
    Files.writeString(script, "#!/bin/sh\n" + body + "\n");
    Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwxr-xr-x"));
    pipelineConfig.getExtraction().getVideoTool().setExecutable(script.toString());
  }
}
