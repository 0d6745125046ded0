package com.flamingo.ai.tabbacklog.service.enrichment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.tabbacklog.agent.TabEnrichmentAgent;
import com.flamingo.ai.tabbacklog.config.PipelineConfig;
import com.flamingo.ai.tabbacklog.domain.enums.ContentType;
import com.flamingo.ai.tabbacklog.domain.enums.Priority;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.validation.Validation;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("EnrichmentEngine")
class EnrichmentEngineTest {

  private static final String URL = "https://example.com/post";

  private static final String VALID =
      """
      {"summary": "A practical guide to Rust ownership.", "content_type": "article",
       "tags": ["rust"], "projects": [], "est_read_min": 8, "priority": "medium"}
      """;

  @Mock private TabEnrichmentAgent agent;

  private PipelineConfig pipelineConfig;
  private SimpleMeterRegistry meterRegistry;
  private EnrichmentEngine engine;

  @BeforeEach
  void setUp() {
    pipelineConfig = new PipelineConfig();
    meterRegistry = new SimpleMeterRegistry();
    EnrichmentOutputParser parser =
        new EnrichmentOutputParser(
            new ObjectMapper(), Validation.buildDefaultValidatorFactory().getValidator());
    engine = new EnrichmentEngine(agent, parser, pipelineConfig, meterRegistry, "test-model");
  }

  @Test
  void shouldReturnResult_whenFirstReplyIsValid() {
    // Given
    givenReplies(VALID);

    // When
    EnrichmentOutcome outcome = engine.enrich(request("Title", "Some text", 42));

    // Then
    assertThat(outcome.isSuccess()).isTrue();
    assertThat(outcome.attempts()).isEqualTo(1);
    EnrichmentResult result = outcome.result();
    assertThat(result.summary()).isEqualTo("A practical guide to Rust ownership.");
    assertThat(result.contentType()).isEqualTo(ContentType.ARTICLE);
    assertThat(result.priority()).isEqualTo(Priority.MEDIUM);
    assertThat(result.estReadMinutes()).isEqualTo(8);
    assertThat(result.videoSeconds()).isEqualTo(42);
    assertThat(result.modelName()).isEqualTo("test-model");
    assertThat(meterRegistry.counter("enrichment.success").count()).isEqualTo(1.0);
  }

  @Test
  void shouldClampTagsAndProjects_whenModelReturnsTooMany() {
    String tags =
        IntStream.rangeClosed(1, 12)
            .mapToObj(i -> "\"t" + i + "\"")
            .collect(Collectors.joining(","));
    String projects =
        IntStream.rangeClosed(1, 7)
            .mapToObj(i -> "\"p" + i + "\"")
            .collect(Collectors.joining(","));
    givenReplies(
        "{\"summary\": \"Long enough summary\", \"content_type\": \"paper\", \"tags\": ["
            + tags
            + "], \"projects\": ["
            + projects
            + "]}");

    EnrichmentResult result = engine.enrich(request("Title", "text", null)).result();

    assertThat(result.tags()).hasSize(10).startsWith("t1", "t2").endsWith("t10");
    assertThat(result.projects()).hasSize(5).containsExactly("p1", "p2", "p3", "p4", "p5");
  }

  @Test
  void shouldCallPredictorExactlyMaxRetriesTimes_whenEveryReplyIsInvalid() {
    // Given
    givenReplies("not json", "{\"summary\": \"x\"}", "still not json");

    // When
    EnrichmentOutcome outcome = engine.enrich(request("Title", "text", null), 3);

    // Then
    assertThat(outcome.isSuccess()).isFalse();
    assertThat(outcome.attempts()).isEqualTo(3);
    assertThat(outcome.lastError()).startsWith("Model output is not valid JSON");
    assertThat(outcome.rawOutput()).isEqualTo("still not json");
    verify(agent, times(3))
        .enrich(anyString(), anyString(), anyString(), anyString(), anyInt(), anyInt());
    assertThat(meterRegistry.counter("enrichment.attempt.failure").count()).isEqualTo(3.0);
    assertThat(meterRegistry.counter("enrichment.exhausted").count()).isEqualTo(1.0);
  }

  @Test
  void shouldSucceedOnLaterAttempt_whenEarlierRepliesAreInvalid() {
    givenReplies("nope", VALID);

    EnrichmentOutcome outcome = engine.enrich(request("Title", "text", null));

    assertThat(outcome.isSuccess()).isTrue();
    assertThat(outcome.attempts()).isEqualTo(2);
  }

  @Test
  void shouldKeepLastRawOutput_whenFinalAttemptFailsWithoutReply() {
    when(agent.enrich(anyString(), anyString(), anyString(), anyString(), anyInt(), anyInt()))
        .thenReturn("garbage")
        .thenThrow(new RuntimeException("connection reset"));

    EnrichmentOutcome outcome = engine.enrich(request("Title", "text", null), 2);

    assertThat(outcome.lastError()).isEqualTo("connection reset");
    assertThat(outcome.rawOutput()).isEqualTo("garbage");
  }

  @Test
  void shouldUseConfiguredRetryBudget() {
    pipelineConfig.getEnrichment().setMaxRetries(1);
    givenReplies("nope");

    EnrichmentOutcome outcome = engine.enrich(request("Title", "text", null));

    assertThat(outcome.attempts()).isEqualTo(1);
  }

  @Test
  void shouldTruncateLongText_beforePrompting() {
    // Given
    givenReplies(VALID);
    String text = "a".repeat(5000);

    // When
    engine.enrich(request("Title", text, null));

    // Then
    ArgumentCaptor<String> sent = ArgumentCaptor.forClass(String.class);
    verify(agent).enrich(eq(URL), eq("Title"), eq("generic_html"), sent.capture(), eq(1), eq(0));
    assertThat(sent.getValue())
        .hasSize(4000 + "... [truncated]".length())
        .endsWith("... [truncated]");
  }

  @Test
  void shouldSendPlaceholders_whenTitleAndTextAreMissing() {
    givenReplies(VALID);

    engine.enrich(new EnrichmentRequest(URL, " ", "youtube", null, 0, 300));

    verify(agent).enrich(URL, "Untitled", "youtube", "No content available", 0, 300);
  }

  @Test
  void shouldRejectNonPositiveRetryBudget() {
    assertThatThrownBy(() -> engine.enrich(request("Title", "text", null), 0))
        .isInstanceOf(IllegalArgumentException.class);
    verify(agent, never())
        .enrich(anyString(), anyString(), anyString(), anyString(), anyInt(), anyInt());
  }

  private void givenReplies(String first, String... rest) {
    when(agent.enrich(anyString(), anyString(), anyString(), anyString(), anyInt(), anyInt()))
        .thenReturn(first, rest);
  }

  private static EnrichmentRequest request(String title, String text, Integer videoSeconds) {
    return new EnrichmentRequest(URL, title, "generic_html", text, 1, videoSeconds);
  }
}
