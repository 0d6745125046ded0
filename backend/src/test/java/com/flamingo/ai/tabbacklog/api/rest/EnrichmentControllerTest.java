package com.flamingo.ai.tabbacklog.api.rest;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.tabbacklog.api.dto.request.EnrichRequest;
import com.flamingo.ai.tabbacklog.domain.enums.ContentType;
import com.flamingo.ai.tabbacklog.domain.enums.Priority;
import com.flamingo.ai.tabbacklog.exception.EnrichmentExhaustedException;
import com.flamingo.ai.tabbacklog.exception.GlobalExceptionHandler;
import com.flamingo.ai.tabbacklog.service.enrichment.EnrichmentResult;
import com.flamingo.ai.tabbacklog.service.enrichment.EnrichmentService;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("EnrichmentController")
class EnrichmentControllerTest {

  private static final String URL = "https://example.com/post";

  @Mock private EnrichmentService enrichmentService;

  private MockMvc mockMvc;
  private final ObjectMapper objectMapper = new ObjectMapper();

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new EnrichmentController(enrichmentService))
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
  }

  @Test
  void shouldReturnEnrichment_whenModelReplyIsValid() throws Exception {
    // Given
    when(enrichmentService.enrich(any()))
        .thenReturn(
            new EnrichmentResult(
                "A practical guide.",
                ContentType.CODE_REPO,
                List.of("rust"),
                List.of(),
                4,
                Priority.HIGH,
                null,
                "test-model"));

    // When / Then
    mockMvc
        .perform(
            post("/api/enrich")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request(URL))))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.url").value(URL))
        .andExpect(jsonPath("$.contentType").value("code_repo"))
        .andExpect(jsonPath("$.priority").value("high"))
        .andExpect(jsonPath("$.tags[0]").value("rust"));
  }

  @Test
  void shouldReturn502WithRawOutput_whenAttemptsAreExhausted() throws Exception {
    when(enrichmentService.enrich(any()))
        .thenThrow(new EnrichmentExhaustedException(URL, 3, "bad reply", "{\"summary\":"));

    mockMvc
        .perform(
            post("/api/enrich")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request(URL))))
        .andExpect(status().isBadGateway())
        .andExpect(jsonPath("$.code").value("LLM_001"))
        .andExpect(jsonPath("$.attempts").value(3))
        .andExpect(jsonPath("$.details").value("{\"summary\":"));
  }

  @Test
  void shouldReturn429_whenNoEnrichmentSlotIsFree() throws Exception {
    when(enrichmentService.enrich(any()))
        .thenThrow(BulkheadFullException.createBulkheadFullException(Bulkhead.ofDefaults("x")));

    mockMvc
        .perform(
            post("/api/enrich")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request(URL))))
        .andExpect(status().isTooManyRequests())
        .andExpect(jsonPath("$.code").value("LLM_003"));
  }

  @Test
  void shouldReturn400_whenUrlIsMissing() throws Exception {
    mockMvc
        .perform(
            post("/api/enrich")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request(null))))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_001"));

    verify(enrichmentService, never()).enrich(any());
  }

  private static EnrichRequest request(String url) {
    return EnrichRequest.builder()
        .url(url)
        .title("Title")
        .siteKind("generic_html")
        .text("Some text")
        .wordCount(2)
        .build();
  }
}
