package com.flamingo.ai.tabbacklog.api.rest;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.tabbacklog.domain.entity.TabItem;
import com.flamingo.ai.tabbacklog.domain.enums.TabStatus;
import com.flamingo.ai.tabbacklog.exception.EnrichmentInProgressException;
import com.flamingo.ai.tabbacklog.exception.GlobalExceptionHandler;
import com.flamingo.ai.tabbacklog.exception.InvalidStatusTransitionException;
import com.flamingo.ai.tabbacklog.exception.TabNotFoundException;
import com.flamingo.ai.tabbacklog.service.enrichment.EnrichmentService;
import com.flamingo.ai.tabbacklog.service.extraction.ExtractionService;
import com.flamingo.ai.tabbacklog.service.ingest.ImportStats;
import com.flamingo.ai.tabbacklog.service.ingest.IngestResult;
import com.flamingo.ai.tabbacklog.service.ingest.TabImportService;
import com.flamingo.ai.tabbacklog.service.tab.StageRunSummary;
import com.flamingo.ai.tabbacklog.service.tab.TabService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("TabController")
class TabControllerTest {

  private static final UUID USER = UUID.fromString("00000000-0000-0000-0000-000000000042");

  @Mock private TabImportService tabImportService;
  @Mock private TabService tabService;
  @Mock private ExtractionService extractionService;
  @Mock private EnrichmentService enrichmentService;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    TabController controller =
        new TabController(tabImportService, tabService, extractionService, enrichmentService);
    mockMvc =
        MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
  }

  @Test
  void shouldReturnImportCounts_whenFileIsUploaded() throws Exception {
    // Given
    MockMultipartFile file =
        new MockMultipartFile("file", "bookmarks.html", "text/html", "<DL></DL>".getBytes());
    ImportStats stats =
        new ImportStats(1, 2, List.of(new ImportStats.CollectionCount("Research", 2)));
    when(tabImportService.importBookmarks(any(), eq(USER), isNull()))
        .thenReturn(
            new TabImportService.ImportOutcome(new IngestResult(2, 1, 1, 0, List.of()), stats));

    // When / Then
    mockMvc
        .perform(multipart("/api/tabs/import").file(file).param("userId", USER.toString()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.totalProcessed").value(2))
        .andExpect(jsonPath("$.inserted").value(1))
        .andExpect(jsonPath("$.skippedDuplicates").value(1))
        .andExpect(jsonPath("$.stats.collections[0].label").value("Research"));
  }

  @Test
  void shouldReturn404_whenTabDoesNotExist() throws Exception {
    when(tabService.getTab(7L)).thenThrow(new TabNotFoundException(7L));

    mockMvc
        .perform(get("/api/tabs/7"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("TAB_001"));
  }

  @Test
  void shouldReturnPersistedErrorState_whenEnrichmentIsExhausted() throws Exception {
    TabItem failed =
        TabItem.builder()
            .id(3L)
            .userId(USER)
            .url("https://example.com")
            .status(TabStatus.LLM_ERROR)
            .lastError("Model output is not valid JSON")
            .build();
    when(enrichmentService.enrichTab(3L)).thenReturn(failed);

    mockMvc
        .perform(post("/api/tabs/3/enrich"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("llm_error"))
        .andExpect(jsonPath("$.lastError").value("Model output is not valid JSON"));
  }

  @Test
  void shouldReturn409_whenTabIsAlreadyBeingEnriched() throws Exception {
    when(enrichmentService.enrichTab(3L)).thenThrow(new EnrichmentInProgressException(3L));

    mockMvc
        .perform(post("/api/tabs/3/enrich"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("LLM_002"));
  }

  @Test
  void shouldReturn409_whenTabCannotEnterStage() throws Exception {
    when(extractionService.extractTab(4L))
        .thenThrow(
            new InvalidStatusTransitionException(4L, TabStatus.ENRICHED, TabStatus.FETCH_PENDING));

    mockMvc
        .perform(post("/api/tabs/4/extract"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("TAB_002"));
  }

  @Test
  void shouldSummarizeStatuses() throws Exception {
    Map<TabStatus, Long> counts = new EnumMap<>(TabStatus.class);
    for (TabStatus s : TabStatus.values()) {
      counts.put(s, 0L);
    }
    counts.put(TabStatus.NEW, 3L);
    counts.put(TabStatus.ENRICHED, 2L);
    when(tabService.countByStatus(USER)).thenReturn(counts);

    mockMvc
        .perform(get("/api/tabs/summary").param("userId", USER.toString()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.total").value(5))
        .andExpect(jsonPath("$.byStatus.new").value(3))
        .andExpect(jsonPath("$.byStatus.llm_error").value(0));
  }

  @Test
  void shouldReturn400_whenStatusFilterIsUnknown() throws Exception {
    mockMvc
        .perform(get("/api/tabs").param("userId", USER.toString()).param("status", "archived"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_001"));
  }

  @Test
  void shouldRunBatchExtraction_withDefaultLimit() throws Exception {
    when(extractionService.extractNewTabs(USER, 20)).thenReturn(new StageRunSummary(2, 1, 1, 0));

    mockMvc
        .perform(post("/api/tabs/extract").param("userId", USER.toString()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.selected").value(2))
        .andExpect(jsonPath("$.failed").value(1));
  }

  @Test
  void shouldReturn204_whenTabIsDeleted() throws Exception {
    mockMvc.perform(delete("/api/tabs/5")).andExpect(status().isNoContent());

    verify(tabService).deleteTab(5L);
  }
}
