package com.flamingo.ai.tabbacklog;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.tabbacklog.domain.entity.EventLogEntry;
import com.flamingo.ai.tabbacklog.domain.entity.TabItem;
import com.flamingo.ai.tabbacklog.domain.enums.ContentType;
import com.flamingo.ai.tabbacklog.domain.enums.Priority;
import com.flamingo.ai.tabbacklog.domain.enums.TabStatus;
import com.flamingo.ai.tabbacklog.service.enrichment.EnrichmentRequest;
import com.flamingo.ai.tabbacklog.service.enrichment.EnrichmentResult;
import com.flamingo.ai.tabbacklog.service.extraction.model.ParsedPage;
import com.flamingo.ai.tabbacklog.service.ingest.TabImportService;
import com.flamingo.ai.tabbacklog.service.tab.TabLifecycleService;
import com.flamingo.ai.tabbacklog.service.tab.TabService;
import dev.langchain4j.model.chat.ChatModel;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/** Drives one tab through import, extraction and enrichment records against SQLite. */
@SpringBootTest
@DisplayName("Tab pipeline against SQLite")
class TabPipelineIntegrationTest {

  private static final String EXPORT =
      """
      <DL><p>
        <DT><H3>Session-Reading</H3>
        <DL><p>
          <DT><A HREF="https://blog.example.org/rust" ADD_DATE="1700000000">Rust ownership</A>
          <DT><A HREF="https://blog.example.org/go">Go channels</A>
        </DL><p>
      </DL><p>
      """;

  @MockitoBean private ChatModel chatModel;

  @Autowired private TabImportService tabImportService;
  @Autowired private TabService tabService;
  @Autowired private TabLifecycleService tabLifecycleService;

  @Test
  void shouldImportOnce_andSkipDuplicatesOnReimport() {
    UUID userId = UUID.randomUUID();

    TabImportService.ImportOutcome first = tabImportService.importBookmarks(export(), userId, 1);
    TabImportService.ImportOutcome second =
        tabImportService.importBookmarks(export(), userId, null);

    assertThat(first.ingest().inserted()).isEqualTo(2);
    assertThat(second.ingest().inserted()).isZero();
    assertThat(second.ingest().skippedDuplicates()).isEqualTo(2);
    List<TabItem> tabs = tabService.listTabs(userId, TabStatus.NEW);
    assertThat(tabs).hasSize(2);
    assertThat(tabs).extracting(TabItem::getCollectionLabel).containsOnly("Reading");
    assertThat(tabs).extracting(TabItem::getImportCount).containsOnly(2);
    assertThat(tabService.countByStatus(userId))
        .containsEntry(TabStatus.NEW, 2L)
        .containsEntry(TabStatus.ENRICHED, 0L);
  }

  @Test
  void shouldRecordEveryStage_andKeepEventsInOrder() {
    // Given
    UUID userId = UUID.randomUUID();
    tabImportService.importBookmarks(export(), userId, null);
    Long tabId =
        tabService.listTabs(userId, null).stream()
            .filter(t -> t.getUrl().endsWith("/rust"))
            .findFirst()
            .orElseThrow()
            .getId();

    // When
    tabLifecycleService.beginExtraction(tabId);
    tabLifecycleService.recordParsed(
        tabId,
        new ParsedPage(
            "generic_html",
            null,
            "Ownership is a set of rules.",
            6,
            null,
            Map.of("domain", "blog.example.org")));
    EnrichmentRequest request = tabLifecycleService.beginEnrichment(tabId);
    tabLifecycleService.recordEnriched(
        tabId,
        new EnrichmentResult(
            "A guide to Rust ownership.",
            ContentType.ARTICLE,
            List.of("rust", "memory"),
            List.of(),
            4,
            Priority.MEDIUM,
            null,
            "test-model"),
        1,
        LocalDateTime.now());

    // Then
    assertThat(request.title()).isEqualTo("Rust ownership");
    assertThat(request.text()).isEqualTo("Ownership is a set of rules.");
    assertThat(tabService.getTab(tabId).getStatus()).isEqualTo(TabStatus.ENRICHED);
    assertThat(tabService.getContent(tabId))
        .hasValueSatisfying(
            c -> assertThat(c.getMetadata()).containsEntry("domain", "blog.example.org"));
    assertThat(tabService.getEnrichment(tabId))
        .hasValueSatisfying(e -> assertThat(e.getTags()).containsExactly("rust", "memory"));
    assertThat(tabService.getEnrichmentHistory(tabId)).hasSize(1);
    assertThat(tabService.getEvents(tabId))
        .extracting(EventLogEntry::getEventType)
        .containsExactly(
            "tab_created",
            "fetch_started",
            "fetch_success",
            "llm_enrich_started",
            "llm_enrich_success");
  }

  @Test
  void shouldInsertAgain_afterTabIsDeleted() {
    UUID userId = UUID.randomUUID();
    tabImportService.importBookmarks(export(), userId, null);
    tabService.listTabs(userId, null).forEach(t -> tabService.deleteTab(t.getId()));

    TabImportService.ImportOutcome again = tabImportService.importBookmarks(export(), userId, null);

    assertThat(again.ingest().inserted()).isEqualTo(2);
    assertThat(tabService.listTabs(userId, null)).hasSize(2);
  }

  private static MockMultipartFile export() {
    return new MockMultipartFile(
        "file", "bookmarks.html", "text/html", EXPORT.getBytes(StandardCharsets.UTF_8));
  }
}
