package com.flamingo.ai.tabbacklog.domain.enums;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.tabbacklog.domain.entity.TabItem;
import com.flamingo.ai.tabbacklog.exception.InvalidStatusTransitionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("TabStatus lifecycle")
class TabStatusTest {

  @ParameterizedTest(name = "{0} -> {1}")
  @CsvSource({
    "NEW, FETCH_PENDING",
    "FETCH_PENDING, PARSED",
    "FETCH_PENDING, FETCH_ERROR",
    "FETCH_ERROR, FETCH_PENDING",
    "PARSED, LLM_PENDING",
    "LLM_PENDING, ENRICHED",
    "LLM_PENDING, LLM_ERROR",
    "LLM_ERROR, LLM_PENDING"
  })
  void shouldAllowTransition_whenEdgeExists(TabStatus from, TabStatus to) {
    assertThat(from.canTransitionTo(to)).isTrue();
  }

  @ParameterizedTest(name = "{0} -/-> {1}")
  @CsvSource({
    "NEW, PARSED",
    "NEW, LLM_PENDING",
    "PARSED, ENRICHED",
    "FETCH_ERROR, LLM_PENDING",
    "ENRICHED, LLM_PENDING",
    "ENRICHED, FETCH_PENDING",
    "PARSED, FETCH_PENDING",
    "LLM_ERROR, FETCH_PENDING"
  })
  void shouldRejectTransition_whenStageWouldBeSkippedOrReversed(TabStatus from, TabStatus to) {
    assertThat(from.canTransitionTo(to)).isFalse();
  }

  @Test
  void shouldTreatEnrichedAsTerminal() {
    for (TabStatus next : TabStatus.values()) {
      assertThat(TabStatus.ENRICHED.canTransitionTo(next)).isFalse();
    }
  }

  @Test
  void shouldParseWireValues() {
    assertThat(TabStatus.fromValue("fetch_error")).isEqualTo(TabStatus.FETCH_ERROR);
    assertThat(TabStatus.fromValue("LLM_PENDING")).isEqualTo(TabStatus.LLM_PENDING);
    assertThatThrownBy(() -> TabStatus.fromValue("archived"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void shouldRecordAndClearError_onTabItem() {
    TabItem tab = TabItem.builder().id(7L).url("https://example.com").build();

    tab.transitionTo(TabStatus.FETCH_PENDING);
    tab.fail(TabStatus.FETCH_ERROR, "Received status 503");
    assertThat(tab.getStatus()).isEqualTo(TabStatus.FETCH_ERROR);
    assertThat(tab.getLastError()).isEqualTo("Received status 503");
    assertThat(tab.getErrorAt()).isNotNull();

    tab.transitionTo(TabStatus.FETCH_PENDING);
    tab.succeed(TabStatus.PARSED);
    assertThat(tab.getStatus()).isEqualTo(TabStatus.PARSED);
    assertThat(tab.getLastError()).isNull();
    assertThat(tab.getErrorAt()).isNull();
  }

  @Test
  void shouldThrow_whenTabSkipsStage() {
    TabItem tab = TabItem.builder().id(7L).url("https://example.com").build();

    assertThatThrownBy(() -> tab.transitionTo(TabStatus.LLM_PENDING))
        .isInstanceOf(InvalidStatusTransitionException.class)
        .hasMessageContaining("new")
        .hasMessageContaining("llm_pending");
    assertThat(tab.getStatus()).isEqualTo(TabStatus.NEW);
  }
}
