package com.flamingo.ai.tabbacklog.service.tab;

/**
 * Counts from a batch stage run.
 *
 * @param selected eligible tabs picked for the run
 * @param succeeded tabs that completed the stage
 * @param failed tabs moved to the stage's error state
 * @param skipped tabs left untouched (already running elsewhere, no free slot, or changed state)
 */
public record StageRunSummary(int selected, int succeeded, int failed, int skipped) {}
