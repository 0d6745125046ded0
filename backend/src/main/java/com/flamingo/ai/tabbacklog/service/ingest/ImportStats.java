package com.flamingo.ai.tabbacklog.service.ingest;

import java.util.List;

/**
 * Summary of the tab collections in a bookmark export.
 *
 * @param collectionCount number of collection folders
 * @param itemCount http(s) links across all collections
 * @param collections per-collection link counts, in document order
 */
public record ImportStats(int collectionCount, int itemCount, List<CollectionCount> collections) {

  /** Link count of one collection. */
  public record CollectionCount(String label, int count) {}
}
