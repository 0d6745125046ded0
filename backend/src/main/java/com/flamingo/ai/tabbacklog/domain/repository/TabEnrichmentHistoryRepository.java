package com.flamingo.ai.tabbacklog.domain.repository;

import com.flamingo.ai.tabbacklog.domain.entity.TabEnrichmentHistory;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for past enrichment runs. */
@Repository
public interface TabEnrichmentHistoryRepository
    extends JpaRepository<TabEnrichmentHistory, Long> {

  /** Lists runs for a tab, most recent first. */
  List<TabEnrichmentHistory> findByTabIdOrderByRunStartedAtDesc(Long tabId);
}
