package com.flamingo.ai.tabbacklog.domain.repository;

import com.flamingo.ai.tabbacklog.domain.entity.TabEnrichment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for the current enrichment of each tab. */
@Repository
public interface TabEnrichmentRepository extends JpaRepository<TabEnrichment, Long> {}
