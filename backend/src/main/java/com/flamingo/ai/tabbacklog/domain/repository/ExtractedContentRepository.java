package com.flamingo.ai.tabbacklog.domain.repository;

import com.flamingo.ai.tabbacklog.domain.entity.ExtractedContent;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for extracted page content, keyed by tab id. */
@Repository
public interface ExtractedContentRepository extends JpaRepository<ExtractedContent, Long> {

  /** Finds content produced by one extractor kind. */
  List<ExtractedContent> findBySiteKind(String siteKind);
}
