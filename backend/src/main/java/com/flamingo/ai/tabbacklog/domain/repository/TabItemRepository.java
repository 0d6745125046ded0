package com.flamingo.ai.tabbacklog.domain.repository;

import com.flamingo.ai.tabbacklog.domain.entity.TabItem;
import com.flamingo.ai.tabbacklog.domain.enums.TabStatus;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for tab items. Every finder here ignores soft-deleted rows. */
@Repository
public interface TabItemRepository extends JpaRepository<TabItem, Long> {

  /** Finds a live tab by id. */
  Optional<TabItem> findByIdAndDeletedAtIsNull(Long id);

  /** Lists a user's live tabs, newest first. */
  List<TabItem> findByUserIdAndDeletedAtIsNullOrderByCreatedAtDesc(UUID userId);

  /** Lists a user's live tabs in one status, newest first. */
  List<TabItem> findByUserIdAndStatusAndDeletedAtIsNullOrderByCreatedAtDesc(
      UUID userId, TabStatus status);

  /** Oldest live tabs of a user in the given status, for batch stage runs. */
  @Query(
      "SELECT t FROM TabItem t WHERE t.userId = :userId AND t.status = :status "
          + "AND t.deletedAt IS NULL ORDER BY t.collectedAt ASC, t.id ASC")
  List<TabItem> findStageCandidates(
      @Param("userId") UUID userId, @Param("status") TabStatus status, Pageable pageable);

  /** Live tab counts grouped by status; each row is {@code [TabStatus, Long]}. */
  @Query(
      "SELECT t.status, COUNT(t) FROM TabItem t WHERE t.userId = :userId "
          + "AND t.deletedAt IS NULL GROUP BY t.status")
  List<Object[]> countByStatus(@Param("userId") UUID userId);
}
