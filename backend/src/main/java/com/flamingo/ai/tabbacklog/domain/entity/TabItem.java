package com.flamingo.ai.tabbacklog.domain.entity;

import com.flamingo.ai.tabbacklog.domain.enums.TabStatus;
import com.flamingo.ai.tabbacklog.exception.InvalidStatusTransitionException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * A saved browser tab tracked through the pipeline. At most one live (non-deleted) row exists per
 * {@code (userId, url)}; rows are soft-deleted only.
 */
@Entity
@Table(name = "tab_item")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TabItem {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @JdbcTypeCode(SqlTypes.VARCHAR)
  @Column(name = "user_id", nullable = false, length = 36)
  private UUID userId;

  @Column(nullable = false, columnDefinition = "TEXT")
  private String url;

  @Column(name = "page_title", columnDefinition = "TEXT")
  private String title;

  /** Name of the bookmark collection (browser window) the tab was saved from. */
  @Column(name = "window_label")
  private String collectionLabel;

  @Column(name = "collected_at", nullable = false)
  private LocalDateTime collectedAt;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private TabStatus status = TabStatus.NEW;

  /** Most recent stage failure, cleared on the next stage success. */
  @Column(name = "last_error", columnDefinition = "TEXT")
  private String lastError;

  @Column(name = "error_at")
  private LocalDateTime errorAt;

  @Column(name = "is_processed", nullable = false)
  @Builder.Default
  private boolean processed = false;

  @Column(name = "processed_at")
  private LocalDateTime processedAt;

  /** How many times the same live tab has been seen by ingestion. */
  @Column(name = "import_count", nullable = false)
  @Builder.Default
  private int importCount = 1;

  @Column(name = "created_at", nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @Column(name = "updated_at", nullable = false)
  private LocalDateTime updatedAt;

  @Column(name = "deleted_at")
  private LocalDateTime deletedAt;

  @PrePersist
  protected void onCreate() {
    LocalDateTime now = LocalDateTime.now();
    if (createdAt == null) {
      createdAt = now;
    }
    if (collectedAt == null) {
      collectedAt = now;
    }
    updatedAt = now;
  }

  @PreUpdate
  protected void onUpdate() {
    updatedAt = LocalDateTime.now();
  }

  public boolean isDeleted() {
    return deletedAt != null;
  }

  /**
   * Moves the tab to {@code next}.
   *
   * @throws InvalidStatusTransitionException if the lifecycle does not allow the move
   */
  public void transitionTo(TabStatus next) {
    if (!status.canTransitionTo(next)) {
      throw new InvalidStatusTransitionException(id, status, next);
    }
    this.status = next;
  }

  /** Records a stage failure and moves to the given error status. */
  public void fail(TabStatus errorStatus, String error) {
    transitionTo(errorStatus);
    this.lastError = error;
    this.errorAt = LocalDateTime.now();
  }

  /** Records a stage success and clears any previous failure. */
  public void succeed(TabStatus doneStatus) {
    transitionTo(doneStatus);
    this.lastError = null;
    this.errorAt = null;
  }

  public void markProcessed() {
    this.processed = true;
    this.processedAt = LocalDateTime.now();
  }

  public void softDelete() {
    this.deletedAt = LocalDateTime.now();
  }
}
