package com.flamingo.ai.tabbacklog.domain.entity;

import com.flamingo.ai.tabbacklog.domain.converter.StringListConverter;
import com.flamingo.ai.tabbacklog.domain.enums.ContentType;
import com.flamingo.ai.tabbacklog.domain.enums.Priority;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Append-only record of every successful enrichment run. */
@Entity
@Table(name = "tab_enrichment_history")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TabEnrichmentHistory {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "tab_id", nullable = false)
  private Long tabId;

  @Column(columnDefinition = "TEXT")
  private String summary;

  @Enumerated(EnumType.STRING)
  @Column(name = "content_type")
  private ContentType contentType;

  @Convert(converter = StringListConverter.class)
  @Column(columnDefinition = "TEXT", nullable = false)
  @Builder.Default
  private List<String> tags = new ArrayList<>();

  @Convert(converter = StringListConverter.class)
  @Column(columnDefinition = "TEXT", nullable = false)
  @Builder.Default
  private List<String> projects = new ArrayList<>();

  @Column(name = "est_read_min")
  private Integer estReadMinutes;

  @Enumerated(EnumType.STRING)
  private Priority priority;

  @Column(name = "model_name")
  private String modelName;

  /** Number of predictor calls the run needed. */
  private Integer attempts;

  @Column(name = "run_started_at", nullable = false)
  private LocalDateTime runStartedAt;

  @Column(name = "run_finished_at")
  private LocalDateTime runFinishedAt;

  @Column(name = "created_at", nullable = false)
  private LocalDateTime createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
  }
}
