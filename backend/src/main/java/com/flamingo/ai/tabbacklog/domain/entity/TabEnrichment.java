package com.flamingo.ai.tabbacklog.domain.entity;

import com.flamingo.ai.tabbacklog.domain.converter.StringListConverter;
import com.flamingo.ai.tabbacklog.domain.enums.ContentType;
import com.flamingo.ai.tabbacklog.domain.enums.Priority;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Current LLM enrichment of a tab. */
@Entity
@Table(name = "tab_enrichment")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TabEnrichment {

  @Id
  @Column(name = "tab_id")
  private Long tabId;

  @Column(columnDefinition = "TEXT", nullable = false)
  private String summary;

  @Enumerated(EnumType.STRING)
  @Column(name = "content_type", nullable = false)
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

  @Column(name = "video_seconds")
  private Integer videoSeconds;

  @Column(name = "model_name")
  private String modelName;

  @Column(name = "created_at", nullable = false)
  private LocalDateTime createdAt;

  @Column(name = "updated_at", nullable = false)
  private LocalDateTime updatedAt;

  @PrePersist
  protected void onCreate() {
    LocalDateTime now = LocalDateTime.now();
    if (createdAt == null) {
      createdAt = now;
    }
    updatedAt = now;
  }

  @PreUpdate
  protected void onUpdate() {
    updatedAt = LocalDateTime.now();
  }
}
