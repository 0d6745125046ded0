package com.flamingo.ai.tabbacklog.domain.entity;

import com.flamingo.ai.tabbacklog.domain.converter.JsonMapConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Normalized page content for a tab. One row per tab, overwritten on re-extraction. */
@Entity
@Table(name = "tab_parsed")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExtractedContent {

  @Id
  @Column(name = "tab_id")
  private Long tabId;

  /** Which extractor produced the content (youtube, twitter, generic_html). */
  @Column(name = "site_kind", nullable = false)
  private String siteKind;

  @Column(name = "title_extracted", columnDefinition = "TEXT")
  private String title;

  @Column(name = "text_full", columnDefinition = "TEXT")
  private String textFull;

  @Column(name = "word_count", nullable = false)
  private int wordCount;

  @Column(name = "video_seconds")
  private Integer videoSeconds;

  @Convert(converter = JsonMapConverter.class)
  @Column(columnDefinition = "TEXT", nullable = false)
  @Builder.Default
  private Map<String, Object> metadata = new LinkedHashMap<>();

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
