package com.flamingo.ai.tabbacklog.domain.entity;

import com.flamingo.ai.tabbacklog.domain.converter.JsonMapConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Audit trail row. Written only by {@link com.flamingo.ai.tabbacklog.service.tab.EventLogService},
 * inside the transaction of the mutation it records; read-only through JPA.
 */
@Entity
@Immutable
@Table(name = "event_log")
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EventLogEntry {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @JdbcTypeCode(SqlTypes.VARCHAR)
  @Column(name = "user_id", length = 36)
  private UUID userId;

  @Column(name = "event_type", nullable = false)
  private String eventType;

  @Column(name = "entity_type")
  private String entityType;

  @Column(name = "entity_id")
  private Long entityId;

  @Convert(converter = JsonMapConverter.class)
  @Column(columnDefinition = "TEXT", nullable = false)
  private Map<String, Object> details;

  @Column(name = "created_at", nullable = false)
  private LocalDateTime createdAt;
}
