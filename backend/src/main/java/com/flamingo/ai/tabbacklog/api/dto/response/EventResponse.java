package com.flamingo.ai.tabbacklog.api.dto.response;

import com.flamingo.ai.tabbacklog.domain.entity.EventLogEntry;
import java.time.LocalDateTime;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an audit event. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventResponse {

  private Long id;
  private String eventType;
  private Map<String, Object> details;
  private LocalDateTime createdAt;

  public static EventResponse fromEntity(EventLogEntry entry) {
    return EventResponse.builder()
        .id(entry.getId())
        .eventType(entry.getEventType())
        .details(entry.getDetails())
        .createdAt(entry.getCreatedAt())
        .build();
  }
}
