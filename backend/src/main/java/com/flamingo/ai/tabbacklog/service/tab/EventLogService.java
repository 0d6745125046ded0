package com.flamingo.ai.tabbacklog.service.tab;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.tabbacklog.domain.enums.EventType;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

/**
 * Appends audit events. Writes go through the connection of the caller's transaction, so an event
 * commits or rolls back together with the mutation it records.
 */
@Service
@RequiredArgsConstructor
public class EventLogService {

  private static final String INSERT_SQL =
      "INSERT INTO event_log (user_id, event_type, entity_type, entity_id, details, created_at) "
          + "VALUES (?, ?, ?, ?, ?, ?)";

  private final JdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  /** Records an event about a tab. */
  public void recordTabEvent(UUID userId, EventType type, Long tabId, Map<String, Object> details) {
    jdbcTemplate.update(
        INSERT_SQL,
        userId == null ? null : userId.toString(),
        type.getValue(),
        EventType.ENTITY_TAB_ITEM,
        tabId,
        toJson(details),
        Timestamp.valueOf(LocalDateTime.now()));
  }

  private String toJson(Map<String, Object> details) {
    if (details == null || details.isEmpty()) {
      return "{}";
    }
    try {
      return objectMapper.writeValueAsString(details);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Event details are not serializable", e);
    }
  }
}
