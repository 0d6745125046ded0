package com.flamingo.ai.tabbacklog.domain.repository;

import com.flamingo.ai.tabbacklog.domain.entity.EventLogEntry;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Read access to the audit trail. */
@Repository
public interface EventLogRepository extends JpaRepository<EventLogEntry, Long> {

  /** Events recorded for one entity, oldest first. */
  List<EventLogEntry> findByEntityTypeAndEntityIdOrderByIdAsc(String entityType, Long entityId);

  /** Events of one type for a user, oldest first. */
  List<EventLogEntry> findByUserIdAndEventTypeOrderByIdAsc(UUID userId, String eventType);
}
