package com.chatwarden.audit;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.UUID;

@Repository
public interface AuditRepository extends JpaRepository<AuditEvent, UUID> {

    Page<AuditEvent> findByChatIdOrderByOccurredAtDesc(Long chatId, Pageable pageable);

    Page<AuditEvent> findByChatIdAndEventTypeOrderByOccurredAtDesc(Long chatId, String eventType, Pageable pageable);

    @Modifying
    @Query("delete from AuditEvent a where a.occurredAt < :cutoff")
    int deleteOlderThan(@Param("cutoff") Instant cutoff);
}
