package com.chatwarden.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Service
public class AuditService {

    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    static final String SYSTEM_PRINCIPAL = "system";

    private final AuditRepository auditRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AuditService(AuditRepository auditRepository, ObjectMapper objectMapper, Clock clock) {
        this.auditRepository = auditRepository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Transactional
    public AuditEvent log(AuditEvent event) {
        AuditEvent saved = auditRepository.save(event);
        log.info("audit event={} action={} principal={} chat={} outcome={}",
                saved.getEventType(), saved.getAction(),
                saved.getPrincipal(), saved.getChatId(), saved.getOutcome());
        return saved;
    }

    /**
     * Records an action taken on one member of a chat, attributed to the current principal.
     */
    public AuditEvent logMemberAction(String eventType, String action, long chatId, long identityId,
                                      boolean changed, Map<String, ?> details) {
        return log(AuditEvent.of(eventType, action, clock.instant())
                .withPrincipal(currentPrincipal())
                .withChat(chatId)
                .withIdentity(identityId)
                .withDetails(serializeSafe(details))
                .withOutcome(changed ? AuditEvent.OUTCOME_SUCCESS : AuditEvent.OUTCOME_NOOP));
    }

    public AuditEvent logPolicyChange(long chatId, String action, Map<String, ?> details) {
        return log(AuditEvent.of(AuditEvent.TYPE_POLICY_CHANGE, action, clock.instant())
                .withPrincipal(currentPrincipal())
                .withChat(chatId)
                .withDetails(serializeSafe(details)));
    }

    /**
     * Outcome is always FAILURE; {@code logged} says whether a restriction log entry was found to flag.
     */
    public AuditEvent logEnforcementFailure(long chatId, long identityId, String detail, boolean logged) {
        Map<String, Object> details = new HashMap<>();
        details.put("logged", logged);
        if (detail != null) {
            details.put("detail", detail);
        }
        return log(AuditEvent.of(AuditEvent.TYPE_ENFORCEMENT_FAILURE, "restrict", clock.instant())
                .withPrincipal(currentPrincipal())
                .withChat(chatId)
                .withIdentity(identityId)
                .withDetails(serializeSafe(details))
                .withOutcome(AuditEvent.OUTCOME_FAILURE));
    }

    public Page<AuditEvent> findByChat(long chatId, Pageable pageable) {
        return auditRepository.findByChatIdOrderByOccurredAtDesc(chatId, pageable);
    }

    public Page<AuditEvent> findByChatAndType(long chatId, String eventType, Pageable pageable) {
        return auditRepository.findByChatIdAndEventTypeOrderByOccurredAtDesc(chatId, eventType, pageable);
    }

    @Transactional
    public int purgeOlderThan(Instant cutoff) {
        return auditRepository.deleteOlderThan(cutoff);
    }

    static String currentPrincipal() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth == null || auth.getName() == null) {
            return SYSTEM_PRINCIPAL;
        }
        return auth.getName();
    }

    private String serializeSafe(Map<String, ?> details) {
        if (details == null || details.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize audit details: {}", e.getMessage());
            return "{}";
        }
    }
}
