package com.chatwarden.audit;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "audit_log")
public class AuditEvent {

    public static final String TYPE_PARDON = "PARDON";
    public static final String TYPE_LIFT_RESTRICTION = "LIFT_RESTRICTION";
    public static final String TYPE_EXEMPTION_GRANT = "EXEMPTION_GRANT";
    public static final String TYPE_EXEMPTION_REVOKE = "EXEMPTION_REVOKE";
    public static final String TYPE_POLICY_CHANGE = "POLICY_CHANGE";
    public static final String TYPE_ENFORCEMENT_FAILURE = "ENFORCEMENT_FAILURE";

    public static final String OUTCOME_SUCCESS = "SUCCESS";
    public static final String OUTCOME_NOOP = "NOOP";
    public static final String OUTCOME_FAILURE = "FAILURE";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "occurred_at", nullable = false)
    private Instant occurredAt;

    @Column(name = "event_type", nullable = false, length = 64)
    private String eventType;

    @Column(length = 256)
    private String principal;

    @Column(name = "chat_id")
    private Long chatId;

    @Column(name = "identity_id")
    private Long identityId;

    @Column(nullable = false, length = 256)
    private String action;

    @Column(length = 4000)
    private String details = "{}";

    @Column(nullable = false, length = 16)
    private String outcome = OUTCOME_SUCCESS;

    public AuditEvent() {}

    public static AuditEvent of(String eventType, String action, Instant occurredAt) {
        AuditEvent event = new AuditEvent();
        event.occurredAt = occurredAt;
        event.eventType = eventType;
        event.action = action;
        return event;
    }

    public AuditEvent withPrincipal(String principal) { this.principal = principal; return this; }
    public AuditEvent withChat(long chatId) { this.chatId = chatId; return this; }
    public AuditEvent withIdentity(long identityId) { this.identityId = identityId; return this; }
    public AuditEvent withDetails(String details) { this.details = details; return this; }
    public AuditEvent withOutcome(String outcome) { this.outcome = outcome; return this; }

    public UUID getId() { return id; }
    public Instant getOccurredAt() { return occurredAt; }
    public String getEventType() { return eventType; }
    public String getPrincipal() { return principal; }
    public Long getChatId() { return chatId; }
    public Long getIdentityId() { return identityId; }
    public String getAction() { return action; }
    public String getDetails() { return details; }
    public String getOutcome() { return outcome; }
}
