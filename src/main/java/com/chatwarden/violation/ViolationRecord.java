package com.chatwarden.violation;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Escalation state of one identity in one chat. "Restricted" is not stored as a
 * status: it is derived by comparing restrictedUntil with the current time.
 */
@Entity
@Table(name = "violations")
@IdClass(ViolationKey.class)
public class ViolationRecord {

    @Id
    @Column(name = "identity_id")
    private Long identityId;

    @Id
    @Column(name = "chat_id")
    private Long chatId;

    @Column(name = "violation_count", nullable = false)
    private int violationCount = 0;

    @Column(name = "last_violation_at")
    private Instant lastViolationAt;

    @Column(name = "restricted_until")
    private Instant restrictedUntil;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected ViolationRecord() {}

    public ViolationRecord(long identityId, long chatId, Instant createdAt) {
        this.identityId = identityId;
        this.chatId = chatId;
        this.createdAt = createdAt;
    }

    void recordViolation(int ordinal, Instant at, Instant until) {
        if (ordinal <= violationCount) {
            throw new IllegalStateException("violation ordinal must grow: " + violationCount + " -> " + ordinal);
        }
        if (until.isBefore(at)) {
            throw new IllegalArgumentException("restriction cannot end before it starts");
        }
        this.violationCount = ordinal;
        this.lastViolationAt = at;
        this.restrictedUntil = until;
    }

    void liftRestriction() {
        this.restrictedUntil = null;
    }

    public boolean isRestrictedAt(Instant now) {
        return restrictedUntil != null && restrictedUntil.isAfter(now);
    }

    public Long getIdentityId() { return identityId; }
    public Long getChatId() { return chatId; }
    public int getViolationCount() { return violationCount; }
    public Instant getLastViolationAt() { return lastViolationAt; }
    public Instant getRestrictedUntil() { return restrictedUntil; }
    public Instant getCreatedAt() { return createdAt; }
}
