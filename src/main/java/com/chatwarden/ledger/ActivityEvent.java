package com.chatwarden.ledger;

import com.chatwarden.policy.ContentCategory;
import jakarta.persistence.*;
import java.time.Instant;

/**
 * One inbound content event. Rows are never updated, only pruned.
 */
@Entity
@Table(name = "activity_events")
public class ActivityEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "identity_id", nullable = false, updatable = false)
    private Long identityId;

    @Column(name = "chat_id", nullable = false, updatable = false)
    private Long chatId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16, updatable = false)
    private ContentCategory category;

    @Column(length = 64, updatable = false)
    private String fingerprint;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;

    protected ActivityEvent() {}

    public ActivityEvent(long identityId, long chatId, ContentCategory category,
                         String fingerprint, Instant occurredAt) {
        this.identityId = identityId;
        this.chatId = chatId;
        this.category = category;
        this.fingerprint = fingerprint;
        this.occurredAt = occurredAt;
    }

    public Long getId() { return id; }
    public Long getIdentityId() { return identityId; }
    public Long getChatId() { return chatId; }
    public ContentCategory getCategory() { return category; }
    public String getFingerprint() { return fingerprint; }
    public Instant getOccurredAt() { return occurredAt; }
}
