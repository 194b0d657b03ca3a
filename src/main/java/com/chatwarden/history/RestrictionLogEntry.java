package com.chatwarden.history;

import com.chatwarden.policy.ContentCategory;
import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(name = "restriction_log")
public class RestrictionLogEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "identity_id", nullable = false)
    private long identityId;

    @Column(name = "chat_id", nullable = false)
    private long chatId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ContentCategory category;

    @Column(nullable = false)
    private int ordinal;

    @Column(name = "duration_minutes", nullable = false)
    private int durationMinutes;

    @Column(length = 256)
    private String reason;

    @Column(nullable = false)
    private boolean enforced = true;

    @Column(name = "enforcement_detail", length = 512)
    private String enforcementDetail;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    protected RestrictionLogEntry() {}

    public RestrictionLogEntry(long identityId, long chatId, ContentCategory category,
                               int ordinal, int durationMinutes, String reason, Instant createdAt) {
        this.identityId = identityId;
        this.chatId = chatId;
        this.category = category;
        this.ordinal = ordinal;
        this.durationMinutes = durationMinutes;
        this.reason = reason;
        this.createdAt = createdAt;
    }

    void markUnenforced(String detail) {
        this.enforced = false;
        this.enforcementDetail = detail;
    }

    public Long getId() { return id; }
    public long getIdentityId() { return identityId; }
    public long getChatId() { return chatId; }
    public ContentCategory getCategory() { return category; }
    public int getOrdinal() { return ordinal; }
    public int getDurationMinutes() { return durationMinutes; }
    public String getReason() { return reason; }
    public boolean isEnforced() { return enforced; }
    public String getEnforcementDetail() { return enforcementDetail; }
    public Instant getCreatedAt() { return createdAt; }
}
