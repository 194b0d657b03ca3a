package com.chatwarden.exemption;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "exemptions")
@IdClass(ExemptionKey.class)
public class Exemption {

    @Id
    @Column(name = "identity_id")
    private Long identityId;

    @Id
    @Column(name = "chat_id")
    private Long chatId;

    @Column(name = "granted_by")
    private Long grantedBy;

    @Column(name = "granted_at", nullable = false)
    private Instant grantedAt;

    public Exemption() {}

    public Exemption(long identityId, long chatId, Long grantedBy, Instant grantedAt) {
        this.identityId = identityId;
        this.chatId = chatId;
        this.grantedBy = grantedBy;
        this.grantedAt = grantedAt;
    }

    public Long getIdentityId() { return identityId; }
    public Long getChatId() { return chatId; }
    public Long getGrantedBy() { return grantedBy; }
    public Instant getGrantedAt() { return grantedAt; }
}
