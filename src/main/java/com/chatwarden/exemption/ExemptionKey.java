package com.chatwarden.exemption;

import java.io.Serializable;
import java.util.Objects;

public class ExemptionKey implements Serializable {

    private Long identityId;
    private Long chatId;

    public ExemptionKey() {}

    public ExemptionKey(Long identityId, Long chatId) {
        this.identityId = identityId;
        this.chatId = chatId;
    }

    public Long getIdentityId() { return identityId; }
    public Long getChatId() { return chatId; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExemptionKey other)) return false;
        return Objects.equals(identityId, other.identityId) && Objects.equals(chatId, other.chatId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identityId, chatId);
    }
}
