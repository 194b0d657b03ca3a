package com.chatwarden.violation;

import java.io.Serializable;
import java.util.Objects;

public class ViolationKey implements Serializable {

    private Long identityId;
    private Long chatId;

    public ViolationKey() {}

    public ViolationKey(Long identityId, Long chatId) {
        this.identityId = identityId;
        this.chatId = chatId;
    }

    public Long getIdentityId() { return identityId; }
    public Long getChatId() { return chatId; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ViolationKey other)) return false;
        return Objects.equals(identityId, other.identityId) && Objects.equals(chatId, other.chatId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identityId, chatId);
    }
}
