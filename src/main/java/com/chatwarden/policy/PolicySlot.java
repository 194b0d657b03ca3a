package com.chatwarden.policy;

public enum PolicySlot {
    STICKER,
    TEXT,
    IMAGE,
    VIDEO
}
