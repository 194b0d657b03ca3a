package com.chatwarden.support;

/**
 * A backing store could not be reached or timed out. The operation may be retried
 * later; the moderation engine treats it as "allow".
 */
public class TransientStoreException extends RuntimeException {

    private final String store;

    public TransientStoreException(String store, Throwable cause) {
        super(store + " unavailable: " + (cause != null ? cause.getMessage() : "unknown cause"), cause);
        this.store = store;
    }

    public String getStore() { return store; }
}
