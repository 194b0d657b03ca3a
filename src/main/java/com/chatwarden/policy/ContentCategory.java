package com.chatwarden.policy;

import java.util.Locale;

/**
 * Content classes the engine rate-limits. Stickers and animations count any item
 * of the class; text, photos and videos count only identical content.
 */
public enum ContentCategory {

    STICKER("sticker", PolicySlot.STICKER, false),
    ANIMATION("animation", PolicySlot.STICKER, false),
    TEXT("text", PolicySlot.TEXT, true),
    PHOTO("photo", PolicySlot.IMAGE, true),
    VIDEO("video", PolicySlot.VIDEO, true);

    private final String value;
    private final PolicySlot policySlot;
    private final boolean fingerprinted;

    ContentCategory(String value, PolicySlot policySlot, boolean fingerprinted) {
        this.value = value;
        this.policySlot = policySlot;
        this.fingerprinted = fingerprinted;
    }

    public String value() { return value; }

    /** Policy slot holding this category's threshold and window. */
    public PolicySlot policySlot() { return policySlot; }

    /** Whether repetition is matched on the content fingerprint. */
    public boolean fingerprinted() { return fingerprinted; }

    public static ContentCategory fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (ContentCategory category : values()) {
                if (category.value.equals(normalized)) return category;
            }
        }
        throw new PolicyValidationException("Unknown content category: " + value);
    }
}
