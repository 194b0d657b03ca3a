package com.chatwarden.policy;

import java.util.Locale;

public enum PolicyField {

    THRESHOLD("threshold"),
    WINDOW_SECONDS("windowSeconds"),
    WARN_ENABLED("warnEnabled");

    public static final int MIN_THRESHOLD = 1;
    public static final int MAX_THRESHOLD = 20;

    private final String key;

    PolicyField(String key) {
        this.key = key;
    }

    public String key() { return key; }

    public static PolicyField fromKey(String key) {
        if (key != null) {
            String normalized = key.trim().replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
            for (PolicyField field : values()) {
                if (field.key.toLowerCase(Locale.ROOT).equals(normalized)) return field;
            }
        }
        throw new PolicyValidationException("Unknown policy field: " + key);
    }

    /**
     * Rejects out-of-range values before anything is written.
     */
    public void validate(int value) {
        switch (this) {
            case THRESHOLD -> {
                if (value < MIN_THRESHOLD || value > MAX_THRESHOLD) {
                    throw new PolicyValidationException("threshold must be between "
                            + MIN_THRESHOLD + " and " + MAX_THRESHOLD + ", got " + value);
                }
            }
            case WINDOW_SECONDS -> {
                if (value <= 0) {
                    throw new PolicyValidationException("windowSeconds must be positive, got " + value);
                }
            }
            case WARN_ENABLED -> {
                if (value != 0 && value != 1) {
                    throw new PolicyValidationException("warnEnabled must be 0 or 1, got " + value);
                }
            }
        }
    }
}
