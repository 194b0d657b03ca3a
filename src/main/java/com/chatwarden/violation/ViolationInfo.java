package com.chatwarden.violation;

import java.time.Instant;

public record ViolationInfo(int violationCount, Instant restrictedUntil) {

    public static ViolationInfo clean() {
        return new ViolationInfo(0, null);
    }
}
