package com.chatwarden.violation;

import java.time.Instant;

/**
 * Outcome of one escalation: the ordinal just assigned and the restriction it earned.
 */
public record Escalation(int ordinal, int durationMinutes, Instant restrictedUntil) {}
