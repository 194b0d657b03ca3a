package com.chatwarden.violation;

import java.util.List;

/**
 * Maps a violation ordinal to a restriction length. Ordinals 1..N use the explicit
 * table, every later ordinal the default. Ordinals below 1 are treated as 1.
 */
public final class EscalationPolicy {

    public static final List<Integer> STANDARD_DURATIONS = List.of(10, 60, 300, 1440);
    public static final int STANDARD_DEFAULT_MINUTES = 2880;

    private final int[] durations;
    private final int defaultMinutes;

    public EscalationPolicy(List<Integer> durationsMinutes, int defaultMinutes) {
        if (defaultMinutes <= 0) {
            throw new IllegalArgumentException("default escalation duration must be positive");
        }
        this.durations = durationsMinutes.stream().mapToInt(Integer::intValue).toArray();
        for (int minutes : durations) {
            if (minutes <= 0) {
                throw new IllegalArgumentException("escalation durations must be positive: " + durationsMinutes);
            }
        }
        this.defaultMinutes = defaultMinutes;
    }

    public static EscalationPolicy standard() {
        return new EscalationPolicy(STANDARD_DURATIONS, STANDARD_DEFAULT_MINUTES);
    }

    public int durationFor(int ordinal) {
        int effective = Math.max(ordinal, 1);
        return effective <= durations.length ? durations[effective - 1] : defaultMinutes;
    }
}
