package com.chatwarden.moderation;

/**
 * Decision for one evaluated content event.
 *
 * <p>{@code ordinal} and {@code durationMinutes} are only meaningful for {@link Outcome#RESTRICT}.
 * {@link Outcome#ALREADY_RESTRICTED} tells the caller to delete the content without
 * restricting again.
 */
public record Verdict(Outcome outcome, long count, int threshold, int ordinal, int durationMinutes) {

    public enum Outcome {
        ALLOW,
        WARN,
        RESTRICT,
        ALREADY_RESTRICTED
    }

    public static Verdict allow() {
        return new Verdict(Outcome.ALLOW, 0, 0, 0, 0);
    }

    public static Verdict allow(long count, int threshold) {
        return new Verdict(Outcome.ALLOW, count, threshold, 0, 0);
    }

    public static Verdict warn(long count, int threshold) {
        return new Verdict(Outcome.WARN, count, threshold, 0, 0);
    }

    public static Verdict restrict(int ordinal, int durationMinutes, long count, int threshold) {
        return new Verdict(Outcome.RESTRICT, count, threshold, ordinal, durationMinutes);
    }

    public static Verdict alreadyRestricted(long count, int threshold) {
        return new Verdict(Outcome.ALREADY_RESTRICTED, count, threshold, 0, 0);
    }

    public boolean deleteContent() {
        return outcome == Outcome.RESTRICT || outcome == Outcome.ALREADY_RESTRICTED;
    }
}
