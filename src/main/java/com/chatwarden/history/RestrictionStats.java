package com.chatwarden.history;

import java.util.List;
import java.util.Map;

/**
 * Restriction totals for one chat over the last {@code periodDays} days.
 * {@code byCategory} is ordered by count, highest first.
 */
public record RestrictionStats(
        long totalRestrictions,
        Map<String, Long> byCategory,
        List<RestrictedIdentity> topRestricted,
        long totalMinutes,
        int periodDays
) {

    public record RestrictedIdentity(long identityId, long restrictions) {}

    public boolean isEmpty() {
        return totalRestrictions == 0;
    }
}
