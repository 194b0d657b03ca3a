package com.chatwarden.history;

import com.chatwarden.policy.ContentCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only log of applied restrictions, kept for chat statistics.
 * The violation record stays authoritative for restriction state.
 */
@Service
public class RestrictionHistory {

    private static final Logger log = LoggerFactory.getLogger(RestrictionHistory.class);

    static final int TOP_RESTRICTED_LIMIT = 5;

    private final RestrictionLogRepository repository;
    private final Clock clock;

    public RestrictionHistory(RestrictionLogRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Transactional
    public RestrictionLogEntry record(long identityId, long chatId, ContentCategory category,
                                      int ordinal, int durationMinutes, String reason) {
        return repository.save(new RestrictionLogEntry(
                identityId, chatId, category, ordinal, durationMinutes, reason, clock.instant()));
    }

    /**
     * Flags the latest restriction of the pair as not applied on the platform.
     * False when the pair has no logged restriction.
     */
    @Transactional
    public boolean markUnenforced(long identityId, long chatId, String detail) {
        return repository.findFirstByIdentityIdAndChatIdOrderByCreatedAtDescIdDesc(identityId, chatId)
                .map(entry -> {
                    entry.markUnenforced(detail);
                    repository.save(entry);
                    log.warn("Restriction not enforced identity={} chat={} ordinal={}: {}",
                            identityId, chatId, entry.getOrdinal(), detail);
                    return true;
                })
                .orElse(false);
    }

    @Transactional(readOnly = true)
    public RestrictionStats stats(long chatId, int days) {
        if (days < 1) {
            throw new IllegalArgumentException("days must be at least 1, got " + days);
        }
        Instant since = clock.instant().minus(days, ChronoUnit.DAYS);

        long total = repository.countByChatIdAndCreatedAtAfter(chatId, since);
        if (total == 0) {
            return new RestrictionStats(0, Map.of(), List.of(), 0, days);
        }

        Map<String, Long> byCategory = new LinkedHashMap<>();
        for (RestrictionLogRepository.CategoryTotal row : repository.countByCategory(chatId, since)) {
            byCategory.put(row.getCategory().value(), row.getTotal());
        }
        List<RestrictionStats.RestrictedIdentity> top = repository
                .topIdentities(chatId, since, PageRequest.of(0, TOP_RESTRICTED_LIMIT))
                .stream()
                .map(row -> new RestrictionStats.RestrictedIdentity(row.getIdentityId(), row.getTotal()))
                .toList();

        Long minutes = repository.sumMinutes(chatId, since);
        return new RestrictionStats(total, byCategory, top, minutes == null ? 0 : minutes, days);
    }

    @Transactional
    public int purgeOlderThan(Instant cutoff) {
        return repository.deleteOlderThan(cutoff);
    }
}
