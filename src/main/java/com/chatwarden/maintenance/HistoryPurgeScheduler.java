package com.chatwarden.maintenance;

import com.chatwarden.audit.AuditService;
import com.chatwarden.config.ChatwardenProperties;
import com.chatwarden.history.RestrictionHistory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

@Component
public class HistoryPurgeScheduler {

    private static final Logger log = LoggerFactory.getLogger(HistoryPurgeScheduler.class);

    private final AuditService auditService;
    private final RestrictionHistory restrictionHistory;
    private final ChatwardenProperties properties;
    private final Clock clock;

    public HistoryPurgeScheduler(AuditService auditService,
                                 RestrictionHistory restrictionHistory,
                                 ChatwardenProperties properties,
                                 Clock clock) {
        this.auditService = auditService;
        this.restrictionHistory = restrictionHistory;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(cron = "${chatwarden.audit.purge-cron:0 0 4 * * *}")
    public void purgeOldAuditEvents() {
        int retentionDays = properties.getRetention().getAuditLogDays();
        Instant cutoff = clock.instant().minus(retentionDays, ChronoUnit.DAYS);

        int deleted = auditService.purgeOlderThan(cutoff);
        if (deleted > 0) {
            log.info("Purged {} audit events older than {} days", deleted, retentionDays);
        }
    }

    @Scheduled(cron = "${chatwarden.restriction-log.purge-cron:0 30 4 * * *}")
    public void purgeOldRestrictions() {
        int retentionDays = properties.getRetention().getRestrictionLogDays();
        Instant cutoff = clock.instant().minus(retentionDays, ChronoUnit.DAYS);

        int deleted = restrictionHistory.purgeOlderThan(cutoff);
        if (deleted > 0) {
            log.info("Purged {} restriction log entries older than {} days", deleted, retentionDays);
        }
    }
}
