package com.chatwarden.maintenance;

import com.chatwarden.config.ChatwardenProperties;
import com.chatwarden.ledger.ActivityLedger;
import com.chatwarden.observability.ModerationMetrics;
import com.chatwarden.policy.ChatPolicyStore;
import com.chatwarden.support.TransientStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class LedgerPruneScheduler {

    private static final Logger log = LoggerFactory.getLogger(LedgerPruneScheduler.class);

    private final ActivityLedger ledger;
    private final ChatPolicyStore policies;
    private final ChatwardenProperties properties;
    private final ModerationMetrics metrics;

    public LedgerPruneScheduler(ActivityLedger ledger,
                                ChatPolicyStore policies,
                                ChatwardenProperties properties,
                                ModerationMetrics metrics) {
        this.ledger = ledger;
        this.policies = policies;
        this.properties = properties;
        this.metrics = metrics;
    }

    @Scheduled(fixedDelayString = "${chatwarden.retention.prune-interval:PT1H}",
            initialDelayString = "${chatwarden.retention.prune-initial-delay:PT5M}")
    public void pruneLedger() {
        try {
            long horizon = horizonSeconds();
            long deleted = ledger.prune(horizon);
            metrics.recordLedgerPruned(deleted);
            if (deleted > 0) {
                log.info("Pruned {} activity events older than {}s", deleted, horizon);
            }
        } catch (TransientStoreException | DataAccessException e) {
            // Next tick retries
            log.warn("Ledger prune failed: {}", e.getMessage());
        }
    }

    /**
     * Retention, widened to the longest configured window so no live count loses events.
     */
    long horizonSeconds() {
        long retention = Duration.ofHours(properties.getRetention().getLedgerRetentionHours()).toSeconds();
        return Math.max(retention, policies.maxConfiguredWindowSeconds());
    }
}
