package com.chatwarden.ledger;

import com.chatwarden.policy.ContentCategory;
import com.chatwarden.support.KeyedLocks;
import com.chatwarden.support.TransientStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;

/**
 * Relational ledger. The insert and the count of one key run in a single
 * transaction under a per-key lock, so concurrent events for the same key
 * always observe strictly increasing counts.
 */
@Component
@ConditionalOnProperty(name = "chatwarden.ledger.backend", havingValue = "jpa", matchIfMissing = true)
public class JpaActivityLedger implements ActivityLedger {

    private static final Logger log = LoggerFactory.getLogger(JpaActivityLedger.class);
    private static final String STORE = "activity ledger";

    private final ActivityEventRepository repository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final KeyedLocks locks = new KeyedLocks();

    public JpaActivityLedger(ActivityEventRepository repository,
                             PlatformTransactionManager transactionManager,
                             Clock clock) {
        this.repository = repository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    @Override
    public long recordAndCount(long identityId, long chatId, ContentCategory category,
                               int windowSeconds, String fingerprint) {
        String digest = Fingerprints.digest(fingerprint);
        String key = chatId + ":" + identityId + ":" + category.value() + ":" + (digest != null ? digest : "*");
        try {
            Long count = locks.withLock(key, () -> transactionTemplate.execute(status -> {
                Instant now = clock.instant();
                repository.save(new ActivityEvent(identityId, chatId, category, digest, now));
                Instant windowStart = now.minusSeconds(windowSeconds);
                if (digest == null) {
                    return repository.countByIdentityIdAndChatIdAndCategoryAndOccurredAtGreaterThanEqual(
                            identityId, chatId, category, windowStart);
                }
                return repository.countByIdentityIdAndChatIdAndCategoryAndFingerprintAndOccurredAtGreaterThanEqual(
                        identityId, chatId, category, digest, windowStart);
            }));
            return count != null ? count : 0L;
        } catch (DataAccessException | TransactionException e) {
            throw new TransientStoreException(STORE, e);
        }
    }

    @Override
    public long prune(long retentionSeconds) {
        Instant cutoff = clock.instant().minusSeconds(retentionSeconds);
        try {
            Integer deleted = transactionTemplate.execute(status -> repository.deleteOlderThan(cutoff));
            long removed = deleted != null ? deleted : 0L;
            log.debug("Pruned {} activity events older than {}", removed, cutoff);
            return removed;
        } catch (DataAccessException | TransactionException e) {
            throw new TransientStoreException(STORE, e);
        }
    }

    @Override
    public void clear(long identityId, long chatId) {
        try {
            Integer deleted = transactionTemplate.execute(status ->
                    repository.deleteByIdentityAndChat(identityId, chatId));
            log.debug("Cleared {} activity events identity={} chat={}", deleted, identityId, chatId);
        } catch (DataAccessException | TransactionException e) {
            throw new TransientStoreException(STORE, e);
        }
    }
}
