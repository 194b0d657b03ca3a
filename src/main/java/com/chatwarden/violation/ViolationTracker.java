package com.chatwarden.violation;

import com.chatwarden.support.KeyedLocks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * Violation counts and restriction expiry per (identity, chat).
 *
 * <p>State per pair: Clean (no record) -&gt; escalate -&gt; Restricted; time passing
 * makes it Expired-but-recorded without any write. {@link #liftRestriction} clears
 * only the expiry, {@link #pardon} returns the pair to Clean. Counts never decay on
 * their own.
 *
 * <p>Mutations run under a per-pair in-process lock and a row lock inside one
 * transaction, so two concurrent escalations always get consecutive ordinals.
 */
@Service
public class ViolationTracker {

    private static final Logger log = LoggerFactory.getLogger(ViolationTracker.class);

    private final ViolationRepository repository;
    private final EscalationPolicy escalationPolicy;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final KeyedLocks locks = new KeyedLocks();

    public ViolationTracker(ViolationRepository repository,
                            EscalationPolicy escalationPolicy,
                            PlatformTransactionManager transactionManager,
                            Clock clock) {
        this.repository = repository;
        this.escalationPolicy = escalationPolicy;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    public ViolationInfo info(long identityId, long chatId) {
        return repository.findByIdentityIdAndChatId(identityId, chatId)
                .map(r -> new ViolationInfo(r.getViolationCount(), r.getRestrictedUntil()))
                .orElse(ViolationInfo.clean());
    }

    public boolean isRestricted(long identityId, long chatId) {
        Instant now = clock.instant();
        return repository.findByIdentityIdAndChatId(identityId, chatId)
                .map(r -> r.isRestrictedAt(now))
                .orElse(false);
    }

    /**
     * Whole minutes left on the current restriction, rounded down; empty when not restricted.
     */
    public Optional<Integer> remainingMinutes(long identityId, long chatId) {
        Instant now = clock.instant();
        return repository.findByIdentityIdAndChatId(identityId, chatId)
                .filter(r -> r.isRestrictedAt(now))
                .map(r -> (int) Duration.between(now, r.getRestrictedUntil()).toMinutes());
    }

    public Escalation escalate(long identityId, long chatId) {
        return locks.withLock(lockKey(identityId, chatId), () -> transactionTemplate.execute(status -> {
            Instant now = clock.instant();
            ViolationRecord record = repository.findForUpdate(identityId, chatId)
                    .orElseGet(() -> new ViolationRecord(identityId, chatId, now));
            return recordViolation(record, now);
        }));
    }

    /**
     * Escalates only if the pair is not currently restricted. The check and the
     * increment share the pair lock and the row lock, so a burst of concurrent
     * offenses escalates once. Empty when a restriction was already in force.
     */
    public Optional<Escalation> escalateUnlessRestricted(long identityId, long chatId) {
        return locks.withLock(lockKey(identityId, chatId), () -> transactionTemplate.execute(status -> {
            Instant now = clock.instant();
            ViolationRecord record = repository.findForUpdate(identityId, chatId)
                    .orElseGet(() -> new ViolationRecord(identityId, chatId, now));
            if (record.isRestrictedAt(now)) {
                return Optional.<Escalation>empty();
            }
            return Optional.of(recordViolation(record, now));
        }));
    }

    private Escalation recordViolation(ViolationRecord record, Instant now) {
        int ordinal = record.getViolationCount() + 1;
        int minutes = escalationPolicy.durationFor(ordinal);
        Instant until = now.plus(minutes, ChronoUnit.MINUTES);
        record.recordViolation(ordinal, now, until);
        repository.save(record);

        log.info("Escalated identity={} chat={} ordinal={} minutes={}",
                record.getIdentityId(), record.getChatId(), ordinal, minutes);
        return new Escalation(ordinal, minutes, until);
    }

    /**
     * Ends the current restriction but keeps the count, so the next offense continues
     * the escalation. False when the pair has no record.
     */
    public boolean liftRestriction(long identityId, long chatId) {
        Boolean lifted = locks.withLock(lockKey(identityId, chatId), () -> transactionTemplate.execute(status ->
                repository.findForUpdate(identityId, chatId)
                        .map(record -> {
                            record.liftRestriction();
                            repository.save(record);
                            return true;
                        })
                        .orElse(false)));
        if (Boolean.TRUE.equals(lifted)) {
            log.info("Restriction lifted identity={} chat={}", identityId, chatId);
        }
        return Boolean.TRUE.equals(lifted);
    }

    /**
     * Forgets the pair's history entirely. False when there was nothing to pardon.
     */
    public boolean pardon(long identityId, long chatId) {
        Boolean pardoned = locks.withLock(lockKey(identityId, chatId), () -> transactionTemplate.execute(status ->
                repository.findForUpdate(identityId, chatId)
                        .map(record -> {
                            repository.delete(record);
                            return true;
                        })
                        .orElse(false)));
        if (Boolean.TRUE.equals(pardoned)) {
            log.info("Pardoned identity={} chat={}", identityId, chatId);
        }
        return Boolean.TRUE.equals(pardoned);
    }

    public List<Offender> topOffenders(long chatId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return repository
                .findByChatIdAndViolationCountGreaterThanOrderByViolationCountDescCreatedAtAscIdentityIdAsc(
                        chatId, 0, PageRequest.of(0, limit))
                .stream()
                .map(r -> new Offender(r.getIdentityId(), r.getViolationCount()))
                .toList();
    }

    private static String lockKey(long identityId, long chatId) {
        return chatId + ":" + identityId;
    }
}
