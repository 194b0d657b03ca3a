package com.chatwarden.moderation;

import com.chatwarden.exemption.ExemptionRegistry;
import com.chatwarden.history.RestrictionHistory;
import com.chatwarden.ledger.ActivityLedger;
import com.chatwarden.observability.ModerationMetrics;
import com.chatwarden.policy.CategoryLimits;
import com.chatwarden.policy.ChatPolicy;
import com.chatwarden.policy.ChatPolicyStore;
import com.chatwarden.policy.ContentCategory;
import com.chatwarden.policy.PolicyValidationException;
import com.chatwarden.support.TransientStoreException;
import com.chatwarden.violation.Escalation;
import com.chatwarden.violation.ViolationTracker;
import io.micrometer.core.instrument.Timer;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.util.Optional;

/**
 * Turns one content event into a verdict: exemption check, policy lookup,
 * windowed count, then warn or escalate.
 *
 * <p>Moderation must never block the message pipeline, so any store failure
 * during evaluation yields {@link Verdict#allow()}. Text, photo and video events
 * must carry a fingerprint; repetition of those is matched on identical content only.
 */
@Service
public class ModerationEngine {

    private static final Logger log = LoggerFactory.getLogger(ModerationEngine.class);
    private static final String DATABASE = "database";

    private final ExemptionRegistry exemptions;
    private final ChatPolicyStore policies;
    private final ActivityLedger ledger;
    private final ViolationTracker violations;
    private final RestrictionHistory history;
    private final ModerationMetrics metrics;

    public ModerationEngine(ExemptionRegistry exemptions,
                            ChatPolicyStore policies,
                            ActivityLedger ledger,
                            ViolationTracker violations,
                            RestrictionHistory history,
                            ModerationMetrics metrics) {
        this.exemptions = exemptions;
        this.policies = policies;
        this.ledger = ledger;
        this.violations = violations;
        this.history = history;
        this.metrics = metrics;
    }

    @Observed(name = "chatwarden.moderation.evaluate", contextualName = "moderation-evaluate")
    public Verdict evaluate(long identityId, long chatId, ContentCategory category, String fingerprint) {
        if (category.fingerprinted() && (fingerprint == null || fingerprint.isEmpty())) {
            throw new PolicyValidationException("A fingerprint is required for " + category.value() + " events");
        }
        Timer.Sample sample = metrics.startEvaluateTimer();
        Verdict verdict;
        try {
            verdict = decide(identityId, chatId, category, fingerprint);
        } catch (TransientStoreException e) {
            verdict = failOpen(identityId, chatId, category, e.getStore(), e);
        } catch (DataAccessException | TransactionException e) {
            verdict = failOpen(identityId, chatId, category, DATABASE, e);
        }
        metrics.stopEvaluateTimer(sample, category);
        metrics.recordVerdict(category, verdict.outcome());
        return verdict;
    }

    private Verdict failOpen(long identityId, long chatId, ContentCategory category,
                             String store, RuntimeException cause) {
        log.warn("{} unavailable, allowing {} from identity={} chat={}: {}",
                store, category.value(), identityId, chatId, cause.getMessage());
        metrics.recordFailOpen(category, store);
        return Verdict.allow();
    }

    private Verdict decide(long identityId, long chatId, ContentCategory category, String fingerprint) {
        if (exemptions.isExempt(identityId, chatId)) {
            return Verdict.allow();
        }

        ChatPolicy policy = policies.get(chatId);
        CategoryLimits limits = policy.limitsFor(category);
        int threshold = limits.threshold();

        // Any sticker counts, not only identical ones
        String key = category.fingerprinted() ? fingerprint : null;
        long count = ledger.recordAndCount(identityId, chatId, category, limits.windowSeconds(), key);

        if (count >= threshold) {
            Optional<Escalation> escalated = violations.escalateUnlessRestricted(identityId, chatId);
            if (escalated.isEmpty()) {
                log.debug("Already restricted identity={} chat={} count={}", identityId, chatId, count);
                return Verdict.alreadyRestricted(count, threshold);
            }
            Escalation escalation = escalated.get();
            recordHistory(identityId, chatId, category, escalation, count, limits);
            log.info("Restricting identity={} chat={} category={} count={}/{} ordinal={} minutes={}",
                    identityId, chatId, category.value(), count, threshold,
                    escalation.ordinal(), escalation.durationMinutes());
            return Verdict.restrict(escalation.ordinal(), escalation.durationMinutes(), count, threshold);
        }

        if (policy.isWarnEnabled() && count == threshold - 1) {
            return Verdict.warn(count, threshold);
        }
        return Verdict.allow(count, threshold);
    }

    private void recordHistory(long identityId, long chatId, ContentCategory category,
                               Escalation escalation, long count, CategoryLimits limits) {
        String reason = count + " " + category.value() + " in " + limits.windowSeconds() + "s";
        try {
            history.record(identityId, chatId, category, escalation.ordinal(), escalation.durationMinutes(), reason);
        } catch (DataAccessException | TransactionException e) {
            // The violation record is authoritative; a missing history row only affects stats
            log.warn("Could not log restriction identity={} chat={} ordinal={}: {}",
                    identityId, chatId, escalation.ordinal(), e.getMessage());
        }
    }
}
