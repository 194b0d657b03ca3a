package com.chatwarden.observability;

import com.chatwarden.moderation.Verdict;
import com.chatwarden.policy.ContentCategory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

/**
 * Micrometer meters for the moderation engine and its maintenance jobs.
 */
@Component
public class ModerationMetrics {

    private final MeterRegistry registry;

    public ModerationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // --- Engine ---

    public void recordVerdict(ContentCategory category, Verdict.Outcome outcome) {
        Counter.builder("chatwarden.verdicts")
                .tag("category", category.value())
                .tag("outcome", outcome.name())
                .register(registry).increment();
    }

    public void recordFailOpen(ContentCategory category, String store) {
        Counter.builder("chatwarden.engine.fail_open")
                .description("Events allowed because a store was unavailable")
                .tag("category", category.value())
                .tag("store", store)
                .register(registry).increment();
    }

    public Timer.Sample startEvaluateTimer() {
        return Timer.start(registry);
    }

    public void stopEvaluateTimer(Timer.Sample sample, ContentCategory category) {
        sample.stop(Timer.builder("chatwarden.evaluate.latency")
                .tag("category", category.value())
                .register(registry));
    }

    // --- Enforcement ---

    public void recordEnforcementFailure() {
        Counter.builder("chatwarden.enforcement.failed")
                .description("Restrictions recorded but not applied on the platform")
                .register(registry).increment();
    }

    // --- Maintenance ---

    public void recordLedgerPruned(long deleted) {
        Counter.builder("chatwarden.ledger.pruned")
                .register(registry).increment(deleted);
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
