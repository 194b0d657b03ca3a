package com.chatwarden.moderation;

import com.chatwarden.exemption.ExemptionRegistry;
import com.chatwarden.exemption.ExemptionRepository;
import com.chatwarden.history.RestrictionHistory;
import com.chatwarden.history.RestrictionLogRepository;
import com.chatwarden.ledger.ActivityEventRepository;
import com.chatwarden.ledger.JpaActivityLedger;
import com.chatwarden.observability.ModerationMetrics;
import com.chatwarden.policy.ChatPolicyRepository;
import com.chatwarden.policy.ChatPolicyStore;
import com.chatwarden.policy.ContentCategory;
import com.chatwarden.support.MutableClock;
import com.chatwarden.support.StoreTestConfig;
import com.chatwarden.violation.ViolationRepository;
import com.chatwarden.violation.ViolationTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import({StoreTestConfig.class, ExemptionRegistry.class, ChatPolicyStore.class, JpaActivityLedger.class,
        ViolationTracker.class, RestrictionHistory.class, ModerationEngine.class})
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class ModerationEngineTest {

    private static final long CHAT = -1009988L;
    private static final long SPAMMER = 4242L;

    @Autowired private ModerationEngine engine;
    @Autowired private ChatPolicyStore policies;
    @Autowired private ExemptionRegistry exemptions;
    @Autowired private ViolationTracker violations;
    @Autowired private ModerationMetrics metrics;
    @Autowired private MutableClock clock;

    @Autowired private ActivityEventRepository events;
    @Autowired private ViolationRepository violationRepository;
    @Autowired private ExemptionRepository exemptionRepository;
    @Autowired private ChatPolicyRepository policyRepository;
    @Autowired private RestrictionLogRepository restrictionLog;

    @BeforeEach
    void setUp() {
        events.deleteAll();
        violationRepository.deleteAll();
        exemptionRepository.deleteAll();
        policyRepository.deleteAll();
        restrictionLog.deleteAll();
        clock.set(StoreTestConfig.START);
    }

    @Test
    void burstWarnsThenRestrictsThenSuppresses() {
        policies.set(CHAT, "sticker", "threshold", 3);
        policies.set(CHAT, "sticker", "windowSeconds", 30);

        Verdict first = sticker();
        clock.advanceSeconds(5);
        Verdict second = sticker();
        clock.advanceSeconds(5);
        Verdict third = sticker();
        clock.advanceSeconds(5);
        Verdict fourth = sticker();

        assertEquals(Verdict.Outcome.ALLOW, first.outcome());
        assertEquals(Verdict.warn(2, 3), second);
        assertEquals(Verdict.restrict(1, 10, 3, 3), third);
        assertTrue(third.deleteContent());
        assertEquals(Verdict.Outcome.ALREADY_RESTRICTED, fourth.outcome());
        assertTrue(fourth.deleteContent());

        assertEquals(1, violations.info(SPAMMER, CHAT).violationCount());
        assertEquals(Instant.parse("2024-05-01T12:10:10Z"), violations.info(SPAMMER, CHAT).restrictedUntil());
        assertEquals(1, restrictionLog.count());
    }

    @Test
    void repeatedOffenceAfterExpiryEscalatesFurther() {
        sticker();
        sticker();
        assertEquals(10, sticker().durationMinutes());

        clock.advanceSeconds(11 * 60);
        sticker();
        sticker();
        Verdict again = sticker();
        assertEquals(Verdict.restrict(2, 60, 3, 3), again);
    }

    @Test
    void thresholdOfOneRestrictsWithoutWarning() {
        policies.set(CHAT, "text", "threshold", 1);

        Verdict verdict = engine.evaluate(SPAMMER, CHAT, ContentCategory.TEXT, "hello");
        assertEquals(Verdict.Outcome.RESTRICT, verdict.outcome());
        assertEquals(1, verdict.ordinal());
    }

    @Test
    void thresholdOfTwoWarnsOnFirstEvent() {
        policies.set(CHAT, "text", "threshold", 2);
        assertEquals(Verdict.Outcome.WARN, engine.evaluate(SPAMMER, CHAT, ContentCategory.TEXT, "x").outcome());
    }

    @Test
    void disabledWarningsAllowInstead() {
        policies.set(CHAT, "sticker", "warnEnabled", 0);
        sticker();
        Verdict second = sticker();
        assertEquals(Verdict.allow(2, 3), second);
    }

    @Test
    void exemptMemberIsNeverCounted() {
        exemptions.grant(SPAMMER, CHAT, null);

        for (int i = 0; i < 5; i++) {
            assertEquals(Verdict.allow(), sticker());
        }
        assertEquals(0, events.count());
        assertEquals(0, violations.info(SPAMMER, CHAT).violationCount());
    }

    @Test
    void differentTextsDoNotAddUp() {
        engine.evaluate(SPAMMER, CHAT, ContentCategory.TEXT, "one");
        engine.evaluate(SPAMMER, CHAT, ContentCategory.TEXT, "two");
        Verdict third = engine.evaluate(SPAMMER, CHAT, ContentCategory.TEXT, "three");
        assertEquals(Verdict.allow(1, 3), third);
    }

    @Test
    void stickersCountRegardlessOfFingerprint() {
        engine.evaluate(SPAMMER, CHAT, ContentCategory.STICKER, "cat");
        engine.evaluate(SPAMMER, CHAT, ContentCategory.STICKER, "dog");
        Verdict third = engine.evaluate(SPAMMER, CHAT, ContentCategory.STICKER, "fox");
        assertEquals(Verdict.Outcome.RESTRICT, third.outcome());
    }

    @Test
    void stickersAndAnimationsCountSeparately() {
        sticker();
        sticker();
        Verdict animation = engine.evaluate(SPAMMER, CHAT, ContentCategory.ANIMATION, null);
        assertEquals(Verdict.allow(1, 3), animation);
    }

    @Test
    void concurrentBurstEscalatesOnce() throws Exception {
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        Map<Verdict.Outcome, Integer> outcomes = new EnumMap<>(Verdict.Outcome.class);
        try {
            List<Future<Verdict>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                Callable<Verdict> task = () -> {
                    start.await();
                    return sticker();
                };
                futures.add(pool.submit(task));
            }
            start.countDown();

            for (Future<Verdict> f : futures) {
                outcomes.merge(f.get(30, TimeUnit.SECONDS).outcome(), 1, Integer::sum);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, outcomes.get(Verdict.Outcome.RESTRICT));
        assertEquals(threads - 3, outcomes.get(Verdict.Outcome.ALREADY_RESTRICTED));
        assertEquals(1, violations.info(SPAMMER, CHAT).violationCount());
        assertEquals(1, restrictionLog.count());
    }

    @Test
    void verdictsAreCounted() {
        double before = warnCount();
        sticker();
        sticker();
        assertEquals(before + 1.0, warnCount());
    }

    private double warnCount() {
        var counter = metrics.getRegistry().find("chatwarden.verdicts")
                .tag("category", "sticker").tag("outcome", "WARN").counter();
        return counter != null ? counter.count() : 0.0;
    }

    private Verdict sticker() {
        return engine.evaluate(SPAMMER, CHAT, ContentCategory.STICKER, null);
    }
}
