package com.chatwarden.ledger;

import com.chatwarden.policy.ContentCategory;
import com.chatwarden.support.MutableClock;
import com.chatwarden.support.StoreTestConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import({StoreTestConfig.class, JpaActivityLedger.class})
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class JpaActivityLedgerTest {

    private static final long CHAT = -1001L;
    private static final long USER = 77L;

    @Autowired private JpaActivityLedger ledger;
    @Autowired private ActivityEventRepository repository;
    @Autowired private MutableClock clock;

    @BeforeEach
    void setUp() {
        repository.deleteAll();
        clock.set(StoreTestConfig.START);
    }

    @Test
    void countsEveryEventInsideWindow() {
        for (int i = 1; i <= 5; i++) {
            assertEquals(i, ledger.recordAndCount(USER, CHAT, ContentCategory.STICKER, 30, null));
            clock.advanceSeconds(2);
        }
    }

    @Test
    void eventsOlderThanWindowAreNotCounted() {
        ledger.recordAndCount(USER, CHAT, ContentCategory.STICKER, 30, null);
        clock.advanceSeconds(20);
        ledger.recordAndCount(USER, CHAT, ContentCategory.STICKER, 30, null);
        clock.advanceSeconds(11);

        assertEquals(2, ledger.recordAndCount(USER, CHAT, ContentCategory.STICKER, 30, null));
    }

    @Test
    void eventExactlyAtWindowStartStillCounts() {
        ledger.recordAndCount(USER, CHAT, ContentCategory.TEXT, 20, "hi");
        clock.advanceSeconds(20);
        assertEquals(2, ledger.recordAndCount(USER, CHAT, ContentCategory.TEXT, 20, "hi"));
    }

    @Test
    void distinctFingerprintsCountSeparately() {
        ledger.recordAndCount(USER, CHAT, ContentCategory.TEXT, 20, "buy now");
        ledger.recordAndCount(USER, CHAT, ContentCategory.TEXT, 20, "buy now");

        assertEquals(1, ledger.recordAndCount(USER, CHAT, ContentCategory.TEXT, 20, "hello"));
        assertEquals(3, ledger.recordAndCount(USER, CHAT, ContentCategory.TEXT, 20, "buy now"));
    }

    @Test
    void categoriesAndChatsAreIsolated() {
        ledger.recordAndCount(USER, CHAT, ContentCategory.STICKER, 30, null);
        ledger.recordAndCount(USER, CHAT, ContentCategory.STICKER, 30, null);

        assertEquals(1, ledger.recordAndCount(USER, CHAT, ContentCategory.ANIMATION, 30, null));
        assertEquals(1, ledger.recordAndCount(USER, CHAT + 1, ContentCategory.STICKER, 30, null));
        assertEquals(1, ledger.recordAndCount(USER + 1, CHAT, ContentCategory.STICKER, 30, null));
    }

    @Test
    void longFingerprintsAreStoredAsDigest() {
        String longText = "spam ".repeat(2000);
        ledger.recordAndCount(USER, CHAT, ContentCategory.TEXT, 20, longText);
        assertEquals(2, ledger.recordAndCount(USER, CHAT, ContentCategory.TEXT, 20, longText));

        String stored = repository.findAll().get(0).getFingerprint();
        assertEquals(64, stored.length());
    }

    @Test
    void pruneDeletesOnlyOlderEvents() {
        ledger.recordAndCount(USER, CHAT, ContentCategory.STICKER, 30, null);
        clock.advanceSeconds(100);
        ledger.recordAndCount(USER, CHAT, ContentCategory.STICKER, 30, null);
        clock.advanceSeconds(100);

        assertEquals(1, ledger.prune(150));
        assertEquals(1, repository.count());
        assertEquals(0, ledger.prune(150));
    }

    @Test
    void clearRemovesMemberEventsInChat() {
        ledger.recordAndCount(USER, CHAT, ContentCategory.STICKER, 30, null);
        ledger.recordAndCount(USER, CHAT, ContentCategory.TEXT, 20, "x");
        ledger.recordAndCount(USER, CHAT + 1, ContentCategory.STICKER, 30, null);

        ledger.clear(USER, CHAT);

        assertEquals(1, repository.count());
        assertEquals(1, ledger.recordAndCount(USER, CHAT, ContentCategory.STICKER, 30, null));
    }

    @Test
    void concurrentRecordsObserveDistinctCounts() throws Exception {
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Long>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return ledger.recordAndCount(USER, CHAT, ContentCategory.STICKER, 30, null);
                }));
            }
            start.countDown();

            Set<Long> counts = new HashSet<>();
            for (Future<Long> f : futures) {
                counts.add(f.get(30, TimeUnit.SECONDS));
            }
            assertEquals(Set.of(1L, 2L, 3L, 4L, 5L, 6L, 7L, 8L), counts);
        } finally {
            pool.shutdownNow();
        }
    }
}
