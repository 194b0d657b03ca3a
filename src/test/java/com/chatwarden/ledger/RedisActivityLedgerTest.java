package com.chatwarden.ledger;

import com.chatwarden.config.ChatwardenProperties;
import com.chatwarden.policy.ContentCategory;
import com.chatwarden.support.MutableClock;
import com.chatwarden.support.TransientStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import reactor.core.publisher.Flux;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RedisActivityLedgerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    private ReactiveRedisTemplate<String, String> redisTemplate;

    private RedisActivityLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new RedisActivityLedger(redisTemplate, new ChatwardenProperties(), new MutableClock(NOW));
    }

    @Test
    @SuppressWarnings("unchecked")
    void recordAndCountRunsScriptWithWindowBounds() {
        doReturn(Flux.just(3L)).when(redisTemplate).execute(any(RedisScript.class), anyList(), anyList());

        long count = ledger.recordAndCount(5L, -10L, ContentCategory.STICKER, 30, "hash");

        assertEquals(3L, count);
        ArgumentCaptor<List<String>> keys = ArgumentCaptor.forClass(List.class);
        ArgumentCaptor<List<String>> args = ArgumentCaptor.forClass(List.class);
        verify(redisTemplate).execute(any(RedisScript.class), keys.capture(), args.capture());

        assertTrue(keys.getValue().get(0).startsWith("chatwarden:ledger:-10:5:sticker:"));
        long now = NOW.toEpochMilli();
        assertEquals(String.valueOf(now), args.getValue().get(0));
        assertEquals(String.valueOf(now - 30_000), args.getValue().get(2));
        assertEquals(String.valueOf(now - 24 * 3_600_000L), args.getValue().get(3));
    }

    @Test
    void keyOmitsDigestWhenAbsent() {
        assertEquals("chatwarden:ledger:-10:5:sticker",
                RedisActivityLedger.key(5L, -10L, ContentCategory.STICKER, null));
        assertEquals("chatwarden:ledger:-10:5:text:abc",
                RedisActivityLedger.key(5L, -10L, ContentCategory.TEXT, "abc"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void redisFailureBecomesTransientStoreException() {
        doReturn(Flux.error(new RedisConnectionFailureException("down")))
                .when(redisTemplate).execute(any(RedisScript.class), anyList(), anyList());

        TransientStoreException ex = assertThrows(TransientStoreException.class,
                () -> ledger.recordAndCount(5L, -10L, ContentCategory.TEXT, 20, "hello"));
        assertInstanceOf(RedisConnectionFailureException.class, ex.getCause());
    }
}
