package com.chatwarden.ledger;

import com.chatwarden.config.ChatwardenProperties;
import com.chatwarden.config.RedisConfig;
import com.chatwarden.policy.ContentCategory;
import com.chatwarden.support.TransientStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Ledger kept in one Redis sorted set per (chat, identity, category[, fingerprint]),
 * scored by epoch millis. Append, trim, expiry and count run in one Lua script,
 * which makes recordAndCount atomic across every process sharing the Redis.
 */
@Component
@ConditionalOnProperty(name = "chatwarden.ledger.backend", havingValue = "redis")
public class RedisActivityLedger implements ActivityLedger {

    private static final Logger log = LoggerFactory.getLogger(RedisActivityLedger.class);
    private static final String STORE = "activity ledger (redis)";
    static final String KEY_PREFIX = "chatwarden:ledger:";

    // KEYS[1]=set, ARGV: now, member, windowStart, retentionStart, ttlMillis
    private static final String RECORD_AND_COUNT_SCRIPT = """
            redis.call('ZADD', KEYS[1], ARGV[1], ARGV[2])
            redis.call('ZREMRANGEBYSCORE', KEYS[1], '-inf', '(' .. ARGV[4])
            redis.call('PEXPIRE', KEYS[1], ARGV[5])
            return redis.call('ZCOUNT', KEYS[1], ARGV[3], '+inf')
            """;

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final DefaultRedisScript<Long> recordAndCountScript;
    private final Clock clock;
    private final Duration timeout;
    private final long retentionMillis;

    public RedisActivityLedger(@Qualifier(RedisConfig.LEDGER_TEMPLATE) ReactiveRedisTemplate<String, String> redisTemplate,
                               ChatwardenProperties properties,
                               Clock clock) {
        this.redisTemplate = redisTemplate;
        this.recordAndCountScript = new DefaultRedisScript<>(RECORD_AND_COUNT_SCRIPT, Long.class);
        this.clock = clock;
        this.timeout = properties.getLedger().getRedisTimeout();
        this.retentionMillis = Duration.ofHours(properties.getRetention().getLedgerRetentionHours()).toMillis();
    }

    @Override
    public long recordAndCount(long identityId, long chatId, ContentCategory category,
                               int windowSeconds, String fingerprint) {
        String key = key(identityId, chatId, category, Fingerprints.digest(fingerprint));
        long now = clock.millis();
        long windowMillis = Duration.ofSeconds(windowSeconds).toMillis();
        // Never trim below the window being counted
        long keepMillis = Math.max(retentionMillis, windowMillis);

        try {
            Long count = redisTemplate.execute(
                    recordAndCountScript,
                    List.of(key),
                    List.of(String.valueOf(now),
                            now + "-" + UUID.randomUUID(),
                            String.valueOf(now - windowMillis),
                            String.valueOf(now - keepMillis),
                            String.valueOf(keepMillis))
            ).blockFirst(timeout);
            return count != null ? count : 0L;
        } catch (RuntimeException e) {
            throw new TransientStoreException(STORE, e);
        }
    }

    @Override
    public long prune(long retentionSeconds) {
        double cutoff = clock.millis() - Duration.ofSeconds(retentionSeconds).toMillis();
        Range<Double> older = Range.of(Range.Bound.unbounded(), Range.Bound.exclusive(cutoff));
        try {
            Long removed = redisTemplate.scan(ScanOptions.scanOptions().match(KEY_PREFIX + "*").build())
                    .flatMap(key -> redisTemplate.opsForZSet().removeRangeByScore(key, older))
                    .reduce(0L, Long::sum)
                    .block(timeout.multipliedBy(30));
            long total = removed != null ? removed : 0L;
            log.debug("Pruned {} ledger entries from redis", total);
            return total;
        } catch (RuntimeException e) {
            throw new TransientStoreException(STORE, e);
        }
    }

    @Override
    public void clear(long identityId, long chatId) {
        String pattern = KEY_PREFIX + chatId + ":" + identityId + ":*";
        try {
            redisTemplate.delete(redisTemplate.scan(ScanOptions.scanOptions().match(pattern).build()))
                    .block(timeout.multipliedBy(10));
        } catch (RuntimeException e) {
            throw new TransientStoreException(STORE, e);
        }
    }

    static String key(long identityId, long chatId, ContentCategory category, String digest) {
        String base = KEY_PREFIX + chatId + ":" + identityId + ":" + category.value();
        return digest != null ? base + ":" + digest : base;
    }
}
