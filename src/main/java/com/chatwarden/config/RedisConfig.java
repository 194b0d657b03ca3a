package com.chatwarden.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.ReactiveRedisConnectionFactory;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializationContext;

@Configuration
@ConditionalOnProperty(name = "chatwarden.ledger.backend", havingValue = "redis")
public class RedisConfig {

    public static final String LEDGER_TEMPLATE = "ledgerRedisTemplate";

    /** Sorted-set keys and members of the activity ledger are plain strings. */
    @Bean(LEDGER_TEMPLATE)
    public ReactiveRedisTemplate<String, String> ledgerRedisTemplate(ReactiveRedisConnectionFactory factory) {
        return new ReactiveRedisTemplate<>(factory, RedisSerializationContext.string());
    }
}
