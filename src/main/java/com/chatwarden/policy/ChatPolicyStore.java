package com.chatwarden.policy;

import com.chatwarden.config.ChatwardenProperties;
import com.chatwarden.support.KeyedLocks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.stream.IntStream;

/**
 * Per-chat thresholds and windows. Reads always hit the repository so an update
 * is visible to the very next evaluation.
 */
@Service
public class ChatPolicyStore {

    private static final Logger log = LoggerFactory.getLogger(ChatPolicyStore.class);

    private final ChatPolicyRepository repository;
    private final ChatwardenProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final KeyedLocks locks = new KeyedLocks();

    public ChatPolicyStore(ChatPolicyRepository repository,
                           ChatwardenProperties properties,
                           PlatformTransactionManager transactionManager,
                           Clock clock) {
        this.repository = repository;
        this.properties = properties;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    /**
     * Stored policy, or the process-wide defaults for chats never customized.
     */
    public ChatPolicy get(long chatId) {
        return repository.findById(chatId)
                .orElseGet(() -> ChatPolicy.withDefaults(chatId, properties.getDefaults(), clock.instant()));
    }

    public ChatPolicy set(long chatId, String category, String field, int value) {
        return set(chatId, ContentCategory.fromValue(category), PolicyField.fromKey(field), value);
    }

    public ChatPolicy set(long chatId, ContentCategory category, PolicyField field, int value) {
        field.validate(value);
        return locks.withLock(Long.toString(chatId), () -> transactionTemplate.execute(status -> {
            ChatPolicy policy = repository.findById(chatId)
                    .orElseGet(() -> ChatPolicy.withDefaults(chatId, properties.getDefaults(), clock.instant()));
            policy.apply(category.policySlot(), field, value);
            policy.setUpdatedAt(clock.instant());
            ChatPolicy saved = repository.save(policy);
            log.info("Policy updated chat={} slot={} field={} value={}",
                    chatId, category.policySlot(), field.key(), value);
            return saved;
        }));
    }

    /**
     * Largest window any chat can currently count over, defaults included.
     * Ledger pruning must never cut below this.
     */
    public int maxConfiguredWindowSeconds() {
        ChatwardenProperties.PolicyDefaults defaults = properties.getDefaults();
        int max = IntStream.of(defaults.getStickerWindowSeconds(), defaults.getTextWindowSeconds(),
                defaults.getImageWindowSeconds(), defaults.getVideoWindowSeconds()).max().orElse(0);

        ChatPolicyRepository.WindowMaxima stored = repository.findWindowMaxima();
        if (stored != null) {
            max = Math.max(max, orZero(stored.getStickerMax()));
            max = Math.max(max, orZero(stored.getTextMax()));
            max = Math.max(max, orZero(stored.getImageMax()));
            max = Math.max(max, orZero(stored.getVideoMax()));
        }
        return max;
    }

    private static int orZero(Integer value) {
        return value != null ? value : 0;
    }
}
