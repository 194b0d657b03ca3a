package com.chatwarden.exemption;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

/**
 * Identities that bypass detection in a chat.
 */
@Service
public class ExemptionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ExemptionRegistry.class);

    private final ExemptionRepository repository;
    private final Clock clock;

    public ExemptionRegistry(ExemptionRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public boolean isExempt(long identityId, long chatId) {
        return repository.existsByIdentityIdAndChatId(identityId, chatId);
    }

    /**
     * Idempotent. Returns true only when this call created the exemption.
     */
    public boolean grant(long identityId, long chatId, Long grantedBy) {
        if (isExempt(identityId, chatId)) {
            return false;
        }
        try {
            repository.saveAndFlush(new Exemption(identityId, chatId, grantedBy, clock.instant()));
        } catch (DataIntegrityViolationException e) {
            // Concurrent grant won the insert; the exemption exists either way
            log.debug("Exemption for identity={} chat={} already granted concurrently", identityId, chatId);
            return false;
        }
        log.info("Exemption granted identity={} chat={} by={}", identityId, chatId, grantedBy);
        return true;
    }

    @Transactional
    public boolean revoke(long identityId, long chatId) {
        boolean removed = repository.deleteByKey(identityId, chatId) > 0;
        if (removed) {
            log.info("Exemption revoked identity={} chat={}", identityId, chatId);
        }
        return removed;
    }

    public List<Exemption> list(long chatId) {
        return repository.findByChatIdOrderByGrantedAtAscIdentityIdAsc(chatId);
    }
}
