package com.chatwarden.ledger;

import com.chatwarden.policy.ContentCategory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;

@Repository
public interface ActivityEventRepository extends JpaRepository<ActivityEvent, Long> {

    long countByIdentityIdAndChatIdAndCategoryAndOccurredAtGreaterThanEqual(
            Long identityId, Long chatId, ContentCategory category, Instant since);

    long countByIdentityIdAndChatIdAndCategoryAndFingerprintAndOccurredAtGreaterThanEqual(
            Long identityId, Long chatId, ContentCategory category, String fingerprint, Instant since);

    @Modifying
    @Query("delete from ActivityEvent e where e.occurredAt < :cutoff")
    int deleteOlderThan(@Param("cutoff") Instant cutoff);

    @Modifying
    @Query("delete from ActivityEvent e where e.identityId = :identityId and e.chatId = :chatId")
    int deleteByIdentityAndChat(@Param("identityId") Long identityId, @Param("chatId") Long chatId);
}
