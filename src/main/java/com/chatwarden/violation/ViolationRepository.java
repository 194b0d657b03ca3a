package com.chatwarden.violation;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ViolationRepository extends JpaRepository<ViolationRecord, ViolationKey> {

    Optional<ViolationRecord> findByIdentityIdAndChatId(Long identityId, Long chatId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select v from ViolationRecord v where v.identityId = :identityId and v.chatId = :chatId")
    Optional<ViolationRecord> findForUpdate(@Param("identityId") Long identityId, @Param("chatId") Long chatId);

    // ties fall back to who offended first, then to the identity itself
    List<ViolationRecord> findByChatIdAndViolationCountGreaterThanOrderByViolationCountDescCreatedAtAscIdentityIdAsc(
            Long chatId, int minCount, Pageable pageable);
}
