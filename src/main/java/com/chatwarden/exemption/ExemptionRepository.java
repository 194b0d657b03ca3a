package com.chatwarden.exemption;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ExemptionRepository extends JpaRepository<Exemption, ExemptionKey> {

    boolean existsByIdentityIdAndChatId(Long identityId, Long chatId);

    List<Exemption> findByChatIdOrderByGrantedAtAscIdentityIdAsc(Long chatId);

    @Modifying
    @Query("delete from Exemption e where e.identityId = :identityId and e.chatId = :chatId")
    int deleteByKey(@Param("identityId") Long identityId, @Param("chatId") Long chatId);
}
