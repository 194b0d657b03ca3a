package com.chatwarden.history;

import com.chatwarden.policy.ContentCategory;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface RestrictionLogRepository extends JpaRepository<RestrictionLogEntry, Long> {

    long countByChatIdAndCreatedAtAfter(long chatId, Instant since);

    @Query("""
            select e.category as category, count(e) as total
            from RestrictionLogEntry e
            where e.chatId = :chatId and e.createdAt > :since
            group by e.category
            order by count(e) desc, e.category asc""")
    List<CategoryTotal> countByCategory(@Param("chatId") long chatId, @Param("since") Instant since);

    @Query("""
            select e.identityId as identityId, count(e) as total
            from RestrictionLogEntry e
            where e.chatId = :chatId and e.createdAt > :since
            group by e.identityId
            order by count(e) desc, e.identityId asc""")
    List<IdentityTotal> topIdentities(@Param("chatId") long chatId, @Param("since") Instant since, Pageable page);

    @Query("""
            select sum(e.durationMinutes)
            from RestrictionLogEntry e
            where e.chatId = :chatId and e.createdAt > :since""")
    Long sumMinutes(@Param("chatId") long chatId, @Param("since") Instant since);

    Optional<RestrictionLogEntry> findFirstByIdentityIdAndChatIdOrderByCreatedAtDescIdDesc(long identityId, long chatId);

    @Modifying
    @Query("delete from RestrictionLogEntry e where e.createdAt < :cutoff")
    int deleteOlderThan(@Param("cutoff") Instant cutoff);

    interface CategoryTotal {
        ContentCategory getCategory();
        Long getTotal();
    }

    interface IdentityTotal {
        Long getIdentityId();
        Long getTotal();
    }
}
