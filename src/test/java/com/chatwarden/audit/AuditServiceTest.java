package com.chatwarden.audit;

import com.chatwarden.support.MutableClock;
import com.chatwarden.support.StoreTestConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.PageRequest;
import org.springframework.security.authentication.TestingAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import({StoreTestConfig.class, AuditService.class})
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class AuditServiceTest {

    private static final long CHAT = -11L;

    @Autowired private AuditService auditService;
    @Autowired private AuditRepository repository;
    @Autowired private MutableClock clock;

    @BeforeEach
    void setUp() {
        repository.deleteAll();
        clock.set(StoreTestConfig.START);
    }

    @AfterEach
    void clearSecurity() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void memberActionAttributedToCaller() {
        SecurityContextHolder.getContext().setAuthentication(new TestingAuthenticationToken("admin-7", null));

        auditService.logMemberAction(AuditEvent.TYPE_PARDON, "pardon", CHAT, 5L, true, Map.of("previousCount", 3));

        AuditEvent saved = repository.findAll().get(0);
        assertEquals("admin-7", saved.getPrincipal());
        assertEquals(AuditEvent.OUTCOME_SUCCESS, saved.getOutcome());
        assertEquals(5L, saved.getIdentityId());
        assertEquals("{\"previousCount\":3}", saved.getDetails());
        assertEquals(StoreTestConfig.START, saved.getOccurredAt());
    }

    @Test
    void noOpAndSystemPrincipal() {
        auditService.logMemberAction(AuditEvent.TYPE_LIFT_RESTRICTION, "lift", CHAT, 5L, false, Map.of());

        AuditEvent saved = repository.findAll().get(0);
        assertEquals("system", saved.getPrincipal());
        assertEquals(AuditEvent.OUTCOME_NOOP, saved.getOutcome());
        assertEquals("{}", saved.getDetails());
    }

    @Test
    void chatTrailIsNewestFirst() {
        auditService.logPolicyChange(CHAT, "set-policy", Map.of("field", "threshold"));
        clock.advanceSeconds(10);
        auditService.logEnforcementFailure(CHAT, 5L, "no rights", true);
        auditService.logPolicyChange(CHAT + 1, "set-policy", Map.of());

        List<String> types = auditService.findByChat(CHAT, PageRequest.of(0, 10)).stream()
                .map(AuditEvent::getEventType)
                .toList();
        assertEquals(List.of(AuditEvent.TYPE_ENFORCEMENT_FAILURE, AuditEvent.TYPE_POLICY_CHANGE), types);
        assertEquals(1, auditService.findByChatAndType(CHAT, AuditEvent.TYPE_POLICY_CHANGE, PageRequest.of(0, 10))
                .getTotalElements());
    }

    @Test
    void purgeRemovesOldEvents() {
        auditService.logPolicyChange(CHAT, "set-policy", Map.of());
        clock.advance(Duration.ofDays(400));
        auditService.logPolicyChange(CHAT, "set-policy", Map.of());

        assertEquals(1, auditService.purgeOlderThan(clock.instant().minus(Duration.ofDays(365))));
        assertEquals(1, repository.count());
    }
}
