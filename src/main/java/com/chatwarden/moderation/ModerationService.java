package com.chatwarden.moderation;

import com.chatwarden.audit.AuditEvent;
import com.chatwarden.audit.AuditService;
import com.chatwarden.exemption.Exemption;
import com.chatwarden.exemption.ExemptionRegistry;
import com.chatwarden.history.RestrictionHistory;
import com.chatwarden.history.RestrictionStats;
import com.chatwarden.ledger.ActivityLedger;
import com.chatwarden.observability.ModerationMetrics;
import com.chatwarden.policy.ChatPolicy;
import com.chatwarden.policy.ChatPolicyStore;
import com.chatwarden.policy.ContentCategory;
import com.chatwarden.support.TransientStoreException;
import com.chatwarden.violation.Offender;
import com.chatwarden.violation.ViolationInfo;
import com.chatwarden.violation.ViolationTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Operations offered to the chat-platform adapter and to chat administrators.
 * Administrative changes are written to the audit log.
 */
@Service
public class ModerationService {

    private static final Logger log = LoggerFactory.getLogger(ModerationService.class);

    private final ModerationEngine engine;
    private final ViolationTracker violations;
    private final ExemptionRegistry exemptions;
    private final ChatPolicyStore policies;
    private final ActivityLedger ledger;
    private final RestrictionHistory history;
    private final AuditService auditService;
    private final ModerationMetrics metrics;

    public ModerationService(ModerationEngine engine,
                             ViolationTracker violations,
                             ExemptionRegistry exemptions,
                             ChatPolicyStore policies,
                             ActivityLedger ledger,
                             RestrictionHistory history,
                             AuditService auditService,
                             ModerationMetrics metrics) {
        this.engine = engine;
        this.violations = violations;
        this.exemptions = exemptions;
        this.policies = policies;
        this.ledger = ledger;
        this.history = history;
        this.auditService = auditService;
        this.metrics = metrics;
    }

    public Verdict evaluate(long identityId, long chatId, String category, String fingerprint) {
        return evaluate(identityId, chatId, ContentCategory.fromValue(category), fingerprint);
    }

    public Verdict evaluate(long identityId, long chatId, ContentCategory category, String fingerprint) {
        return engine.evaluate(identityId, chatId, category, fingerprint);
    }

    /**
     * Forgets the member's violations and recent activity in the chat.
     */
    public boolean pardon(long identityId, long chatId) {
        ViolationInfo before = violations.info(identityId, chatId);
        boolean pardoned = violations.pardon(identityId, chatId);
        if (pardoned) {
            try {
                ledger.clear(identityId, chatId);
            } catch (TransientStoreException e) {
                // Stale events age out of the window on their own
                log.warn("Pardoned identity={} chat={} but could not clear activity: {}",
                        identityId, chatId, e.getMessage());
            }
        }
        auditService.logMemberAction(AuditEvent.TYPE_PARDON, "pardon", chatId, identityId, pardoned,
                Map.of("previousCount", before.violationCount()));
        return pardoned;
    }

    public boolean liftRestriction(long identityId, long chatId) {
        boolean lifted = violations.liftRestriction(identityId, chatId);
        auditService.logMemberAction(AuditEvent.TYPE_LIFT_RESTRICTION, "lift", chatId, identityId, lifted, Map.of());
        return lifted;
    }

    public boolean grantExemption(long identityId, long chatId, Long grantedBy) {
        boolean granted = exemptions.grant(identityId, chatId, grantedBy);
        Map<String, Object> details = new HashMap<>();
        if (grantedBy != null) {
            details.put("grantedBy", grantedBy);
        }
        auditService.logMemberAction(AuditEvent.TYPE_EXEMPTION_GRANT, "grant", chatId, identityId, granted, details);
        return granted;
    }

    public boolean revokeExemption(long identityId, long chatId) {
        boolean revoked = exemptions.revoke(identityId, chatId);
        auditService.logMemberAction(AuditEvent.TYPE_EXEMPTION_REVOKE, "revoke", chatId, identityId, revoked, Map.of());
        return revoked;
    }

    public List<Exemption> listExemptions(long chatId) {
        return exemptions.list(chatId);
    }

    public ModerationStatus getStatus(long identityId, long chatId) {
        ViolationInfo info = violations.info(identityId, chatId);
        Optional<Integer> remaining = violations.remainingMinutes(identityId, chatId);
        return new ModerationStatus(identityId, chatId, info.violationCount(),
                violations.isRestricted(identityId, chatId), remaining.orElse(null),
                exemptions.isExempt(identityId, chatId));
    }

    /**
     * Members with the most violations, exempt members left out.
     */
    public List<Offender> topOffenders(long chatId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        Set<Long> exempt = exemptions.list(chatId).stream()
                .map(Exemption::getIdentityId)
                .collect(Collectors.toSet());
        return violations.topOffenders(chatId, limit + exempt.size()).stream()
                .filter(offender -> !exempt.contains(offender.identityId()))
                .limit(limit)
                .toList();
    }

    public ChatPolicy getPolicy(long chatId) {
        return policies.get(chatId);
    }

    public ChatPolicy setPolicy(long chatId, String category, String field, int value) {
        ChatPolicy updated = policies.set(chatId, category, field, value);
        auditService.logPolicyChange(chatId, "set-policy",
                Map.of("category", category, "field", field, "value", value));
        return updated;
    }

    /**
     * Called by the adapter when a restriction was recorded but the platform refused to apply it.
     * The violation record is left as is.
     */
    public boolean reportEnforcementFailure(long identityId, long chatId, String detail) {
        metrics.recordEnforcementFailure();
        boolean marked = history.markUnenforced(identityId, chatId, detail);
        auditService.logEnforcementFailure(chatId, identityId, detail, marked);
        return marked;
    }

    public RestrictionStats restrictionStats(long chatId, int days) {
        return history.stats(chatId, days);
    }

    public Page<AuditEvent> auditTrail(long chatId, String eventType, Pageable pageable) {
        if (eventType != null) {
            return auditService.findByChatAndType(chatId, eventType, pageable);
        }
        return auditService.findByChat(chatId, pageable);
    }
}
