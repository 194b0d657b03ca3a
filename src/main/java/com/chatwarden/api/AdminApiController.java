package com.chatwarden.api;

import com.chatwarden.audit.AuditEvent;
import com.chatwarden.exemption.Exemption;
import com.chatwarden.history.RestrictionStats;
import com.chatwarden.moderation.ModerationService;
import com.chatwarden.moderation.ModerationStatus;
import com.chatwarden.policy.ChatPolicy;
import com.chatwarden.violation.Offender;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/admin/chats/{chatId}")
@PreAuthorize("hasAuthority('SCOPE_chatwarden.admin')")
public class AdminApiController {

    static final int MAX_OFFENDERS = 100;
    static final int MAX_AUDIT_PAGE_SIZE = 200;

    private final ModerationService moderationService;

    public AdminApiController(ModerationService moderationService) {
        this.moderationService = moderationService;
    }

    // --- Members ---
    @GetMapping("/members/{identityId}/status")
    public ModerationStatus getStatus(@PathVariable long chatId, @PathVariable long identityId) {
        return moderationService.getStatus(identityId, chatId);
    }

    @PostMapping("/members/{identityId}/pardon")
    public ChangeResponse pardon(@PathVariable long chatId, @PathVariable long identityId) {
        return new ChangeResponse(moderationService.pardon(identityId, chatId));
    }

    @PostMapping("/members/{identityId}/lift")
    public ChangeResponse lift(@PathVariable long chatId, @PathVariable long identityId) {
        return new ChangeResponse(moderationService.liftRestriction(identityId, chatId));
    }

    @GetMapping("/offenders")
    public List<Offender> topOffenders(@PathVariable long chatId,
                                       @RequestParam(defaultValue = "10") int limit) {
        return moderationService.topOffenders(chatId, Math.min(limit, MAX_OFFENDERS));
    }

    // --- Exemptions ---
    @GetMapping("/exemptions")
    public List<Exemption> listExemptions(@PathVariable long chatId) {
        return moderationService.listExemptions(chatId);
    }

    @PutMapping("/exemptions/{identityId}")
    public ChangeResponse grantExemption(@PathVariable long chatId,
                                         @PathVariable long identityId,
                                         @RequestBody(required = false) GrantRequest request) {
        Long grantedBy = request != null ? request.grantedBy() : null;
        return new ChangeResponse(moderationService.grantExemption(identityId, chatId, grantedBy));
    }

    @DeleteMapping("/exemptions/{identityId}")
    public ChangeResponse revokeExemption(@PathVariable long chatId, @PathVariable long identityId) {
        return new ChangeResponse(moderationService.revokeExemption(identityId, chatId));
    }

    // --- Policy ---
    @GetMapping("/policy")
    public ChatPolicy getPolicy(@PathVariable long chatId) {
        return moderationService.getPolicy(chatId);
    }

    @PutMapping("/policy")
    public ChatPolicy setPolicy(@PathVariable long chatId, @Valid @RequestBody PolicyUpdateRequest request) {
        return moderationService.setPolicy(chatId, request.category(), request.field(), request.value());
    }

    // --- History ---
    @GetMapping("/stats")
    public RestrictionStats stats(@PathVariable long chatId,
                                  @RequestParam(defaultValue = "7") int days) {
        return moderationService.restrictionStats(chatId, days);
    }

    @GetMapping("/audit")
    public Page<AuditEvent> auditTrail(@PathVariable long chatId,
                                       @RequestParam(defaultValue = "0") int page,
                                       @RequestParam(defaultValue = "50") int size,
                                       @RequestParam(required = false) String eventType) {
        return moderationService.auditTrail(chatId, eventType, PageRequest.of(page, Math.min(size, MAX_AUDIT_PAGE_SIZE)));
    }

    public record GrantRequest(Long grantedBy) {}

    public record PolicyUpdateRequest(
            @NotBlank String category,
            @NotBlank String field,
            @NotNull Integer value
    ) {}
}
