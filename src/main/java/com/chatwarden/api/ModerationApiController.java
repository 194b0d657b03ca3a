package com.chatwarden.api;

import com.chatwarden.moderation.ModerationService;
import com.chatwarden.moderation.Verdict;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.springframework.web.bind.annotation.*;

/**
 * Endpoints called by the chat-platform adapter for every triaged content event.
 * Platform administrators are filtered out by the adapter before it calls here.
 */
@RestController
@RequestMapping("/api/moderation")
public class ModerationApiController {

    private final ModerationService moderationService;

    public ModerationApiController(ModerationService moderationService) {
        this.moderationService = moderationService;
    }

    @PostMapping("/events")
    public EventResponse evaluate(@Valid @RequestBody EventRequest request) {
        Verdict verdict = moderationService.evaluate(
                request.identityId(), request.chatId(), request.category(), request.fingerprint());
        return EventResponse.from(verdict);
    }

    @PostMapping("/enforcement-failures")
    public ChangeResponse enforcementFailed(@Valid @RequestBody EnforcementFailureRequest request) {
        return new ChangeResponse(moderationService.reportEnforcementFailure(
                request.identityId(), request.chatId(), request.detail()));
    }

    public record EventRequest(
            @NotNull Long identityId,
            @NotNull Long chatId,
            @NotBlank String category,
            @Size(max = 65536) String fingerprint
    ) {}

    public record EventResponse(
            String outcome,
            long count,
            int threshold,
            Integer ordinal,
            Integer durationMinutes,
            boolean deleteContent
    ) {
        static EventResponse from(Verdict verdict) {
            boolean restricted = verdict.outcome() == Verdict.Outcome.RESTRICT;
            return new EventResponse(
                    verdict.outcome().name(),
                    verdict.count(),
                    verdict.threshold(),
                    restricted ? verdict.ordinal() : null,
                    restricted ? verdict.durationMinutes() : null,
                    verdict.deleteContent());
        }
    }

    public record EnforcementFailureRequest(
            @NotNull Long identityId,
            @NotNull Long chatId,
            @Size(max = 512) String detail
    ) {}
}
