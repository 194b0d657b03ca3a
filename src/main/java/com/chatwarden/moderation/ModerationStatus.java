package com.chatwarden.moderation;

/**
 * Member standing in one chat. {@code remainingMinutes} is null when not restricted.
 */
public record ModerationStatus(
        long identityId,
        long chatId,
        int violationCount,
        boolean restricted,
        Integer remainingMinutes,
        boolean exempt
) {}
