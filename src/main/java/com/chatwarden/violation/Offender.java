package com.chatwarden.violation;

public record Offender(long identityId, int violationCount) {}
