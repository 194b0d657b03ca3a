package com.chatwarden.policy;

public record CategoryLimits(int threshold, int windowSeconds) {}
