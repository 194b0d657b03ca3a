package com.chatwarden.api;

/**
 * Result of a mutation that may find nothing to change.
 */
public record ChangeResponse(boolean changed) {}
