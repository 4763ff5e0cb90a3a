package dev.minutes.session;

/** Tenant-qualified session identity. */
public record SessionKey(String tenantId, String sessionId) {}
