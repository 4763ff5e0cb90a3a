package dev.minutes.intake;

/**
 * Identity parsed from a chunk object key.
 *
 * @param tenantId owning tenant
 * @param sessionId recording session
 * @param chunkIndex zero-based chunk position
 */
public record ChunkKey(String tenantId, String sessionId, int chunkIndex) {}
