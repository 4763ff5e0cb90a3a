package dev.minutes.segment;

import java.time.Instant;
import org.jspecify.annotations.Nullable;

/**
 * Metadata of one uploaded chunk, as reported by the storage notification.
 *
 * @param tenantId owning tenant
 * @param sessionId recording session
 * @param chunkIndex zero-based chunk position
 * @param storageRef {@code s3://bucket/key} of the object
 * @param byteSize reported object size
 * @param integrityTag reported etag
 * @param uploadedAt event time of the upload
 */
public record SegmentUpload(
    String tenantId,
    String sessionId,
    int chunkIndex,
    String storageRef,
    long byteSize,
    @Nullable String integrityTag,
    Instant uploadedAt) {}
