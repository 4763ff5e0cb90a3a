package dev.minutes.storage;

import org.jspecify.annotations.Nullable;

/**
 * Result of a HEAD request against object storage.
 *
 * @param byteSize content length in bytes
 * @param etag entity tag reported by the store, without surrounding quotes
 */
public record ObjectMetadata(long byteSize, @Nullable String etag) {}
