package dev.minutes.intake;

import jakarta.validation.constraints.NotBlank;
import java.time.Instant;
import org.jspecify.annotations.Nullable;

/**
 * An object-created event from storage. Delivered at least once, in any order.
 *
 * @param bucket bucket of the new object
 * @param objectKey key of the new object, possibly URL-encoded
 * @param objectSize size in bytes
 * @param etag entity tag of the object
 * @param eventTimestamp time of the upload
 */
public record UploadNotification(
    @NotBlank String bucket,
    @NotBlank String objectKey,
    long objectSize,
    @Nullable String etag,
    @Nullable Instant eventTimestamp) {}
