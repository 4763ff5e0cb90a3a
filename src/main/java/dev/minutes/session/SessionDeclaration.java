package dev.minutes.session;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.time.Instant;
import org.jspecify.annotations.Nullable;

/**
 * A client's statement of how many chunks a recording consists of.
 *
 * @param tenantId owning tenant
 * @param sessionId recording session
 * @param expectedSegmentCount number of chunks the client will upload, bounded by the three-digit
 *     chunk index of the upload key
 * @param totalDurationSeconds recording length, if known
 * @param createdAt client-side creation time of the recording
 */
public record SessionDeclaration(
    @NotBlank String tenantId,
    @NotBlank String sessionId,
    @Positive @Max(1000) int expectedSegmentCount,
    @Nullable @Positive Integer totalDurationSeconds,
    @Nullable Instant createdAt) {}
