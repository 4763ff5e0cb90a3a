package dev.minutes.intake;

import dev.minutes.completion.CompletionResult;
import org.jspecify.annotations.Nullable;

/**
 * Outcome of handling one upload notification.
 *
 * @param accepted {@code false} when the key was malformed and the notification dropped
 * @param tenantId parsed tenant, if accepted
 * @param sessionId parsed session, if accepted
 * @param chunkIndex parsed index, if accepted
 * @param created whether this notification registered the chunk
 * @param completion completion verdict, or {@code null} if the check failed or did not run
 */
public record IntakeResult(
    boolean accepted,
    @Nullable String tenantId,
    @Nullable String sessionId,
    @Nullable Integer chunkIndex,
    boolean created,
    @Nullable CompletionResult completion) {

  static IntakeResult dropped() {
    return new IntakeResult(false, null, null, null, false, null);
  }
}
