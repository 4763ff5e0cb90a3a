package dev.minutes.session;

import java.time.Instant;
import org.jspecify.annotations.Nullable;

/** Immutable snapshot of a {@link RecordingSession} row. */
public record SessionRecord(
    String tenantId,
    String sessionId,
    @Nullable Integer expectedSegmentCount,
    @Nullable Integer totalDurationSeconds,
    SessionStatus status,
    @Nullable String executionHandle,
    @Nullable String videoLocation,
    @Nullable String audioLocation,
    @Nullable String transcriptLocation,
    @Nullable String summaryLocation,
    @Nullable String missingIndices,
    @Nullable String errorDetail,
    @Nullable String pipelineVersion,
    @Nullable Instant completedAt,
    Instant createdAt,
    Instant updatedAt) {

  static SessionRecord from(RecordingSession session) {
    return new SessionRecord(
        session.getTenantId(),
        session.getSessionId(),
        session.getExpectedSegmentCount(),
        session.getTotalDurationSeconds(),
        session.getStatus(),
        session.getExecutionHandle(),
        session.getVideoLocation(),
        session.getAudioLocation(),
        session.getTranscriptLocation(),
        session.getSummaryLocation(),
        session.getMissingIndices(),
        session.getErrorDetail(),
        session.getPipelineVersion(),
        session.getCompletedAt(),
        session.getCreatedAt(),
        session.getUpdatedAt());
  }
}
