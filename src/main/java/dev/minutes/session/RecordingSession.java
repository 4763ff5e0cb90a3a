package dev.minutes.session;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.UUID;

/**
 * Session-level state of one recording.
 *
 * <p>The {@code status} column is only ever written through the compare-and-swap queries in
 * {@link RecordingSessionRepository}; artifact and handle columns are written with targeted blind
 * updates that leave {@code status} alone.
 *
 * <p>Maps to the {@code recording_sessions} table managed by Flyway migrations.
 *
 * @see SessionStatus
 */
@Entity
@Table(
    name = "recording_sessions",
    uniqueConstraints = @UniqueConstraint(columnNames = {"tenant_id", "session_id"}))
public class RecordingSession {

  @Id private UUID id;

  @Column(name = "tenant_id", nullable = false, updatable = false)
  private String tenantId;

  @Column(name = "session_id", nullable = false, updatable = false)
  private String sessionId;

  @Column(name = "expected_segment_count")
  private Integer expectedSegmentCount;

  @Column(name = "total_duration_seconds")
  private Integer totalDurationSeconds;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private SessionStatus status = SessionStatus.PENDING;

  @Column(name = "execution_handle")
  private String executionHandle;

  @Column(name = "video_location")
  private String videoLocation;

  @Column(name = "audio_location")
  private String audioLocation;

  @Column(name = "transcript_location")
  private String transcriptLocation;

  @Column(name = "summary_location")
  private String summaryLocation;

  @Column(name = "missing_indices")
  private String missingIndices;

  @Column(name = "error_detail")
  private String errorDetail;

  @Column(name = "pipeline_version")
  private String pipelineVersion;

  @Column(name = "completed_at")
  private Instant completedAt;

  @Column(name = "declared_at")
  private Instant declaredAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected RecordingSession() {
    // JPA requires no-arg constructor
  }

  public RecordingSession(String tenantId, String sessionId) {
    this.id = UUID.randomUUID();
    this.tenantId = tenantId;
    this.sessionId = sessionId;
  }

  @PrePersist
  protected void onCreate() {
    this.createdAt = Instant.now();
    this.updatedAt = this.createdAt;
  }

  @PreUpdate
  protected void onUpdate() {
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getTenantId() {
    return tenantId;
  }

  public String getSessionId() {
    return sessionId;
  }

  public Integer getExpectedSegmentCount() {
    return expectedSegmentCount;
  }

  public void setExpectedSegmentCount(Integer expectedSegmentCount) {
    this.expectedSegmentCount = expectedSegmentCount;
  }

  public Integer getTotalDurationSeconds() {
    return totalDurationSeconds;
  }

  public void setTotalDurationSeconds(Integer totalDurationSeconds) {
    this.totalDurationSeconds = totalDurationSeconds;
  }

  public SessionStatus getStatus() {
    return status;
  }

  public String getExecutionHandle() {
    return executionHandle;
  }

  public String getVideoLocation() {
    return videoLocation;
  }

  public String getAudioLocation() {
    return audioLocation;
  }

  public String getTranscriptLocation() {
    return transcriptLocation;
  }

  public String getSummaryLocation() {
    return summaryLocation;
  }

  public String getMissingIndices() {
    return missingIndices;
  }

  public String getErrorDetail() {
    return errorDetail;
  }

  public String getPipelineVersion() {
    return pipelineVersion;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }

  public Instant getDeclaredAt() {
    return declaredAt;
  }

  public void setDeclaredAt(Instant declaredAt) {
    this.declaredAt = declaredAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
