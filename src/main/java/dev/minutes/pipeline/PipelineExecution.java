package dev.minutes.pipeline;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.UUID;

/**
 * A persisted, resumable run of the post-processing pipeline for one session.
 *
 * <p>The scheduler claims due rows with a short lease, runs one stage and stores the outcome.
 * Waits are expressed as a future {@code next_attempt_at}, never as a blocked thread. The row id
 * is the execution handle recorded on the session.
 *
 * <p>Maps to the {@code pipeline_executions} table managed by Flyway migrations.
 */
@Entity
@Table(name = "pipeline_executions")
public class PipelineExecution {

  @Id private UUID id;

  @Column(name = "tenant_id", nullable = false, updatable = false)
  private String tenantId;

  @Column(name = "session_id", nullable = false, updatable = false)
  private String sessionId;

  @Column(name = "start_payload", nullable = false, updatable = false)
  private String startPayload;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private PipelineState state = PipelineState.VALIDATING;

  @Column(nullable = false)
  private int attempt;

  @Column(name = "next_attempt_at", nullable = false)
  private Instant nextAttemptAt;

  @Column(name = "lease_until")
  private Instant leaseUntil;

  @Column(name = "video_location")
  private String videoLocation;

  @Column(name = "audio_location")
  private String audioLocation;

  @Column(name = "transcription_job")
  private String transcriptionJob;

  @Column(name = "transcript_location")
  private String transcriptLocation;

  @Column(name = "summary_location")
  private String summaryLocation;

  @Column(name = "awaiting_since")
  private Instant awaitingSince;

  @Column(name = "poll_count", nullable = false)
  private int pollCount;

  @Enumerated(EnumType.STRING)
  @Column(name = "failure_kind")
  private FailureKind failureKind;

  @Column(name = "failure_detail")
  private String failureDetail;

  @Version private Long version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected PipelineExecution() {
    // JPA requires no-arg constructor
  }

  /**
   * Creates an execution in {@link PipelineState#VALIDATING}, due immediately.
   *
   * @param tenantId owning tenant
   * @param sessionId recording session
   * @param startPayload JSON-serialized {@link PipelineStartRequest}
   * @param now creation time
   */
  public PipelineExecution(String tenantId, String sessionId, String startPayload, Instant now) {
    this.id = UUID.randomUUID();
    this.tenantId = tenantId;
    this.sessionId = sessionId;
    this.startPayload = startPayload;
    this.nextAttemptAt = now;
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

  /** Rebuilds the stage context from the stored columns. */
  public PipelineContext toContext(PipelineStartRequest request) {
    return new PipelineContext(
        request,
        videoLocation,
        audioLocation,
        transcriptionJob,
        awaitingSince,
        pollCount,
        transcriptLocation,
        summaryLocation);
  }

  /** Moves to {@code next}, storing the advanced context and resetting the attempt counter. */
  public void advance(PipelineState next, PipelineContext context, Instant now) {
    storeContext(context);
    this.state = next;
    this.attempt = 0;
    this.nextAttemptAt = now;
    this.leaseUntil = null;
  }

  /** Stays in the current state and runs again at {@code dueAt}. */
  public void waitUntil(PipelineContext context, Instant dueAt) {
    storeContext(context);
    this.nextAttemptAt = dueAt;
    this.leaseUntil = null;
  }

  /** Records a retryable failure and schedules the next attempt. */
  public void retryAt(FailureKind kind, String detail, Instant dueAt) {
    this.attempt++;
    this.failureKind = kind;
    this.failureDetail = detail;
    this.nextAttemptAt = dueAt;
    this.leaseUntil = null;
  }

  /** Ends the execution in {@link PipelineState#FAILED}. */
  public void fail(FailureKind kind, String detail) {
    this.state = PipelineState.FAILED;
    this.failureKind = kind;
    this.failureDetail = detail;
    this.leaseUntil = null;
  }

  /** Releases the lease without changing anything else. */
  public void release() {
    this.leaseUntil = null;
  }

  private void storeContext(PipelineContext context) {
    this.videoLocation = context.videoLocation();
    this.audioLocation = context.audioLocation();
    this.transcriptionJob = context.transcriptionJob();
    this.awaitingSince = context.awaitingSince();
    this.pollCount = context.pollCount();
    this.transcriptLocation = context.transcriptLocation();
    this.summaryLocation = context.summaryLocation();
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

  public String getStartPayload() {
    return startPayload;
  }

  public PipelineState getState() {
    return state;
  }

  public int getAttempt() {
    return attempt;
  }

  public Instant getNextAttemptAt() {
    return nextAttemptAt;
  }

  public Instant getLeaseUntil() {
    return leaseUntil;
  }

  public String getTranscriptionJob() {
    return transcriptionJob;
  }

  public int getPollCount() {
    return pollCount;
  }

  public FailureKind getFailureKind() {
    return failureKind;
  }

  public String getFailureDetail() {
    return failureDetail;
  }

  public Long getVersion() {
    return version;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
