package dev.minutes.segment;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.UUID;

/**
 * One uploaded chunk of a recording session.
 *
 * <p>Identity is {@code (tenant_id, session_id, chunk_index)}, enforced by a unique constraint.
 * Rows are written once through {@link SegmentRepository#insertIfAbsent} and never updated; a
 * redelivered notification for the same index leaves the first row untouched.
 *
 * <p>Maps to the {@code segments} table managed by Flyway migrations.
 */
@Entity
@Table(
    name = "segments",
    uniqueConstraints = @UniqueConstraint(columnNames = {"tenant_id", "session_id", "chunk_index"}))
public class Segment {

  @Id private UUID id;

  @Column(name = "tenant_id", nullable = false, updatable = false)
  private String tenantId;

  @Column(name = "session_id", nullable = false, updatable = false)
  private String sessionId;

  @Column(name = "chunk_index", nullable = false, updatable = false)
  private int chunkIndex;

  @Column(name = "storage_ref", nullable = false, updatable = false)
  private String storageRef;

  @Column(name = "byte_size", nullable = false, updatable = false)
  private long byteSize;

  @Column(name = "integrity_tag", updatable = false)
  private String integrityTag;

  @Column(name = "uploaded_at", nullable = false, updatable = false)
  private Instant uploadedAt;

  @Enumerated(EnumType.STRING)
  @Column(name = "validation_state", nullable = false, updatable = false)
  private ValidationState validationState;

  @Column(name = "expires_at", nullable = false, updatable = false)
  private Instant expiresAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Segment() {
    // JPA requires no-arg constructor
  }

  public Segment(
      String tenantId,
      String sessionId,
      int chunkIndex,
      String storageRef,
      long byteSize,
      String integrityTag,
      Instant uploadedAt,
      Instant expiresAt) {
    this.id = UUID.randomUUID();
    this.tenantId = tenantId;
    this.sessionId = sessionId;
    this.chunkIndex = chunkIndex;
    this.storageRef = storageRef;
    this.byteSize = byteSize;
    this.integrityTag = integrityTag;
    this.uploadedAt = uploadedAt;
    this.validationState = ValidationState.VALIDATED;
    this.expiresAt = expiresAt;
  }

  @PrePersist
  protected void onCreate() {
    this.createdAt = Instant.now();
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

  public int getChunkIndex() {
    return chunkIndex;
  }

  public String getStorageRef() {
    return storageRef;
  }

  public long getByteSize() {
    return byteSize;
  }

  public String getIntegrityTag() {
    return integrityTag;
  }

  public Instant getUploadedAt() {
    return uploadedAt;
  }

  public ValidationState getValidationState() {
    return validationState;
  }

  public Instant getExpiresAt() {
    return expiresAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
