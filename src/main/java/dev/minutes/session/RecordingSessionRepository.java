package dev.minutes.session;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

/** Spring Data repository for {@link RecordingSession} entities. */
public interface RecordingSessionRepository extends JpaRepository<RecordingSession, UUID> {

  Optional<RecordingSession> findByTenantIdAndSessionId(String tenantId, String sessionId);

  List<RecordingSession> findByStatusAndUpdatedAtBefore(SessionStatus status, Instant updatedAt);

  /**
   * Creates a {@code PENDING} session row unless one already exists for the identity.
   *
   * @return 1 if created, 0 if the session already existed
   */
  @Modifying
  @Transactional
  @Query(
      value =
          """
            INSERT INTO recording_sessions (id, tenant_id, session_id, status, created_at, updated_at)
            VALUES (:id, :tenantId, :sessionId, 'PENDING', :now, :now)
            ON CONFLICT (tenant_id, session_id) DO NOTHING
            """,
      nativeQuery = true)
  int insertIfAbsent(
      @Param("id") UUID id,
      @Param("tenantId") String tenantId,
      @Param("sessionId") String sessionId,
      @Param("now") Instant now);

  /**
   * Sets the declared chunk count while the session is still revisable, or when no count was
   * declared yet.
   *
   * @return number of rows updated (0 or 1)
   */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Transactional
  @Query(
      """
      UPDATE RecordingSession s
      SET s.expectedSegmentCount = :expectedCount,
          s.totalDurationSeconds = :totalDurationSeconds,
          s.declaredAt = :declaredAt,
          s.updatedAt = :now
      WHERE s.tenantId = :tenantId AND s.sessionId = :sessionId
        AND (s.expectedSegmentCount IS NULL OR s.status IN :revisable)
      """)
  int updateDeclaration(
      @Param("tenantId") String tenantId,
      @Param("sessionId") String sessionId,
      @Param("expectedCount") int expectedCount,
      @Param("totalDurationSeconds") Integer totalDurationSeconds,
      @Param("declaredAt") Instant declaredAt,
      @Param("now") Instant now,
      @Param("revisable") Collection<SessionStatus> revisable);

  /**
   * Compare-and-swap on the session status. The update applies only if the current status is one
   * of {@code from}; the returned row count is the only race signal.
   *
   * @return 1 if the transition was applied, 0 otherwise
   */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Transactional
  @Query(
      """
      UPDATE RecordingSession s
      SET s.status = :to,
          s.errorDetail = :errorDetail,
          s.missingIndices = :missingIndices,
          s.updatedAt = :now
      WHERE s.tenantId = :tenantId AND s.sessionId = :sessionId AND s.status IN :from
      """)
  int compareAndSetStatus(
      @Param("tenantId") String tenantId,
      @Param("sessionId") String sessionId,
      @Param("from") Collection<SessionStatus> from,
      @Param("to") SessionStatus to,
      @Param("errorDetail") String errorDetail,
      @Param("missingIndices") String missingIndices,
      @Param("now") Instant now);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Transactional
  @Query(
      """
      UPDATE RecordingSession s SET s.videoLocation = :location, s.updatedAt = :now
      WHERE s.tenantId = :tenantId AND s.sessionId = :sessionId
      """)
  int updateVideoLocation(
      @Param("tenantId") String tenantId,
      @Param("sessionId") String sessionId,
      @Param("location") String location,
      @Param("now") Instant now);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Transactional
  @Query(
      """
      UPDATE RecordingSession s SET s.audioLocation = :location, s.updatedAt = :now
      WHERE s.tenantId = :tenantId AND s.sessionId = :sessionId
      """)
  int updateAudioLocation(
      @Param("tenantId") String tenantId,
      @Param("sessionId") String sessionId,
      @Param("location") String location,
      @Param("now") Instant now);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Transactional
  @Query(
      """
      UPDATE RecordingSession s SET s.transcriptLocation = :location, s.updatedAt = :now
      WHERE s.tenantId = :tenantId AND s.sessionId = :sessionId
      """)
  int updateTranscriptLocation(
      @Param("tenantId") String tenantId,
      @Param("sessionId") String sessionId,
      @Param("location") String location,
      @Param("now") Instant now);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Transactional
  @Query(
      """
      UPDATE RecordingSession s SET s.summaryLocation = :location, s.updatedAt = :now
      WHERE s.tenantId = :tenantId AND s.sessionId = :sessionId
      """)
  int updateSummaryLocation(
      @Param("tenantId") String tenantId,
      @Param("sessionId") String sessionId,
      @Param("location") String location,
      @Param("now") Instant now);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Transactional
  @Query(
      """
      UPDATE RecordingSession s SET s.executionHandle = :handle, s.updatedAt = :now
      WHERE s.tenantId = :tenantId AND s.sessionId = :sessionId
      """)
  int updateExecutionHandle(
      @Param("tenantId") String tenantId,
      @Param("sessionId") String sessionId,
      @Param("handle") String handle,
      @Param("now") Instant now);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Transactional
  @Query(
      """
      UPDATE RecordingSession s
      SET s.completedAt = :completedAt, s.pipelineVersion = :pipelineVersion, s.updatedAt = :now
      WHERE s.tenantId = :tenantId AND s.sessionId = :sessionId
      """)
  int updateCompletion(
      @Param("tenantId") String tenantId,
      @Param("sessionId") String sessionId,
      @Param("completedAt") Instant completedAt,
      @Param("pipelineVersion") String pipelineVersion,
      @Param("now") Instant now);
}
