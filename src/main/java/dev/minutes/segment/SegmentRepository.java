package dev.minutes.segment;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

/** Spring Data repository for {@link Segment} entities. */
public interface SegmentRepository extends JpaRepository<Segment, UUID> {

  /**
   * Inserts a validated segment unless a row with the same identity already exists.
   *
   * @return 1 if the row was inserted, 0 if the identity was already registered
   */
  @Modifying
  @Transactional
  @Query(
      value =
          """
            INSERT INTO segments (id, tenant_id, session_id, chunk_index, storage_ref, byte_size,
                                  integrity_tag, uploaded_at, validation_state, expires_at, created_at)
            VALUES (:id, :tenantId, :sessionId, :chunkIndex, :storageRef, :byteSize,
                    :integrityTag, :uploadedAt, 'VALIDATED', :expiresAt, :createdAt)
            ON CONFLICT (tenant_id, session_id, chunk_index) DO NOTHING
            """,
      nativeQuery = true)
  int insertIfAbsent(
      @Param("id") UUID id,
      @Param("tenantId") String tenantId,
      @Param("sessionId") String sessionId,
      @Param("chunkIndex") int chunkIndex,
      @Param("storageRef") String storageRef,
      @Param("byteSize") long byteSize,
      @Param("integrityTag") String integrityTag,
      @Param("uploadedAt") Instant uploadedAt,
      @Param("expiresAt") Instant expiresAt,
      @Param("createdAt") Instant createdAt);

  Optional<Segment> findByTenantIdAndSessionIdAndChunkIndex(
      String tenantId, String sessionId, int chunkIndex);

  /**
   * Returns one page of validated chunk indices for a session, ordered by index.
   *
   * @param pageable page request; callers walk pages until {@link Slice#hasNext()} is false
   */
  @Query(
      """
      SELECT s.chunkIndex FROM Segment s
      WHERE s.tenantId = :tenantId AND s.sessionId = :sessionId
        AND s.validationState = dev.minutes.segment.ValidationState.VALIDATED
      ORDER BY s.chunkIndex
      """)
  Slice<Integer> findValidatedIndices(
      @Param("tenantId") String tenantId,
      @Param("sessionId") String sessionId,
      Pageable pageable);

  List<Segment> findByTenantIdAndSessionIdAndValidationStateOrderByChunkIndexAsc(
      String tenantId, String sessionId, ValidationState validationState);

  /**
   * Deletes segments whose retention period has elapsed.
   *
   * @return number of rows removed
   */
  @Modifying
  @Transactional
  @Query("DELETE FROM Segment s WHERE s.expiresAt < :now")
  int deleteExpired(@Param("now") Instant now);
}
