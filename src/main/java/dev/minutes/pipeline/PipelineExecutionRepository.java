package dev.minutes.pipeline;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

/** Spring Data repository for {@link PipelineExecution} entities. */
public interface PipelineExecutionRepository extends JpaRepository<PipelineExecution, UUID> {

  /** Ids of unleased executions in {@code states} whose next attempt is due. */
  @Query(
      """
      SELECT e.id FROM PipelineExecution e
      WHERE e.state IN :states AND e.nextAttemptAt <= :now
        AND (e.leaseUntil IS NULL OR e.leaseUntil < :now)
      ORDER BY e.nextAttemptAt
      """)
  List<UUID> findDue(
      @Param("states") Collection<PipelineState> states,
      @Param("now") Instant now,
      Pageable pageable);

  /**
   * Reserves an execution for one step. Only one caller can win the lease while it is valid.
   *
   * @return 1 if the lease was acquired, 0 otherwise
   */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Transactional
  @Query(
      """
      UPDATE PipelineExecution e SET e.leaseUntil = :leaseUntil
      WHERE e.id = :id AND (e.leaseUntil IS NULL OR e.leaseUntil < :now)
      """)
  int claim(
      @Param("id") UUID id, @Param("now") Instant now, @Param("leaseUntil") Instant leaseUntil);

  boolean existsByTenantIdAndSessionId(String tenantId, String sessionId);

  List<PipelineExecution> findByTenantIdAndSessionIdOrderByCreatedAtDesc(
      String tenantId, String sessionId);
}
