package dev.minutes.session;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Durable record of session-level state.
 *
 * <p>Status changes go exclusively through {@link #transitionStatus}, a compare-and-swap that
 * reports a lost race as {@code applied=false} instead of throwing.
 */
public interface SessionCatalog {

  /**
   * Creates the session if needed and records its expected chunk count.
   *
   * @throws SessionDeclarationConflictException if the count changes after dispatch
   */
  SessionRecord declareSession(SessionDeclaration declaration);

  /** Returns the declared chunk count, or empty if the session has not been declared. */
  OptionalInt getExpectedCount(String tenantId, String sessionId);

  /**
   * Moves the session to {@code to} if its current status is one of {@code from}.
   *
   * @throws IllegalArgumentException if {@code from} is empty or contains a status that is not a
   *     legal predecessor of {@code to}
   */
  TransitionResult transitionStatus(
      String tenantId,
      String sessionId,
      Set<SessionStatus> from,
      SessionStatus to,
      TransitionExtras extras);

  /** Stores the location of a derived artifact. Does not touch the status. */
  void recordArtifact(String tenantId, String sessionId, ArtifactKind kind, String location);

  /** Stores the handle of the pipeline execution started for the session. */
  void recordExecutionHandle(String tenantId, String sessionId, String handle);

  /** Stores completion time and pipeline version ahead of the final status transition. */
  void recordCompletion(
      String tenantId, String sessionId, Instant completedAt, String pipelineVersion);

  Optional<SessionRecord> findSession(String tenantId, String sessionId);

  /** Sessions that have been in {@code status} since before {@code olderThan}. */
  List<SessionKey> findStale(SessionStatus status, Instant olderThan);
}
