package dev.minutes.session;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** {@link SessionCatalog} backed by PostgreSQL conditional updates. */
@Service
public class JpaSessionCatalog implements SessionCatalog {

  private static final Logger log = LoggerFactory.getLogger(JpaSessionCatalog.class);

  private final RecordingSessionRepository repository;
  private final Clock clock;

  public JpaSessionCatalog(RecordingSessionRepository repository, Clock clock) {
    this.repository = repository;
    this.clock = clock;
  }

  @Override
  @Transactional
  public SessionRecord declareSession(SessionDeclaration declaration) {
    String tenantId = declaration.tenantId();
    String sessionId = declaration.sessionId();
    Instant now = clock.instant();

    if (repository.insertIfAbsent(UUID.randomUUID(), tenantId, sessionId, now) == 1) {
      log.info("Created session {}/{}", tenantId, sessionId);
    }

    int updated =
        repository.updateDeclaration(
            tenantId,
            sessionId,
            declaration.expectedSegmentCount(),
            declaration.totalDurationSeconds(),
            declaration.createdAt() != null ? declaration.createdAt() : now,
            now,
            SessionStatus.REVISABLE);

    RecordingSession session = load(tenantId, sessionId);
    if (updated == 0
        && !Objects.equals(session.getExpectedSegmentCount(), declaration.expectedSegmentCount())) {
      throw new SessionDeclarationConflictException(
          "Session "
              + tenantId
              + "/"
              + sessionId
              + " is already "
              + session.getStatus()
              + " with "
              + session.getExpectedSegmentCount()
              + " expected segments");
    }
    log.info(
        "Declared session {}/{} with {} expected segments",
        tenantId,
        sessionId,
        session.getExpectedSegmentCount());
    return SessionRecord.from(session);
  }

  @Override
  public OptionalInt getExpectedCount(String tenantId, String sessionId) {
    return repository
        .findByTenantIdAndSessionId(tenantId, sessionId)
        .map(RecordingSession::getExpectedSegmentCount)
        .filter(Objects::nonNull)
        .map(OptionalInt::of)
        .orElse(OptionalInt.empty());
  }

  @Override
  public TransitionResult transitionStatus(
      String tenantId,
      String sessionId,
      Set<SessionStatus> from,
      SessionStatus to,
      TransitionExtras extras) {
    SessionStatus.requireLegalTransition(from, to);
    int updated =
        repository.compareAndSetStatus(
            tenantId,
            sessionId,
            from,
            to,
            extras.errorDetail(),
            extras.missingIndices(),
            clock.instant());
    if (updated == 0) {
      log.debug("Transition {} -> {} not applied for {}/{}", from, to, tenantId, sessionId);
      return new TransitionResult(false);
    }
    log.info("Session {}/{} -> {}", tenantId, sessionId, to);
    return new TransitionResult(true);
  }

  @Override
  public void recordArtifact(
      String tenantId, String sessionId, ArtifactKind kind, String location) {
    Instant now = clock.instant();
    switch (kind) {
      case VIDEO -> repository.updateVideoLocation(tenantId, sessionId, location, now);
      case AUDIO -> repository.updateAudioLocation(tenantId, sessionId, location, now);
      case TRANSCRIPT -> repository.updateTranscriptLocation(tenantId, sessionId, location, now);
      case SUMMARY -> repository.updateSummaryLocation(tenantId, sessionId, location, now);
    }
  }

  @Override
  public void recordExecutionHandle(String tenantId, String sessionId, String handle) {
    repository.updateExecutionHandle(tenantId, sessionId, handle, clock.instant());
  }

  @Override
  public void recordCompletion(
      String tenantId, String sessionId, Instant completedAt, String pipelineVersion) {
    repository.updateCompletion(tenantId, sessionId, completedAt, pipelineVersion, clock.instant());
  }

  @Override
  public Optional<SessionRecord> findSession(String tenantId, String sessionId) {
    return repository.findByTenantIdAndSessionId(tenantId, sessionId).map(SessionRecord::from);
  }

  @Override
  public List<SessionKey> findStale(SessionStatus status, Instant olderThan) {
    return repository.findByStatusAndUpdatedAtBefore(status, olderThan).stream()
        .map(session -> new SessionKey(session.getTenantId(), session.getSessionId()))
        .toList();
  }

  private RecordingSession load(String tenantId, String sessionId) {
    return repository
        .findByTenantIdAndSessionId(tenantId, sessionId)
        .orElseThrow(() -> new SessionNotFoundException(tenantId, sessionId));
  }
}
