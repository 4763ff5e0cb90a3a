package dev.minutes.completion;

import dev.minutes.pipeline.PipelineLauncher;
import dev.minutes.session.SessionCatalog;
import dev.minutes.session.SessionKey;
import dev.minutes.session.SessionRecord;
import dev.minutes.session.SessionStatus;
import dev.minutes.session.TransitionExtras;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Re-evaluates sessions whose pipeline could not be started, so none stays stuck.
 *
 * <p>Two cases are recovered: sessions in {@code DISPATCH_FAILED}, and sessions left in {@code
 * READY} without any execution because the rollback after a failed start did not reach the
 * catalog. The latter are moved to {@code DISPATCH_FAILED} first, so the usual READY
 * compare-and-swap still decides who dispatches.
 */
@Component
public class DispatchRecoverySweeper {

  private static final Logger log = LoggerFactory.getLogger(DispatchRecoverySweeper.class);

  private final SessionCatalog sessionCatalog;
  private final CompletionDetector completionDetector;
  private final PipelineLauncher pipelineLauncher;
  private final Clock clock;
  private final Duration minAge;

  public DispatchRecoverySweeper(
      SessionCatalog sessionCatalog,
      CompletionDetector completionDetector,
      PipelineLauncher pipelineLauncher,
      Clock clock,
      @Value("${minutes.dispatch-recovery.min-age-ms}") long minAgeMs) {
    this.sessionCatalog = sessionCatalog;
    this.completionDetector = completionDetector;
    this.pipelineLauncher = pipelineLauncher;
    this.clock = clock;
    this.minAge = Duration.ofMillis(minAgeMs);
  }

  @Scheduled(
      fixedDelayString = "${minutes.dispatch-recovery.interval-ms}",
      initialDelayString = "${minutes.dispatch-recovery.interval-ms}")
  public void sweep() {
    Instant olderThan = clock.instant().minus(minAge);
    for (SessionKey key : sessionCatalog.findStale(SessionStatus.READY, olderThan)) {
      try {
        releaseOrphan(key);
      } catch (RuntimeException e) {
        log.error("Orphan check of {}/{} failed", key.tenantId(), key.sessionId(), e);
      }
    }

    List<SessionKey> stale = sessionCatalog.findStale(SessionStatus.DISPATCH_FAILED, olderThan);
    for (SessionKey key : stale) {
      try {
        CompletionResult result = completionDetector.evaluate(key.tenantId(), key.sessionId());
        log.info(
            "Re-dispatch of {}/{}: {}", key.tenantId(), key.sessionId(), result.reason());
      } catch (RuntimeException e) {
        log.error("Re-dispatch of {}/{} failed", key.tenantId(), key.sessionId(), e);
      }
    }
  }

  private void releaseOrphan(SessionKey key) {
    SessionRecord session =
        sessionCatalog.findSession(key.tenantId(), key.sessionId()).orElse(null);
    if (session == null
        || session.executionHandle() != null
        || pipelineLauncher.hasExecution(key.tenantId(), key.sessionId())) {
      return;
    }
    boolean applied =
        sessionCatalog
            .transitionStatus(
                key.tenantId(),
                key.sessionId(),
                EnumSet.of(SessionStatus.READY),
                SessionStatus.DISPATCH_FAILED,
                TransitionExtras.error("DISPATCH_ERROR: no pipeline execution was started"))
            .applied();
    if (applied) {
      log.warn(
          "Session {}/{} was READY without a pipeline execution, queued for re-dispatch",
          key.tenantId(),
          key.sessionId());
    }
  }
}
