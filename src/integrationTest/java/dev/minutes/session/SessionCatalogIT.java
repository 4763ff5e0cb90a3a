package dev.minutes.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.minutes.BaseIntegrationTest;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class SessionCatalogIT extends BaseIntegrationTest {

  @Autowired private SessionCatalog sessionCatalog;

  private SessionRecord declare(int expected) {
    return sessionCatalog.declareSession(new SessionDeclaration("u1", "r1", expected, null, null));
  }

  @Test
  void declarationCreatesPendingSession() {
    SessionRecord record = declare(3);

    assertThat(record.status()).isEqualTo(SessionStatus.PENDING);
    assertThat(sessionCatalog.getExpectedCount("u1", "r1")).hasValue(3);
    assertThat(sessionCatalog.getExpectedCount("u1", "unknown")).isEmpty();
  }

  @Test
  void declarationCanBeRevisedBeforeDispatch() {
    declare(3);

    assertThat(declare(5).expectedSegmentCount()).isEqualTo(5);
  }

  @Test
  void changingCountAfterDispatchConflicts() {
    declare(3);
    sessionCatalog.transitionStatus(
        "u1", "r1", SessionStatus.NOT_DISPATCHED, SessionStatus.READY, TransitionExtras.none());

    assertThatThrownBy(() -> declare(4)).isInstanceOf(SessionDeclarationConflictException.class);
    assertThat(declare(3).status()).isEqualTo(SessionStatus.READY);
  }

  @Test
  void concurrentReadyTransitionsApplyOnce() throws Exception {
    declare(2);
    ExecutorService pool = Executors.newFixedThreadPool(8);
    try {
      List<Callable<Boolean>> calls = new ArrayList<>();
      for (int i = 0; i < 8; i++) {
        calls.add(
            () ->
                sessionCatalog
                    .transitionStatus(
                        "u1",
                        "r1",
                        SessionStatus.NOT_DISPATCHED,
                        SessionStatus.READY,
                        TransitionExtras.none())
                    .applied());
      }
      int applied = 0;
      for (Future<Boolean> future : pool.invokeAll(calls)) {
        if (future.get()) {
          applied++;
        }
      }
      assertThat(applied).isEqualTo(1);
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void missingIndicesAreClearedOnReady() {
    declare(3);
    sessionCatalog.transitionStatus(
        "u1",
        "r1",
        EnumSet.of(SessionStatus.PENDING),
        SessionStatus.INCOMPLETE,
        TransitionExtras.missing(List.of(1, 2)));
    assertThat(sessionCatalog.findSession("u1", "r1").orElseThrow().missingIndices())
        .isEqualTo("1,2");

    sessionCatalog.transitionStatus(
        "u1", "r1", SessionStatus.NOT_DISPATCHED, SessionStatus.READY, TransitionExtras.none());

    SessionRecord record = sessionCatalog.findSession("u1", "r1").orElseThrow();
    assertThat(record.status()).isEqualTo(SessionStatus.READY);
    assertThat(record.missingIndices()).isNull();
  }

  @Test
  void failedSessionStaysFailed() {
    declare(1);
    sessionCatalog.transitionStatus(
        "u1", "r1", SessionStatus.NOT_DISPATCHED, SessionStatus.READY, TransitionExtras.none());
    sessionCatalog.transitionStatus(
        "u1",
        "r1",
        EnumSet.of(SessionStatus.READY),
        SessionStatus.FAILED,
        TransitionExtras.error("VALIDATION_ERROR: chunk 0 missing"));

    TransitionResult result =
        sessionCatalog.transitionStatus(
            "u1",
            "r1",
            EnumSet.of(SessionStatus.READY),
            SessionStatus.VALIDATING,
            TransitionExtras.none());

    assertThat(result.applied()).isFalse();
    SessionRecord record = sessionCatalog.findSession("u1", "r1").orElseThrow();
    assertThat(record.status()).isEqualTo(SessionStatus.FAILED);
    assertThat(record.errorDetail()).isEqualTo("VALIDATION_ERROR: chunk 0 missing");
  }

  @Test
  void artifactsAndCompletionAreRecorded() {
    declare(1);
    sessionCatalog.recordArtifact(
        "u1", "r1", ArtifactKind.VIDEO, "s3://recordings/users/u1/videos/r1.mp4");
    sessionCatalog.recordExecutionHandle("u1", "r1", "exec-1");
    Instant completedAt = Instant.parse("2026-03-01T11:00:00Z");
    sessionCatalog.recordCompletion("u1", "r1", completedAt, "1.0.0");

    SessionRecord record = sessionCatalog.findSession("u1", "r1").orElseThrow();
    assertThat(record.videoLocation()).isEqualTo("s3://recordings/users/u1/videos/r1.mp4");
    assertThat(record.executionHandle()).isEqualTo("exec-1");
    assertThat(record.completedAt()).isEqualTo(completedAt);
    assertThat(record.pipelineVersion()).isEqualTo("1.0.0");
    assertThat(record.status()).isEqualTo(SessionStatus.PENDING);
  }
}
