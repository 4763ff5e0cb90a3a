package dev.minutes.intake;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import dev.minutes.BaseIntegrationTest;
import dev.minutes.completion.CompletionReason;
import dev.minutes.completion.SessionDeclarationService;
import dev.minutes.pipeline.PipelineExecution;
import dev.minutes.pipeline.PipelineExecutionRepository;
import dev.minutes.pipeline.PipelineState;
import dev.minutes.session.SessionCatalog;
import dev.minutes.session.SessionDeclaration;
import dev.minutes.session.SessionRecord;
import dev.minutes.session.SessionStatus;
import dev.minutes.storage.ObjectMetadata;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class ChunkIntakeIT extends BaseIntegrationTest {

  @Autowired private ChunkIntakeListener intakeListener;

  @Autowired private SessionDeclarationService declarationService;

  @Autowired private SessionCatalog sessionCatalog;

  @Autowired private PipelineExecutionRepository executionRepository;

  @BeforeEach
  void objectsAreReachable() {
    when(objectStore.head(any())).thenReturn(Optional.of(new ObjectMetadata(2048, "etag")));
  }

  private IntakeResult deliver(int index) {
    return intakeListener.onUpload(
        new UploadNotification(
            "recordings",
            String.format("users/u1/chunks/r1/chunk_%03d.mp4", index),
            2048,
            "etag",
            Instant.parse("2026-03-01T10:00:00Z")));
  }

  @Test
  void lastChunkDispatchesExactlyOnePipeline() {
    declarationService.declare("u1", new SessionDeclaration("u1", "r1", 3, 1800, null));

    deliver(2);
    assertThat(deliver(0).completion().reason()).isEqualTo(CompletionReason.MISSING_SEGMENTS);
    deliver(2);
    IntakeResult last = deliver(1);
    IntakeResult late = deliver(1);

    assertThat(last.completion().dispatched()).isTrue();
    assertThat(late.created()).isFalse();
    assertThat(late.completion().reason()).isEqualTo(CompletionReason.ALREADY_DISPATCHED);

    List<PipelineExecution> executions =
        executionRepository.findByTenantIdAndSessionIdOrderByCreatedAtDesc("u1", "r1");
    assertThat(executions).hasSize(1);
    assertThat(executions.get(0).getState()).isEqualTo(PipelineState.VALIDATING);

    SessionRecord session = sessionCatalog.findSession("u1", "r1").orElseThrow();
    assertThat(session.status()).isEqualTo(SessionStatus.READY);
    assertThat(session.executionHandle()).isEqualTo(executions.get(0).getId().toString());
    assertThat(session.missingIndices()).isNull();
  }

  @Test
  void chunksBeforeDeclarationAwaitIt() {
    deliver(0);
    IntakeResult result = deliver(1);

    assertThat(result.completion().reason()).isEqualTo(CompletionReason.AWAITING_DECLARATION);
    assertThat(executionRepository.count()).isZero();

    declarationService.declare("u1", new SessionDeclaration("u1", "r1", 2, null, null));

    assertThat(executionRepository.count()).isEqualTo(1);
    assertThat(sessionCatalog.findSession("u1", "r1").orElseThrow().status())
        .isEqualTo(SessionStatus.READY);
  }

  @Test
  void malformedKeyIsDropped() {
    IntakeResult result =
        intakeListener.onUpload(
            new UploadNotification("recordings", "users/u1/notes.txt", 10, null, null));

    assertThat(result.accepted()).isFalse();
  }
}
