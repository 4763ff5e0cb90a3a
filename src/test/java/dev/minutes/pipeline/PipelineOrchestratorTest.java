package dev.minutes.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.minutes.fixture.InMemorySessionCatalog;
import dev.minutes.fixture.PipelineFixtures;
import dev.minutes.pipeline.stage.FinalizeCatalogStage;
import dev.minutes.pipeline.stage.PollTranscriptionStage;
import dev.minutes.pipeline.stage.StartTranscodeStage;
import dev.minutes.pipeline.stage.StartTranscribeStage;
import dev.minutes.pipeline.stage.SummarizeStage;
import dev.minutes.pipeline.stage.ValidateInputStage;
import dev.minutes.session.SessionRecord;
import dev.minutes.session.SessionStatus;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class PipelineOrchestratorTest {

  private static final String TENANT = PipelineFixtures.TENANT;
  private static final String SESSION = PipelineFixtures.SESSION;

  @Mock private PipelineExecutionRepository repository;

  @Mock private ValidateInputStage validateInputStage;

  @Mock private StartTranscodeStage startTranscodeStage;

  @Mock private StartTranscribeStage startTranscribeStage;

  @Mock private PollTranscriptionStage pollTranscriptionStage;

  @Mock private SummarizeStage summarizeStage;

  @Mock private FinalizeCatalogStage finalizeCatalogStage;

  private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

  private InMemorySessionCatalog catalog;
  private PipelineOrchestrator orchestrator;
  private PipelineExecution execution;

  @BeforeEach
  void setUp() throws Exception {
    catalog = new InMemorySessionCatalog().declare(TENANT, SESSION, 3);
    catalog.forceStatus(TENANT, SESSION, SessionStatus.READY);
    orchestrator =
        new PipelineOrchestrator(
            repository,
            catalog,
            objectMapper,
            PipelineFixtures.properties(),
            Clock.fixed(PipelineFixtures.NOW, ZoneOffset.UTC),
            validateInputStage,
            startTranscodeStage,
            startTranscribeStage,
            pollTranscriptionStage,
            summarizeStage,
            finalizeCatalogStage);
    execution =
        new PipelineExecution(
            TENANT,
            SESSION,
            objectMapper.writeValueAsString(PipelineFixtures.startRequest(3)),
            PipelineFixtures.NOW);
  }

  private void stubClaim() {
    when(repository.claim(eq(execution.getId()), any(), any())).thenReturn(1);
    when(repository.findById(execution.getId())).thenReturn(Optional.of(execution));
  }

  private Optional<PipelineState> step() {
    return orchestrator.step(execution.getId());
  }

  @Test
  void happyPathWalksEveryStateAndMirrorsCatalog() {
    stubClaim();
    when(validateInputStage.execute(any()))
        .thenAnswer(inv -> StageOutcome.advance(inv.getArgument(0)));
    when(startTranscodeStage.execute(any()))
        .thenAnswer(
            inv ->
                StageOutcome.advance(
                    inv.<PipelineContext>getArgument(0)
                        .withMedia("s3://recordings/v.mp4", "s3://recordings/a.wav")));
    when(startTranscribeStage.execute(any()))
        .thenAnswer(
            inv ->
                StageOutcome.waitFor(
                    inv.<PipelineContext>getArgument(0)
                        .withTranscriptionJob("job-1", PipelineFixtures.NOW),
                    Duration.ofSeconds(30)));
    when(pollTranscriptionStage.execute(any()))
        .thenAnswer(
            inv ->
                StageOutcome.advance(
                    inv.<PipelineContext>getArgument(0).withTranscript("s3://recordings/t.json")));
    when(summarizeStage.execute(any()))
        .thenAnswer(
            inv ->
                StageOutcome.advance(
                    inv.<PipelineContext>getArgument(0).withSummary("s3://recordings/s.json")));
    when(finalizeCatalogStage.execute(any()))
        .thenAnswer(inv -> StageOutcome.advance(inv.getArgument(0)));

    assertThat(step()).contains(PipelineState.TRANSCODING);
    assertThat(catalog.status(TENANT, SESSION)).isEqualTo(SessionStatus.TRANSCODING);

    assertThat(step()).contains(PipelineState.AWAITING_TRANSCRIPTION);
    assertThat(catalog.status(TENANT, SESSION)).isEqualTo(SessionStatus.TRANSCRIBING);

    assertThat(step()).contains(PipelineState.AWAITING_TRANSCRIPTION);
    assertThat(execution.getTranscriptionJob()).isEqualTo("job-1");
    assertThat(execution.getNextAttemptAt()).isEqualTo(PipelineFixtures.NOW.plusSeconds(30));

    assertThat(step()).contains(PipelineState.SUMMARIZING);
    assertThat(step()).contains(PipelineState.FINALIZING);
    assertThat(step()).contains(PipelineState.COMPLETED);

    assertThat(catalog.status(TENANT, SESSION)).isEqualTo(SessionStatus.COMPLETED);
    assertThat(catalog.appliedTransitionsTo(SessionStatus.VALIDATING)).isEqualTo(1);
    verify(startTranscribeStage, times(1)).execute(any());
    verify(pollTranscriptionStage, times(1)).execute(any());
    verify(repository, times(6)).save(execution);
  }

  @Test
  void retryableFailureIsRetriedUntilMaxAttemptsThenFails() {
    stubClaim();
    when(validateInputStage.execute(any()))
        .thenAnswer(inv -> StageOutcome.advance(inv.getArgument(0)));
    when(startTranscodeStage.execute(any()))
        .thenReturn(StageOutcome.failure(FailureKind.PROCESSING_ERROR, "ffmpeg exited 1"));
    step();

    assertThat(step()).contains(PipelineState.TRANSCODING);
    assertThat(execution.getAttempt()).isEqualTo(1);
    assertThat(execution.getNextAttemptAt()).isEqualTo(PipelineFixtures.NOW.plusSeconds(1));

    assertThat(step()).contains(PipelineState.TRANSCODING);
    assertThat(execution.getAttempt()).isEqualTo(2);
    assertThat(execution.getNextAttemptAt()).isEqualTo(PipelineFixtures.NOW.plusSeconds(2));

    assertThat(step()).contains(PipelineState.FAILED);
    verify(startTranscodeStage, times(3)).execute(any());
    assertThat(execution.getFailureKind()).isEqualTo(FailureKind.PROCESSING_ERROR);

    SessionRecord session = catalog.findSession(TENANT, SESSION).orElseThrow();
    assertThat(session.status()).isEqualTo(SessionStatus.FAILED);
    assertThat(session.errorDetail()).isEqualTo("PROCESSING_ERROR: ffmpeg exited 1");
  }

  @Test
  void nonRetryableFailureFailsImmediately() {
    stubClaim();
    when(validateInputStage.execute(any()))
        .thenReturn(StageOutcome.failure(FailureKind.VALIDATION_ERROR, "bad prefix"));

    assertThat(step()).contains(PipelineState.FAILED);

    assertThat(catalog.status(TENANT, SESSION)).isEqualTo(SessionStatus.FAILED);
    assertThat(catalog.findSession(TENANT, SESSION).orElseThrow().errorDetail())
        .isEqualTo("VALIDATION_ERROR: bad prefix");
  }

  @Test
  void terminalExecutionIsNeverSteppedAgain() {
    stubClaim();
    when(validateInputStage.execute(any()))
        .thenReturn(StageOutcome.failure(FailureKind.VALIDATION_ERROR, "bad prefix"));
    step();

    assertThat(step()).contains(PipelineState.FAILED);
    assertThat(step()).contains(PipelineState.FAILED);

    verify(validateInputStage, times(1)).execute(any());
    assertThat(catalog.appliedTransitionsTo(SessionStatus.FAILED)).isEqualTo(1);
  }

  @Test
  void lostLeaseSkipsTheStep() {
    when(repository.claim(eq(execution.getId()), any(), any())).thenReturn(0);

    assertThat(step()).isEmpty();

    verify(repository, never()).findById(any());
    verifyNoInteractions(validateInputStage);
  }

  @Test
  void unreadablePayloadFailsValidation() {
    execution = new PipelineExecution(TENANT, SESSION, "{not json", PipelineFixtures.NOW);
    stubClaim();

    assertThat(step()).contains(PipelineState.FAILED);

    assertThat(execution.getFailureKind()).isEqualTo(FailureKind.VALIDATION_ERROR);
    verifyNoInteractions(validateInputStage);
  }

  @Test
  void unexpectedStageExceptionIsRetriedAsProcessingError() {
    stubClaim();
    when(validateInputStage.execute(any())).thenThrow(new IllegalStateException("npe-ish"));

    assertThat(step()).contains(PipelineState.VALIDATING);

    assertThat(execution.getAttempt()).isEqualTo(1);
    assertThat(execution.getFailureKind()).isEqualTo(FailureKind.PROCESSING_ERROR);
  }

  @Test
  void catalogOutageInStageIsRetriedAsCatalogError() {
    stubClaim();
    when(validateInputStage.execute(any()))
        .thenThrow(new DataAccessResourceFailureException("connection refused"));

    step();

    assertThat(execution.getFailureKind()).isEqualTo(FailureKind.CATALOG_ERROR);
    assertThat(execution.getState()).isEqualTo(PipelineState.VALIDATING);
  }

  @Test
  void catalogOutageEnteringValidatingRetriesBeforeRunningTheStage() {
    stubClaim();
    catalog.failNextTransitionTo(SessionStatus.VALIDATING);

    assertThat(step()).contains(PipelineState.VALIDATING);

    assertThat(execution.getAttempt()).isEqualTo(1);
    assertThat(execution.getFailureKind()).isEqualTo(FailureKind.CATALOG_ERROR);
    assertThat(catalog.status(TENANT, SESSION)).isEqualTo(SessionStatus.READY);
    verify(validateInputStage, never()).execute(any());

    when(validateInputStage.execute(any()))
        .thenAnswer(inv -> StageOutcome.advance(inv.getArgument(0)));

    assertThat(step()).contains(PipelineState.TRANSCODING);
    assertThat(catalog.status(TENANT, SESSION)).isEqualTo(SessionStatus.TRANSCODING);
  }

  @Test
  void catalogOutageEnteringValidatingFailsSessionOnceAttemptsRunOut() {
    stubClaim();
    catalog.failNextTransitionTo(SessionStatus.VALIDATING);
    step();
    catalog.failNextTransitionTo(SessionStatus.VALIDATING);
    step();
    catalog.failNextTransitionTo(SessionStatus.VALIDATING);

    assertThat(step()).contains(PipelineState.FAILED);

    verifyNoInteractions(validateInputStage);
    assertThat(catalog.status(TENANT, SESSION)).isEqualTo(SessionStatus.FAILED);
    assertThat(catalog.findSession(TENANT, SESSION).orElseThrow().errorDetail())
        .startsWith("CATALOG_ERROR: ");
  }

  @Test
  void waitKeepsStateAndPersistsContext() {
    stubClaim();
    when(validateInputStage.execute(any()))
        .thenAnswer(inv -> StageOutcome.advance(inv.getArgument(0)));
    when(startTranscodeStage.execute(any()))
        .thenAnswer(
            inv ->
                StageOutcome.advance(
                    inv.<PipelineContext>getArgument(0)
                        .withMedia("s3://recordings/v.mp4", "s3://recordings/a.wav")));
    when(startTranscribeStage.execute(any()))
        .thenAnswer(
            inv ->
                StageOutcome.waitFor(
                    inv.<PipelineContext>getArgument(0)
                        .withTranscriptionJob("job-7", PipelineFixtures.NOW),
                    Duration.ofSeconds(30)));
    when(pollTranscriptionStage.execute(any()))
        .thenAnswer(
            inv ->
                StageOutcome.waitFor(
                    inv.<PipelineContext>getArgument(0).withNextPoll(), Duration.ofMinutes(1)));
    step();
    step();
    step();

    assertThat(step()).contains(PipelineState.AWAITING_TRANSCRIPTION);

    assertThat(execution.getPollCount()).isEqualTo(1);
    assertThat(execution.getAttempt()).isZero();
    assertThat(execution.getNextAttemptAt()).isEqualTo(PipelineFixtures.NOW.plusSeconds(60));
    assertThat(catalog.status(TENANT, SESSION)).isEqualTo(SessionStatus.TRANSCRIBING);
  }
}
