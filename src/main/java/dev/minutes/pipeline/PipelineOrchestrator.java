package dev.minutes.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.minutes.pipeline.stage.FinalizeCatalogStage;
import dev.minutes.pipeline.stage.PollTranscriptionStage;
import dev.minutes.pipeline.stage.StartTranscodeStage;
import dev.minutes.pipeline.stage.StartTranscribeStage;
import dev.minutes.pipeline.stage.SummarizeStage;
import dev.minutes.pipeline.stage.ValidateInputStage;
import dev.minutes.session.SessionCatalog;
import dev.minutes.session.SessionStatus;
import dev.minutes.session.TransitionExtras;
import dev.minutes.session.TransitionResult;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Drives a {@link PipelineExecution} through its states one step at a time.
 *
 * <p>A step claims the execution, runs exactly one stage adapter and stores the outcome:
 *
 * <ul>
 *   <li>{@link StageOutcome.Advance}: the catalog status is moved forward by compare-and-swap, then
 *       the execution enters the next state and is due immediately.
 *   <li>{@link StageOutcome.Wait}: the execution stays in its state and becomes due after the delay.
 *   <li>{@link StageOutcome.Failure}: retryable kinds are rescheduled with exponential backoff until
 *       {@code max-attempts}; everything else ends the execution and marks the session FAILED with
 *       {@code "<KIND>: <message>"}.
 * </ul>
 *
 * <p>Terminal executions are never stepped again.
 */
@Service
public class PipelineOrchestrator {

  private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

  private final PipelineExecutionRepository repository;
  private final SessionCatalog sessionCatalog;
  private final ObjectMapper objectMapper;
  private final PipelineProperties properties;
  private final Clock clock;
  private final ValidateInputStage validateInputStage;
  private final StartTranscodeStage startTranscodeStage;
  private final StartTranscribeStage startTranscribeStage;
  private final PollTranscriptionStage pollTranscriptionStage;
  private final SummarizeStage summarizeStage;
  private final FinalizeCatalogStage finalizeCatalogStage;

  public PipelineOrchestrator(
      PipelineExecutionRepository repository,
      SessionCatalog sessionCatalog,
      ObjectMapper objectMapper,
      PipelineProperties properties,
      Clock clock,
      ValidateInputStage validateInputStage,
      StartTranscodeStage startTranscodeStage,
      StartTranscribeStage startTranscribeStage,
      PollTranscriptionStage pollTranscriptionStage,
      SummarizeStage summarizeStage,
      FinalizeCatalogStage finalizeCatalogStage) {
    this.repository = repository;
    this.sessionCatalog = sessionCatalog;
    this.objectMapper = objectMapper;
    this.properties = properties;
    this.clock = clock;
    this.validateInputStage = validateInputStage;
    this.startTranscodeStage = startTranscodeStage;
    this.startTranscribeStage = startTranscribeStage;
    this.pollTranscriptionStage = pollTranscriptionStage;
    this.summarizeStage = summarizeStage;
    this.finalizeCatalogStage = finalizeCatalogStage;
  }

  /**
   * Runs one step of an execution.
   *
   * @param executionId the execution to step
   * @return the state after the step, or empty if another worker holds the lease
   */
  public Optional<PipelineState> step(UUID executionId) {
    Instant now = clock.instant();
    if (repository.claim(executionId, now, now.plus(properties.lease())) == 0) {
      return Optional.empty();
    }
    PipelineExecution execution =
        repository
            .findById(executionId)
            .orElseThrow(() -> new IllegalStateException("Execution vanished: " + executionId));

    PipelineState state = execution.getState();
    if (state.isTerminal()) {
      execution.release();
      repository.save(execution);
      return Optional.of(state);
    }

    PipelineStartRequest request;
    try {
      request = objectMapper.readValue(execution.getStartPayload(), PipelineStartRequest.class);
    } catch (JsonProcessingException e) {
      fail(execution, FailureKind.VALIDATION_ERROR, "Unreadable start payload");
      repository.save(execution);
      return Optional.of(execution.getState());
    }

    if (state == PipelineState.VALIDATING) {
      try {
        enterValidating(request);
      } catch (DataAccessException e) {
        log.warn(
            "Could not mark {}/{} as VALIDATING: {}",
            request.tenantId(),
            request.sessionId(),
            e.getMessage());
        handleFailure(execution, FailureKind.CATALOG_ERROR, e.getMessage(), now);
        repository.save(execution);
        return Optional.of(execution.getState());
      }
    }

    PipelineContext context = execution.toContext(request);
    StageOutcome outcome = runStage(state, context);
    apply(execution, state, outcome, now);
    repository.save(execution);
    return Optional.of(execution.getState());
  }

  /** The stage never runs while the session is still READY in the catalog. */
  private void enterValidating(PipelineStartRequest request) {
    sessionCatalog.transitionStatus(
        request.tenantId(),
        request.sessionId(),
        EnumSet.of(SessionStatus.READY),
        SessionStatus.VALIDATING,
        TransitionExtras.none());
  }

  StageOutcome runStage(PipelineState state, PipelineContext context) {
    try {
      return switch (state) {
        case VALIDATING -> validateInputStage.execute(context);
        case TRANSCODING -> startTranscodeStage.execute(context);
        case AWAITING_TRANSCRIPTION ->
            context.transcriptionJob() == null
                ? startTranscribeStage.execute(context)
                : pollTranscriptionStage.execute(context);
        case SUMMARIZING -> summarizeStage.execute(context);
        case FINALIZING -> finalizeCatalogStage.execute(context);
        case COMPLETED, FAILED -> throw new IllegalStateException(state + " has no stage");
      };
    } catch (DataAccessException e) {
      log.error("Catalog access failed in {} for {}", state, context.sessionId(), e);
      return StageOutcome.failure(FailureKind.CATALOG_ERROR, e.getMessage());
    } catch (RuntimeException e) {
      log.error("Stage {} failed unexpectedly for {}", state, context.sessionId(), e);
      return StageOutcome.failure(FailureKind.PROCESSING_ERROR, e.getMessage());
    }
  }

  private void apply(
      PipelineExecution execution, PipelineState state, StageOutcome outcome, Instant now) {
    if (outcome instanceof StageOutcome.Advance advance) {
      PipelineState next = state.next();
      try {
        mirror(execution, state, next);
      } catch (DataAccessException e) {
        handleFailure(execution, FailureKind.CATALOG_ERROR, e.getMessage(), now);
        return;
      }
      execution.advance(next, advance.context(), now);
      log.info("Execution {} for {} -> {}", execution.getId(), execution.getSessionId(), next);
    } else if (outcome instanceof StageOutcome.Wait wait) {
      execution.waitUntil(wait.context(), now.plus(wait.delay()));
    } else if (outcome instanceof StageOutcome.Failure failure) {
      handleFailure(execution, failure.kind(), failure.message(), now);
    }
  }

  private void mirror(PipelineExecution execution, PipelineState from, PipelineState to) {
    TransitionResult result =
        sessionCatalog.transitionStatus(
            execution.getTenantId(),
            execution.getSessionId(),
            EnumSet.of(from.sessionStatus()),
            to.sessionStatus(),
            TransitionExtras.none());
    if (!result.applied()) {
      log.warn(
          "Session {}/{} was not in {} when moving to {}",
          execution.getTenantId(),
          execution.getSessionId(),
          from.sessionStatus(),
          to.sessionStatus());
    }
  }

  private void handleFailure(
      PipelineExecution execution, FailureKind kind, String message, Instant now) {
    String detail = message != null ? message : kind.name();
    int nextAttempt = execution.getAttempt() + 1;
    if (kind.isRetryable() && nextAttempt < properties.maxAttempts()) {
      log.warn(
          "Execution {} in {} failed with {} (attempt {}/{}): {}",
          execution.getId(),
          execution.getState(),
          kind,
          nextAttempt,
          properties.maxAttempts(),
          detail);
      execution.retryAt(kind, detail, now.plus(properties.retryDelay(nextAttempt)));
      return;
    }
    fail(execution, kind, detail);
  }

  private void fail(PipelineExecution execution, FailureKind kind, String detail) {
    String errorDetail = kind.name() + ": " + detail;
    log.error(
        "Execution {} for {}/{} failed in {}: {}",
        execution.getId(),
        execution.getTenantId(),
        execution.getSessionId(),
        execution.getState(),
        errorDetail);
    try {
      TransitionResult result =
          sessionCatalog.transitionStatus(
              execution.getTenantId(),
              execution.getSessionId(),
              SessionStatus.FAILED.allowedPredecessors(),
              SessionStatus.FAILED,
              TransitionExtras.error(errorDetail));
      if (!result.applied()) {
        log.warn(
            "Session {}/{} was already terminal when recording failure",
            execution.getTenantId(),
            execution.getSessionId());
      }
    } catch (DataAccessException e) {
      log.error(
          "Could not record failure of {}/{} in catalog",
          execution.getTenantId(),
          execution.getSessionId(),
          e);
    }
    execution.fail(kind, detail);
  }
}
