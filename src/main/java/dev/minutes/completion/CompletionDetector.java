package dev.minutes.completion;

import dev.minutes.pipeline.PipelineLauncher;
import dev.minutes.pipeline.PipelineProperties;
import dev.minutes.pipeline.PipelineStartRequest;
import dev.minutes.segment.SegmentRef;
import dev.minutes.segment.SegmentRegistry;
import dev.minutes.session.SessionCatalog;
import dev.minutes.session.SessionStatus;
import dev.minutes.session.TransitionExtras;
import dev.minutes.session.TransitionResult;
import dev.minutes.storage.StorageKeys;
import dev.minutes.storage.StorageLocation;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Decides whether a session has all of its chunks and, if so, starts the pipeline at most once.
 *
 * <p>A session is complete exactly when the registered indices equal {@code {0..k-1}} for the
 * declared count {@code k}. The compare-and-swap from a not-yet-dispatched status to {@code READY}
 * is the only point that may start the pipeline, so any number of concurrent evaluations of the
 * same complete session start it once.
 */
@Service
public class CompletionDetector {

  private static final Logger log = LoggerFactory.getLogger(CompletionDetector.class);

  private final SessionCatalog sessionCatalog;
  private final SegmentRegistry segmentRegistry;
  private final PipelineLauncher pipelineLauncher;
  private final PipelineProperties pipelineProperties;
  private final Clock clock;

  public CompletionDetector(
      SessionCatalog sessionCatalog,
      SegmentRegistry segmentRegistry,
      PipelineLauncher pipelineLauncher,
      PipelineProperties pipelineProperties,
      Clock clock) {
    this.sessionCatalog = sessionCatalog;
    this.segmentRegistry = segmentRegistry;
    this.pipelineLauncher = pipelineLauncher;
    this.pipelineProperties = pipelineProperties;
    this.clock = clock;
  }

  public CompletionResult evaluate(String tenantId, String sessionId) {
    OptionalInt declared = sessionCatalog.getExpectedCount(tenantId, sessionId);
    Set<Integer> uploaded = segmentRegistry.listValidatedIndices(tenantId, sessionId);
    if (declared.isEmpty()) {
      log.debug("Session {}/{} has no declared chunk count yet", tenantId, sessionId);
      return CompletionResult.awaitingDeclaration(uploaded.size());
    }

    int expected = declared.getAsInt();
    List<Integer> missing =
        IntStream.range(0, expected).filter(i -> !uploaded.contains(i)).boxed().toList();
    if (!missing.isEmpty()) {
      sessionCatalog.transitionStatus(
          tenantId,
          sessionId,
          EnumSet.of(SessionStatus.PENDING, SessionStatus.INCOMPLETE),
          SessionStatus.INCOMPLETE,
          TransitionExtras.missing(missing));
      log.info(
          "Session {}/{} incomplete: {}/{} chunks, missing {}",
          tenantId,
          sessionId,
          expected - missing.size(),
          expected,
          missing);
      return CompletionResult.missing(expected, uploaded.size(), missing);
    }

    List<Integer> unexpected = uploaded.stream().filter(i -> i >= expected).sorted().toList();
    if (!unexpected.isEmpty()) {
      sessionCatalog.transitionStatus(
          tenantId,
          sessionId,
          EnumSet.of(SessionStatus.PENDING, SessionStatus.INCOMPLETE),
          SessionStatus.INCOMPLETE,
          TransitionExtras.error(
              "Unexpected chunk indices "
                  + unexpected.stream().map(String::valueOf).collect(Collectors.joining(","))
                  + " for declared count "
                  + expected));
      log.warn(
          "Session {}/{} has chunks beyond declared count {}: {}",
          tenantId,
          sessionId,
          expected,
          unexpected);
      return CompletionResult.unexpected(expected, uploaded.size(), unexpected);
    }

    TransitionResult ready =
        sessionCatalog.transitionStatus(
            tenantId,
            sessionId,
            SessionStatus.NOT_DISPATCHED,
            SessionStatus.READY,
            TransitionExtras.none());
    if (!ready.applied()) {
      log.info("Session {}/{} complete, already dispatched", tenantId, sessionId);
      return CompletionResult.complete(expected, CompletionReason.ALREADY_DISPATCHED, null);
    }

    log.info("Session {}/{} complete with {} chunks, dispatching", tenantId, sessionId, expected);
    String handle;
    try {
      handle = pipelineLauncher.start(startRequest(tenantId, sessionId, expected));
    } catch (RuntimeException e) {
      log.error("Failed to start pipeline for {}/{}", tenantId, sessionId, e);
      try {
        sessionCatalog.transitionStatus(
            tenantId,
            sessionId,
            EnumSet.of(SessionStatus.READY),
            SessionStatus.DISPATCH_FAILED,
            TransitionExtras.error("DISPATCH_ERROR: " + e.getMessage()));
      } catch (RuntimeException rollbackFailure) {
        log.error(
            "Could not mark {}/{} as DISPATCH_FAILED, left READY for the recovery sweep",
            tenantId,
            sessionId,
            rollbackFailure);
      }
      return CompletionResult.complete(expected, CompletionReason.DISPATCH_FAILED, null);
    }

    try {
      sessionCatalog.recordExecutionHandle(tenantId, sessionId, handle);
    } catch (RuntimeException e) {
      log.warn(
          "Pipeline {} started for {}/{} but the handle was not recorded: {}",
          handle,
          tenantId,
          sessionId,
          e.getMessage());
    }
    return CompletionResult.complete(expected, CompletionReason.DISPATCHED, handle);
  }

  private PipelineStartRequest startRequest(String tenantId, String sessionId, int chunkCount) {
    List<SegmentRef> refs = segmentRegistry.listSegmentRefs(tenantId, sessionId);
    if (refs.isEmpty()) {
      throw new IllegalStateException("No segment locations for " + tenantId + "/" + sessionId);
    }
    String bucket = StorageLocation.parse(refs.get(0).storageRef()).bucket();
    Instant now = clock.instant();
    return new PipelineStartRequest(
        sessionId,
        tenantId,
        bucket,
        StorageKeys.chunkPrefix(tenantId, sessionId),
        chunkCount,
        pipelineProperties.pipelineVersion(),
        now,
        new PipelineStartRequest.Metadata(pipelineProperties.trigger(), chunkCount, now));
  }
}
