package dev.minutes.pipeline.stage;

import dev.minutes.pipeline.FailureKind;
import dev.minutes.pipeline.PipelineContext;
import dev.minutes.pipeline.PipelineProperties;
import dev.minutes.pipeline.PipelineStage;
import dev.minutes.pipeline.StageOutcome;
import dev.minutes.session.ArtifactKind;
import dev.minutes.session.SessionCatalog;
import dev.minutes.transcription.TranscriberUnavailableException;
import dev.minutes.transcription.TranscriptionClient;
import dev.minutes.transcription.TranscriptionJobStatus;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Checks the transcription job once. Running jobs produce a wait with growing delay until the
 * transcription timeout, measured from the job start, is exceeded.
 */
@Component
public class PollTranscriptionStage implements PipelineStage {

  private static final Logger log = LoggerFactory.getLogger(PollTranscriptionStage.class);

  private final TranscriptionClient transcriptionClient;
  private final SessionCatalog sessionCatalog;
  private final PipelineProperties properties;
  private final Clock clock;

  public PollTranscriptionStage(
      TranscriptionClient transcriptionClient,
      SessionCatalog sessionCatalog,
      PipelineProperties properties,
      Clock clock) {
    this.transcriptionClient = transcriptionClient;
    this.sessionCatalog = sessionCatalog;
    this.properties = properties;
    this.clock = clock;
  }

  @Override
  public StageOutcome execute(PipelineContext context) {
    Instant now = clock.instant();
    Instant startedAt = context.awaitingSince() != null ? context.awaitingSince() : now;
    boolean overdue = now.isAfter(startedAt.plus(properties.transcriptionTimeout()));

    TranscriptionJobStatus status;
    try {
      status = transcriptionClient.getJob(context.transcriptionJob());
    } catch (TranscriberUnavailableException e) {
      log.warn("Transcription status unavailable for {}: {}", context.sessionId(), e.getMessage());
      return overdue ? timedOut(context) : nextPoll(context);
    }

    switch (status.status()) {
      case COMPLETED -> {
        if (status.transcriptUri() == null || status.transcriptUri().isBlank()) {
          return StageOutcome.failure(
              FailureKind.TRANSCRIPTION_ERROR, "Completed job reported no transcript location");
        }
        sessionCatalog.recordArtifact(
            context.tenantId(), context.sessionId(), ArtifactKind.TRANSCRIPT, status.transcriptUri());
        return StageOutcome.advance(context.withTranscript(status.transcriptUri()));
      }
      case FAILED -> {
        return StageOutcome.failure(
            FailureKind.TRANSCRIPTION_ERROR,
            status.failureReason() != null ? status.failureReason() : "Transcription job failed");
      }
      default -> {
        if (overdue) {
          return timedOut(context);
        }
        log.debug(
            "Transcription job {} is {} (poll {})",
            context.transcriptionJob(),
            status.status(),
            context.pollCount() + 1);
        return nextPoll(context);
      }
    }
  }

  private StageOutcome nextPoll(PipelineContext context) {
    return StageOutcome.waitFor(context.withNextPoll(), properties.pollDelay(context.pollCount()));
  }

  private StageOutcome timedOut(PipelineContext context) {
    return StageOutcome.failure(
        FailureKind.TRANSCRIPTION_ERROR,
        "Transcription job "
            + context.transcriptionJob()
            + " did not finish within "
            + properties.transcriptionTimeout());
  }
}
