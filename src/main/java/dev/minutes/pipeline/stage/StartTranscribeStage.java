package dev.minutes.pipeline.stage;

import dev.minutes.pipeline.FailureKind;
import dev.minutes.pipeline.PipelineContext;
import dev.minutes.pipeline.PipelineProperties;
import dev.minutes.pipeline.PipelineStage;
import dev.minutes.pipeline.StageOutcome;
import dev.minutes.storage.StorageKeys;
import dev.minutes.storage.StorageLocation;
import dev.minutes.transcription.TranscriptionClient;
import dev.minutes.transcription.TranscriptionJobState;
import dev.minutes.transcription.TranscriptionJobStatus;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Submits the transcription job and enters the polling wait. Job names are unique per attempt:
 * {@code meeting-transcript-{session}-{yyyyMMdd-HHmmss}-{8 hex}}.
 */
@Component
public class StartTranscribeStage implements PipelineStage {

  private static final DateTimeFormatter JOB_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

  private final TranscriptionClient transcriptionClient;
  private final PipelineProperties properties;
  private final Clock clock;

  public StartTranscribeStage(
      TranscriptionClient transcriptionClient, PipelineProperties properties, Clock clock) {
    this.transcriptionClient = transcriptionClient;
    this.properties = properties;
    this.clock = clock;
  }

  @Override
  public StageOutcome execute(PipelineContext context) {
    if (context.audioLocation() == null) {
      return StageOutcome.failure(FailureKind.PROCESSING_ERROR, "No audio to transcribe");
    }
    Instant now = clock.instant();
    String jobName = jobName(context.sessionId(), now);
    StorageLocation output =
        new StorageLocation(
            context.request().storageBucket(),
            StorageKeys.transcriptKey(context.tenantId(), context.sessionId()));

    TranscriptionJobStatus status =
        transcriptionClient.startJob(jobName, context.audioLocation(), output);
    if (status.status() == TranscriptionJobState.FAILED) {
      return StageOutcome.failure(
          FailureKind.PROCESSING_ERROR,
          "Transcription job could not be started: " + status.failureReason());
    }
    return StageOutcome.waitFor(
        context.withTranscriptionJob(jobName, now), properties.pollDelay(0));
  }

  static String jobName(String sessionId, Instant now) {
    return "meeting-transcript-"
        + sessionId
        + "-"
        + JOB_TIMESTAMP.format(now)
        + "-"
        + UUID.randomUUID().toString().substring(0, 8);
  }
}
