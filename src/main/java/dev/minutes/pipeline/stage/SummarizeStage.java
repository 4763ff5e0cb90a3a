package dev.minutes.pipeline.stage;

import dev.minutes.pipeline.FailureKind;
import dev.minutes.pipeline.PipelineContext;
import dev.minutes.pipeline.PipelineStage;
import dev.minutes.pipeline.StageOutcome;
import dev.minutes.session.ArtifactKind;
import dev.minutes.session.SessionCatalog;
import dev.minutes.storage.ObjectStore;
import dev.minutes.storage.ObjectStoreException;
import dev.minutes.storage.StorageKeys;
import dev.minutes.storage.StorageLocation;
import dev.minutes.summary.SummarizerUnavailableException;
import dev.minutes.summary.SummaryDocument;
import dev.minutes.summary.SummaryFormatException;
import dev.minutes.summary.SummaryService;
import dev.minutes.transcription.TranscriptDocument;
import dev.minutes.transcription.TranscriptFormatException;
import dev.minutes.transcription.TranscriptParser;
import org.springframework.stereotype.Component;

/**
 * Reads the transcript, asks the model for a summary and stores it.
 *
 * <p>The summary object is written only after the model output has passed validation, so a
 * malformed response leaves no artifact behind.
 */
@Component
public class SummarizeStage implements PipelineStage {

  private final ObjectStore objectStore;
  private final TranscriptParser transcriptParser;
  private final SummaryService summaryService;
  private final SessionCatalog sessionCatalog;

  public SummarizeStage(
      ObjectStore objectStore,
      TranscriptParser transcriptParser,
      SummaryService summaryService,
      SessionCatalog sessionCatalog) {
    this.objectStore = objectStore;
    this.transcriptParser = transcriptParser;
    this.summaryService = summaryService;
    this.sessionCatalog = sessionCatalog;
  }

  @Override
  public StageOutcome execute(PipelineContext context) {
    if (context.transcriptLocation() == null) {
      return StageOutcome.failure(FailureKind.TRANSCRIPTION_ERROR, "No transcript location");
    }

    TranscriptDocument transcript;
    try {
      String json = objectStore.getString(StorageLocation.parse(context.transcriptLocation()));
      transcript = transcriptParser.parse(json);
    } catch (IllegalArgumentException | TranscriptFormatException e) {
      return StageOutcome.failure(FailureKind.TRANSCRIPTION_ERROR, e.getMessage());
    } catch (ObjectStoreException e) {
      return StageOutcome.failure(FailureKind.PROCESSING_ERROR, e.getMessage());
    }

    SummaryDocument summary;
    try {
      summary =
          summaryService.summarize(
              context.sessionId(), context.request().pipelineVersion(), transcript);
    } catch (SummaryFormatException e) {
      return StageOutcome.failure(FailureKind.SUMMARY_FORMAT_ERROR, e.getMessage());
    } catch (SummarizerUnavailableException e) {
      return StageOutcome.failure(FailureKind.PROCESSING_ERROR, "Summarizer throttled: " + e.getMessage());
    }

    StorageLocation target =
        new StorageLocation(
            context.request().storageBucket(),
            StorageKeys.summaryKey(context.tenantId(), context.sessionId()));
    try {
      objectStore.putJson(target, summaryService.toJson(summary));
    } catch (ObjectStoreException e) {
      return StageOutcome.failure(FailureKind.PROCESSING_ERROR, e.getMessage());
    }

    sessionCatalog.recordArtifact(
        context.tenantId(), context.sessionId(), ArtifactKind.SUMMARY, target.toUri());
    return StageOutcome.advance(context.withSummary(target.toUri()));
  }
}
