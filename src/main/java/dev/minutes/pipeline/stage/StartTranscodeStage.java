package dev.minutes.pipeline.stage;

import dev.minutes.media.TranscodeRequest;
import dev.minutes.media.TranscodeResponse;
import dev.minutes.media.TranscoderClient;
import dev.minutes.pipeline.FailureKind;
import dev.minutes.pipeline.PipelineContext;
import dev.minutes.pipeline.PipelineStage;
import dev.minutes.pipeline.StageOutcome;
import dev.minutes.segment.SegmentRef;
import dev.minutes.segment.SegmentRegistry;
import dev.minutes.session.ArtifactKind;
import dev.minutes.session.SessionCatalog;
import dev.minutes.storage.StorageKeys;
import dev.minutes.storage.StorageLocation;
import java.util.List;
import org.springframework.stereotype.Component;

/** Hands the ordered chunk list to the transcoder and records the resulting video and audio. */
@Component
public class StartTranscodeStage implements PipelineStage {

  private final SegmentRegistry segmentRegistry;
  private final TranscoderClient transcoderClient;
  private final SessionCatalog sessionCatalog;

  public StartTranscodeStage(
      SegmentRegistry segmentRegistry,
      TranscoderClient transcoderClient,
      SessionCatalog sessionCatalog) {
    this.segmentRegistry = segmentRegistry;
    this.transcoderClient = transcoderClient;
    this.sessionCatalog = sessionCatalog;
  }

  @Override
  public StageOutcome execute(PipelineContext context) {
    String tenantId = context.tenantId();
    String sessionId = context.sessionId();
    List<String> segmentKeys =
        segmentRegistry.listSegmentRefs(tenantId, sessionId).stream()
            .map(SegmentRef::storageRef)
            .map(ref -> StorageLocation.parse(ref).key())
            .toList();
    if (segmentKeys.isEmpty()) {
      return StageOutcome.failure(FailureKind.PROCESSING_ERROR, "No segments to transcode");
    }

    TranscodeResponse response =
        transcoderClient.transcode(
            new TranscodeRequest(
                sessionId,
                tenantId,
                context.request().storageBucket(),
                segmentKeys,
                StorageKeys.videoKey(tenantId, sessionId),
                StorageKeys.audioKey(tenantId, sessionId)));
    if (!response.success()) {
      return StageOutcome.failure(
          FailureKind.PROCESSING_ERROR, "Transcoding failed: " + response.errorMessage());
    }

    sessionCatalog.recordArtifact(tenantId, sessionId, ArtifactKind.VIDEO, response.videoLocation());
    sessionCatalog.recordArtifact(tenantId, sessionId, ArtifactKind.AUDIO, response.audioLocation());
    return StageOutcome.advance(
        context.withMedia(response.videoLocation(), response.audioLocation()));
  }
}
