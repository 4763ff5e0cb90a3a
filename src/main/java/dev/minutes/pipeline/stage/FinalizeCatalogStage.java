package dev.minutes.pipeline.stage;

import dev.minutes.pipeline.FailureKind;
import dev.minutes.pipeline.PipelineContext;
import dev.minutes.pipeline.PipelineStage;
import dev.minutes.pipeline.StageOutcome;
import dev.minutes.session.ArtifactKind;
import dev.minutes.session.SessionCatalog;
import java.time.Clock;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Writes every artifact location plus completion time and pipeline version to the catalog. The
 * final {@code COMPLETED} transition follows when the orchestrator advances.
 */
@Component
public class FinalizeCatalogStage implements PipelineStage {

  private final SessionCatalog sessionCatalog;
  private final Clock clock;

  public FinalizeCatalogStage(SessionCatalog sessionCatalog, Clock clock) {
    this.sessionCatalog = sessionCatalog;
    this.clock = clock;
  }

  @Override
  public StageOutcome execute(PipelineContext context) {
    String tenantId = context.tenantId();
    String sessionId = context.sessionId();
    try {
      record(tenantId, sessionId, ArtifactKind.VIDEO, context.videoLocation());
      record(tenantId, sessionId, ArtifactKind.AUDIO, context.audioLocation());
      record(tenantId, sessionId, ArtifactKind.TRANSCRIPT, context.transcriptLocation());
      record(tenantId, sessionId, ArtifactKind.SUMMARY, context.summaryLocation());
      sessionCatalog.recordCompletion(
          tenantId, sessionId, clock.instant(), context.request().pipelineVersion());
    } catch (DataAccessException e) {
      return StageOutcome.failure(FailureKind.CATALOG_ERROR, e.getMessage());
    }
    return StageOutcome.advance(context);
  }

  private void record(String tenantId, String sessionId, ArtifactKind kind, String location) {
    if (location != null) {
      sessionCatalog.recordArtifact(tenantId, sessionId, kind, location);
    }
  }
}
