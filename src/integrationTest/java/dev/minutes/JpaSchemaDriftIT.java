package dev.minutes;

import static org.assertj.core.api.Assertions.assertThat;

import dev.minutes.pipeline.PipelineExecution;
import dev.minutes.pipeline.PipelineExecutionRepository;
import dev.minutes.pipeline.PipelineState;
import dev.minutes.segment.Segment;
import dev.minutes.segment.SegmentRepository;
import dev.minutes.segment.ValidationState;
import dev.minutes.session.RecordingSession;
import dev.minutes.session.RecordingSessionRepository;
import dev.minutes.session.SessionStatus;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.annotation.Transactional;

/**
 * Compensates for ddl-auto=none by verifying each JPA entity can be persisted and read back
 * against the Flyway schema.
 */
@Transactional
class JpaSchemaDriftIT extends BaseIntegrationTest {

  private static final Instant UPLOADED = Instant.parse("2026-03-01T10:00:00Z");

  @Autowired private SegmentRepository segmentRepository;

  @Autowired private RecordingSessionRepository sessionRepository;

  @Autowired private PipelineExecutionRepository executionRepository;

  @Test
  void segmentEntityRoundtripsAgainstFlywaySchema() {
    Segment segment =
        new Segment(
            "u1",
            "r1",
            0,
            "s3://recordings/users/u1/chunks/r1/chunk_000.mp4",
            1024,
            "etag-0",
            UPLOADED,
            UPLOADED.plusSeconds(86_400));

    Segment saved = segmentRepository.saveAndFlush(segment);
    Segment found = segmentRepository.findById(saved.getId()).orElseThrow();

    assertThat(found.getChunkIndex()).isZero();
    assertThat(found.getByteSize()).isEqualTo(1024);
    assertThat(found.getIntegrityTag()).isEqualTo("etag-0");
    assertThat(found.getValidationState()).isEqualTo(ValidationState.VALIDATED);
    assertThat(found.getUploadedAt()).isEqualTo(UPLOADED);
  }

  @Test
  void recordingSessionEntityRoundtripsAgainstFlywaySchema() {
    RecordingSession session = new RecordingSession("u1", "r1");
    session.setExpectedSegmentCount(4);
    session.setTotalDurationSeconds(1800);

    RecordingSession saved = sessionRepository.saveAndFlush(session);
    RecordingSession found = sessionRepository.findById(saved.getId()).orElseThrow();

    assertThat(found.getStatus()).isEqualTo(SessionStatus.PENDING);
    assertThat(found.getExpectedSegmentCount()).isEqualTo(4);
    assertThat(found.getTotalDurationSeconds()).isEqualTo(1800);
    assertThat(found.getCreatedAt()).isNotNull();
    assertThat(found.getUpdatedAt()).isNotNull();
  }

  @Test
  void pipelineExecutionEntityRoundtripsAgainstFlywaySchema() {
    PipelineExecution execution = new PipelineExecution("u1", "r1", "{\"tenantId\":\"u1\"}", UPLOADED);

    PipelineExecution saved = executionRepository.saveAndFlush(execution);
    PipelineExecution found = executionRepository.findById(saved.getId()).orElseThrow();

    assertThat(found.getState()).isEqualTo(PipelineState.VALIDATING);
    assertThat(found.getAttempt()).isZero();
    assertThat(found.getNextAttemptAt()).isEqualTo(UPLOADED);
    assertThat(found.getStartPayload()).isEqualTo("{\"tenantId\":\"u1\"}");
    assertThat(found.getVersion()).isNotNull();
  }
}
