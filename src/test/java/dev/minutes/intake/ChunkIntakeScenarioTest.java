package dev.minutes.intake;

import static org.assertj.core.api.Assertions.assertThat;

import dev.minutes.completion.CompletionDetector;
import dev.minutes.completion.CompletionReason;
import dev.minutes.fixture.CountingPipelineLauncher;
import dev.minutes.fixture.InMemorySegmentRegistry;
import dev.minutes.fixture.InMemorySessionCatalog;
import dev.minutes.fixture.PipelineFixtures;
import dev.minutes.session.SessionStatus;
import java.time.Clock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Out-of-order, duplicated notifications for one session, end to end through the listener. */
class ChunkIntakeScenarioTest {

  private InMemorySessionCatalog catalog;
  private CountingPipelineLauncher launcher;
  private ChunkIntakeListener listener;

  @BeforeEach
  void setUp() {
    catalog = new InMemorySessionCatalog().declare("u1", "r1", 3);
    launcher = new CountingPipelineLauncher();
    InMemorySegmentRegistry registry = new InMemorySegmentRegistry();
    CompletionDetector detector =
        new CompletionDetector(
            catalog, registry, launcher, PipelineFixtures.properties(), Clock.systemUTC());
    listener = new ChunkIntakeListener(new ChunkKeyParser(), registry, detector, Clock.systemUTC());
  }

  @Test
  void lastMissingChunkDispatchesAndLaterDuplicatesDoNot() {
    IntakeResult first = notify(2);
    assertThat(first.completion().reason()).isEqualTo(CompletionReason.MISSING_SEGMENTS);
    assertThat(first.completion().missing()).containsExactly(0, 1);

    IntakeResult second = notify(0);
    assertThat(second.completion().missing()).containsExactly(1);

    IntakeResult duplicate = notify(2);
    assertThat(duplicate.created()).isFalse();
    assertThat(duplicate.completion().missing()).containsExactly(1);
    assertThat(catalog.status("u1", "r1")).isEqualTo(SessionStatus.INCOMPLETE);

    IntakeResult last = notify(1);
    assertThat(last.completion().complete()).isTrue();
    assertThat(last.completion().dispatched()).isTrue();
    assertThat(launcher.starts()).isEqualTo(1);
    assertThat(launcher.started().get(0).chunkCount()).isEqualTo(3);

    IntakeResult late = notify(2);
    assertThat(late.completion().complete()).isTrue();
    assertThat(late.completion().dispatched()).isFalse();
    assertThat(late.completion().reason()).isEqualTo(CompletionReason.ALREADY_DISPATCHED);
    assertThat(launcher.starts()).isEqualTo(1);
    assertThat(catalog.status("u1", "r1")).isEqualTo(SessionStatus.READY);
  }

  private IntakeResult notify(int index) {
    return listener.onUpload(
        new UploadNotification(
            InMemorySegmentRegistry.BUCKET,
            String.format("users/u1/chunks/r1/chunk_%03d.mp4", index),
            1024,
            "etag-" + index,
            null));
  }
}
