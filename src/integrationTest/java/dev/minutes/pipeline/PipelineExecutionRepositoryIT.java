package dev.minutes.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import dev.minutes.BaseIntegrationTest;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.PageRequest;

class PipelineExecutionRepositoryIT extends BaseIntegrationTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

  @Autowired private PipelineExecutionRepository repository;

  private UUID insert(String sessionId, Instant dueAt) {
    return repository.save(new PipelineExecution("u1", sessionId, "{}", dueAt)).getId();
  }

  @Test
  void onlyOneClaimWinsWhileLeaseIsValid() {
    UUID id = insert("r1", NOW);

    assertThat(repository.claim(id, NOW, NOW.plusSeconds(60))).isEqualTo(1);
    assertThat(repository.claim(id, NOW.plusSeconds(30), NOW.plusSeconds(90))).isZero();
    assertThat(repository.claim(id, NOW.plusSeconds(61), NOW.plusSeconds(121))).isEqualTo(1);
  }

  @Test
  void findDueSkipsFutureAndLeasedExecutions() {
    UUID due = insert("r1", NOW.minusSeconds(5));
    insert("r2", NOW.plusSeconds(60));
    UUID leased = insert("r3", NOW.minusSeconds(10));
    repository.claim(leased, NOW, NOW.plusSeconds(60));

    List<UUID> found =
        repository.findDue(EnumSet.of(PipelineState.VALIDATING), NOW, PageRequest.of(0, 10));

    assertThat(found).containsExactly(due);
  }

  @Test
  void findDueIgnoresTerminalStates() {
    insert("r1", NOW.minusSeconds(5));

    assertThat(
            repository.findDue(
                EnumSet.of(PipelineState.TRANSCODING), NOW, PageRequest.of(0, 10)))
        .isEmpty();
  }

  @Test
  void existsIsScopedToTenantAndSession() {
    insert("r1", NOW);

    assertThat(repository.existsByTenantIdAndSessionId("u1", "r1")).isTrue();
    assertThat(repository.existsByTenantIdAndSessionId("u1", "r2")).isFalse();
    assertThat(repository.existsByTenantIdAndSessionId("u2", "r1")).isFalse();
  }
}
