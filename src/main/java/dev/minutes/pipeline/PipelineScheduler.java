package dev.minutes.pipeline;

import java.time.Clock;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Periodically steps every due, unleased pipeline execution. */
@Component
public class PipelineScheduler {

  private static final Logger log = LoggerFactory.getLogger(PipelineScheduler.class);

  private static final Set<PipelineState> ACTIVE_STATES =
      EnumSet.complementOf(EnumSet.of(PipelineState.COMPLETED, PipelineState.FAILED));

  private final PipelineExecutionRepository repository;
  private final PipelineOrchestrator orchestrator;
  private final PipelineProperties properties;
  private final Clock clock;

  public PipelineScheduler(
      PipelineExecutionRepository repository,
      PipelineOrchestrator orchestrator,
      PipelineProperties properties,
      Clock clock) {
    this.repository = repository;
    this.orchestrator = orchestrator;
    this.properties = properties;
    this.clock = clock;
  }

  @Scheduled(
      fixedDelayString = "${minutes.pipeline.tick-interval-ms}",
      initialDelayString = "${minutes.pipeline.tick-interval-ms}")
  public void tick() {
    int stepped = stepDueExecutions();
    if (stepped > 0) {
      log.debug("Stepped {} pipeline executions", stepped);
    }
  }

  /**
   * Steps due executions once each.
   *
   * @return number of executions examined
   */
  public int stepDueExecutions() {
    List<UUID> due =
        repository.findDue(
            ACTIVE_STATES, clock.instant(), PageRequest.of(0, properties.batchSize()));
    for (UUID id : due) {
      try {
        orchestrator.step(id);
      } catch (RuntimeException e) {
        log.error("Pipeline step failed for execution {}", id, e);
      }
    }
    return due.size();
  }
}
