package dev.minutes.segment;

import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Periodically removes segment rows past their retention date. */
@Component
public class SegmentHousekeeping {

  private static final Logger log = LoggerFactory.getLogger(SegmentHousekeeping.class);

  private final SegmentRegistry segmentRegistry;
  private final Clock clock;

  public SegmentHousekeeping(SegmentRegistry segmentRegistry, Clock clock) {
    this.segmentRegistry = segmentRegistry;
    this.clock = clock;
  }

  @Scheduled(
      fixedDelayString = "${minutes.segments.purge-interval-ms}",
      initialDelayString = "${minutes.segments.purge-interval-ms}")
  public void purgeExpired() {
    int purged = segmentRegistry.purgeExpired(clock.instant());
    if (purged > 0) {
      log.info("Purged {} expired segments", purged);
    }
  }
}
