package dev.minutes.segment;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/** Durable record of every validated chunk, keyed by tenant, session and chunk index. */
public interface SegmentRegistry {

  /**
   * Validates and records a chunk. Recording the same identity twice is a no-op that reports
   * {@code created=false}; the first write wins.
   *
   * @throws InvalidSegmentException if the size is not positive or the object is unreachable
   */
  UpsertResult upsertSegment(SegmentUpload upload);

  /** Returns every validated chunk index of the session, read across all pages. */
  Set<Integer> listValidatedIndices(String tenantId, String sessionId);

  /** Returns validated segments ordered by chunk index. */
  List<SegmentRef> listSegmentRefs(String tenantId, String sessionId);

  /**
   * Removes segments whose retention has elapsed.
   *
   * @return number of purged segments
   */
  int purgeExpired(Instant now);
}
