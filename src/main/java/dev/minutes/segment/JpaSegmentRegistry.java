package dev.minutes.segment;

import dev.minutes.storage.ObjectMetadata;
import dev.minutes.storage.ObjectStore;
import dev.minutes.storage.StorageLocation;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;
import org.springframework.stereotype.Service;

/**
 * {@link SegmentRegistry} backed by PostgreSQL.
 *
 * <p>Each chunk is checked against object storage before it is recorded. The insert relies on
 * {@code ON CONFLICT DO NOTHING}, so concurrent deliveries of the same notification produce
 * exactly one row and exactly one {@code created=true}.
 */
@Service
public class JpaSegmentRegistry implements SegmentRegistry {

  private static final Logger log = LoggerFactory.getLogger(JpaSegmentRegistry.class);

  private final SegmentRepository segmentRepository;
  private final ObjectStore objectStore;
  private final SegmentProperties properties;
  private final Clock clock;

  public JpaSegmentRegistry(
      SegmentRepository segmentRepository,
      ObjectStore objectStore,
      SegmentProperties properties,
      Clock clock) {
    this.segmentRepository = segmentRepository;
    this.objectStore = objectStore;
    this.properties = properties;
    this.clock = clock;
  }

  @Override
  public UpsertResult upsertSegment(SegmentUpload upload) {
    if (upload.byteSize() <= 0) {
      throw new InvalidSegmentException(
          "Segment " + upload.chunkIndex() + " of " + upload.sessionId() + " is empty");
    }
    StorageLocation location;
    try {
      location = StorageLocation.parse(upload.storageRef());
    } catch (IllegalArgumentException e) {
      throw new InvalidSegmentException(e.getMessage());
    }
    Optional<ObjectMetadata> head = objectStore.head(location);
    if (head.isEmpty()) {
      throw new InvalidSegmentException("Segment object is not reachable: " + location);
    }

    Instant now = clock.instant();
    Instant expiresAt = upload.uploadedAt().plus(Duration.ofDays(properties.retentionDays()));
    int inserted =
        segmentRepository.insertIfAbsent(
            UUID.randomUUID(),
            upload.tenantId(),
            upload.sessionId(),
            upload.chunkIndex(),
            upload.storageRef(),
            upload.byteSize(),
            upload.integrityTag(),
            upload.uploadedAt(),
            expiresAt,
            now);

    if (inserted == 1) {
      log.info(
          "Recorded segment {} of session {}/{} ({} bytes)",
          upload.chunkIndex(),
          upload.tenantId(),
          upload.sessionId(),
          upload.byteSize());
      return new UpsertResult(true);
    }

    warnOnConflictingRedelivery(upload);
    return new UpsertResult(false);
  }

  private void warnOnConflictingRedelivery(SegmentUpload upload) {
    segmentRepository
        .findByTenantIdAndSessionIdAndChunkIndex(
            upload.tenantId(), upload.sessionId(), upload.chunkIndex())
        .filter(
            existing ->
                existing.getByteSize() != upload.byteSize()
                    || !Objects.equals(existing.getIntegrityTag(), upload.integrityTag()))
        .ifPresentOrElse(
            existing ->
                log.warn(
                    "Conflicting redelivery for segment {} of {}/{}: kept size={} etag={}, ignored"
                        + " size={} etag={}",
                    upload.chunkIndex(),
                    upload.tenantId(),
                    upload.sessionId(),
                    existing.getByteSize(),
                    existing.getIntegrityTag(),
                    upload.byteSize(),
                    upload.integrityTag()),
            () ->
                log.debug(
                    "Segment {} of {}/{} already recorded",
                    upload.chunkIndex(),
                    upload.tenantId(),
                    upload.sessionId()));
  }

  @Override
  public Set<Integer> listValidatedIndices(String tenantId, String sessionId) {
    Set<Integer> indices = new HashSet<>();
    Pageable pageable = PageRequest.of(0, properties.pageSize());
    Slice<Integer> slice;
    do {
      slice = segmentRepository.findValidatedIndices(tenantId, sessionId, pageable);
      indices.addAll(slice.getContent());
      pageable = slice.nextPageable();
    } while (slice.hasNext());
    return indices;
  }

  @Override
  public List<SegmentRef> listSegmentRefs(String tenantId, String sessionId) {
    return segmentRepository
        .findByTenantIdAndSessionIdAndValidationStateOrderByChunkIndexAsc(
            tenantId, sessionId, ValidationState.VALIDATED)
        .stream()
        .map(segment -> new SegmentRef(segment.getChunkIndex(), segment.getStorageRef()))
        .toList();
  }

  @Override
  public int purgeExpired(Instant now) {
    return segmentRepository.deleteExpired(now);
  }
}
