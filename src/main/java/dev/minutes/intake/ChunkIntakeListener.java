package dev.minutes.intake;

import dev.minutes.completion.CompletionDetector;
import dev.minutes.completion.CompletionResult;
import dev.minutes.segment.SegmentRegistry;
import dev.minutes.segment.SegmentUpload;
import dev.minutes.segment.UpsertResult;
import dev.minutes.storage.StorageKeys;
import dev.minutes.storage.StorageLocation;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Handles one upload notification: parse the key, register the chunk, check completeness.
 *
 * <p>The completeness check runs even for redelivered chunks, since an earlier delivery may have
 * registered the chunk and then failed before its own check. A failing check is logged and does
 * not fail the notification; an invalid chunk does, so that storage redelivers it.
 */
@Service
public class ChunkIntakeListener {

  private static final Logger log = LoggerFactory.getLogger(ChunkIntakeListener.class);

  private final ChunkKeyParser keyParser;
  private final SegmentRegistry segmentRegistry;
  private final CompletionDetector completionDetector;
  private final Clock clock;

  public ChunkIntakeListener(
      ChunkKeyParser keyParser,
      SegmentRegistry segmentRegistry,
      CompletionDetector completionDetector,
      Clock clock) {
    this.keyParser = keyParser;
    this.segmentRegistry = segmentRegistry;
    this.completionDetector = completionDetector;
    this.clock = clock;
  }

  /**
   * @throws dev.minutes.segment.InvalidSegmentException if the chunk is empty or unreachable
   */
  public IntakeResult onUpload(UploadNotification notification) {
    ChunkKey key;
    try {
      key = keyParser.parse(notification.objectKey());
    } catch (MalformedKeyException e) {
      log.warn("Dropping notification for {}: {}", notification.bucket(), e.getMessage());
      return IntakeResult.dropped();
    }

    Instant uploadedAt =
        notification.eventTimestamp() != null ? notification.eventTimestamp() : clock.instant();
    String storageRef =
        new StorageLocation(
                notification.bucket(),
                StorageKeys.chunkKey(key.tenantId(), key.sessionId(), key.chunkIndex()))
            .toUri();
    UpsertResult upsert =
        segmentRegistry.upsertSegment(
            new SegmentUpload(
                key.tenantId(),
                key.sessionId(),
                key.chunkIndex(),
                storageRef,
                notification.objectSize(),
                notification.etag(),
                uploadedAt));

    CompletionResult completion = null;
    try {
      completion = completionDetector.evaluate(key.tenantId(), key.sessionId());
    } catch (RuntimeException e) {
      log.error(
          "Completion check failed for {}/{} after chunk {}",
          key.tenantId(),
          key.sessionId(),
          key.chunkIndex(),
          e);
    }
    return new IntakeResult(
        true, key.tenantId(), key.sessionId(), key.chunkIndex(), upsert.created(), completion);
  }
}
