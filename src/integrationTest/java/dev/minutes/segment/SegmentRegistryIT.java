package dev.minutes.segment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import dev.minutes.BaseIntegrationTest;
import dev.minutes.storage.ObjectMetadata;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class SegmentRegistryIT extends BaseIntegrationTest {

  private static final Instant UPLOADED = Instant.parse("2026-03-01T10:00:00Z");

  @Autowired private SegmentRegistry segmentRegistry;

  @Autowired private SegmentRepository segmentRepository;

  @BeforeEach
  void objectsAreReachable() {
    when(objectStore.head(any())).thenReturn(Optional.of(new ObjectMetadata(1024, "etag")));
  }

  private static SegmentUpload upload(String tenantId, String sessionId, int index, long size) {
    return new SegmentUpload(
        tenantId,
        sessionId,
        index,
        "s3://recordings/users/" + tenantId + "/chunks/" + sessionId + "/chunk_" + index + ".mp4",
        size,
        "etag-" + index,
        UPLOADED);
  }

  @Test
  void redeliveryKeepsFirstWrite() {
    assertThat(segmentRegistry.upsertSegment(upload("u1", "r1", 0, 1024)).created()).isTrue();
    assertThat(segmentRegistry.upsertSegment(upload("u1", "r1", 0, 4096)).created()).isFalse();

    Segment stored =
        segmentRepository.findByTenantIdAndSessionIdAndChunkIndex("u1", "r1", 0).orElseThrow();
    assertThat(stored.getByteSize()).isEqualTo(1024);
    assertThat(segmentRepository.count()).isEqualTo(1);
  }

  @Test
  void concurrentDeliveriesCreateExactlyOneRow() throws Exception {
    ExecutorService pool = Executors.newFixedThreadPool(8);
    try {
      List<Callable<Boolean>> calls = new ArrayList<>();
      for (int i = 0; i < 8; i++) {
        calls.add(() -> segmentRegistry.upsertSegment(upload("u1", "r1", 3, 1024)).created());
      }
      int created = 0;
      for (Future<Boolean> future : pool.invokeAll(calls)) {
        if (future.get()) {
          created++;
        }
      }
      assertThat(created).isEqualTo(1);
    } finally {
      pool.shutdownNow();
    }
    assertThat(segmentRepository.count()).isEqualTo(1);
  }

  @Test
  void sameIndexInAnotherTenantIsDistinct() {
    segmentRegistry.upsertSegment(upload("u1", "r1", 0, 1024));

    assertThat(segmentRegistry.upsertSegment(upload("u2", "r1", 0, 1024)).created()).isTrue();
    assertThat(segmentRegistry.listValidatedIndices("u1", "r1")).containsExactly(0);
    assertThat(segmentRegistry.listValidatedIndices("u2", "r1")).containsExactly(0);
  }

  @Test
  void listingReadsAcrossAllPages() {
    // page-size in the it profile is smaller than the number of chunks
    IntStream.range(0, 12)
        .forEach(i -> segmentRegistry.upsertSegment(upload("u1", "long", i, 1024)));

    assertThat(segmentRegistry.listValidatedIndices("u1", "long"))
        .containsExactlyInAnyOrderElementsOf(IntStream.range(0, 12).boxed().toList());
    assertThat(segmentRegistry.listSegmentRefs("u1", "long"))
        .extracting(SegmentRef::chunkIndex)
        .containsExactlyElementsOf(IntStream.range(0, 12).boxed().toList());
  }

  @Test
  void emptyChunkIsRejectedWithoutRow() {
    assertThatThrownBy(() -> segmentRegistry.upsertSegment(upload("u1", "r1", 0, 0)))
        .isInstanceOf(InvalidSegmentException.class);

    assertThat(segmentRepository.count()).isZero();
  }

  @Test
  void purgeRemovesOnlyExpiredSegments() {
    segmentRegistry.upsertSegment(upload("u1", "r1", 0, 1024));

    assertThat(segmentRegistry.purgeExpired(UPLOADED.plusSeconds(3600))).isZero();
    assertThat(segmentRegistry.purgeExpired(UPLOADED.plusSeconds(31L * 86_400))).isEqualTo(1);
    assertThat(segmentRepository.count()).isZero();
  }
}
