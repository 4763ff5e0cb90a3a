package dev.minutes.segment;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Segment registry settings bound from {@code minutes.segments.*}.
 *
 * @param pageSize rows per page when listing validated indices
 * @param retentionDays days a segment row is kept before housekeeping removes it
 * @param purgeIntervalMs delay between housekeeping runs
 */
@ConfigurationProperties(prefix = "minutes.segments")
public record SegmentProperties(int pageSize, int retentionDays, long purgeIntervalMs) {

  public SegmentProperties {
    if (pageSize < 1) {
      throw new IllegalStateException("minutes.segments.page-size must be >= 1, got: " + pageSize);
    }
    if (retentionDays < 1) {
      throw new IllegalStateException(
          "minutes.segments.retention-days must be >= 1, got: " + retentionDays);
    }
  }
}
