package dev.minutes.segment;

/**
 * Outcome of {@link SegmentRegistry#upsertSegment}.
 *
 * @param created {@code true} if this call registered the segment, {@code false} if it was
 *     already present
 */
public record UpsertResult(boolean created) {}
