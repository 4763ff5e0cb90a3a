package dev.minutes.segment;

/**
 * Position and location of a validated segment, as handed to the transcoder.
 *
 * @param chunkIndex zero-based position in the recording
 * @param storageRef {@code s3://bucket/key} of the chunk object
 */
public record SegmentRef(int chunkIndex, String storageRef) {}
