package dev.minutes.media;

/** Response of the transcoding worker. Locations are {@code s3://} URIs. */
public record TranscodeResponse(
        boolean success,
        String videoLocation,
        String audioLocation,
        String errorMessage
) {}
