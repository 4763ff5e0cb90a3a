package dev.minutes.media;

import java.util.List;

/**
 * Body of {@code POST /transcode}.
 *
 * @param sessionId recording session
 * @param tenantId owning tenant
 * @param bucket bucket holding the chunks and receiving the outputs
 * @param segmentKeys chunk keys in playback order
 * @param videoKey key for the concatenated video
 * @param audioKey key for the extracted audio track
 */
public record TranscodeRequest(
        String sessionId,
        String tenantId,
        String bucket,
        List<String> segmentKeys,
        String videoKey,
        String audioKey
) {
    public TranscodeRequest {
        segmentKeys = List.copyOf(segmentKeys);
    }
}
