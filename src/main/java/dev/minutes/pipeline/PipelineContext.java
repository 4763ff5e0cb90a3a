package dev.minutes.pipeline;

import java.time.Instant;
import org.jspecify.annotations.Nullable;

/**
 * Accumulated, immutable state passed from stage to stage. Stages return a modified copy.
 *
 * @param request the start payload
 * @param videoLocation concatenated video, once transcoded
 * @param audioLocation extracted audio, once transcoded
 * @param transcriptionJob name of the transcription job, once started
 * @param awaitingSince when the transcription job was started
 * @param pollCount number of status polls so far
 * @param transcriptLocation transcript artifact, once transcribed
 * @param summaryLocation summary artifact, once summarized
 */
public record PipelineContext(
    PipelineStartRequest request,
    @Nullable String videoLocation,
    @Nullable String audioLocation,
    @Nullable String transcriptionJob,
    @Nullable Instant awaitingSince,
    int pollCount,
    @Nullable String transcriptLocation,
    @Nullable String summaryLocation) {

  public static PipelineContext start(PipelineStartRequest request) {
    return new PipelineContext(request, null, null, null, null, 0, null, null);
  }

  public String tenantId() {
    return request.tenantId();
  }

  public String sessionId() {
    return request.sessionId();
  }

  public PipelineContext withMedia(String video, String audio) {
    return new PipelineContext(
        request, video, audio, transcriptionJob, awaitingSince, pollCount, transcriptLocation,
        summaryLocation);
  }

  public PipelineContext withTranscriptionJob(String jobName, Instant startedAt) {
    return new PipelineContext(
        request, videoLocation, audioLocation, jobName, startedAt, 0, transcriptLocation,
        summaryLocation);
  }

  public PipelineContext withNextPoll() {
    return new PipelineContext(
        request, videoLocation, audioLocation, transcriptionJob, awaitingSince, pollCount + 1,
        transcriptLocation, summaryLocation);
  }

  public PipelineContext withTranscript(String location) {
    return new PipelineContext(
        request, videoLocation, audioLocation, transcriptionJob, awaitingSince, pollCount,
        location, summaryLocation);
  }

  public PipelineContext withSummary(String location) {
    return new PipelineContext(
        request, videoLocation, audioLocation, transcriptionJob, awaitingSince, pollCount,
        transcriptLocation, location);
  }
}
