package dev.minutes.pipeline;

import dev.minutes.media.TranscoderProperties;
import dev.minutes.summary.SummarizerProperties;
import dev.minutes.transcription.TranscriberProperties;
import org.springframework.stereotype.Component;

/** Fails startup when a single stage call could outlast the execution lease. */
@Component
class StageLeaseGuard {

  StageLeaseGuard(
      PipelineProperties pipelineProperties,
      TranscoderProperties transcoderProperties,
      TranscriberProperties transcriberProperties,
      SummarizerProperties summarizerProperties) {
    pipelineProperties.requireLeaseCovers("transcode", transcoderProperties.callBudget());
    pipelineProperties.requireLeaseCovers("transcription", transcriberProperties.callBudget());
    pipelineProperties.requireLeaseCovers("summarize", summarizerProperties.callBudget());
  }
}
