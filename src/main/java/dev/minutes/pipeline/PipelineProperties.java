package dev.minutes.pipeline;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Pipeline scheduling and retry settings bound from {@code minutes.pipeline.*}.
 *
 * @param pipelineVersion version stamped into start payloads and artifacts
 * @param trigger trigger name recorded in start payload metadata
 * @param tickIntervalMs delay between scheduler ticks
 * @param batchSize executions stepped per tick
 * @param leaseMs how long a claimed execution is reserved for one step
 * @param maxAttempts attempts per state for retryable failures
 * @param retryDelayMs first retry delay
 * @param retryMultiplier backoff multiplier between retries
 * @param pollIntervalMs first transcription status poll delay
 * @param maxPollIntervalMs cap for the poll backoff
 * @param transcriptionTimeoutMs maximum time spent awaiting a transcription job
 */
@ConfigurationProperties(prefix = "minutes.pipeline")
public record PipelineProperties(
    String pipelineVersion,
    String trigger,
    long tickIntervalMs,
    int batchSize,
    long leaseMs,
    int maxAttempts,
    long retryDelayMs,
    double retryMultiplier,
    long pollIntervalMs,
    long maxPollIntervalMs,
    long transcriptionTimeoutMs) {

  public PipelineProperties {
    if (maxAttempts < 1) {
      throw new IllegalStateException(
          "minutes.pipeline.max-attempts must be >= 1, got: " + maxAttempts);
    }
    if (retryMultiplier < 1.0) {
      throw new IllegalStateException(
          "minutes.pipeline.retry-multiplier must be >= 1.0, got: " + retryMultiplier);
    }
    if (batchSize < 1) {
      throw new IllegalStateException(
          "minutes.pipeline.batch-size must be >= 1, got: " + batchSize);
    }
  }

  /** Delay before retry number {@code attempt} (1-based). */
  public Duration retryDelay(int attempt) {
    return Duration.ofMillis((long) (retryDelayMs * Math.pow(retryMultiplier, attempt - 1)));
  }

  /** Delay before the next status poll after {@code pollCount} polls, capped at the maximum. */
  public Duration pollDelay(int pollCount) {
    long delay = (long) (pollIntervalMs * Math.pow(2, Math.min(pollCount, 16)));
    return Duration.ofMillis(Math.min(delay, maxPollIntervalMs));
  }

  /**
   * Ensures a claimed step cannot outlive its lease, which would let a second worker run the same
   * stage concurrently.
   *
   * @throws IllegalStateException if the lease does not exceed {@code budget}
   */
  public void requireLeaseCovers(String stage, Duration budget) {
    if (lease().compareTo(budget) <= 0) {
      throw new IllegalStateException(
          "minutes.pipeline.lease-ms must exceed the "
              + stage
              + " budget of "
              + budget.toMillis()
              + " ms, got: "
              + leaseMs);
    }
  }

  public Duration lease() {
    return Duration.ofMillis(leaseMs);
  }

  public Duration transcriptionTimeout() {
    return Duration.ofMillis(transcriptionTimeoutMs);
  }
}
