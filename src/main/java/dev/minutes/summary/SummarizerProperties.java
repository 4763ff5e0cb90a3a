package dev.minutes.summary;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Summarization model settings bound from {@code minutes.summarizer.*}.
 *
 * @param baseUrl OpenAI-compatible endpoint
 * @param apiKey API key for the endpoint
 * @param modelName model identifier; also stamped into summaries as {@code model_version}
 * @param temperature sampling temperature
 * @param maxTokens completion token limit
 * @param timeoutMs request timeout
 */
@ConfigurationProperties(prefix = "minutes.summarizer")
public record SummarizerProperties(
    String baseUrl,
    String apiKey,
    String modelName,
    double temperature,
    int maxTokens,
    long timeoutMs) {

  /** Longest time one summarization call can take; the model client does not retry. */
  public Duration callBudget() {
    return Duration.ofMillis(timeoutMs);
  }
}
