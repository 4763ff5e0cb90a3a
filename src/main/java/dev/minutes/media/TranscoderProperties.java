package dev.minutes.media;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "minutes.transcoder")
public record TranscoderProperties(
        String baseUrl,
        int connectTimeoutMs,
        int readTimeoutMs,
        Retry retry
) {
    /** Longest time one call can take, counting every retry and the backoff between them. */
    public Duration callBudget() {
        return retry.budget(connectTimeoutMs + (long) readTimeoutMs);
    }

    public record Retry(int maxAttempts, long delayMs, double multiplier) {

        Duration budget(long perAttemptMs) {
            long total = maxAttempts * perAttemptMs;
            for (int i = 0; i < maxAttempts - 1; i++) {
                total += (long) (delayMs * Math.pow(multiplier, i));
            }
            return Duration.ofMillis(total);
        }
    }
}
