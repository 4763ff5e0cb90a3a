package dev.minutes.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables the scheduled pipeline tick, dispatch recovery and segment housekeeping, plus the
 * {@code @Retryable} proxies around the worker clients.
 */
@Configuration
@EnableScheduling
@EnableRetry
public class SchedulingConfig {}
