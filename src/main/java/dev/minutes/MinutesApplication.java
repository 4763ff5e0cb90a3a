package dev.minutes;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the Minutes recording-ingestion service.
 *
 * <p>Receives chunk-upload notifications, detects when a recording session is complete and drives
 * the transcode, transcribe and summarize pipeline through a database-backed scheduler.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class MinutesApplication {
    public static void main(String[] args) {
        SpringApplication.run(MinutesApplication.class, args);
    }
}
