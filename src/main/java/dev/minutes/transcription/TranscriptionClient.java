package dev.minutes.transcription;

import dev.minutes.storage.StorageLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

@Service
public class TranscriptionClient {

    private static final Logger log = LoggerFactory.getLogger(TranscriptionClient.class);

    private final RestClient restClient;
    private final TranscriberProperties properties;

    public TranscriptionClient(@Qualifier("transcriberRestClient") RestClient restClient,
                               TranscriberProperties properties) {
        this.restClient = restClient;
        this.properties = properties;
    }

    /**
     * Submit a transcription job for the given audio file.
     * The worker writes its transcript to {@code output}.
     */
    @Retryable(
            retryFor = RestClientException.class,
            recover = "recoverStartJob",
            maxAttemptsExpression = "${minutes.transcriber.retry.max-attempts}",
            backoff = @Backoff(
                    delayExpression = "${minutes.transcriber.retry.delay-ms}",
                    multiplierExpression = "${minutes.transcriber.retry.multiplier}"
            )
    )
    public TranscriptionJobStatus startJob(String jobName, String audioUri, StorageLocation output) {
        TranscriptionJobStatus status = restClient.post()
                .uri("/jobs")
                .body(buildRequest(jobName, audioUri, output))
                .retrieve()
                .body(TranscriptionJobStatus.class);
        if (status == null) {
            return TranscriptionJobStatus.failed(jobName, "Transcriber returned no body");
        }
        log.info("Started transcription job {} with status {}", jobName, status.status());
        return status;
    }

    @Recover
    TranscriptionJobStatus recoverStartJob(RestClientException e, String jobName, String audioUri,
                                           StorageLocation output) {
        log.warn("Transcription job {} could not be started after retries: {}", jobName, e.getMessage());
        return TranscriptionJobStatus.failed(jobName, e.getMessage());
    }

    /**
     * Fetch the current status of a job. A job the worker does not know is reported as FAILED.
     */
    @Retryable(
            retryFor = RestClientException.class,
            recover = "recoverGetJob",
            maxAttemptsExpression = "${minutes.transcriber.retry.max-attempts}",
            backoff = @Backoff(
                    delayExpression = "${minutes.transcriber.retry.delay-ms}",
                    multiplierExpression = "${minutes.transcriber.retry.multiplier}"
            )
    )
    public TranscriptionJobStatus getJob(String jobName) {
        TranscriptionJobStatus status;
        try {
            status = restClient.get()
                    .uri("/jobs/{name}", jobName)
                    .retrieve()
                    .body(TranscriptionJobStatus.class);
        } catch (HttpClientErrorException.NotFound e) {
            return TranscriptionJobStatus.failed(jobName, "Job not found");
        }
        if (status == null) {
            throw new RestClientException("Transcriber returned no body for job " + jobName);
        }
        return status;
    }

    @Recover
    TranscriptionJobStatus recoverGetJob(RestClientException e, String jobName) {
        throw new TranscriberUnavailableException(
                "Status of transcription job " + jobName + " unavailable: " + e.getMessage(), e);
    }

    private TranscriptionJobRequest buildRequest(String jobName, String audioUri, StorageLocation output) {
        return new TranscriptionJobRequest(
                jobName,
                audioUri,
                properties.mediaFormat(),
                properties.sampleRateHertz(),
                output.bucket(),
                output.key(),
                properties.languageOptions(),
                true,
                properties.maxSpeakers()
        );
    }
}
