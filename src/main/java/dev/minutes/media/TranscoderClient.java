package dev.minutes.media;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

@Service
public class TranscoderClient {

    private static final Logger log = LoggerFactory.getLogger(TranscoderClient.class);

    private final RestClient restClient;

    public TranscoderClient(@Qualifier("transcoderRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    /**
     * Concatenate the given chunks into one video and extract its audio track.
     * Retries on transient RestClientException with exponential backoff.
     */
    @Retryable(
            retryFor = RestClientException.class,
            maxAttemptsExpression = "${minutes.transcoder.retry.max-attempts}",
            backoff = @Backoff(
                    delayExpression = "${minutes.transcoder.retry.delay-ms}",
                    multiplierExpression = "${minutes.transcoder.retry.multiplier}"
            )
    )
    public TranscodeResponse transcode(TranscodeRequest request) {
        TranscodeResponse response = restClient.post()
                .uri("/transcode")
                .body(request)
                .retrieve()
                .body(TranscodeResponse.class);

        if (response == null) {
            return new TranscodeResponse(false, null, null,
                    "Transcoder returned no body for " + request.sessionId());
        }
        if (response.success() && (response.videoLocation() == null || response.audioLocation() == null)) {
            return new TranscodeResponse(false, null, null,
                    "Transcoder reported success without output locations for " + request.sessionId());
        }
        return response;
    }

    @Recover
    TranscodeResponse recoverTranscode(RestClientException e, TranscodeRequest request) {
        log.warn("Transcoder request failed after retries for {}: {}", request.sessionId(), e.getMessage());
        return new TranscodeResponse(false, null, null, e.getMessage());
    }
}
