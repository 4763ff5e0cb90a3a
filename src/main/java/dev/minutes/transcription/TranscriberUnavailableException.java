package dev.minutes.transcription;

/** The transcription worker could not be reached after retries. The job state is unknown. */
public class TranscriberUnavailableException extends RuntimeException {

    public TranscriberUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
