package dev.minutes.transcription;

/** The transcript artifact is not valid JSON or misses required fields. */
public class TranscriptFormatException extends RuntimeException {

    public TranscriptFormatException(String message) {
        super(message);
    }

    public TranscriptFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
