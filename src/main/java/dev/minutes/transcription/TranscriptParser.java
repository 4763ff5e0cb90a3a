package dev.minutes.transcription;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/** Parses and validates transcript artifacts. */
@Component
public class TranscriptParser {

    private final ObjectMapper objectMapper;
    private final Validator validator;

    public TranscriptParser(ObjectMapper objectMapper, Validator validator) {
        this.objectMapper = objectMapper;
        this.validator = validator;
    }

    /**
     * @throws TranscriptFormatException if the JSON is malformed or fails validation
     */
    public TranscriptDocument parse(String json) {
        TranscriptDocument document;
        try {
            document = objectMapper.readValue(json, TranscriptDocument.class);
        } catch (JsonProcessingException e) {
            throw new TranscriptFormatException("Transcript is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (document == null) {
            throw new TranscriptFormatException("Transcript is empty");
        }
        Set<ConstraintViolation<TranscriptDocument>> violations = validator.validate(document);
        if (!violations.isEmpty()) {
            String message = violations.stream()
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new TranscriptFormatException("Transcript validation failed: " + message);
        }
        return document;
    }
}
