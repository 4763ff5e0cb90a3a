package dev.minutes.summary;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Strict parser for model output.
 *
 * <p>Only surrounding whitespace is tolerated. Markdown fences, prose around the object or a
 * top-level array are all rejected with {@link SummaryFormatException}.
 */
@Component
public class SummaryParser {

  private final ObjectMapper objectMapper;
  private final Validator validator;

  public SummaryParser(ObjectMapper objectMapper, Validator validator) {
    this.objectMapper = objectMapper;
    this.validator = validator;
  }

  public SummaryDraft parse(String modelOutput) {
    if (modelOutput == null || modelOutput.isBlank()) {
      throw new SummaryFormatException("Model returned an empty response");
    }
    JsonNode node;
    try {
      node = objectMapper.readTree(modelOutput.strip());
    } catch (JsonProcessingException e) {
      throw new SummaryFormatException("Model output is not valid JSON: " + e.getOriginalMessage(), e);
    }
    if (node == null || !node.isObject()) {
      throw new SummaryFormatException("Model output is not a JSON object");
    }

    SummaryDraft draft;
    try {
      draft = objectMapper.treeToValue(node, SummaryDraft.class);
    } catch (JsonProcessingException e) {
      throw new SummaryFormatException("Model output has unexpected structure: " + e.getOriginalMessage(), e);
    }
    requireValid(draft);
    return draft;
  }

  <T> void requireValid(T value) {
    Set<ConstraintViolation<T>> violations = validator.validate(value);
    if (!violations.isEmpty()) {
      String messages =
          violations.stream()
              .map(v -> v.getPropertyPath() + ": " + v.getMessage())
              .sorted()
              .collect(Collectors.joining(", "));
      throw new SummaryFormatException("Summary validation failed: " + messages);
    }
  }
}
