package dev.minutes.pipeline.stage;

import dev.minutes.pipeline.FailureKind;
import dev.minutes.pipeline.PipelineContext;
import dev.minutes.pipeline.PipelineStage;
import dev.minutes.pipeline.PipelineStartRequest;
import dev.minutes.pipeline.StageOutcome;
import dev.minutes.segment.SegmentRegistry;
import dev.minutes.storage.StorageKeys;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.springframework.stereotype.Component;

/**
 * Checks the start payload before any media work begins: required fields, a positive chunk count,
 * a chunk prefix inside the tenant's own key space and a registry holding exactly the declared
 * chunks.
 */
@Component
public class ValidateInputStage implements PipelineStage {

  private final Validator validator;
  private final SegmentRegistry segmentRegistry;

  public ValidateInputStage(Validator validator, SegmentRegistry segmentRegistry) {
    this.validator = validator;
    this.segmentRegistry = segmentRegistry;
  }

  @Override
  public StageOutcome execute(PipelineContext context) {
    PipelineStartRequest request = context.request();
    Set<ConstraintViolation<PipelineStartRequest>> violations = validator.validate(request);
    if (!violations.isEmpty()) {
      String messages =
          violations.stream()
              .map(v -> v.getPropertyPath() + ": " + v.getMessage())
              .sorted()
              .collect(Collectors.joining(", "));
      return StageOutcome.failure(FailureKind.VALIDATION_ERROR, "Invalid input: " + messages);
    }

    String expectedPrefix = StorageKeys.chunkPrefix(request.tenantId(), request.sessionId());
    if (!expectedPrefix.equals(request.storagePrefix())) {
      return StageOutcome.failure(
          FailureKind.VALIDATION_ERROR,
          "Storage prefix " + request.storagePrefix() + " does not match " + expectedPrefix);
    }

    Set<Integer> expected =
        IntStream.range(0, request.chunkCount()).boxed().collect(Collectors.toSet());
    Set<Integer> registered =
        segmentRegistry.listValidatedIndices(request.tenantId(), request.sessionId());
    if (!registered.equals(expected)) {
      return StageOutcome.failure(
          FailureKind.VALIDATION_ERROR,
          "Expected chunks 0.."
              + (request.chunkCount() - 1)
              + " but registry holds "
              + registered.size()
              + " chunk(s)");
    }
    return StageOutcome.advance(context);
  }
}
