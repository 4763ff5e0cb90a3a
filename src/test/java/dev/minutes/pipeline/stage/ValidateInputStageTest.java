package dev.minutes.pipeline.stage;

import static org.assertj.core.api.Assertions.assertThat;

import dev.minutes.fixture.InMemorySegmentRegistry;
import dev.minutes.fixture.PipelineFixtures;
import dev.minutes.pipeline.FailureKind;
import dev.minutes.pipeline.PipelineContext;
import dev.minutes.pipeline.PipelineStartRequest;
import dev.minutes.pipeline.StageOutcome;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ValidateInputStageTest {

  private static ValidatorFactory factory;
  private static Validator validator;

  private InMemorySegmentRegistry registry;
  private ValidateInputStage stage;

  @BeforeAll
  static void createValidator() {
    factory = Validation.buildDefaultValidatorFactory();
    validator = factory.getValidator();
  }

  @AfterAll
  static void closeValidator() {
    factory.close();
  }

  @BeforeEach
  void setUp() {
    registry = new InMemorySegmentRegistry();
    stage = new ValidateInputStage(validator, registry);
  }

  @Test
  void advancesWhenRegistryHoldsExactlyTheDeclaredChunks() {
    registry.upload("u1", "r1", 0, 1, 2);
    PipelineContext context = PipelineFixtures.context();

    StageOutcome outcome = stage.execute(context);

    assertThat(outcome).isEqualTo(StageOutcome.advance(context));
  }

  @Test
  void blankFieldsFailValidation() {
    PipelineStartRequest request =
        new PipelineStartRequest(
            "r1", "u1", " ", "users/u1/chunks/r1/", 3, "1.0.0", PipelineFixtures.NOW,
            new PipelineStartRequest.Metadata("session-completion", 3, PipelineFixtures.NOW));

    StageOutcome outcome = stage.execute(PipelineContext.start(request));

    assertThat(outcome).isInstanceOf(StageOutcome.Failure.class);
    StageOutcome.Failure failure = (StageOutcome.Failure) outcome;
    assertThat(failure.kind()).isEqualTo(FailureKind.VALIDATION_ERROR);
    assertThat(failure.message()).contains("storageBucket");
  }

  @Test
  void nonPositiveChunkCountFailsValidation() {
    StageOutcome outcome = stage.execute(PipelineContext.start(PipelineFixtures.startRequest(0)));

    assertThat(((StageOutcome.Failure) outcome).kind()).isEqualTo(FailureKind.VALIDATION_ERROR);
    assertThat(((StageOutcome.Failure) outcome).message()).contains("chunkCount");
  }

  @Test
  void prefixOutsideTenantKeySpaceFailsValidation() {
    registry.upload("u1", "r1", 0, 1, 2);
    PipelineStartRequest request =
        new PipelineStartRequest(
            "r1", "u1", "recordings", "users/u2/chunks/r1/", 3, "1.0.0", PipelineFixtures.NOW,
            new PipelineStartRequest.Metadata("session-completion", 3, PipelineFixtures.NOW));

    StageOutcome outcome = stage.execute(PipelineContext.start(request));

    assertThat(((StageOutcome.Failure) outcome).kind()).isEqualTo(FailureKind.VALIDATION_ERROR);
    assertThat(((StageOutcome.Failure) outcome).message()).contains("users/u2/chunks/r1/");
  }

  @Test
  void registryMismatchFailsValidation() {
    registry.upload("u1", "r1", 0, 2);

    StageOutcome outcome = stage.execute(PipelineFixtures.context());

    assertThat(((StageOutcome.Failure) outcome).kind()).isEqualTo(FailureKind.VALIDATION_ERROR);
    assertThat(((StageOutcome.Failure) outcome).message()).contains("0..2");
  }
}
