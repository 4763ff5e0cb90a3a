package dev.minutes.transcription;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class TranscriptParserTest {

  private static ValidatorFactory factory;
  private static TranscriptParser parser;

  @BeforeAll
  static void setUp() {
    factory = Validation.buildDefaultValidatorFactory();
    parser = new TranscriptParser(new ObjectMapper(), factory.getValidator());
  }

  @AfterAll
  static void tearDown() {
    factory.close();
  }

  @Test
  void parsesSnakeCaseTranscript() throws IOException {
    TranscriptDocument document = parser.parse(fixture("weekly-sync.json"));

    assertThat(document.recordingId()).isEqualTo("r1");
    assertThat(document.segments()).hasSize(2);
    assertThat(document.segments().get(0).speakerLabel()).isEqualTo("spk_0");
    assertThat(document.segments().get(0).words()).hasSize(1);
    assertThat(document.segments().get(1).words()).isNull();
    assertThat(document.speakersDetected()).isEqualTo(2);
  }

  @Test
  void dialogueHasOneStrippedLinePerSegment() throws IOException {
    TranscriptDocument document = parser.parse(fixture("weekly-sync.json"));

    assertThat(document.toDialogue())
        .isEqualTo(
            "spk_0: Let's ship the intake service on Friday.\n"
                + "spk_1: Agreed, I will update the runbook.");
  }

  @Test
  void missingRequiredFieldFailsValidation() {
    String json =
        """
        {"recording_id": "r1", "generated_at": "2026-03-01T10:40:00Z", "segments": [],
         "pipeline_version": "1.0.0"}
        """;

    assertThatThrownBy(() -> parser.parse(json))
        .isInstanceOf(TranscriptFormatException.class)
        .hasMessageContaining("modelVersion");
  }

  @Test
  void outOfRangeConfidenceFailsValidation() {
    String json =
        """
        {"recording_id": "r1", "generated_at": "2026-03-01T10:40:00Z",
         "segments": [{"id": "s", "start_ms": 0, "end_ms": 10, "speaker_label": "spk_0",
                       "text": "hi", "confidence": 1.7}],
         "pipeline_version": "1.0.0", "model_version": "m"}
        """;

    assertThatThrownBy(() -> parser.parse(json))
        .isInstanceOf(TranscriptFormatException.class)
        .hasMessageContaining("confidence");
  }

  @Test
  void malformedJsonIsRejected() {
    assertThatThrownBy(() -> parser.parse("{\"recording_id\": "))
        .isInstanceOf(TranscriptFormatException.class)
        .hasMessageContaining("not valid JSON");
  }

  private static String fixture(String name) throws IOException {
    try (InputStream in =
        TranscriptParserTest.class.getResourceAsStream("/transcripts/" + name)) {
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
  }
}
