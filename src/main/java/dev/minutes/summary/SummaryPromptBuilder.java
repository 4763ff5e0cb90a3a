package dev.minutes.summary;

import dev.minutes.transcription.TranscriptDocument;
import org.springframework.stereotype.Component;

/** Builds the instruction sent to the model for one transcript. */
@Component
public class SummaryPromptBuilder {

  private static final String TEMPLATE =
      """
      You are an expert meeting analyst. Summarize the meeting transcript below.

      Respond with a single JSON object and nothing else, using exactly these fields:
      {
        "summary_text": "3-5 sentence summary of the meeting",
        "actions": [
          {"id": "a1", "description": "what must be done", "owner": "speaker label or name, or null",
           "due_date": "YYYY-MM-DD or null", "source_timestamp_ms": 0}
        ],
        "decisions": [
          {"id": "d1", "decision": "what was decided", "source_timestamp_ms": 0}
        ],
        "key_topics": ["topic"],
        "participants": ["speaker label"]
      }

      Use empty arrays when there are no actions or decisions.
      source_timestamp_ms is the start time of the segment where the item was raised.

      Transcript (%d segments):
      %s
      """;

  public String build(TranscriptDocument transcript) {
    return TEMPLATE.formatted(transcript.segments().size(), transcript.toDialogue());
  }
}
