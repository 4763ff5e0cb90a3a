package dev.minutes.summary;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.exception.RetriableException;
import dev.langchain4j.model.chat.ChatModel;
import dev.minutes.transcription.TranscriptDocument;
import java.time.Clock;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns a transcript into a validated {@link SummaryDocument} using the configured chat model.
 *
 * <p>Nothing is persisted here; the caller stores the rendered JSON only after this service has
 * returned a document that passed validation.
 */
@Service
public class SummaryService {

  private static final Logger log = LoggerFactory.getLogger(SummaryService.class);

  private final ChatModel chatModel;
  private final SummaryPromptBuilder promptBuilder;
  private final SummaryParser parser;
  private final ObjectMapper objectMapper;
  private final SummarizerProperties properties;
  private final Clock clock;

  public SummaryService(
      ChatModel chatModel,
      SummaryPromptBuilder promptBuilder,
      SummaryParser parser,
      ObjectMapper objectMapper,
      SummarizerProperties properties,
      Clock clock) {
    this.chatModel = chatModel;
    this.promptBuilder = promptBuilder;
    this.parser = parser;
    this.objectMapper = objectMapper;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Summarizes a transcript.
   *
   * @param sessionId recording the transcript belongs to
   * @param pipelineVersion version stamped into the summary
   * @param transcript validated transcript
   * @return the validated summary
   * @throws SummaryFormatException if the model output is malformed
   * @throws SummarizerUnavailableException if the model is throttling or temporarily unavailable
   */
  public SummaryDocument summarize(
      String sessionId, String pipelineVersion, TranscriptDocument transcript) {
    String output;
    try {
      output = chatModel.chat(promptBuilder.build(transcript));
    } catch (RetriableException e) {
      log.warn("Summarizer unavailable for {}: {}", sessionId, e.getMessage());
      throw new SummarizerUnavailableException(e.getMessage(), e);
    }

    SummaryDraft draft = parser.parse(output);
    SummaryDocument document =
        new SummaryDocument(
            sessionId,
            clock.instant().toString(),
            draft.summaryText(),
            draft.actions(),
            draft.decisions(),
            draft.keyTopics(),
            draft.participants(),
            pipelineVersion,
            properties.modelName(),
            UUID.randomUUID().toString());
    parser.requireValid(document);
    log.info(
        "Summarized {}: {} actions, {} decisions",
        sessionId,
        document.actions().size(),
        document.decisions().size());
    return document;
  }

  public String toJson(SummaryDocument document) {
    try {
      return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot serialize summary for " + document.recordingId(), e);
    }
  }
}
