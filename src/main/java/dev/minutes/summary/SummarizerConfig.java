package dev.minutes.summary;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configures the LangChain4j {@link ChatModel} used for meeting summaries.
 *
 * <p>Retries inside the model client are disabled; throttling is surfaced to the pipeline, which
 * reschedules the step with its own backoff.
 */
@Configuration
public class SummarizerConfig {

  @Bean
  public ChatModel summaryChatModel(SummarizerProperties properties) {
    return OpenAiChatModel.builder()
        .baseUrl(properties.baseUrl())
        .apiKey(properties.apiKey())
        .modelName(properties.modelName())
        .temperature(properties.temperature())
        .maxTokens(properties.maxTokens())
        .timeout(Duration.ofMillis(properties.timeoutMs()))
        .maxRetries(0)
        .build();
  }
}
