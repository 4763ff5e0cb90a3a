package dev.minutes.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/** Starts executions by inserting a due {@link PipelineExecution} row for the scheduler. */
@Service
public class LocalPipelineLauncher implements PipelineLauncher {

  private static final Logger log = LoggerFactory.getLogger(LocalPipelineLauncher.class);

  private final PipelineExecutionRepository repository;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public LocalPipelineLauncher(
      PipelineExecutionRepository repository, ObjectMapper objectMapper, Clock clock) {
    this.repository = repository;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  @Override
  public String start(PipelineStartRequest request) {
    String payload;
    try {
      payload = objectMapper.writeValueAsString(request);
    } catch (JsonProcessingException e) {
      throw new PipelineLaunchException("Cannot serialize start payload", e);
    }
    try {
      PipelineExecution execution =
          repository.save(
              new PipelineExecution(
                  request.tenantId(), request.sessionId(), payload, clock.instant()));
      log.info(
          "Started pipeline execution {} for {}/{}",
          execution.getId(),
          request.tenantId(),
          request.sessionId());
      return execution.getId().toString();
    } catch (DataAccessException e) {
      throw new PipelineLaunchException("Cannot create pipeline execution", e);
    }
  }

  @Override
  public boolean hasExecution(String tenantId, String sessionId) {
    return repository.existsByTenantIdAndSessionId(tenantId, sessionId);
  }
}
