package dev.minutes.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.minutes.fixture.PipelineFixtures;
import java.time.Clock;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

@ExtendWith(MockitoExtension.class)
class LocalPipelineLauncherTest {

  @Mock private PipelineExecutionRepository repository;

  @Captor private ArgumentCaptor<PipelineExecution> executionCaptor;

  private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

  private LocalPipelineLauncher launcher;

  @BeforeEach
  void setUp() {
    launcher =
        new LocalPipelineLauncher(
            repository, objectMapper, Clock.fixed(PipelineFixtures.NOW, ZoneOffset.UTC));
  }

  @Test
  void startPersistsDueExecutionAndReturnsItsId() throws Exception {
    when(repository.save(executionCaptor.capture())).thenAnswer(inv -> inv.getArgument(0));

    String handle = launcher.start(PipelineFixtures.startRequest(3));

    PipelineExecution saved = executionCaptor.getValue();
    assertThat(handle).isEqualTo(saved.getId().toString());
    assertThat(saved.getState()).isEqualTo(PipelineState.VALIDATING);
    assertThat(saved.getNextAttemptAt()).isEqualTo(PipelineFixtures.NOW);
    assertThat(saved.getTenantId()).isEqualTo("u1");
    assertThat(objectMapper.readValue(saved.getStartPayload(), PipelineStartRequest.class))
        .isEqualTo(PipelineFixtures.startRequest(3));
  }

  @Test
  void repositoryFailureBecomesLaunchException() {
    when(repository.save(any())).thenThrow(new DataIntegrityViolationException("dup"));

    assertThatThrownBy(() -> launcher.start(PipelineFixtures.startRequest(3)))
        .isInstanceOf(PipelineLaunchException.class)
        .hasCauseInstanceOf(DataIntegrityViolationException.class);
  }

  @Test
  void hasExecutionAsksTheRepository() {
    when(repository.existsByTenantIdAndSessionId("u1", "r1")).thenReturn(true);

    assertThat(launcher.hasExecution("u1", "r1")).isTrue();
  }
}
