package dev.minutes.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.minutes.session.SessionStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class PipelineStateTest {

  @Test
  void nextFollowsProcessingOrder() {
    assertThat(PipelineState.VALIDATING.next()).isEqualTo(PipelineState.TRANSCODING);
    assertThat(PipelineState.TRANSCODING.next()).isEqualTo(PipelineState.AWAITING_TRANSCRIPTION);
    assertThat(PipelineState.AWAITING_TRANSCRIPTION.next()).isEqualTo(PipelineState.SUMMARIZING);
    assertThat(PipelineState.SUMMARIZING.next()).isEqualTo(PipelineState.FINALIZING);
    assertThat(PipelineState.FINALIZING.next()).isEqualTo(PipelineState.COMPLETED);
  }

  @ParameterizedTest
  @EnumSource(
      value = PipelineState.class,
      names = {"COMPLETED", "FAILED"})
  void terminalStatesHaveNoNext(PipelineState state) {
    assertThat(state.isTerminal()).isTrue();
    assertThatThrownBy(state::next).isInstanceOf(IllegalStateException.class);
  }

  @ParameterizedTest
  @EnumSource(
      value = PipelineState.class,
      names = {"COMPLETED", "FAILED"},
      mode = EnumSource.Mode.EXCLUDE)
  void everyAdvanceIsALegalCatalogTransition(PipelineState state) {
    SessionStatus from = state.sessionStatus();
    SessionStatus to = state.next().sessionStatus();

    assertThat(to.allowedPredecessors()).contains(from);
    assertThat(SessionStatus.FAILED.allowedPredecessors()).contains(from);
  }

  @Test
  void awaitingTranscriptionMirrorsTranscribing() {
    assertThat(PipelineState.AWAITING_TRANSCRIPTION.sessionStatus())
        .isEqualTo(SessionStatus.TRANSCRIBING);
  }
}
