package dev.minutes.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class SessionStatusTest {

  @ParameterizedTest
  @EnumSource(SessionStatus.class)
  void terminalStatusesAreNoOnesPredecessor(SessionStatus target) {
    assertThat(target.allowedPredecessors())
        .doesNotContain(SessionStatus.COMPLETED, SessionStatus.FAILED);
  }

  @Test
  void onlyCompletedAndFailedAreTerminal() {
    assertThat(EnumSet.allOf(SessionStatus.class).stream().filter(SessionStatus::isTerminal))
        .containsExactlyInAnyOrder(SessionStatus.COMPLETED, SessionStatus.FAILED);
  }

  @Test
  void dispatchFailedIsTheOnlyWayBackToReady() {
    assertThat(SessionStatus.READY.allowedPredecessors())
        .containsExactlyInAnyOrderElementsOf(SessionStatus.NOT_DISPATCHED);
    assertThat(SessionStatus.DISPATCH_FAILED.allowedPredecessors())
        .containsExactly(SessionStatus.READY);
  }

  @Test
  void processingStatusesMoveStrictlyForward() {
    assertThat(SessionStatus.TRANSCODING.allowedPredecessors())
        .containsExactly(SessionStatus.VALIDATING);
    assertThat(SessionStatus.COMPLETED.allowedPredecessors())
        .containsExactly(SessionStatus.FINALIZING);
  }

  @Test
  void legalTransitionPasses() {
    assertThatCode(
            () ->
                SessionStatus.requireLegalTransition(
                    SessionStatus.NOT_DISPATCHED, SessionStatus.READY))
        .doesNotThrowAnyException();
  }

  @Test
  void transitionOutOfTerminalIsRejected() {
    assertThatThrownBy(
            () ->
                SessionStatus.requireLegalTransition(
                    Set.of(SessionStatus.COMPLETED), SessionStatus.FAILED))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("COMPLETED -> FAILED");
  }

  @Test
  void emptySourceSetIsRejected() {
    assertThatThrownBy(
            () -> SessionStatus.requireLegalTransition(Set.of(), SessionStatus.INCOMPLETE))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void missingExtrasAreCommaSeparated() {
    assertThat(TransitionExtras.missing(List.of(2, 4)).missingIndices()).isEqualTo("2,4");
  }
}
