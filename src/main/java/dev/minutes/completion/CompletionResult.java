package dev.minutes.completion;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Verdict of one {@link CompletionDetector#evaluate} call.
 *
 * @param complete registered indices are exactly {@code 0..expected-1}
 * @param dispatched this call performed the READY transition and started the pipeline
 * @param reason detailed outcome
 * @param expected declared chunk count, if any
 * @param uploaded number of registered chunks
 * @param missing missing indices in ascending order
 * @param unexpected registered indices outside the declared range, ascending
 * @param executionHandle handle of the started execution, when dispatched
 */
public record CompletionResult(
    boolean complete,
    boolean dispatched,
    CompletionReason reason,
    @Nullable Integer expected,
    int uploaded,
    List<Integer> missing,
    List<Integer> unexpected,
    @Nullable String executionHandle) {

  public CompletionResult {
    missing = List.copyOf(missing);
    unexpected = List.copyOf(unexpected);
  }

  static CompletionResult awaitingDeclaration(int uploaded) {
    return new CompletionResult(
        false, false, CompletionReason.AWAITING_DECLARATION, null, uploaded, List.of(), List.of(),
        null);
  }

  static CompletionResult missing(int expected, int uploaded, List<Integer> missing) {
    return new CompletionResult(
        false, false, CompletionReason.MISSING_SEGMENTS, expected, uploaded, missing, List.of(),
        null);
  }

  static CompletionResult unexpected(int expected, int uploaded, List<Integer> unexpected) {
    return new CompletionResult(
        false, false, CompletionReason.UNEXPECTED_SEGMENTS, expected, uploaded, List.of(),
        unexpected, null);
  }

  static CompletionResult complete(
      int expected, CompletionReason reason, @Nullable String executionHandle) {
    return new CompletionResult(
        true,
        reason == CompletionReason.DISPATCHED,
        reason,
        expected,
        expected,
        List.of(),
        List.of(),
        executionHandle);
  }
}
