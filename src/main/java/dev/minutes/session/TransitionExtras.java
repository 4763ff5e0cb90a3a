package dev.minutes.session;

import java.util.List;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/**
 * Columns written together with a status transition. Both are replaced on every applied
 * transition, so moving to {@code READY} clears a previous missing-index list.
 *
 * @param errorDetail {@code "<KIND>: <message>"} for failures, otherwise {@code null}
 * @param missingIndices comma-separated missing chunk indices, otherwise {@code null}
 */
public record TransitionExtras(@Nullable String errorDetail, @Nullable String missingIndices) {

  public static TransitionExtras none() {
    return new TransitionExtras(null, null);
  }

  public static TransitionExtras error(String errorDetail) {
    return new TransitionExtras(errorDetail, null);
  }

  public static TransitionExtras missing(List<Integer> missing) {
    return new TransitionExtras(
        null, missing.stream().map(String::valueOf).collect(Collectors.joining(",")));
  }
}
