package dev.minutes.session;

/**
 * Outcome of {@link SessionCatalog#transitionStatus}.
 *
 * @param applied {@code false} when another writer moved the session first
 */
public record TransitionResult(boolean applied) {}
