package dev.minutes.session;

/** Derived artifacts recorded on a session as the pipeline produces them. */
public enum ArtifactKind {
  VIDEO,
  AUDIO,
  TRANSCRIPT,
  SUMMARY
}
