package dev.minutes.segment;

/** Outcome of validating an uploaded chunk against object storage. */
public enum ValidationState {
  /** Object exists with a positive size; counts toward session completeness. */
  VALIDATED,
  /** Object failed validation. Never counted toward completeness. */
  REJECTED
}
