package com.mk.fx.qa.rivet.execution.model;

/** Terminal status of one execution unit. */
public enum OutcomeStatus {
  PASSED,
  FAILED,
  SKIPPED,
  /** Passed only after one or more retried attempts. */
  FLAKY,
  /** Abandoned while in flight, or cancelled while backing off between attempts. */
  CANCELLED;

  public boolean isSuccessful() {
    return this == PASSED || this == FLAKY;
  }
}
