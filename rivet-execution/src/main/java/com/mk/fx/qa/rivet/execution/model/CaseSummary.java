package com.mk.fx.qa.rivet.execution.model;

/** Tally of one test case across all dataset rows it ran for. */
public record CaseSummary(
    String name,
    Phase phase,
    int runs,
    int passed,
    int failed,
    int flaky,
    int skipped,
    int cancelled) {

  /**
   * Case-level status: FAILED if any row failed, FLAKY if any row was flaky, SKIPPED or CANCELLED
   * if no row ran to completion, otherwise PASSED.
   */
  public OutcomeStatus status() {
    if (failed > 0) {
      return OutcomeStatus.FAILED;
    }
    if (flaky > 0) {
      return OutcomeStatus.FLAKY;
    }
    if (passed == 0) {
      return cancelled > 0 ? OutcomeStatus.CANCELLED : OutcomeStatus.SKIPPED;
    }
    return OutcomeStatus.PASSED;
  }
}
