package com.mk.fx.qa.rivet.execution.model;

import java.time.Duration;
import java.util.List;

/**
 * Terminal result of one execution unit. Every unit yields exactly one outcome.
 *
 * @param rowIndex dataset row index, {@code null} outside dataset runs
 * @param attempts number of attempts made, 0 for units that never started
 * @param response redacted snapshot of the last exchange, {@code null} when none happened
 */
public record Outcome(
    int sequenceIndex,
    String caseName,
    Phase phase,
    Integer rowIndex,
    OutcomeStatus status,
    int attempts,
    Duration duration,
    ResponseSnapshot response,
    List<FailureDetail> failures) {

  public Outcome {
    failures = failures == null ? List.of() : List.copyOf(failures);
    duration = duration == null ? Duration.ZERO : duration;
  }

  public static Outcome skipped(ExecutionUnit unit, String reason) {
    return new Outcome(
        unit.sequenceIndex(),
        unit.name(),
        unit.phase(),
        unit.rowIndex(),
        OutcomeStatus.SKIPPED,
        0,
        Duration.ZERO,
        null,
        List.of(FailureDetail.of(FailureKind.NOT_STARTED, "not started: " + reason)));
  }

  public static Outcome cancelled(
      ExecutionUnit unit, int attempts, Duration elapsed, String reason) {
    return new Outcome(
        unit.sequenceIndex(),
        unit.name(),
        unit.phase(),
        unit.rowIndex(),
        OutcomeStatus.CANCELLED,
        attempts,
        elapsed,
        null,
        List.of(FailureDetail.of(FailureKind.CANCELLED, "cancelled: " + reason)));
  }

  public static Outcome internalError(ExecutionUnit unit, Duration elapsed, Throwable error) {
    return new Outcome(
        unit.sequenceIndex(),
        unit.name(),
        unit.phase(),
        unit.rowIndex(),
        OutcomeStatus.FAILED,
        1,
        elapsed,
        null,
        List.of(
            FailureDetail.of(
                FailureKind.INTERNAL,
                error.getClass().getSimpleName()
                    + (error.getMessage() != null ? ": " + error.getMessage() : ""))));
  }

  public boolean isFailure() {
    return status == OutcomeStatus.FAILED;
  }
}
