package com.mk.fx.qa.rivet.execution.retry;

import com.mk.fx.qa.rivet.execution.model.OutcomeStatus;
import java.time.Duration;
import java.util.Objects;
import java.util.function.BooleanSupplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs an attempt function under a {@link RetryPolicy}. Only transient failures are retried;
 * backoff is applied between attempts and never after the last one.
 */
@Slf4j
public class RetryController {

  /** One attempt of a unit. Attempt numbers start at 1. */
  @FunctionalInterface
  public interface AttemptFunction {
    Attempt attempt(int number) throws InterruptedException;
  }

  private final Sleeper sleeper;

  public RetryController(Sleeper sleeper) {
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  public RetryController() {
    this(Sleeper.chunked());
  }

  /**
   * Runs attempts until one succeeds, a failure is terminal, attempts are exhausted or cancellation
   * is observed while backing off.
   *
   * @param label unit name used in logs
   * @throws InterruptedException if the calling thread is interrupted during an attempt or backoff
   */
  public RetryOutcome execute(
      String label, RetryPolicy policy, AttemptFunction function, BooleanSupplier cancelled)
      throws InterruptedException {
    Objects.requireNonNull(policy, "policy");
    Objects.requireNonNull(function, "function");
    Objects.requireNonNull(cancelled, "cancelled");

    var start = System.nanoTime();
    Attempt last = null;
    for (int number = 1; number <= policy.maxAttempts(); number++) {
      if (number > 1) {
        var backoff = policy.backoffBefore(number);
        log.warn(
            "Unit '{}' attempt {} failed ({}), retrying in {} ms ({}/{})",
            label,
            number - 1,
            describe(last),
            backoff.toMillis(),
            number,
            policy.maxAttempts());
        if (!backoff.isZero() && !sleeper.sleep(backoff, cancelled)) {
          return new RetryOutcome(OutcomeStatus.CANCELLED, number - 1, last, since(start));
        }
        if (cancelled.getAsBoolean()) {
          return new RetryOutcome(OutcomeStatus.CANCELLED, number - 1, last, since(start));
        }
      }

      last = function.attempt(number);
      if (last.succeeded()) {
        var status = number == 1 ? OutcomeStatus.PASSED : OutcomeStatus.FLAKY;
        if (status == OutcomeStatus.FLAKY) {
          log.info("Unit '{}' passed on attempt {} (flaky)", label, number);
        }
        return new RetryOutcome(status, number, last, since(start));
      }
      if (!last.isTransient(policy)) {
        break;
      }
    }
    return new RetryOutcome(OutcomeStatus.FAILED, last.number(), last, since(start));
  }

  private static String describe(Attempt attempt) {
    if (attempt.error() != null) {
      return attempt.error().getKind() + ": " + attempt.error().getMessage();
    }
    return "status " + attempt.response().getStatusCode();
  }

  private static Duration since(long startNanos) {
    return Duration.ofNanos(System.nanoTime() - startNanos);
  }
}
