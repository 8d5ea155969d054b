package com.mk.fx.qa.rivet.execution.retry;

import com.mk.fx.qa.rivet.execution.model.OutcomeStatus;
import java.time.Duration;

/**
 * Collapsed result of all attempts of one unit.
 *
 * @param status PASSED, FLAKY, FAILED or CANCELLED
 * @param lastAttempt last completed attempt, {@code null} if cancelled before the first finished
 * @param elapsed total time across attempts and backoffs
 */
public record RetryOutcome(
    OutcomeStatus status, int attempts, Attempt lastAttempt, Duration elapsed) {}
