package com.mk.fx.qa.rivet.execution.scheduler;

/**
 * Counts of one scheduler pass.
 *
 * @param completed units that reached PASSED, FLAKY or FAILED
 * @param cancellationReason reason of the run's cancellation, {@code null} if none
 * @param peakTracked most units the scheduler held as in flight at once
 */
public record SchedulerResult(
    long launched,
    long completed,
    long skipped,
    long cancelled,
    String cancellationReason,
    int peakTracked) {}
