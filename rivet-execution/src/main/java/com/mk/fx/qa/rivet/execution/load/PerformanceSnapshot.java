package com.mk.fx.qa.rivet.execution.load;

import com.mk.fx.qa.rivet.execution.metrics.MetricsSnapshot;
import com.mk.fx.qa.rivet.execution.metrics.TimeSeriesPoint;

/**
 * Live view of a performance run, pushed once per report interval.
 *
 * @param metrics cumulative statistics, never final
 * @param interval statistics of the report interval that just closed
 */
public record PerformanceSnapshot(
    MetricsSnapshot metrics,
    TimeSeriesPoint interval,
    LoadPhase phase,
    int targetConcurrency,
    int inFlight) {}
