package com.mk.fx.qa.rivet.execution.metrics;

import java.time.Instant;

/** One report-interval sample used to plot the evolution of load and latency. */
public record TimeSeriesPoint(
    Instant timestamp,
    long totalRequests,
    long totalErrors,
    long windowRequests,
    long latMinMs,
    long latMaxMs,
    long latAvgMs,
    int targetConcurrency,
    int inFlight) {}
