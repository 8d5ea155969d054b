package com.mk.fx.qa.rivet.execution.metrics;

import java.time.Duration;

/**
 * Point-in-time statistics. Live snapshots always have {@code finalSnapshot == false}.
 *
 * @param throughput completions per second over the trailing window
 */
public record MetricsSnapshot(
    String runId,
    Duration elapsed,
    long count,
    long errorCount,
    double errorRate,
    double throughput,
    LatencyStatistics latency,
    boolean finalSnapshot) {}
