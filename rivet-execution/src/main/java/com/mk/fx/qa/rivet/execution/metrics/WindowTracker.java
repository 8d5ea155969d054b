package com.mk.fx.qa.rivet.execution.metrics;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Latency and request counts for the current report interval. Resets after each snapshot, returning
 * a {@link TimeSeriesPoint}.
 */
final class WindowTracker {
  private final AtomicLong windowLatencyMin = new AtomicLong(Long.MAX_VALUE);
  private final AtomicLong windowLatencyMax = new AtomicLong(0);
  private final AtomicLong windowLatencySum = new AtomicLong(0);
  private final AtomicLong windowRequests = new AtomicLong(0);

  void record(long latencyMs) {
    long v = Math.max(0, latencyMs);
    windowLatencyMax.accumulateAndGet(v, Math::max);
    windowLatencyMin.accumulateAndGet(v, Math::min);
    windowLatencySum.addAndGet(v);
    windowRequests.incrementAndGet();
  }

  TimeSeriesPoint snapshotAndReset(
      Instant timestamp,
      long totalRequests,
      long totalErrors,
      int targetConcurrency,
      int inFlight) {
    long minLocal = windowLatencyMin.getAndSet(Long.MAX_VALUE);
    long maxLocal = windowLatencyMax.getAndSet(0);
    long sumLocal = windowLatencySum.getAndSet(0);
    long countLocal = windowRequests.getAndSet(0);

    return new TimeSeriesPoint(
        timestamp,
        totalRequests,
        totalErrors,
        countLocal,
        minLocal == Long.MAX_VALUE ? 0 : minLocal,
        maxLocal,
        countLocal == 0 ? 0 : sumLocal / countLocal,
        targetConcurrency,
        inFlight);
  }
}
