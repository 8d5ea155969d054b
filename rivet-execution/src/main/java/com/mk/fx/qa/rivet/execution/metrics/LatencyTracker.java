package com.mk.fx.qa.rivet.execution.metrics;

import java.util.Arrays;
import java.util.Random;
import lombok.extern.slf4j.Slf4j;

/**
 * Latency distribution with exact percentiles up to {@code maxExactSamples} values. Past that it
 * migrates the retained values into a {@link Reservoir} and reports percentiles as approximate.
 * Min, max and mean stay exact in both modes.
 */
@Slf4j
final class LatencyTracker {

  private static final int INITIAL_CAPACITY = 1024;

  private final int maxExactSamples;
  private final int reservoirSize;
  private final Random random;
  private long[] exact = new long[INITIAL_CAPACITY];
  private int exactSize;
  private Reservoir reservoir;
  private long count;
  private long min = Long.MAX_VALUE;
  private long max;
  private long sum;

  LatencyTracker(int maxExactSamples, int reservoirSize, Random random) {
    this.maxExactSamples = Math.max(1, maxExactSamples);
    this.reservoirSize = Math.max(1, reservoirSize);
    this.random = random;
  }

  synchronized void record(long latencyMs) {
    long v = Math.max(0, latencyMs);
    count++;
    sum += v;
    max = Math.max(max, v);
    min = Math.min(min, v);

    if (reservoir != null) {
      reservoir.add(v);
      return;
    }
    if (exactSize == maxExactSamples) {
      migrateToReservoir();
      reservoir.add(v);
      return;
    }
    if (exactSize == exact.length) {
      exact = Arrays.copyOf(exact, Math.min(maxExactSamples, exact.length * 2));
    }
    exact[exactSize++] = v;
  }

  synchronized boolean isApproximate() {
    return reservoir != null;
  }

  synchronized long count() {
    return count;
  }

  synchronized LatencyStatistics statistics() {
    if (count == 0) {
      return LatencyStatistics.empty();
    }
    long[] sorted;
    if (reservoir != null) {
      sorted = reservoir.sortedSnapshot();
    } else {
      sorted = Arrays.copyOf(exact, exactSize);
      Arrays.sort(sorted);
    }
    return new LatencyStatistics(
        count,
        min,
        max,
        (double) sum / count,
        LatencyStatistics.percentile(sorted, 50),
        LatencyStatistics.percentile(sorted, 95),
        LatencyStatistics.percentile(sorted, 99),
        reservoir != null);
  }

  private void migrateToReservoir() {
    log.info(
        "Latency store reached {} samples, switching to a {}-value reservoir"
            + " (approximate percentiles)",
        maxExactSamples,
        reservoirSize);
    reservoir = new Reservoir(reservoirSize, random);
    for (int i = 0; i < exactSize; i++) {
      reservoir.add(exact[i]);
    }
    exact = new long[0];
    exactSize = 0;
  }
}
