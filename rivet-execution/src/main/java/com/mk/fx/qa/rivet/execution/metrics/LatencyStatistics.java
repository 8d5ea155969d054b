package com.mk.fx.qa.rivet.execution.metrics;

/**
 * Latency summary in milliseconds. Percentiles use the nearest-rank method.
 *
 * @param approximate percentiles come from a reservoir sample rather than every latency
 */
public record LatencyStatistics(
    long count,
    long minMs,
    long maxMs,
    double meanMs,
    long p50Ms,
    long p95Ms,
    long p99Ms,
    boolean approximate) {

  public static LatencyStatistics empty() {
    return new LatencyStatistics(0, 0, 0, 0.0, 0, 0, 0, false);
  }

  /**
   * Nearest-rank percentile: the value at index {@code ceil(p/100 * n) - 1} of the sorted values.
   *
   * @param sorted ascending values, may be empty
   * @param percentile in [0, 100]
   */
  public static long percentile(long[] sorted, double percentile) {
    if (percentile < 0 || percentile > 100) {
      throw new IllegalArgumentException("Percentile must be between 0 and 100");
    }
    if (sorted.length == 0) {
      return 0;
    }
    var idx = (int) Math.ceil((percentile / 100.0) * sorted.length) - 1;
    return sorted[Math.min(sorted.length - 1, Math.max(0, idx))];
  }
}
