package com.mk.fx.qa.rivet.execution.metrics;

import java.util.Arrays;

/**
 * Completions per second over a trailing window of one-second buckets. Until the window has been
 * open for its full length, the elapsed time is the denominator.
 */
final class ThroughputWindow {

  private final int seconds;
  private final long startNanos;
  private final long[] counts;
  private final long[] bucketSecond;

  ThroughputWindow(int seconds, long startNanos) {
    this.seconds = Math.max(1, seconds);
    this.startNanos = startNanos;
    this.counts = new long[this.seconds];
    this.bucketSecond = new long[this.seconds];
    Arrays.fill(bucketSecond, -1L);
  }

  void record(long nowNanos) {
    var second = secondOf(nowNanos);
    var idx = (int) (second % seconds);
    if (bucketSecond[idx] != second) {
      bucketSecond[idx] = second;
      counts[idx] = 0;
    }
    counts[idx]++;
  }

  double rate(long nowNanos) {
    var current = secondOf(nowNanos);
    var oldest = current - seconds + 1;
    long total = 0;
    for (int i = 0; i < seconds; i++) {
      if (bucketSecond[i] >= oldest && bucketSecond[i] <= current) {
        total += counts[i];
      }
    }
    var elapsedSec = Math.max(0.001, (nowNanos - startNanos) / 1_000_000_000.0);
    return total / Math.min(seconds, elapsedSec);
  }

  private long secondOf(long nanos) {
    return Math.max(0, (nanos - startNanos) / 1_000_000_000L);
  }
}
