package com.mk.fx.qa.rivet.execution.metrics;

import java.time.Duration;

/**
 * Sizing of the metrics aggregator.
 *
 * @param maxExactSamples latencies kept exactly before switching to the reservoir
 * @param reservoirSize reservoir capacity once approximate
 * @param throughputWindow trailing window for the throughput figure, whole seconds
 */
public record MetricsSettings(int maxExactSamples, int reservoirSize, Duration throughputWindow) {

  public static final long DEFAULT_MEMORY_CAP_BYTES = 8L * 1024 * 1024;
  public static final int DEFAULT_RESERVOIR_SIZE = 10_000;
  public static final Duration DEFAULT_THROUGHPUT_WINDOW = Duration.ofSeconds(10);

  public static MetricsSettings defaults() {
    return fromMemoryCap(
        DEFAULT_MEMORY_CAP_BYTES, DEFAULT_RESERVOIR_SIZE, DEFAULT_THROUGHPUT_WINDOW);
  }

  /** Derives the exact-sample limit from a byte budget at eight bytes per latency. */
  public static MetricsSettings fromMemoryCap(
      long memoryCapBytes, int reservoirSize, Duration throughputWindow) {
    var exact = (int) Math.min(Integer.MAX_VALUE - 8, Math.max(1, memoryCapBytes / Long.BYTES));
    return new MetricsSettings(exact, reservoirSize, throughputWindow);
  }
}
