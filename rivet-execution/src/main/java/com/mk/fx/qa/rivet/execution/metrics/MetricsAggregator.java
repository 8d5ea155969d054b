package com.mk.fx.qa.rivet.execution.metrics;

import com.google.common.annotations.VisibleForTesting;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.LongSupplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Single ingestion point for samples of one run. Every method is serialized on the aggregator, so
 * workers may publish concurrently.
 *
 * <p>Live snapshots reflect whatever has been recorded so far and are never final. {@link
 * #finish()} computes the final statistics once from the full retained distribution.
 */
@Slf4j
public class MetricsAggregator {

  private final String runId;
  private final LongSupplier nanoClock;
  private final long startNanos;
  private final LatencyTracker latency;
  private final ThroughputWindow throughput;
  private final WindowTracker window = new WindowTracker();
  private final ErrorTracker errors = new ErrorTracker();
  private final Map<Integer, Long> statusCodes = new TreeMap<>();
  private final List<TimeSeriesPoint> timeSeries = new CopyOnWriteArrayList<>();
  private long count;
  private MetricsSnapshot finalSnapshot;

  public MetricsAggregator(String runId, MetricsSettings settings) {
    this(runId, settings, System::nanoTime, new Random());
  }

  @VisibleForTesting
  MetricsAggregator(String runId, MetricsSettings settings, LongSupplier nanoClock, Random random) {
    this.runId = Objects.requireNonNull(runId, "runId");
    Objects.requireNonNull(settings, "settings");
    this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
    this.startNanos = nanoClock.getAsLong();
    this.latency = new LatencyTracker(settings.maxExactSamples(), settings.reservoirSize(), random);
    var windowSeconds = (int) Math.max(1, settings.throughputWindow().toSeconds());
    this.throughput = new ThroughputWindow(windowSeconds, startNanos);
  }

  public synchronized void record(Sample sample) {
    count++;
    latency.record(sample.latencyMs());
    window.record(sample.latencyMs());
    throughput.record(Math.max(startNanos, sample.timestampNanos()));
    if (sample.statusCode() > 0) {
      statusCodes.merge(sample.statusCode(), 1L, Long::sum);
    }
    if (!sample.success()) {
      errors.recordFailure(sample.errorCategory(), sample.statusCode(), sample.errorMessage());
    }
  }

  /** Live statistics. Never marked final. */
  public synchronized MetricsSnapshot snapshot() {
    return build(false);
  }

  /** Final statistics from the full retained distribution. Later calls return the same snapshot. */
  public synchronized MetricsSnapshot finish() {
    if (finalSnapshot == null) {
      finalSnapshot = build(true);
      logSummary(finalSnapshot);
    }
    return finalSnapshot;
  }

  /** Closes the current report interval and appends its point to the time series. */
  public synchronized TimeSeriesPoint rollWindow(int targetConcurrency, int inFlight) {
    var point =
        window.snapshotAndReset(
            Instant.now(), count, errors.totalErrors(), targetConcurrency, inFlight);
    timeSeries.add(point);
    return point;
  }

  public synchronized long count() {
    return count;
  }

  public synchronized Map<Integer, Long> statusCodes() {
    return Map.copyOf(statusCodes);
  }

  public Map<String, Long> errorBreakdown() {
    return errors.breakdownSnapshot();
  }

  public List<ErrorSample> errorSamples() {
    return errors.samplesSnapshot();
  }

  public List<TimeSeriesPoint> timeSeries() {
    return List.copyOf(timeSeries);
  }

  public synchronized boolean isApproximate() {
    return latency.isApproximate();
  }

  /** Logs one INFO line describing {@code snapshot}. */
  public void logSnapshot(MetricsSnapshot snapshot) {
    log.info(describe("snapshot", snapshot));
  }

  private MetricsSnapshot build(boolean isFinal) {
    var now = nanoClock.getAsLong();
    var errorCount = errors.totalErrors();
    return new MetricsSnapshot(
        runId,
        Duration.ofNanos(Math.max(0, now - startNanos)),
        count,
        errorCount,
        count == 0 ? 0.0 : (double) errorCount / count,
        throughput.rate(Math.max(startNanos, now)),
        latency.statistics(),
        isFinal);
  }

  private void logSummary(MetricsSnapshot snapshot) {
    var line = describe("summary", snapshot);
    if (!errors.breakdownSnapshot().isEmpty()) {
      line += ", errorBreakdown=" + errors.breakdownSnapshot();
    }
    log.info(line);
  }

  private String describe(String label, MetricsSnapshot snapshot) {
    var sb = new StringBuilder();
    sb.append("Run ")
        .append(runId)
        .append(' ')
        .append(label)
        .append(": requests=")
        .append(snapshot.count())
        .append(", errors=")
        .append(snapshot.errorCount())
        .append(", rps=")
        .append(String.format("%.2f", snapshot.throughput()));
    var lat = snapshot.latency();
    if (lat.count() > 0) {
      sb.append(", lat(ms) min=")
          .append(lat.minMs())
          .append(", avg=")
          .append(String.format("%.1f", lat.meanMs()))
          .append(", max=")
          .append(lat.maxMs())
          .append(", p50=")
          .append(lat.p50Ms())
          .append(", p95=")
          .append(lat.p95Ms())
          .append(", p99=")
          .append(lat.p99Ms());
      if (lat.approximate()) {
        sb.append(" (approximate)");
      }
    }
    return sb.toString();
  }
}
