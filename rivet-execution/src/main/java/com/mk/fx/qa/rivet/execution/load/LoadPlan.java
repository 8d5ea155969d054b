package com.mk.fx.qa.rivet.execution.load;

import static com.mk.fx.qa.rivet.execution.utils.LoadUtils.orDefault;

import com.mk.fx.qa.rivet.execution.engine.RunConfigurationException;
import java.time.Duration;
import lombok.Builder;

/**
 * Shape of a performance run. Immutable; {@link #validate()} is called before the run starts.
 *
 * @param targetConcurrency steady concurrency, and the spike baseline
 * @param rampDuration ramp length for {@link LoadPatternType#RAMP_UP}
 * @param spikePeakConcurrency concurrency during a spike, {@code null} for twice the baseline
 * @param spikeInterval length of one steady-then-spike cycle
 * @param spikeDuration length of the spike at the end of each cycle
 * @param spikeCycles number of spikes, {@code null} for as many as fit in the duration
 * @param maxConcurrency hard ceiling for every target, {@code null} derives it from the pattern
 * @param targetRps arrival rate at steady state, {@code null} launches as fast as slots free up
 * @param tickInterval how often the driver re-evaluates its targets
 * @param reportInterval how often live snapshots and time-series points are produced
 * @param drainTimeout how long in-flight units may run after the load window closes
 */
@Builder(toBuilder = true)
public record LoadPlan(
    LoadPatternType pattern,
    int targetConcurrency,
    Duration duration,
    Duration rampDuration,
    Integer spikePeakConcurrency,
    Duration spikeInterval,
    Duration spikeDuration,
    Integer spikeCycles,
    Integer maxConcurrency,
    Double targetRps,
    ThinkTime thinkTime,
    Duration tickInterval,
    Duration reportInterval,
    Duration drainTimeout) {

  public static final Duration DEFAULT_SPIKE_INTERVAL = Duration.ofSeconds(30);
  public static final Duration DEFAULT_SPIKE_DURATION = Duration.ofSeconds(5);
  public static final Duration DEFAULT_TICK_INTERVAL = Duration.ofMillis(100);
  public static final Duration DEFAULT_REPORT_INTERVAL = Duration.ofSeconds(1);
  public static final Duration DEFAULT_DRAIN_TIMEOUT = Duration.ofSeconds(30);

  public LoadPlan {
    rampDuration = orDefault(rampDuration, Duration.ZERO);
    spikeInterval = orDefault(spikeInterval, DEFAULT_SPIKE_INTERVAL);
    spikeDuration = orDefault(spikeDuration, DEFAULT_SPIKE_DURATION);
    thinkTime = thinkTime == null ? ThinkTime.none() : thinkTime;
    tickInterval = orDefault(tickInterval, DEFAULT_TICK_INTERVAL);
    reportInterval = orDefault(reportInterval, DEFAULT_REPORT_INTERVAL);
    drainTimeout = orDefault(drainTimeout, DEFAULT_DRAIN_TIMEOUT);
  }

  public static LoadPlan constant(int concurrency, Duration duration) {
    return LoadPlan.builder()
        .pattern(LoadPatternType.CONSTANT)
        .targetConcurrency(concurrency)
        .duration(duration)
        .build();
  }

  public static LoadPlan rampUp(int concurrency, Duration ramp, Duration duration) {
    return LoadPlan.builder()
        .pattern(LoadPatternType.RAMP_UP)
        .targetConcurrency(concurrency)
        .rampDuration(ramp)
        .duration(duration)
        .build();
  }

  public static LoadPlan spike(int baseline, Duration duration) {
    return LoadPlan.builder()
        .pattern(LoadPatternType.SPIKE)
        .targetConcurrency(baseline)
        .duration(duration)
        .build();
  }

  public int effectivePeak() {
    return spikePeakConcurrency != null ? spikePeakConcurrency : targetConcurrency * 2;
  }

  public int effectiveMaxConcurrency() {
    if (maxConcurrency != null) {
      return maxConcurrency;
    }
    return pattern == LoadPatternType.SPIKE
        ? Math.max(targetConcurrency, effectivePeak())
        : targetConcurrency;
  }

  /**
   * @throws RunConfigurationException describing the first invalid parameter
   */
  public LoadPlan validate() {
    if (pattern == null) {
      throw new RunConfigurationException("Load plan requires a pattern");
    }
    if (targetConcurrency < 1) {
      throw new RunConfigurationException(
          "Load plan targetConcurrency must be >= 1 but was " + targetConcurrency);
    }
    if (duration == null || duration.isZero() || duration.isNegative()) {
      throw new RunConfigurationException("Load plan duration must be positive");
    }
    if (maxConcurrency != null && maxConcurrency < 1) {
      throw new RunConfigurationException(
          "Load plan maxConcurrency must be >= 1 but was " + maxConcurrency);
    }
    if (targetRps != null && (targetRps.isNaN() || targetRps <= 0)) {
      throw new RunConfigurationException("Load plan targetRps must be positive");
    }
    if (isNotPositive(tickInterval) || isNotPositive(reportInterval)) {
      throw new RunConfigurationException("Load plan tick and report intervals must be positive");
    }
    if (drainTimeout.isNegative()) {
      throw new RunConfigurationException("Load plan drainTimeout must not be negative");
    }
    switch (pattern) {
      case RAMP_UP -> {
        if (isNotPositive(rampDuration) || rampDuration.compareTo(duration) > 0) {
          throw new RunConfigurationException(
              "Ramp-up requires a positive rampDuration no longer than the duration");
        }
      }
      case SPIKE -> {
        if (isNotPositive(spikeDuration) || spikeInterval.compareTo(spikeDuration) <= 0) {
          throw new RunConfigurationException(
              "Spike requires 0 < spikeDuration < spikeInterval");
        }
        if (effectivePeak() < targetConcurrency) {
          throw new RunConfigurationException(
              "Spike peak " + effectivePeak() + " is below the baseline " + targetConcurrency);
        }
        if (spikeCycles != null && spikeCycles < 1) {
          throw new RunConfigurationException("Spike cycles must be >= 1 when set");
        }
      }
      case CONSTANT -> {
        // no pattern-specific parameters
      }
    }
    return this;
  }

  private static boolean isNotPositive(Duration d) {
    return d == null || d.isZero() || d.isNegative();
  }
}
