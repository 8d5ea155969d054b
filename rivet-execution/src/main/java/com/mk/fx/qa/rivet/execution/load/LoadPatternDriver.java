package com.mk.fx.qa.rivet.execution.load;

import java.time.Duration;

/**
 * Computes target concurrency (and target arrival rate) as a pure function of elapsed time.
 *
 * <p>Negative elapsed time counts as zero, and every target is clamped to [0, max concurrency], so
 * a late or skewed tick can never produce a negative or unbounded value. Elapsed time at or past
 * the duration yields {@link LoadPhase#DRAINING} with a zero target.
 */
public final class LoadPatternDriver {

  private final LoadPlan plan;
  private final int max;

  public LoadPatternDriver(LoadPlan plan) {
    this.plan = plan.validate();
    this.max = plan.effectiveMaxConcurrency();
  }

  public DriverTick tick(Duration elapsed) {
    var at = elapsed == null || elapsed.isNegative() ? Duration.ZERO : elapsed;
    if (at.compareTo(plan.duration()) >= 0) {
      return new DriverTick(LoadPhase.DRAINING, 0, 0.0);
    }

    LoadPhase phase;
    int target;
    switch (plan.pattern()) {
      case RAMP_UP -> {
        if (at.compareTo(plan.rampDuration()) < 0) {
          phase = LoadPhase.RAMPING;
          target =
              (int) Math.round(plan.targetConcurrency() * ratio(at, plan.rampDuration()));
        } else {
          phase = LoadPhase.STEADY;
          target = plan.targetConcurrency();
        }
      }
      case SPIKE -> {
        if (isSpiking(at)) {
          phase = LoadPhase.SPIKING;
          target = plan.effectivePeak();
        } else {
          phase = LoadPhase.STEADY;
          target = plan.targetConcurrency();
        }
      }
      default -> {
        phase = LoadPhase.STEADY;
        target = plan.targetConcurrency();
      }
    }

    var clamped = Math.max(0, Math.min(max, target));
    return new DriverTick(phase, clamped, rateFor(clamped));
  }

  /** Steady for the first part of each cycle, spiking for its last {@code spikeDuration}. */
  private boolean isSpiking(Duration at) {
    var interval = plan.spikeInterval().toNanos();
    var cycle = at.toNanos() / interval;
    if (plan.spikeCycles() != null && cycle >= plan.spikeCycles()) {
      return false;
    }
    var position = at.toNanos() % interval;
    return position >= interval - plan.spikeDuration().toNanos();
  }

  /** Scales the steady-state rate by the same factor as the concurrency curve. */
  private double rateFor(int concurrency) {
    if (plan.targetRps() == null) {
      return 0.0;
    }
    return plan.targetRps() * concurrency / plan.targetConcurrency();
  }

  private static double ratio(Duration part, Duration whole) {
    return Math.min(1.0, (double) part.toNanos() / whole.toNanos());
  }

  public LoadPlan plan() {
    return plan;
  }
}
