package com.mk.fx.qa.rivet.execution.load;

public enum LoadPatternType {
  /** Target concurrency held for the full duration. */
  CONSTANT,
  /** Linear increase from 0 to target over the ramp duration, then held. */
  RAMP_UP,
  /** Baseline concurrency with periodic bursts to a peak. */
  SPIKE
}
