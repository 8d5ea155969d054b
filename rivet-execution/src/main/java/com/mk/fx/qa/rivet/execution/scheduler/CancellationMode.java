package com.mk.fx.qa.rivet.execution.scheduler;

/** What happens to units already in flight when a run is cancelled. */
public enum CancellationMode {
  /** In-flight units run to a terminal state. */
  GRACEFUL,
  /** In-flight units are interrupted and reported as CANCELLED. */
  ABANDON
}
