package com.mk.fx.qa.rivet.execution.load;

/**
 * Receives progress of a performance run. Callbacks run on the run's reporter and ticker threads
 * and should return quickly; exceptions they throw are logged and ignored.
 */
public interface PerformanceListener {

  PerformanceListener NONE = snapshot -> {};

  void onSnapshot(PerformanceSnapshot snapshot);

  default void onPhaseChange(PhaseChange change) {}
}
