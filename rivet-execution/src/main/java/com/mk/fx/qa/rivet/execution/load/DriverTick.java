package com.mk.fx.qa.rivet.execution.load;

/**
 * Targets for one scheduling tick.
 *
 * @param targetRps arrival rate to pace launches at, 0 when the plan has no rate
 */
public record DriverTick(LoadPhase phase, int targetConcurrency, double targetRps) {}
