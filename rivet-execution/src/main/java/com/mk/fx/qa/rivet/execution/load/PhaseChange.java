package com.mk.fx.qa.rivet.execution.load;

import java.time.Duration;

/** A transition of the load pattern, as observed by the tick loop. */
public record PhaseChange(LoadPhase from, LoadPhase to, Duration elapsed, int targetConcurrency) {}
