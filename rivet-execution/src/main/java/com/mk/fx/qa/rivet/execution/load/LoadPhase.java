package com.mk.fx.qa.rivet.execution.load;

public enum LoadPhase {
  IDLE,
  RAMPING,
  STEADY,
  SPIKING,
  DRAINING,
  DONE
}
