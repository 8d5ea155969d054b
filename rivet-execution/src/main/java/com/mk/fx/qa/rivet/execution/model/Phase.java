package com.mk.fx.qa.rivet.execution.model;

/** Suite section an execution unit belongs to. */
public enum Phase {
  SETUP,
  TEST,
  TEARDOWN
}
