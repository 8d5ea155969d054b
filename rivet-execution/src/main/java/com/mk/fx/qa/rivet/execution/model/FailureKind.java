package com.mk.fx.qa.rivet.execution.model;

public enum FailureKind {
  CONNECTION,
  TIMEOUT,
  PROTOCOL,
  ASSERTION,
  CANCELLED,
  NOT_STARTED,
  INTERNAL;

  public boolean isTransport() {
    return this == CONNECTION || this == TIMEOUT || this == PROTOCOL;
  }
}
