package com.mk.fx.qa.rivet.execution.assertion;

public enum CheckKind {
  STATUS,
  HEADER,
  PATH,
  SCHEMA
}
