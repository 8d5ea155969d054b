package com.mk.fx.qa.rivet.execution.assertion;

public enum MismatchKind {
  /** The located value exists but differs from the expectation. */
  NOT_EQUAL,
  /** The header or path does not exist in the response. */
  NOT_FOUND,
  /** The body is not JSON although a path or schema check needs it. */
  INVALID_BODY,
  SCHEMA_VIOLATION
}
