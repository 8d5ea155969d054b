package com.mk.fx.qa.rivet.execution.assertion;

/**
 * One expectation on a response. The permitted records map one to one onto {@link CheckKind}, so
 * consumers dispatching on {@link #kind()} may cast to the matching record.
 */
public sealed interface Check permits StatusCheck, HeaderCheck, PathCheck, SchemaCheck {

  CheckKind kind();

  /** What the check looks at, used in mismatch reports. */
  String locator();

  /**
   * Rejects checks that can never be evaluated, such as a malformed status expression.
   *
   * @throws IllegalArgumentException if the check is malformed
   */
  default void validate() {}
}
