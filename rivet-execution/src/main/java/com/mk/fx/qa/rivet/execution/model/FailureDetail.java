package com.mk.fx.qa.rivet.execution.model;

import com.mk.fx.qa.rivet.execution.assertion.Mismatch;

/**
 * One reason a unit did not pass.
 *
 * @param kind failure class
 * @param message redacted human readable description
 * @param mismatch assertion detail, only present for {@link FailureKind#ASSERTION}
 */
public record FailureDetail(FailureKind kind, String message, Mismatch mismatch) {

  public static FailureDetail of(FailureKind kind, String message) {
    return new FailureDetail(kind, message, null);
  }

  public static FailureDetail assertion(Mismatch mismatch) {
    return new FailureDetail(FailureKind.ASSERTION, mismatch.describe(), mismatch);
  }
}
