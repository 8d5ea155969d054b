package com.mk.fx.qa.rivet.execution.assertion;

/**
 * One failed check.
 *
 * @param locator status, header name, path expression or schema rule with its JSON pointer
 */
public record Mismatch(
    CheckKind check, String locator, MismatchKind kind, String expected, String actual) {

  public String describe() {
    return switch (kind) {
      case NOT_EQUAL -> locator + ": expected " + expected + " but was " + actual;
      case NOT_FOUND -> locator + ": expected " + expected + " but it does not exist";
      case INVALID_BODY -> locator + ": response body is not valid JSON (" + actual + ")";
      case SCHEMA_VIOLATION -> locator + ": expected " + expected + " but was " + actual;
    };
  }

  public Mismatch withActual(String value) {
    return new Mismatch(check, locator, kind, expected, value);
  }
}
