package com.mk.fx.qa.rivet.execution.assertion;

import java.util.Arrays;

/**
 * Expected status code. Accepts an exact code ({@code 201}), a status class ({@code 2xx}) or
 * {@code |}-separated alternatives of either ({@code 200|204|3xx}).
 */
public record StatusCheck(String expected) implements Check {

  /** Applied when a case declares no checks. */
  public static final StatusCheck BELOW_400 = new StatusCheck("1xx|2xx|3xx");

  public static StatusCheck of(int code) {
    return new StatusCheck(String.valueOf(code));
  }

  @Override
  public CheckKind kind() {
    return CheckKind.STATUS;
  }

  @Override
  public String locator() {
    return "status";
  }

  @Override
  public void validate() {
    matches(0);
  }

  public boolean matches(int status) {
    if (expected == null || expected.isBlank()) {
      throw new IllegalArgumentException("Status expectation is empty");
    }
    return Arrays.stream(expected.split("\\|"))
        .map(String::trim)
        .map(StatusCheck::parseToken)
        .anyMatch(range -> status >= range[0] && status <= range[1]);
  }

  private static int[] parseToken(String token) {
    var lower = token.toLowerCase();
    if (lower.length() == 3 && lower.endsWith("xx") && Character.isDigit(lower.charAt(0))) {
      var base = (lower.charAt(0) - '0') * 100;
      return new int[] {base, base + 99};
    }
    try {
      var code = Integer.parseInt(lower);
      if (code < 100 || code > 599) {
        throw new IllegalArgumentException("Invalid status code: " + token);
      }
      return new int[] {code, code};
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid status code: " + token, e);
    }
  }
}
