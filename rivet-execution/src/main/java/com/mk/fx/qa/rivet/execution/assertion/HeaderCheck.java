package com.mk.fx.qa.rivet.execution.assertion;

/**
 * Expected response header. The name is matched case-insensitively; a {@code null} expected value
 * only requires the header to be present.
 */
public record HeaderCheck(String name, String expected) implements Check {

  public static HeaderCheck present(String name) {
    return new HeaderCheck(name, null);
  }

  @Override
  public CheckKind kind() {
    return CheckKind.HEADER;
  }

  @Override
  public String locator() {
    return "header " + name;
  }

  @Override
  public void validate() {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Header check requires a header name");
    }
  }
}
