package com.mk.fx.qa.rivet.execution.assertion;

import com.jayway.jsonpath.JsonPath;

/**
 * JSONPath expectation on the response body. Paths without a leading {@code $} are read from the
 * root, so {@code data.id} and {@code $.data.id} are equivalent.
 *
 * @param expected expected JSON value (string, number, boolean, list, map or {@code null})
 * @param existsOnly when true only existence of the path is checked
 */
public record PathCheck(String path, Object expected, boolean existsOnly) implements Check {

  public static PathCheck equalTo(String path, Object expected) {
    return new PathCheck(path, expected, false);
  }

  public static PathCheck exists(String path) {
    return new PathCheck(path, null, true);
  }

  @Override
  public CheckKind kind() {
    return CheckKind.PATH;
  }

  @Override
  public String locator() {
    return normalizedPath();
  }

  @Override
  public void validate() {
    if (path == null || path.isBlank()) {
      throw new IllegalArgumentException("Path check requires a path expression");
    }
    JsonPath.compile(normalizedPath());
  }

  public String normalizedPath() {
    var trimmed = path.trim();
    if (trimmed.startsWith("$")) {
      return trimmed;
    }
    return trimmed.startsWith("[") ? "$" + trimmed : "$." + trimmed;
  }

  public PathCheck withExpected(Object value) {
    return new PathCheck(path, value, existsOnly);
  }
}
