package com.mk.fx.qa.rivet.execution.assertion;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Comparator;

/** JSON value equality where numbers compare by value, so {@code 1} equals {@code 1.0}. */
final class JsonValues {

  private static final Comparator<JsonNode> NUMERIC_AWARE =
      (a, b) -> {
        if (a.isNumber() && b.isNumber()) {
          return a.decimalValue().compareTo(b.decimalValue());
        }
        return a.equals(b) ? 0 : 1;
      };

  private JsonValues() {}

  static boolean sameValue(JsonNode expected, JsonNode actual) {
    if (expected == null || actual == null) {
      return expected == actual;
    }
    return expected.equals(NUMERIC_AWARE, actual);
  }
}
