package com.mk.fx.qa.rivet.execution.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Builder;

/**
 * Parsed suite. Variables keep declaration order because later values may reference earlier ones.
 */
@Builder(toBuilder = true)
public record Suite(
    String name,
    String description,
    Map<String, String> variables,
    List<TestCase> setup,
    List<TestCase> tests,
    DatasetRef dataset,
    List<TestCase> teardown) {

  public Suite {
    variables =
        variables == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    setup = setup == null ? List.of() : List.copyOf(setup);
    tests = tests == null ? List.of() : List.copyOf(tests);
    teardown = teardown == null ? List.of() : List.copyOf(teardown);
  }
}
