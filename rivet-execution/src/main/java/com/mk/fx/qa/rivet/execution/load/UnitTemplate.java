package com.mk.fx.qa.rivet.execution.load;

import com.mk.fx.qa.rivet.execution.model.TestCase;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What a performance run sends. Cases are cycled round-robin for the whole load window.
 *
 * @param variables variables substituted into every case, in declaration order
 * @param environment environment name exposed to templates, may be {@code null}
 */
public record UnitTemplate(
    String name, List<TestCase> cases, Map<String, String> variables, String environment) {

  public UnitTemplate {
    cases = cases == null ? List.of() : List.copyOf(cases);
    variables =
        variables == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
  }

  public static UnitTemplate of(String name, TestCase... cases) {
    return new UnitTemplate(name, List.of(cases), Map.of(), null);
  }
}
