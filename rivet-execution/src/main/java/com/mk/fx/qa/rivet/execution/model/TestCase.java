package com.mk.fx.qa.rivet.execution.model;

import com.mk.fx.qa.rivet.execution.assertion.Check;
import com.mk.fx.qa.rivet.execution.retry.RetryPolicy;
import java.time.Duration;
import java.util.List;
import lombok.Builder;

/**
 * A named request with its expectations.
 *
 * @param checks expectations, an empty list means "status below 400"
 * @param timeout per-case timeout, {@code null} uses the engine default
 * @param retry per-case retry policy, {@code null} uses the engine default
 */
@Builder(toBuilder = true)
public record TestCase(
    String name, RequestTemplate request, List<Check> checks, Duration timeout, RetryPolicy retry) {

  public TestCase {
    checks = checks == null ? List.of() : List.copyOf(checks);
  }
}
