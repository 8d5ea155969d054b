package com.mk.fx.qa.rivet.execution.scheduler;

import com.mk.fx.qa.rivet.execution.engine.RunConfigurationException;
import java.time.Duration;
import java.util.Objects;

/**
 * Everything one run needs to know about how it is controlled. Passed explicitly so independent
 * runs never share mutable state.
 *
 * @param concurrency initial bound on units in flight
 * @param maxConcurrency upper limit the bound may be raised to at runtime, sizes the worker pool
 * @param bail stop dispatching after the first failed unit
 * @param drainTimeout how long to wait for in-flight units once dispatch stops, {@code null} for
 *     no limit; units still running after it are abandoned
 */
public record RunContext(
    String runId,
    int concurrency,
    int maxConcurrency,
    boolean bail,
    CancellationMode mode,
    CancellationToken token,
    Duration drainTimeout) {

  public RunContext {
    Objects.requireNonNull(runId, "runId");
    mode = mode == null ? CancellationMode.GRACEFUL : mode;
    token = token == null ? new CancellationToken() : token;
    if (concurrency < 1) {
      throw new RunConfigurationException("Concurrency bound must be >= 1 but was " + concurrency);
    }
    if (maxConcurrency < concurrency) {
      throw new RunConfigurationException(
          "Max concurrency " + maxConcurrency + " is below the concurrency bound " + concurrency);
    }
  }

  public static RunContext of(String runId, int concurrency, boolean bail) {
    return new RunContext(
        runId,
        concurrency,
        concurrency,
        bail,
        CancellationMode.GRACEFUL,
        new CancellationToken(),
        null);
  }

  public RunContext withConcurrency(int bound, boolean bailOnFailure) {
    return new RunContext(
        runId, bound, Math.max(bound, maxConcurrency), bailOnFailure, mode, token, drainTimeout);
  }
}
