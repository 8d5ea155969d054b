package com.mk.fx.qa.rivet.execution.model;

import com.mk.fx.qa.rivet.execution.coverage.CoverageReport;
import com.mk.fx.qa.rivet.execution.metrics.LatencyStatistics;
import java.time.Duration;
import java.util.List;

/**
 * Final result of a functional run. Outcomes are ordered by sequence index.
 *
 * @param cancellationReason why dispatch stopped early, {@code null} for complete runs
 * @param coverage coverage against the supplied catalog, {@code null} when none was supplied
 */
public record RunResult(
    String runId,
    String suiteName,
    int total,
    int passed,
    int failed,
    int skipped,
    int flaky,
    int cancelled,
    Duration duration,
    List<Outcome> outcomes,
    List<CaseSummary> cases,
    boolean suitePassed,
    String cancellationReason,
    CoverageReport coverage,
    LatencyStatistics latency) {

  public RunResult {
    outcomes = List.copyOf(outcomes);
    cases = List.copyOf(cases);
  }

  public RunResult withCoverage(CoverageReport report) {
    return new RunResult(
        runId,
        suiteName,
        total,
        passed,
        failed,
        skipped,
        flaky,
        cancelled,
        duration,
        outcomes,
        cases,
        suitePassed,
        cancellationReason,
        report,
        latency);
  }
}
