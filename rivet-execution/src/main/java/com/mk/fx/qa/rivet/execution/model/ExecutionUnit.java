package com.mk.fx.qa.rivet.execution.model;

import com.mk.fx.qa.rivet.execution.assertion.Check;
import com.mk.fx.qa.rivet.rest.Request;
import java.util.List;

/**
 * Minimal schedulable item. The sequence index is assigned once when the run is planned and is
 * the only ordering the scheduler carries through to the report.
 *
 * @param request request with every placeholder already substituted
 * @param checks checks with placeholders in expected values already substituted
 * @param row dataset row, {@code null} outside dataset runs
 */
public record ExecutionUnit(
    int sequenceIndex,
    Phase phase,
    TestCase testCase,
    DatasetRow row,
    Request request,
    List<Check> checks) {

  public ExecutionUnit {
    checks = checks == null ? List.of() : List.copyOf(checks);
  }

  public String name() {
    return testCase.name();
  }

  public Integer rowIndex() {
    return row == null ? null : row.index();
  }
}
