package com.mk.fx.qa.rivet.execution.collate;

import com.mk.fx.qa.rivet.execution.model.Outcome;
import java.util.List;

/**
 * Partial view of a run for live progress. Never final: the run may still change it.
 *
 * @param outcomes filled slots in sequence order; pending slots are omitted
 */
public record RunProgress(
    String runId,
    int total,
    int completed,
    int passed,
    int failed,
    int skipped,
    int flaky,
    int cancelled,
    List<Outcome> outcomes) {

  public RunProgress {
    outcomes = List.copyOf(outcomes);
  }

  public int pending() {
    return total - completed;
  }

  public boolean finalSnapshot() {
    return false;
  }
}
