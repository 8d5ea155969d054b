package com.mk.fx.qa.rivet.execution.collate;

import com.mk.fx.qa.rivet.execution.coverage.CoverageReport;
import com.mk.fx.qa.rivet.execution.metrics.LatencyStatistics;
import com.mk.fx.qa.rivet.execution.model.CaseSummary;
import com.mk.fx.qa.rivet.execution.model.ExecutionUnit;
import com.mk.fx.qa.rivet.execution.model.Outcome;
import com.mk.fx.qa.rivet.execution.model.OutcomeStatus;
import com.mk.fx.qa.rivet.execution.model.RunResult;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReferenceArray;
import lombok.extern.slf4j.Slf4j;

/**
 * Restores sequence order from out-of-order completions. Each planned unit owns one slot keyed by
 * its sequence index; pending slots are simply empty, so partial snapshots need no sorting.
 *
 * <p>Safe for concurrent {@link #record} and {@link #snapshot} calls.
 */
@Slf4j
public class ResultCollator {

  private final String runId;
  private final String suiteName;
  private final List<ExecutionUnit> plan;
  private final AtomicReferenceArray<Outcome> slots;

  public ResultCollator(String runId, String suiteName, List<ExecutionUnit> plan) {
    this.runId = runId;
    this.suiteName = suiteName;
    this.plan = List.copyOf(plan);
    this.slots = new AtomicReferenceArray<>(this.plan.size());
    for (int i = 0; i < this.plan.size(); i++) {
      if (this.plan.get(i).sequenceIndex() != i) {
        throw new IllegalArgumentException(
            "Plan is not indexed 0..n-1: position "
                + i
                + " has index "
                + this.plan.get(i).sequenceIndex());
      }
    }
  }

  /**
   * Fills the slot of {@code outcome}.
   *
   * @throws IllegalStateException if the slot is already filled
   * @throws IndexOutOfBoundsException if the index was never planned
   */
  public void record(Outcome outcome) {
    var index = outcome.sequenceIndex();
    if (index < 0 || index >= slots.length()) {
      throw new IndexOutOfBoundsException("Unplanned sequence index " + index);
    }
    if (!slots.compareAndSet(index, null, outcome)) {
      throw new IllegalStateException("Outcome for sequence index " + index + " recorded twice");
    }
  }

  public int size() {
    return slots.length();
  }

  public RunProgress snapshot() {
    var filled = filled();
    var counts = Counts.of(filled);
    return new RunProgress(
        runId,
        slots.length(),
        filled.size(),
        counts.passed,
        counts.failed,
        counts.skipped,
        counts.flaky,
        counts.cancelled,
        filled);
  }

  /**
   * Builds the final result. Slots still empty at this point are recorded as SKIPPED so every
   * planned unit reports exactly one outcome.
   */
  public RunResult finish(
      Duration duration,
      String cancellationReason,
      CoverageReport coverage,
      LatencyStatistics latency) {
    for (int i = 0; i < slots.length(); i++) {
      if (slots.get(i) == null) {
        var reason = cancellationReason != null ? cancellationReason : "no result reported";
        if (slots.compareAndSet(i, null, Outcome.skipped(plan.get(i), reason))) {
          log.warn("Run {} unit #{} had no outcome, marked skipped", runId, i);
        }
      }
    }
    var outcomes = filled();
    var counts = Counts.of(outcomes);
    var suitePassed =
        outcomes.stream()
            .filter(o -> o.status() != OutcomeStatus.SKIPPED)
            .allMatch(o -> o.status().isSuccessful());

    return new RunResult(
        runId,
        suiteName,
        outcomes.size(),
        counts.passed,
        counts.failed,
        counts.skipped,
        counts.flaky,
        counts.cancelled,
        duration,
        outcomes,
        summarise(outcomes),
        suitePassed,
        cancellationReason,
        coverage,
        latency);
  }

  private List<Outcome> filled() {
    List<Outcome> out = new ArrayList<>(slots.length());
    for (int i = 0; i < slots.length(); i++) {
      var o = slots.get(i);
      if (o != null) {
        out.add(o);
      }
    }
    return out;
  }

  /** Per-case tallies in first-appearance order; a case is keyed by phase and name. */
  private static List<CaseSummary> summarise(List<Outcome> outcomes) {
    Map<String, int[]> tallies = new LinkedHashMap<>();
    Map<String, Outcome> firstSeen = new LinkedHashMap<>();
    for (Outcome o : outcomes) {
      var key = o.phase() + "/" + o.caseName();
      firstSeen.putIfAbsent(key, o);
      var t = tallies.computeIfAbsent(key, k -> new int[6]);
      t[0]++;
      t[1 + o.status().ordinal()]++;
    }
    List<CaseSummary> summaries = new ArrayList<>(tallies.size());
    tallies.forEach(
        (key, t) -> {
          var first = firstSeen.get(key);
          summaries.add(
              new CaseSummary(
                  first.caseName(),
                  first.phase(),
                  t[0],
                  t[1 + OutcomeStatus.PASSED.ordinal()],
                  t[1 + OutcomeStatus.FAILED.ordinal()],
                  t[1 + OutcomeStatus.FLAKY.ordinal()],
                  t[1 + OutcomeStatus.SKIPPED.ordinal()],
                  t[1 + OutcomeStatus.CANCELLED.ordinal()]));
        });
    return summaries;
  }

  private static final class Counts {
    private int passed;
    private int failed;
    private int skipped;
    private int flaky;
    private int cancelled;

    static Counts of(List<Outcome> outcomes) {
      var c = new Counts();
      for (Outcome o : outcomes) {
        switch (o.status()) {
          case PASSED -> c.passed++;
          case FAILED -> c.failed++;
          case SKIPPED -> c.skipped++;
          case FLAKY -> c.flaky++;
          case CANCELLED -> c.cancelled++;
        }
      }
      return c;
    }
  }
}
