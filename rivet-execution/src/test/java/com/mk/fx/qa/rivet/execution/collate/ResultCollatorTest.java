package com.mk.fx.qa.rivet.execution.collate;

import static com.mk.fx.qa.rivet.execution.Fixtures.failed;
import static com.mk.fx.qa.rivet.execution.Fixtures.outcome;
import static com.mk.fx.qa.rivet.execution.Fixtures.passed;
import static com.mk.fx.qa.rivet.execution.Fixtures.units;
import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.rivet.execution.metrics.LatencyStatistics;
import com.mk.fx.qa.rivet.execution.model.ExecutionUnit;
import com.mk.fx.qa.rivet.execution.model.Outcome;
import com.mk.fx.qa.rivet.execution.model.OutcomeStatus;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class ResultCollatorTest {

  @Test
  void finish_restoresSequenceOrder_regardlessOfCompletionOrder() throws Exception {
    var plan = units(50);
    var collator = new ResultCollator("run-1", "suite", plan);
    List<ExecutionUnit> shuffled = new ArrayList<>(plan);
    Collections.shuffle(shuffled, new Random(11));

    ExecutorService pool = Executors.newFixedThreadPool(8);
    try {
      for (ExecutionUnit unit : shuffled) {
        pool.submit(() -> collator.record(passed(unit)));
      }
    } finally {
      pool.shutdown();
      assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
    }

    var result = collator.finish(Duration.ofSeconds(1), null, null, LatencyStatistics.empty());

    assertEquals(
        IntStream.range(0, 50).boxed().toList(),
        result.outcomes().stream().map(Outcome::sequenceIndex).toList());
    assertEquals(50, result.passed());
    assertTrue(result.suitePassed());
  }

  @Test
  void record_twice_isRejected() {
    var plan = units(2);
    var collator = new ResultCollator("run-1", "suite", plan);
    collator.record(passed(plan.get(0)));

    assertThrows(IllegalStateException.class, () -> collator.record(failed(plan.get(0))));
  }

  @Test
  void snapshot_omitsPendingSlots_andIsNeverFinal() {
    var plan = units(4);
    var collator = new ResultCollator("run-1", "suite", plan);
    collator.record(passed(plan.get(2)));
    collator.record(failed(plan.get(0)));

    var progress = collator.snapshot();

    assertFalse(progress.finalSnapshot());
    assertEquals(4, progress.total());
    assertEquals(2, progress.completed());
    assertEquals(2, progress.pending());
    assertEquals(1, progress.failed());
    assertEquals(
        List.of(0, 2), progress.outcomes().stream().map(Outcome::sequenceIndex).toList());
  }

  @Test
  void finish_fillsMissingSlotsAsSkipped() {
    var plan = units(3);
    var collator = new ResultCollator("run-1", "suite", plan);
    collator.record(passed(plan.get(0)));

    var result = collator.finish(Duration.ZERO, "aborted by user", null, null);

    assertEquals(3, result.total());
    assertEquals(2, result.skipped());
    assertEquals(
        "not started: aborted by user", result.outcomes().get(1).failures().get(0).message());
    assertEquals("aborted by user", result.cancellationReason());
  }

  @Test
  void suitePassed_ignoresSkipped_butNotFailures() {
    var plan = units(3);
    var collator = new ResultCollator("run-1", "suite", plan);
    collator.record(passed(plan.get(0)));
    collator.record(outcome(plan.get(1), OutcomeStatus.FLAKY, List.of()));
    collator.record(outcome(plan.get(2), OutcomeStatus.SKIPPED, List.of()));

    var result = collator.finish(Duration.ZERO, null, null, null);
    assertTrue(result.suitePassed());
    assertEquals(1, result.flaky());
    assertEquals(1, result.skipped());

    var failing = new ResultCollator("run-2", "suite", plan);
    failing.record(failed(plan.get(0)));
    assertFalse(failing.finish(Duration.ZERO, null, null, null).suitePassed());
  }

  @Test
  void suitePassed_isFalse_whenUnitsWereCancelled() {
    var plan = units(3);
    var collator = new ResultCollator("run-1", "suite", plan);
    collator.record(outcome(plan.get(0), OutcomeStatus.CANCELLED, List.of()));
    collator.record(outcome(plan.get(1), OutcomeStatus.CANCELLED, List.of()));
    collator.record(outcome(plan.get(2), OutcomeStatus.SKIPPED, List.of()));

    var result = collator.finish(Duration.ZERO, "aborted by user", null, null);

    assertFalse(result.suitePassed());
    assertEquals(2, result.cancelled());
    assertEquals(0, result.failed());
  }

  @Test
  void caseSummaries_groupRowsOfTheSameCase() {
    var plan = units(3);
    var collator = new ResultCollator("run-1", "suite", plan);
    plan.forEach(u -> collator.record(passed(u)));

    var result = collator.finish(Duration.ZERO, null, null, null);

    assertEquals(3, result.cases().size());
    assertEquals("case-0", result.cases().get(0).name());
    assertEquals(OutcomeStatus.PASSED, result.cases().get(0).status());
  }

  @Test
  void constructor_rejectsGapsInThePlan() {
    var plan = List.of(units(3).get(0), units(3).get(2));
    assertThrows(IllegalArgumentException.class, () -> new ResultCollator("r", "s", plan));
  }
}
