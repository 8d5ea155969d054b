package com.mk.fx.qa.rivet.execution.scheduler;

import static com.mk.fx.qa.rivet.execution.Fixtures.failed;
import static com.mk.fx.qa.rivet.execution.Fixtures.passed;
import static com.mk.fx.qa.rivet.execution.Fixtures.unit;
import static com.mk.fx.qa.rivet.execution.Fixtures.units;
import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.rivet.execution.engine.RunConfigurationException;
import com.mk.fx.qa.rivet.execution.model.FailureKind;
import com.mk.fx.qa.rivet.execution.model.ExecutionUnit;
import com.mk.fx.qa.rivet.execution.model.Outcome;
import com.mk.fx.qa.rivet.execution.model.OutcomeStatus;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;
import java.util.function.IntConsumer;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class WorkerPoolSchedulerTest {

  private final List<Outcome> published = Collections.synchronizedList(new ArrayList<>());

  private List<Outcome> sortedOutcomes() {
    List<Outcome> copy = new ArrayList<>(published);
    copy.sort(Comparator.comparingInt(Outcome::sequenceIndex));
    return copy;
  }

  @Test
  void neverExceedsConcurrencyBound_andPublishesEachUnitOnce() {
    var inFlight = new AtomicInteger();
    var maxSeen = new AtomicInteger();
    var limiter = new ConcurrencyLimiter(3, 3);
    UnitWorker worker =
        (unit, cancelled) -> {
          var now = inFlight.incrementAndGet();
          maxSeen.accumulateAndGet(now, Math::max);
          Thread.sleep(ThreadLocalRandom.current().nextInt(1, 6));
          inFlight.decrementAndGet();
          return passed(unit);
        };

    var result =
        WorkerPoolScheduler.execute(
            RunContext.of("run-bound", 3, false),
            limiter,
            units(30).iterator(),
            worker,
            published::add);

    assertTrue(maxSeen.get() <= 3, "observed " + maxSeen.get() + " in flight");
    assertTrue(limiter.peakInFlight() <= 3);
    assertEquals(30, result.launched());
    assertEquals(30, result.completed());
    assertEquals(0, result.skipped());
    assertNull(result.cancellationReason());
    assertEquals(
        IntStream.range(0, 30).boxed().toList(),
        sortedOutcomes().stream().map(Outcome::sequenceIndex).toList());
  }

  @Test
  void longUnitStream_tracksOnlyUnitsInFlight() {
    var count = 50_000;
    var sinkCalls = new AtomicLong();

    var result =
        WorkerPoolScheduler.execute(
            RunContext.of("run-stream", 4, false),
            new ConcurrencyLimiter(4, 4),
            IntStream.range(0, count).mapToObj(i -> unit(i)).iterator(),
            (unit, cancelled) -> passed(unit),
            outcome -> sinkCalls.incrementAndGet());

    assertEquals(count, result.launched());
    assertEquals(count, result.completed());
    assertEquals(count, sinkCalls.get());
    assertTrue(result.peakTracked() <= 4, "tracked " + result.peakTracked() + " at once");
  }

  @Test
  void bail_skipsUnitsNotYetStarted_andLetsInFlightFinish() throws Exception {
    var secondStarted = new CountDownLatch(1);
    UnitWorker worker =
        (unit, cancelled) -> {
          if (unit.sequenceIndex() == 0) {
            assertTrue(secondStarted.await(5, TimeUnit.SECONDS));
            return failed(unit);
          }
          if (unit.sequenceIndex() == 1) {
            secondStarted.countDown();
            var deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (!cancelled.getAsBoolean() && System.nanoTime() < deadline) {
              Thread.sleep(1);
            }
          }
          return passed(unit);
        };

    var result =
        WorkerPoolScheduler.execute(
            RunContext.of("run-bail", 2, true),
            new ConcurrencyLimiter(2, 2),
            units(10).iterator(),
            worker,
            published::add);

    var outcomes = sortedOutcomes();
    assertEquals(10, outcomes.size());
    assertEquals(OutcomeStatus.FAILED, outcomes.get(0).status());
    assertEquals(OutcomeStatus.PASSED, outcomes.get(1).status());
    for (int i = 2; i < 10; i++) {
      var skipped = outcomes.get(i);
      assertEquals(OutcomeStatus.SKIPPED, skipped.status());
      assertEquals(FailureKind.NOT_STARTED, skipped.failures().get(0).kind());
      assertTrue(skipped.failures().get(0).message().startsWith("not started"));
    }
    assertEquals(2, result.launched());
    assertEquals(8, result.skipped());
    assertTrue(result.cancellationReason().contains("case-0"));
  }

  @Test
  void abandonMode_cancelsInFlightUnits_andSkipsTheRest() throws Exception {
    var started = new CountDownLatch(2);
    var token = new CancellationToken();
    UnitWorker worker =
        (unit, cancelled) -> {
          started.countDown();
          Thread.sleep(30_000);
          return passed(unit);
        };
    var aborter =
        new Thread(
            () -> {
              try {
                if (started.await(5, TimeUnit.SECONDS)) {
                  token.cancel(CancellationToken.Cause.ABORT, "aborted by user");
                }
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
            });
    aborter.start();

    var context =
        new RunContext("run-abandon", 2, 2, false, CancellationMode.ABANDON, token, null);
    var start = System.nanoTime();
    var result =
        WorkerPoolScheduler.execute(
            context, new ConcurrencyLimiter(2, 2), units(5).iterator(), worker, published::add);
    aborter.join();

    assertTrue(Duration.ofNanos(System.nanoTime() - start).toSeconds() < 10);
    var outcomes = sortedOutcomes();
    assertEquals(5, outcomes.size());
    assertEquals(OutcomeStatus.CANCELLED, outcomes.get(0).status());
    assertEquals(OutcomeStatus.CANCELLED, outcomes.get(1).status());
    assertEquals("cancelled: aborted by user", outcomes.get(0).failures().get(0).message());
    for (int i = 2; i < 5; i++) {
      assertEquals(OutcomeStatus.SKIPPED, outcomes.get(i).status());
    }
    assertEquals(2, result.cancelled());
    assertEquals(3, result.skipped());
  }

  @Test
  void abandonMode_recordsTheAttemptInProgress() throws Exception {
    var secondAttempt = new CountDownLatch(1);
    var token = new CancellationToken();
    UnitWorker worker =
        new UnitWorker() {
          @Override
          public Outcome run(ExecutionUnit unit, BooleanSupplier cancelled) {
            throw new AssertionError("attempt-reporting variant expected");
          }

          @Override
          public Outcome run(
              ExecutionUnit unit, BooleanSupplier cancelled, IntConsumer attemptStarted)
              throws InterruptedException {
            attemptStarted.accept(1);
            attemptStarted.accept(2);
            secondAttempt.countDown();
            Thread.sleep(30_000);
            return passed(unit);
          }
        };
    var aborter =
        new Thread(
            () -> {
              try {
                if (secondAttempt.await(5, TimeUnit.SECONDS)) {
                  token.cancel(CancellationToken.Cause.ABORT, "aborted by user");
                }
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
            });
    aborter.start();

    var context =
        new RunContext("run-attempts", 1, 1, false, CancellationMode.ABANDON, token, null);
    WorkerPoolScheduler.execute(
        context, new ConcurrencyLimiter(1, 1), units(1).iterator(), worker, published::add);
    aborter.join();

    assertEquals(1, published.size());
    assertEquals(OutcomeStatus.CANCELLED, published.get(0).status());
    assertEquals(2, published.get(0).attempts());
  }

  @Test
  void drainTimeout_abandonsUnitsThatOutliveIt() {
    UnitWorker worker =
        (unit, cancelled) -> {
          Thread.sleep(30_000);
          return passed(unit);
        };
    var context =
        new RunContext(
            "run-drain", 1, 1, false, CancellationMode.GRACEFUL, null, Duration.ofMillis(100));

    WorkerPoolScheduler.execute(
        context, new ConcurrencyLimiter(1, 1), units(1).iterator(), worker, published::add);

    assertEquals(1, published.size());
    assertEquals(OutcomeStatus.CANCELLED, published.get(0).status());
    assertEquals("cancelled: drain timeout", published.get(0).failures().get(0).message());
  }

  @Test
  void workerException_becomesInternalFailure_andOtherUnitsStillRun() {
    UnitWorker worker =
        (unit, cancelled) -> {
          if (unit.sequenceIndex() == 1) {
            throw new IllegalStateException("kaput");
          }
          return passed(unit);
        };

    WorkerPoolScheduler.execute(
        RunContext.of("run-crash", 2, false),
        new ConcurrencyLimiter(2, 2),
        units(4).iterator(),
        worker,
        published::add);

    var outcomes = sortedOutcomes();
    assertEquals(4, outcomes.size());
    assertEquals(OutcomeStatus.FAILED, outcomes.get(1).status());
    assertEquals(FailureKind.INTERNAL, outcomes.get(1).failures().get(0).kind());
    assertEquals("IllegalStateException: kaput", outcomes.get(1).failures().get(0).message());
    assertEquals(OutcomeStatus.PASSED, outcomes.get(3).status());
  }

  @Test
  void sinkFailure_doesNotStopTheRun() {
    var calls = new AtomicInteger();
    var result =
        WorkerPoolScheduler.execute(
            RunContext.of("run-sink", 1, false),
            new ConcurrencyLimiter(1, 1),
            units(3).iterator(),
            (unit, cancelled) -> passed(unit),
            outcome -> {
              calls.incrementAndGet();
              throw new IllegalStateException("sink down");
            });

    assertEquals(3, calls.get());
    assertEquals(3, result.completed());
  }

  @Test
  void zeroConcurrency_isRejectedBeforeAnyDispatch() {
    var calls = new AtomicInteger();
    assertThrows(
        RunConfigurationException.class,
        () ->
            WorkerPoolScheduler.execute(
                RunContext.of("run-zero", 0, false),
                new ConcurrencyLimiter(1, 1),
                units(3).iterator(),
                (unit, cancelled) -> {
                  calls.incrementAndGet();
                  return passed(unit);
                },
                published::add));
    assertEquals(0, calls.get());
    assertTrue(published.isEmpty());
  }
}
