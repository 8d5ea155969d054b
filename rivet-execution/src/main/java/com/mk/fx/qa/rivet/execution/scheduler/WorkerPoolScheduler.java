package com.mk.fx.qa.rivet.execution.scheduler;

import static java.util.concurrent.Executors.newFixedThreadPool;

import com.mk.fx.qa.rivet.execution.model.ExecutionUnit;
import com.mk.fx.qa.rivet.execution.model.Outcome;
import com.mk.fx.qa.rivet.execution.model.OutcomeStatus;
import java.time.Duration;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/**
 * Dispatches execution units in source order with at most {@link ConcurrencyLimiter#limit()} in
 * flight, and publishes exactly one outcome per unit through a single serialized sink.
 *
 * <p>Threading: a fixed pool of daemon threads sized to the context's max concurrency. The calling
 * thread runs the dispatch loop and blocks until every launched unit is terminal. A permit is taken
 * before each launch and released by the worker after it has published, so the bail flag raised by
 * a failing unit is visible to the dispatch loop before it can launch the next unit.
 *
 * <p>Cancellation stops dispatch immediately. Units never launched are published as SKIPPED with a
 * "not started" reason. In GRACEFUL mode in-flight units finish normally; in ABANDON mode they are
 * interrupted and published as CANCELLED, and anything they produce afterwards is discarded.
 *
 * <p>Only units still in flight are tracked. A worker drops its entry after publishing and before
 * returning its permit, so the tracked set never outgrows the concurrency bound however long the
 * unit stream runs.
 */
@Slf4j
public final class WorkerPoolScheduler {

  private static final long POLL_MILLIS = 50L;

  private WorkerPoolScheduler() {
    throw new UnsupportedOperationException("WorkerPoolScheduler cannot be instantiated");
  }

  /**
   * Runs all units from {@code units}.
   *
   * @param context run id, bail flag, cancellation token and mode
   * @param limiter permit source; its limit may be changed concurrently
   * @param units units in sequence order, consumed lazily; {@code hasNext} may block to pace
   *     launches
   * @param worker executes one unit
   * @param sink receives every outcome exactly once; calls are serialized
   * @return launch and completion counts
   */
  public static SchedulerResult execute(
      RunContext context,
      ConcurrencyLimiter limiter,
      Iterator<ExecutionUnit> units,
      UnitWorker worker,
      Consumer<Outcome> sink) {
    Objects.requireNonNull(context, "context");
    Objects.requireNonNull(limiter, "limiter");
    Objects.requireNonNull(units, "units");
    Objects.requireNonNull(worker, "worker");
    Objects.requireNonNull(sink, "sink");

    var token = context.token();
    var publisher = new Publisher(context.runId(), sink);
    var threadCounter = new AtomicInteger();
    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName("rivet-run-" + context.runId() + "-" + threadCounter.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        };

    ExecutorService executor = newFixedThreadPool(context.maxConcurrency(), threadFactory);
    var tracker = new Tracker();
    var abandon = context.mode() == CancellationMode.ABANDON;

    try {
      try {
        dispatch(context, limiter, units, worker, executor, publisher, tracker);
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
        token.cancel(CancellationToken.Cause.INTERRUPTED, "dispatching thread interrupted");
        abandon = true;
      }

      if (token.isCancelled()) {
        skipRemaining(units, token.reason(), publisher);
      }
      awaitCompletion(context, tracker, publisher, abandon);
    } finally {
      executor.shutdownNow();
      try {
        if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
          log.warn("Run {} worker pool did not terminate within 5s", context.runId());
        }
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
      }
    }

    return new SchedulerResult(
        tracker.launched.get(),
        publisher.completed(),
        publisher.skipped(),
        publisher.cancelled(),
        token.reason(),
        tracker.peak.get());
  }

  private static void dispatch(
      RunContext context,
      ConcurrencyLimiter limiter,
      Iterator<ExecutionUnit> units,
      UnitWorker worker,
      ExecutorService executor,
      Publisher publisher,
      Tracker tracker)
      throws InterruptedException {
    var token = context.token();
    while (!token.isCancelled()) {
      if (!units.hasNext()) {
        return;
      }
      if (!limiter.tryAcquire(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
        continue;
      }
      if (token.isCancelled() || !units.hasNext()) {
        limiter.release();
        return;
      }
      var inFlight = new InFlight(tracker.launched.getAndIncrement(), units.next());
      tracker.add(inFlight);
      log.debug(
          "Run {} dispatching unit #{} '{}'",
          context.runId(),
          inFlight.unit.sequenceIndex(),
          inFlight.unit.name());
      inFlight.future =
          executor.submit(() -> runUnit(context, limiter, worker, publisher, tracker, inFlight));
    }
  }

  private static void runUnit(
      RunContext context,
      ConcurrencyLimiter limiter,
      UnitWorker worker,
      Publisher publisher,
      Tracker tracker,
      InFlight inFlight) {
    var token = context.token();
    var unit = inFlight.unit;
    Outcome outcome;
    try {
      outcome = worker.run(unit, token::isCancelled, number -> inFlight.attempts = number);
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      outcome =
          Outcome.cancelled(unit, inFlight.attempts, inFlight.elapsed(), "worker interrupted");
    } catch (RuntimeException ex) {
      log.error(
          "Run {} unit #{} '{}' failed unexpectedly: {}",
          context.runId(),
          unit.sequenceIndex(),
          unit.name(),
          ex.getMessage(),
          ex);
      outcome = Outcome.internalError(unit, inFlight.elapsed(), ex);
    }

    try {
      if (context.bail()
          && outcome.isFailure()
          && token.cancel(
              CancellationToken.Cause.BAIL,
              "bail after unit #" + unit.sequenceIndex() + " '" + unit.name() + "' failed")) {
        log.info("Run {} bailing: {}", context.runId(), token.reason());
      }
      if (inFlight.published.compareAndSet(false, true)) {
        publisher.publish(outcome);
      } else {
        log.debug(
            "Run {} discarding late result of abandoned unit #{}",
            context.runId(),
            unit.sequenceIndex());
      }
    } finally {
      tracker.remove(inFlight);
      limiter.release();
    }
  }

  private static void skipRemaining(
      Iterator<ExecutionUnit> units, String reason, Publisher publisher) {
    while (units.hasNext()) {
      publisher.publish(Outcome.skipped(units.next(), reason));
    }
  }

  /** Waits for in-flight units, abandoning them when the mode or the drain timeout requires. */
  private static void awaitCompletion(
      RunContext context, Tracker tracker, Publisher publisher, boolean abandonMode) {
    var token = context.token();
    var deadline =
        context.drainTimeout() == null
            ? Long.MAX_VALUE
            : System.nanoTime() + context.drainTimeout().toNanos();

    while (true) {
      var next = tracker.any();
      if (next == null) {
        return;
      }
      if (abandonMode && token.isCancelled()) {
        abandon(context, tracker, publisher, token.reason());
        return;
      }
      var remaining = deadline - System.nanoTime();
      if (remaining <= 0) {
        abandon(context, tracker, publisher, "drain timeout");
        return;
      }
      try {
        var wait = Math.min(TimeUnit.MILLISECONDS.toNanos(POLL_MILLIS), remaining);
        next.future.get(wait, TimeUnit.NANOSECONDS);
      } catch (TimeoutException pending) {
        continue;
      } catch (CancellationException cancelled) {
        log.debug("Run {} unit #{} future cancelled", context.runId(), next.unit.sequenceIndex());
      } catch (ExecutionException ex) {
        log.error(
            "Run {} unit #{} worker crashed: {}",
            context.runId(),
            next.unit.sequenceIndex(),
            ex.getCause() != null ? ex.getCause().getMessage() : ex.getMessage(),
            ex);
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
        token.cancel(CancellationToken.Cause.INTERRUPTED, "interrupted while draining");
        abandon(context, tracker, publisher, token.reason());
        return;
      }
      tracker.remove(next);
    }
  }

  private static void abandon(
      RunContext context, Tracker tracker, Publisher publisher, String reason) {
    for (InFlight inFlight : tracker.inFlight.values()) {
      if (inFlight.published.compareAndSet(false, true)) {
        log.warn(
            "Run {} abandoning in-flight unit #{} '{}': {}",
            context.runId(),
            inFlight.unit.sequenceIndex(),
            inFlight.unit.name(),
            reason);
        publisher.publish(
            Outcome.cancelled(inFlight.unit, inFlight.attempts, inFlight.elapsed(), reason));
      }
      inFlight.future.cancel(true);
      tracker.remove(inFlight);
    }
  }

  /** Units launched but not yet terminal, keyed by launch number. */
  private static final class Tracker {
    private final Map<Long, InFlight> inFlight = new ConcurrentHashMap<>();
    private final AtomicLong launched = new AtomicLong();
    private final AtomicInteger peak = new AtomicInteger();

    void add(InFlight entry) {
      inFlight.put(entry.launchNumber, entry);
      peak.accumulateAndGet(inFlight.size(), Math::max);
    }

    void remove(InFlight entry) {
      inFlight.remove(entry.launchNumber, entry);
    }

    InFlight any() {
      return inFlight.values().stream().findFirst().orElse(null);
    }
  }

  private static final class InFlight {
    private final long launchNumber;
    private final ExecutionUnit unit;
    private final long startNanos = System.nanoTime();
    private final AtomicBoolean published = new AtomicBoolean(false);
    private volatile Future<?> future;
    private volatile int attempts = 1;

    private InFlight(long launchNumber, ExecutionUnit unit) {
      this.launchNumber = launchNumber;
      this.unit = unit;
    }

    private Duration elapsed() {
      return Duration.ofNanos(System.nanoTime() - startNanos);
    }
  }

  /** Single ingestion point: serializes sink calls and counts terminal states. */
  private static final class Publisher {
    private final String runId;
    private final Consumer<Outcome> sink;
    private long completed;
    private long skipped;
    private long cancelled;

    private Publisher(String runId, Consumer<Outcome> sink) {
      this.runId = runId;
      this.sink = sink;
    }

    synchronized void publish(Outcome outcome) {
      if (outcome.status() == OutcomeStatus.SKIPPED) {
        skipped++;
      } else if (outcome.status() == OutcomeStatus.CANCELLED) {
        cancelled++;
      } else {
        completed++;
      }
      try {
        sink.accept(outcome);
      } catch (RuntimeException ex) {
        log.error(
            "Run {} sink rejected outcome #{}: {}",
            runId,
            outcome.sequenceIndex(),
            ex.getMessage(),
            ex);
      }
    }

    synchronized long completed() {
      return completed;
    }

    synchronized long skipped() {
      return skipped;
    }

    synchronized long cancelled() {
      return cancelled;
    }
  }
}
