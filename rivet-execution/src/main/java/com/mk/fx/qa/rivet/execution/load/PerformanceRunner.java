package com.mk.fx.qa.rivet.execution.load;

import static java.util.concurrent.Executors.newScheduledThreadPool;

import com.mk.fx.qa.rivet.execution.assertion.Check;
import com.mk.fx.qa.rivet.execution.engine.RunConfigurationException;
import com.mk.fx.qa.rivet.execution.metrics.MetricsAggregator;
import com.mk.fx.qa.rivet.execution.metrics.MetricsSettings;
import com.mk.fx.qa.rivet.execution.metrics.Sample;
import com.mk.fx.qa.rivet.execution.model.ExecutionUnit;
import com.mk.fx.qa.rivet.execution.model.Outcome;
import com.mk.fx.qa.rivet.execution.model.OutcomeStatus;
import com.mk.fx.qa.rivet.execution.model.Phase;
import com.mk.fx.qa.rivet.execution.model.TestCase;
import com.mk.fx.qa.rivet.execution.scheduler.CancellationMode;
import com.mk.fx.qa.rivet.execution.scheduler.CancellationToken;
import com.mk.fx.qa.rivet.execution.scheduler.ConcurrencyLimiter;
import com.mk.fx.qa.rivet.execution.scheduler.RunContext;
import com.mk.fx.qa.rivet.execution.scheduler.UnitWorker;
import com.mk.fx.qa.rivet.execution.scheduler.WorkerPoolScheduler;
import com.mk.fx.qa.rivet.execution.template.TemplateResolver;
import com.mk.fx.qa.rivet.rest.Request;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs a {@link LoadPlan} against a {@link UnitTemplate}.
 *
 * <p>The calling thread runs the {@link WorkerPoolScheduler} over an endless round-robin source of
 * units that stops at the end of the load window. A ticker thread re-evaluates the {@link
 * LoadPatternDriver} every tick interval and moves the scheduler's bound to the new target; a
 * reporter thread closes a time-series interval and pushes a {@link PerformanceSnapshot} every
 * report interval. When a target arrival rate is set, the unit source paces launches to it.
 *
 * <p>Think time is spent by the worker after its unit completes and before it releases its slot, so
 * it throttles a slot the way a pausing virtual user would.
 */
@Slf4j
public class PerformanceRunner {

  private static final long PACING_CHUNK_NANOS = TimeUnit.MILLISECONDS.toNanos(50);

  private final UnitWorker worker;
  private final TemplateResolver resolver;
  private final MetricsSettings metricsSettings;

  public PerformanceRunner(
      UnitWorker worker, TemplateResolver resolver, MetricsSettings metricsSettings) {
    this.worker = Objects.requireNonNull(worker, "worker");
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.metricsSettings = Objects.requireNonNull(metricsSettings, "metricsSettings");
  }

  /**
   * Runs the plan to completion, or until {@code token} is cancelled.
   *
   * @throws RunConfigurationException if the plan or template is invalid; nothing is sent
   */
  public PerformanceResult run(
      String runId,
      LoadPlan plan,
      UnitTemplate template,
      PerformanceListener listener,
      CancellationToken token) {
    Objects.requireNonNull(runId, "runId");
    if (plan == null) {
      throw new RunConfigurationException("Load plan is required");
    }
    if (template == null || template.cases().isEmpty()) {
      throw new RunConfigurationException("Unit template requires at least one test case");
    }
    var driver = new LoadPatternDriver(plan);
    var sink = listener != null ? listener : PerformanceListener.NONE;
    var units = planTemplate(template);

    var max = plan.effectiveMaxConcurrency();
    var limiter = new ConcurrencyLimiter(0, max);
    var context =
        new RunContext(
            runId, max, max, false, CancellationMode.GRACEFUL, token, plan.drainTimeout());
    var runToken = context.token();
    var metrics = new MetricsAggregator(runId, metricsSettings);
    var thinkTime = ThinkTimeStrategy.from(plan.thinkTime());
    var state = new TickState(runId, driver, limiter, sink, System.nanoTime());

    log.info(
        "Run {} starting {} load '{}': target={}, max={}, duration={}s, rps={}",
        runId,
        plan.pattern(),
        template.name(),
        plan.targetConcurrency(),
        max,
        plan.duration().toSeconds(),
        plan.targetRps() != null ? plan.targetRps() : "unpaced");

    state.apply();
    var timers = newScheduledThreadPool(2, timerThreads(runId));
    try {
      var tickMillis = plan.tickInterval().toMillis();
      var reportMillis = plan.reportInterval().toMillis();
      timers.scheduleAtFixedRate(
          () -> guarded(runId, "ticker", state::apply),
          tickMillis,
          tickMillis,
          TimeUnit.MILLISECONDS);
      timers.scheduleAtFixedRate(
          () -> guarded(runId, "reporter", () -> report(metrics, state, limiter, sink)),
          reportMillis,
          reportMillis,
          TimeUnit.MILLISECONDS);

      UnitWorker pacedWorker =
          (unit, cancelled) -> {
            var outcome = worker.run(unit, cancelled);
            if (thinkTime.isEnabled()) {
              thinkTime.pause(cancelled);
            }
            return outcome;
          };

      var source = new PacedUnitSource(units, state, runToken, plan.duration());
      var scheduled =
          WorkerPoolScheduler.execute(
              context, limiter, source, pacedWorker, outcome -> record(metrics, outcome));

      timers.shutdownNow();
      metrics.rollWindow(0, limiter.inFlight());
      state.transition(LoadPhase.DONE, 0);
      var finalMetrics = metrics.finish();

      var aborted = runToken.isCancelled();
      if (aborted) {
        log.warn("Run {} aborted: {}", runId, runToken.reason());
      }
      return PerformanceResult.builder()
          .runId(runId)
          .metrics(finalMetrics)
          .statusCodes(metrics.statusCodes())
          .errorBreakdown(metrics.errorBreakdown())
          .errorSamples(metrics.errorSamples())
          .timeSeries(metrics.timeSeries())
          .launched(scheduled.launched())
          .completed(scheduled.completed())
          .cancelledUnits(scheduled.cancelled())
          .peakInFlight(limiter.peakInFlight())
          .phases(state.history())
          .cancelled(aborted)
          .cancellationReason(scheduled.cancellationReason())
          .build();
    } finally {
      timers.shutdownNow();
    }
  }

  /** Resolves every case once; a performance run has no per-unit variables. */
  private List<ResolvedCase> planTemplate(UnitTemplate template) {
    var scope = resolver.buildScope(template.variables(), null, template.environment());
    List<ResolvedCase> resolved = new ArrayList<>(template.cases().size());
    for (var testCase : template.cases()) {
      if (testCase.request() == null) {
        throw new RunConfigurationException("Test case '" + testCase.name() + "' has no request");
      }
      resolved.add(
          new ResolvedCase(
              testCase,
              resolver.resolveRequest(testCase.request(), scope),
              resolver.resolveChecks(testCase.checks(), scope)));
    }
    return resolved;
  }

  private static void record(MetricsAggregator metrics, Outcome outcome) {
    if (outcome.status() == OutcomeStatus.SKIPPED || outcome.status() == OutcomeStatus.CANCELLED) {
      return;
    }
    metrics.record(Sample.fromOutcome(outcome, System.nanoTime()));
  }

  private static void report(
      MetricsAggregator metrics,
      TickState state,
      ConcurrencyLimiter limiter,
      PerformanceListener listener) {
    var target = limiter.limit();
    var inFlight = limiter.inFlight();
    var point = metrics.rollWindow(target, inFlight);
    var snapshot = metrics.snapshot();
    metrics.logSnapshot(snapshot);
    listener.onSnapshot(new PerformanceSnapshot(snapshot, point, state.phase(), target, inFlight));
  }

  private static void guarded(String runId, String label, Runnable action) {
    try {
      action.run();
    } catch (RuntimeException ex) {
      log.warn("Run {} {} failed: {}", runId, label, ex.getMessage(), ex);
    }
  }

  private static ThreadFactory timerThreads(String runId) {
    var counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName("rivet-load-" + runId + "-timer-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }

  private record ResolvedCase(TestCase testCase, Request request, List<Check> checks) {}

  /** Driver state shared by the ticker, the reporter and the unit source. */
  private static final class TickState {
    private final String runId;
    private final LoadPatternDriver driver;
    private final ConcurrencyLimiter limiter;
    private final PerformanceListener listener;
    private final long startNanos;
    private final List<PhaseChange> history = new CopyOnWriteArrayList<>();
    private volatile LoadPhase phase = LoadPhase.IDLE;
    private volatile double targetRps;

    private TickState(
        String runId,
        LoadPatternDriver driver,
        ConcurrencyLimiter limiter,
        PerformanceListener listener,
        long startNanos) {
      this.runId = runId;
      this.driver = driver;
      this.limiter = limiter;
      this.listener = listener;
      this.startNanos = startNanos;
    }

    synchronized void apply() {
      if (phase == LoadPhase.DRAINING || phase == LoadPhase.DONE) {
        return;
      }
      var tick = driver.tick(elapsed());
      limiter.setLimit(tick.targetConcurrency());
      targetRps = tick.targetRps();
      transition(tick.phase(), tick.targetConcurrency());
    }

    synchronized void transition(LoadPhase next, int target) {
      var previous = phase;
      if (previous == next) {
        return;
      }
      phase = next;
      var change = new PhaseChange(previous, next, elapsed(), target);
      history.add(change);
      log.info(
          "Run {} phase {} -> {} at {} ms, target concurrency {}",
          runId,
          previous,
          next,
          change.elapsed().toMillis(),
          target);
      try {
        listener.onPhaseChange(change);
      } catch (RuntimeException ex) {
        log.warn("Run {} phase listener failed: {}", runId, ex.getMessage(), ex);
      }
    }

    LoadPhase phase() {
      return phase;
    }

    double targetRps() {
      return targetRps;
    }

    Duration elapsed() {
      return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    List<PhaseChange> history() {
      return List.copyOf(history);
    }
  }

  /**
   * Endless round-robin over the resolved cases, ending at the close of the load window or on
   * cancellation. {@code hasNext} blocks until the next launch slot when a rate is in force.
   */
  private static final class PacedUnitSource implements Iterator<ExecutionUnit> {
    private final List<ResolvedCase> cases;
    private final TickState state;
    private final CancellationToken token;
    private final long endNanos;
    private long nextLaunchNanos;
    private boolean ready;
    private int sequence;

    private PacedUnitSource(
        List<ResolvedCase> cases, TickState state, CancellationToken token, Duration duration) {
      this.cases = cases;
      this.state = state;
      this.token = token;
      this.endNanos = state.startNanos + duration.toNanos();
      this.nextLaunchNanos = state.startNanos;
    }

    @Override
    public boolean hasNext() {
      if (windowClosed()) {
        return false;
      }
      if (ready) {
        return true;
      }
      try {
        while (System.nanoTime() < nextLaunchNanos) {
          if (windowClosed()) {
            return false;
          }
          var wait = Math.min(PACING_CHUNK_NANOS, nextLaunchNanos - System.nanoTime());
          if (wait > 0) {
            TimeUnit.NANOSECONDS.sleep(wait);
          }
        }
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
        return false;
      }
      ready = true;
      return !windowClosed();
    }

    private boolean windowClosed() {
      if (token.isCancelled() || System.nanoTime() >= endNanos) {
        state.transition(LoadPhase.DRAINING, 0);
        return true;
      }
      return false;
    }

    @Override
    public ExecutionUnit next() {
      if (!hasNext()) {
        throw new NoSuchElementException("Load window closed");
      }
      ready = false;
      var rps = state.targetRps();
      if (rps > 0) {
        var interval = (long) Math.max(1, 1_000_000_000L / rps);
        nextLaunchNanos = Math.max(nextLaunchNanos, System.nanoTime()) + interval;
      }
      var resolved = cases.get(sequence % cases.size());
      return new ExecutionUnit(
          sequence++, Phase.TEST, resolved.testCase(), null, resolved.request(), resolved.checks());
    }
  }
}
