package com.mk.fx.qa.rivet.execution.engine;

import com.mk.fx.qa.rivet.execution.assertion.Check;
import com.mk.fx.qa.rivet.execution.collate.ResultCollator;
import com.mk.fx.qa.rivet.execution.coverage.CoverageCalculator;
import com.mk.fx.qa.rivet.execution.coverage.CoverageReport;
import com.mk.fx.qa.rivet.execution.coverage.ExecutedCall;
import com.mk.fx.qa.rivet.execution.metrics.MetricsAggregator;
import com.mk.fx.qa.rivet.execution.metrics.MetricsSettings;
import com.mk.fx.qa.rivet.execution.metrics.Sample;
import com.mk.fx.qa.rivet.execution.model.DatasetRow;
import com.mk.fx.qa.rivet.execution.model.ExecutionUnit;
import com.mk.fx.qa.rivet.execution.model.Outcome;
import com.mk.fx.qa.rivet.execution.model.OutcomeStatus;
import com.mk.fx.qa.rivet.execution.model.Phase;
import com.mk.fx.qa.rivet.execution.model.RunResult;
import com.mk.fx.qa.rivet.execution.model.Suite;
import com.mk.fx.qa.rivet.execution.model.TestCase;
import com.mk.fx.qa.rivet.execution.scheduler.CancellationToken;
import com.mk.fx.qa.rivet.execution.scheduler.ConcurrencyLimiter;
import com.mk.fx.qa.rivet.execution.scheduler.RunContext;
import com.mk.fx.qa.rivet.execution.scheduler.UnitWorker;
import com.mk.fx.qa.rivet.execution.scheduler.WorkerPoolScheduler;
import com.mk.fx.qa.rivet.execution.template.TemplateResolver;
import com.mk.fx.qa.rivet.execution.utils.LoadUtils;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/**
 * Plans and runs one suite.
 *
 * <p>Planning assigns sequence indexes in report order: setup steps, then every test case for
 * every dataset row (row-major), then teardown steps. The name filter applies to all three phases.
 * Each unit's request and expectations are resolved against its own variable scope before anything
 * is sent.
 *
 * <p>Execution is three scheduler passes. Setup and teardown run one unit at a time; the main pass
 * runs at the run's concurrency bound. A failed setup step skips the main pass. Teardown always
 * runs after a bail, and is skipped only when the user aborted the run.
 */
@Slf4j
public class TestRunExecutor {

  private static final List<DatasetRow> NO_ROW = Collections.singletonList(null);

  private final UnitWorker worker;
  private final TemplateResolver resolver;
  private final MetricsSettings metricsSettings;
  private final CoverageCalculator coverageCalculator;
  private final RunRegistry registry;
  private final int defaultConcurrency;
  private final int maxConcurrency;

  public TestRunExecutor(
      UnitWorker worker,
      TemplateResolver resolver,
      MetricsSettings metricsSettings,
      CoverageCalculator coverageCalculator,
      RunRegistry registry,
      int defaultConcurrency,
      int maxConcurrency) {
    this.worker = Objects.requireNonNull(worker, "worker");
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.metricsSettings = Objects.requireNonNull(metricsSettings, "metricsSettings");
    this.coverageCalculator = Objects.requireNonNull(coverageCalculator, "coverageCalculator");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.defaultConcurrency = defaultConcurrency;
    this.maxConcurrency = maxConcurrency;
  }

  /**
   * Runs {@code suite} once per dataset row, or once when {@code dataset} is empty.
   *
   * @throws RunConfigurationException before any dispatch if the suite or options are invalid
   */
  public RunResult execute(Suite suite, List<DatasetRow> dataset, RunOptions options) {
    var opts = options != null ? options : RunOptions.defaults();
    var concurrency = effectiveConcurrency(suite, opts);
    validate(suite, concurrency);

    var runId = opts.runId() != null ? opts.runId() : LoadUtils.newRunId();
    var plan = new Plan();
    var setup = filter(suite.setup(), opts.filter());
    planPhase(plan.setup, Phase.SETUP, setup, NO_ROW, suite, opts, 0);
    var rows = dataset == null || dataset.isEmpty() ? NO_ROW : dataset;
    var tests = filter(suite.tests(), opts.filter());
    planPhase(plan.main, Phase.TEST, tests, rows, suite, opts, plan.size());
    var teardown = filter(suite.teardown(), opts.filter());
    planPhase(plan.teardown, Phase.TEARDOWN, teardown, NO_ROW, suite, opts, plan.size());

    var handle = registry.register(runId);
    try {
      return run(runId, suite, plan, concurrency, opts, handle);
    } finally {
      registry.unregister(runId);
    }
  }

  private RunResult run(
      String runId,
      Suite suite,
      Plan plan,
      int concurrency,
      RunOptions opts,
      RunRegistry.RunHandle handle) {
    var collator = new ResultCollator(runId, suite.name(), plan.all());
    var metrics = new MetricsAggregator(runId, metricsSettings);
    Consumer<Outcome> sink = outcome -> publish(runId, collator, metrics, opts, outcome);

    log.info(
        "Run {} starting suite '{}': setup={}, tests={}, teardown={}, concurrency={}, bail={}",
        runId,
        suite.name(),
        plan.setup.size(),
        plan.main.size(),
        plan.teardown.size(),
        concurrency,
        opts.bail());
    var start = System.nanoTime();

    String cancellationReason = null;
    var setupToken = handle.nextPass();
    var setup = runPass(runId, 1, true, opts, setupToken, plan.setup, sink);
    if (setup.failed() || setupToken.isCancelled()) {
      var reason = setup.failed() ? "setup step failed" : setupToken.reason();
      cancellationReason = reason;
      plan.main.forEach(unit -> sink.accept(Outcome.skipped(unit, reason)));
    } else {
      var mainToken = handle.nextPass();
      runPass(runId, concurrency, opts.bail(), opts, mainToken, plan.main, sink);
      cancellationReason = mainToken.reason();
    }

    var teardownToken = handle.nextPass();
    runPass(runId, 1, false, opts, teardownToken, plan.teardown, sink);
    if (handle.isAborted()) {
      cancellationReason = handle.abortReason();
    }

    var latency = metrics.finish().latency();
    var result =
        collator.finish(
            Duration.ofNanos(System.nanoTime() - start), cancellationReason, null, latency);
    if (!opts.catalog().isEmpty()) {
      result = result.withCoverage(coverage(result.outcomes(), opts));
    }
    logSummary(result);
    return result;
  }

  /** Runs one phase; an empty phase is a no-op. */
  private PassResult runPass(
      String runId,
      int bound,
      boolean bail,
      RunOptions opts,
      CancellationToken token,
      List<ExecutionUnit> units,
      Consumer<Outcome> sink) {
    if (units.isEmpty()) {
      return new PassResult(false);
    }
    var failed = new boolean[1];
    var context =
        new RunContext(
            runId, bound, bound, bail, opts.cancellationMode(), token, opts.drainTimeout());
    WorkerPoolScheduler.execute(
        context,
        new ConcurrencyLimiter(bound, bound),
        units.iterator(),
        worker,
        outcome -> {
          if (outcome.isFailure()) {
            failed[0] = true;
          }
          sink.accept(outcome);
        });
    return new PassResult(failed[0]);
  }

  private void publish(
      String runId,
      ResultCollator collator,
      MetricsAggregator metrics,
      RunOptions opts,
      Outcome outcome) {
    collator.record(outcome);
    if (outcome.status() != OutcomeStatus.SKIPPED
        && outcome.status() != OutcomeStatus.CANCELLED) {
      metrics.record(Sample.fromOutcome(outcome, System.nanoTime()));
    }
    if (opts.progressListener() != null) {
      try {
        opts.progressListener().onProgress(collator.snapshot());
      } catch (RuntimeException ex) {
        log.warn("Run {} progress listener failed: {}", runId, ex.getMessage(), ex);
      }
    }
  }

  private CoverageReport coverage(List<Outcome> outcomes, RunOptions opts) {
    List<ExecutedCall> calls = new ArrayList<>();
    for (Outcome outcome : outcomes) {
      var response = outcome.response();
      if (response != null && response.status() > 0) {
        calls.add(new ExecutedCall(response.method(), response.url(), response.status()));
      }
    }
    return coverageCalculator.evaluate(calls, opts.catalog());
  }

  private void planPhase(
      List<ExecutionUnit> target,
      Phase phase,
      List<TestCase> cases,
      List<DatasetRow> rows,
      Suite suite,
      RunOptions opts,
      int firstIndex) {
    var index = firstIndex;
    for (DatasetRow row : rows) {
      var scope = resolver.buildScope(suite.variables(), row, opts.environment());
      for (TestCase testCase : cases) {
        var checks = resolver.resolveChecks(testCase.checks(), scope);
        validateChecks(testCase, checks);
        target.add(
            new ExecutionUnit(
                index++,
                phase,
                testCase,
                row,
                resolver.resolveRequest(testCase.request(), scope),
                checks));
      }
    }
  }

  private int effectiveConcurrency(Suite suite, RunOptions opts) {
    if (suite != null && suite.dataset() != null && suite.dataset().parallel() != null) {
      return suite.dataset().parallel();
    }
    return opts.concurrency() != null ? opts.concurrency() : defaultConcurrency;
  }

  private static List<TestCase> filter(List<TestCase> tests, String filter) {
    if (filter == null || filter.isBlank()) {
      return tests;
    }
    return tests.stream().filter(t -> t.name() != null && t.name().contains(filter)).toList();
  }

  private void validate(Suite suite, int concurrency) {
    if (suite == null) {
      throw new RunConfigurationException("Suite is required");
    }
    if (suite.name() == null || suite.name().isBlank()) {
      throw new RunConfigurationException("Suite name must not be empty");
    }
    if (concurrency < 1) {
      throw new RunConfigurationException("Concurrency bound must be >= 1 but was " + concurrency);
    }
    if (concurrency > maxConcurrency) {
      throw new RunConfigurationException(
          "Concurrency bound " + concurrency + " exceeds the maximum of " + maxConcurrency);
    }
    validateCases(suite.setup());
    validateCases(suite.tests());
    validateCases(suite.teardown());
  }

  private static void validateCases(List<TestCase> cases) {
    for (TestCase testCase : cases) {
      if (testCase == null || testCase.name() == null || testCase.name().isBlank()) {
        throw new RunConfigurationException("Every test case needs a name");
      }
      if (testCase.request() == null || testCase.request().method() == null) {
        throw new RunConfigurationException(
            "Test case '" + testCase.name() + "' needs a request method");
      }
      if (testCase.timeout() != null
          && (testCase.timeout().isZero() || testCase.timeout().isNegative())) {
        throw new RunConfigurationException(
            "Test case '" + testCase.name() + "' timeout must be positive");
      }
      if (testCase.retry() != null) {
        testCase.retry().validate();
      }
    }
  }

  /** Checks are validated after substitution, since a status or path may be a placeholder. */
  private static void validateChecks(TestCase testCase, List<Check> checks) {
    try {
      checks.forEach(Check::validate);
    } catch (IllegalArgumentException e) {
      throw new RunConfigurationException(
          "Test case '" + testCase.name() + "' has an invalid check: " + e.getMessage(), e);
    }
  }

  private static void logSummary(RunResult result) {
    log.info(
        "Run {} finished suite '{}' in {} ms: total={}, passed={}, failed={}, flaky={},"
            + " skipped={}, cancelled={}, suitePassed={}",
        result.runId(),
        result.suiteName(),
        result.duration().toMillis(),
        result.total(),
        result.passed(),
        result.failed(),
        result.flaky(),
        result.skipped(),
        result.cancelled(),
        result.suitePassed());
    if (result.coverage() != null) {
      log.info(
          "Run {} coverage: {}/{} expected responses",
          result.runId(),
          result.coverage().coveredTuples(),
          result.coverage().declaredTuples());
    }
  }

  private record PassResult(boolean failed) {}

  /** Units of the three phases; indexes run continuously across them. */
  private static final class Plan {
    private final List<ExecutionUnit> setup = new ArrayList<>();
    private final List<ExecutionUnit> main = new ArrayList<>();
    private final List<ExecutionUnit> teardown = new ArrayList<>();

    int size() {
      return setup.size() + main.size() + teardown.size();
    }

    List<ExecutionUnit> all() {
      List<ExecutionUnit> all = new ArrayList<>(size());
      all.addAll(setup);
      all.addAll(main);
      all.addAll(teardown);
      return all;
    }
  }
}
