package com.mk.fx.qa.rivet.execution.engine;

import static java.util.concurrent.Executors.newFixedThreadPool;

import com.mk.fx.qa.rivet.execution.coverage.CatalogEntry;
import com.mk.fx.qa.rivet.execution.coverage.CoverageCalculator;
import com.mk.fx.qa.rivet.execution.coverage.CoverageReport;
import com.mk.fx.qa.rivet.execution.coverage.ExecutedCall;
import com.mk.fx.qa.rivet.execution.load.LoadPlan;
import com.mk.fx.qa.rivet.execution.load.PerformanceListener;
import com.mk.fx.qa.rivet.execution.load.PerformanceResult;
import com.mk.fx.qa.rivet.execution.load.PerformanceRunner;
import com.mk.fx.qa.rivet.execution.load.UnitTemplate;
import com.mk.fx.qa.rivet.execution.model.DatasetRow;
import com.mk.fx.qa.rivet.execution.model.RunResult;
import com.mk.fx.qa.rivet.execution.model.Suite;
import com.mk.fx.qa.rivet.execution.utils.LoadUtils;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/** Entry point of the engine. Every call is synchronous and independent of any other run. */
@Slf4j
public class RivetEngine {

  private final TestRunExecutor testRunExecutor;
  private final PerformanceRunner performanceRunner;
  private final CoverageCalculator coverageCalculator;
  private final RunRegistry registry;

  public RivetEngine(
      TestRunExecutor testRunExecutor,
      PerformanceRunner performanceRunner,
      CoverageCalculator coverageCalculator,
      RunRegistry registry) {
    this.testRunExecutor = Objects.requireNonNull(testRunExecutor, "testRunExecutor");
    this.performanceRunner = Objects.requireNonNull(performanceRunner, "performanceRunner");
    this.coverageCalculator = Objects.requireNonNull(coverageCalculator, "coverageCalculator");
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  /**
   * Runs one suite and returns once every unit is terminal.
   *
   * @param dataset rows to run the tests for, empty or {@code null} to run them once
   * @throws RunConfigurationException if the run cannot start; nothing has been sent
   */
  public RunResult execute(Suite suite, List<DatasetRow> dataset, RunOptions options) {
    return testRunExecutor.execute(suite, dataset, options);
  }

  public RunResult execute(
      Suite suite, List<DatasetRow> dataset, int concurrencyBound, boolean bailOnFailure) {
    return execute(suite, dataset, RunOptions.of(concurrencyBound, bailOnFailure));
  }

  /**
   * Runs suites under run ids {@code <runId>-1}, {@code <runId>-2} and so on, returning results in
   * suite order. With {@link RunOptions#suiteParallelism()} above 1, suites run in chunks of that
   * size on a dedicated pool and each chunk completes before the next starts. With bail on, no
   * suite after a failing one (sequential) or after a chunk holding a failure (parallel) is run.
   *
   * @param datasets rows by dataset name, looked up through each suite's dataset reference
   * @throws RunConfigurationException if a suite cannot start or the parallelism is below 1
   */
  public List<RunResult> executeAll(
      List<Suite> suites, Map<String, List<DatasetRow>> datasets, RunOptions options) {
    var opts = options != null ? options : RunOptions.defaults();
    var rowsByName = datasets != null ? datasets : Map.<String, List<DatasetRow>>of();
    var baseId = opts.runId() != null ? opts.runId() : LoadUtils.newRunId();
    var parallelism = opts.suiteParallelism() != null ? opts.suiteParallelism() : 1;
    if (parallelism < 1) {
      throw new RunConfigurationException("Suite parallelism must be >= 1 but was " + parallelism);
    }
    if (parallelism == 1 || suites.size() < 2) {
      return executeSequentially(suites, rowsByName, opts, baseId);
    }
    return executeInChunks(suites, rowsByName, opts, baseId, parallelism);
  }

  private List<RunResult> executeSequentially(
      List<Suite> suites,
      Map<String, List<DatasetRow>> rowsByName,
      RunOptions opts,
      String baseId) {
    List<RunResult> results = new ArrayList<>();
    for (int i = 0; i < suites.size(); i++) {
      var suite = suites.get(i);
      var result = executeNumbered(suite, rowsByName, opts, baseId, i);
      results.add(result);
      if (opts.bail() && !result.suitePassed()) {
        log.info(
            "Run {} stopping after failed suite '{}', {} suite(s) not run",
            baseId,
            suite.name(),
            suites.size() - i - 1);
        break;
      }
    }
    return results;
  }

  private List<RunResult> executeInChunks(
      List<Suite> suites,
      Map<String, List<DatasetRow>> rowsByName,
      RunOptions opts,
      String baseId,
      int parallelism) {
    var threadCounter = new AtomicInteger();
    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName("rivet-suites-" + baseId + "-" + threadCounter.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        };
    ExecutorService pool = newFixedThreadPool(Math.min(parallelism, suites.size()), threadFactory);
    log.info("Run {} running {} suite(s), {} at a time", baseId, suites.size(), parallelism);

    List<RunResult> results = new ArrayList<>();
    try {
      for (int from = 0; from < suites.size(); from += parallelism) {
        var to = Math.min(from + parallelism, suites.size());
        List<Future<RunResult>> chunk = new ArrayList<>();
        for (int i = from; i < to; i++) {
          var suite = suites.get(i);
          var number = i;
          chunk.add(pool.submit(() -> executeNumbered(suite, rowsByName, opts, baseId, number)));
        }
        var chunkFailed = false;
        for (Future<RunResult> future : chunk) {
          var result = await(baseId, future);
          results.add(result);
          chunkFailed |= !result.suitePassed();
        }
        if (opts.bail() && chunkFailed) {
          log.info(
              "Run {} stopping after a failed suite in chunk {}-{}, {} suite(s) not run",
              baseId,
              from + 1,
              to,
              suites.size() - to);
          break;
        }
      }
    } finally {
      pool.shutdownNow();
    }
    return results;
  }

  private RunResult executeNumbered(
      Suite suite,
      Map<String, List<DatasetRow>> rowsByName,
      RunOptions opts,
      String baseId,
      int index) {
    var rows = suite.dataset() != null ? rowsByName.get(suite.dataset().name()) : null;
    return execute(suite, rows, opts.toBuilder().runId(baseId + "-" + (index + 1)).build());
  }

  private static RunResult await(String baseId, Future<RunResult> future) {
    try {
      return future.get();
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException(
          "Run " + baseId + " interrupted waiting for suites", interrupted);
    } catch (ExecutionException ex) {
      if (ex.getCause() instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new IllegalStateException("Run " + baseId + " suite failed: " + ex.getCause(), ex);
    }
  }

  public PerformanceResult executePerformance(
      LoadPlan plan, UnitTemplate template, PerformanceListener listener) {
    return executePerformance(LoadUtils.newRunId(), plan, template, listener);
  }

  /**
   * Runs a load plan under a caller-chosen id, so it can be aborted with {@link #abort(String)}
   * from another thread.
   */
  public PerformanceResult executePerformance(
      String runId, LoadPlan plan, UnitTemplate template, PerformanceListener listener) {
    var handle = registry.register(runId);
    try {
      return performanceRunner.run(runId, plan, template, listener, handle.nextPass());
    } finally {
      registry.unregister(runId);
    }
  }

  public CoverageReport evaluateCoverage(
      Collection<ExecutedCall> executed, List<CatalogEntry> catalog) {
    return coverageCalculator.evaluate(executed, catalog);
  }

  /**
   * Stops dispatching new units of a running run.
   *
   * @return {@code false} if no run with this id is active
   */
  public boolean abort(String runId) {
    return registry.abort(runId, "aborted by user");
  }
}
