package com.mk.fx.qa.rivet.execution.engine;

import com.mk.fx.qa.rivet.execution.coverage.CatalogEntry;
import com.mk.fx.qa.rivet.execution.scheduler.CancellationMode;
import java.time.Duration;
import java.util.List;
import lombok.Builder;

/**
 * Caller choices for one functional run. Unset values fall back to the engine defaults.
 *
 * @param runId identifier used in logs and for {@link RivetEngine#abort(String)}, generated when
 *     {@code null}
 * @param concurrency concurrency bound, {@code null} for the engine default; a dataset's own
 *     {@code parallel} value takes precedence
 * @param filter substring a step name must contain to run, applied to setup, tests and teardown
 *     alike
 * @param environment environment name exposed to templates as {@code RIVET_ENV}
 * @param catalog endpoint catalog, coverage is computed when non-empty
 * @param drainTimeout bound on waiting for in-flight units after cancellation, {@code null} waits
 *     for them all
 * @param suiteParallelism suites {@link RivetEngine#executeAll} runs at once, {@code null} runs
 *     them one after another
 */
@Builder(toBuilder = true)
public record RunOptions(
    String runId,
    Integer concurrency,
    boolean bail,
    CancellationMode cancellationMode,
    String filter,
    String environment,
    List<CatalogEntry> catalog,
    ProgressListener progressListener,
    Duration drainTimeout,
    Integer suiteParallelism) {

  public RunOptions {
    cancellationMode = cancellationMode == null ? CancellationMode.GRACEFUL : cancellationMode;
    catalog = catalog == null ? List.of() : List.copyOf(catalog);
  }

  public static RunOptions defaults() {
    return RunOptions.builder().build();
  }

  public static RunOptions of(int concurrency, boolean bail) {
    return RunOptions.builder().concurrency(concurrency).bail(bail).build();
  }
}
