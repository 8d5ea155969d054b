package com.mk.fx.qa.rivet.execution.engine;

import com.mk.fx.qa.rivet.execution.scheduler.CancellationToken;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;

/**
 * Thread-safe registry of running runs, used to route user aborts.
 *
 * <p>A functional run moves through several scheduler passes, each with its own token. The registry
 * remembers an abort so that a pass that starts after it is cancelled immediately.
 */
@Slf4j
public class RunRegistry {

  private final Map<String, RunHandle> active = new ConcurrentHashMap<>();

  /**
   * Registers a run.
   *
   * @throws RunConfigurationException if a run with the same id is already active
   */
  public RunHandle register(String runId) {
    var handle = new RunHandle(runId);
    if (active.putIfAbsent(runId, handle) != null) {
      throw new RunConfigurationException("Run " + runId + " is already active");
    }
    return handle;
  }

  public void unregister(String runId) {
    active.remove(runId);
  }

  /**
   * Aborts an active run.
   *
   * @return {@code false} if no run with this id is active
   */
  public boolean abort(String runId, String reason) {
    var handle = active.get(runId);
    if (handle == null) {
      return false;
    }
    log.info("Run {} abort requested: {}", runId, reason);
    handle.abort(reason);
    return true;
  }

  public Set<String> activeRuns() {
    return Set.copyOf(active.keySet());
  }

  public Optional<RunHandle> find(String runId) {
    return Optional.ofNullable(active.get(runId));
  }

  /** Abort state of one run and the token of its current scheduler pass. */
  public static final class RunHandle {
    private final String runId;
    private final AtomicReference<CancellationToken> current = new AtomicReference<>();
    private volatile String abortReason;

    private RunHandle(String runId) {
      this.runId = runId;
    }

    /** Installs the token of the next pass; it is cancelled at once if the run was aborted. */
    public CancellationToken nextPass() {
      var token = new CancellationToken();
      current.set(token);
      var reason = abortReason;
      if (reason != null) {
        token.cancel(CancellationToken.Cause.ABORT, reason);
      }
      return token;
    }

    void abort(String reason) {
      abortReason = reason;
      var token = current.get();
      if (token != null) {
        token.cancel(CancellationToken.Cause.ABORT, reason);
      }
    }

    public boolean isAborted() {
      return abortReason != null;
    }

    public String abortReason() {
      return abortReason;
    }

    public String runId() {
      return runId;
    }
  }
}
