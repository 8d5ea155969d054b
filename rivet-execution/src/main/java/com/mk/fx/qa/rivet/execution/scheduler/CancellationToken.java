package com.mk.fx.qa.rivet.execution.scheduler;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/** Run-scoped cancellation flag. The first cancellation wins; later ones are ignored. */
public final class CancellationToken {

  public enum Cause {
    /** A unit failed while bail mode was on. */
    BAIL,
    /** The user aborted the run. */
    ABORT,
    /** The dispatching thread was interrupted. */
    INTERRUPTED
  }

  private record Signal(Cause cause, String reason) {}

  private final AtomicReference<Signal> signal = new AtomicReference<>();

  /**
   * Requests cancellation.
   *
   * @return {@code true} if this call cancelled the token, {@code false} if it already was
   */
  public boolean cancel(Cause cause, String reason) {
    return signal.compareAndSet(null, new Signal(cause, reason));
  }

  public boolean isCancelled() {
    return signal.get() != null;
  }

  public Optional<Cause> cause() {
    var s = signal.get();
    return s == null ? Optional.empty() : Optional.of(s.cause());
  }

  /** Reason given to the winning {@link #cancel} call, {@code null} if not cancelled. */
  public String reason() {
    var s = signal.get();
    return s == null ? null : s.reason();
  }
}
