package com.mk.fx.qa.rivet.execution.retry;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/** Cancellable wait used between attempts. Injectable so tests do not sleep. */
@FunctionalInterface
public interface Sleeper {

  long SLEEP_CHUNK_MILLIS = 100L;

  /**
   * Waits for {@code duration} unless cancellation is observed first.
   *
   * @return {@code true} if the full duration elapsed, {@code false} if cancelled
   */
  boolean sleep(Duration duration, BooleanSupplier cancelled) throws InterruptedException;

  /** Sleeps in short chunks and checks for cancellation between chunks. */
  static Sleeper chunked() {
    return (duration, cancelled) -> {
      long remaining = duration.toMillis();
      while (remaining > 0) {
        if (cancelled.getAsBoolean()) {
          return false;
        }
        var chunk = Math.min(SLEEP_CHUNK_MILLIS, remaining);
        TimeUnit.MILLISECONDS.sleep(chunk);
        remaining -= chunk;
      }
      return !cancelled.getAsBoolean();
    };
  }
}
