package com.mk.fx.qa.rivet.execution.load;

import static com.mk.fx.qa.rivet.execution.utils.LoadUtils.toDuration;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

public class ThinkTimeStrategy {

  private static final long SLEEP_CHUNK_MILLIS = 200L;

  private final ThinkTime.Type type;
  private final long min;
  private final long max;
  private final long fixed;

  private ThinkTimeStrategy(ThinkTime.Type type, long min, long max, long fixed) {
    this.type = type;
    this.min = min;
    this.max = max;
    this.fixed = fixed;
  }

  public static ThinkTimeStrategy from(ThinkTime config) {
    if (config == null || config.type() == null) {
      return new ThinkTimeStrategy(ThinkTime.Type.NONE, 0, 0, 0);
    }
    return switch (config.type()) {
      case NONE -> new ThinkTimeStrategy(ThinkTime.Type.NONE, 0, 0, 0);
      case FIXED -> new ThinkTimeStrategy(
          ThinkTime.Type.FIXED, 0, 0, toDuration(config.fixed()).toMillis());
      case RANDOM -> new ThinkTimeStrategy(
          ThinkTime.Type.RANDOM,
          toDuration(config.min()).toMillis(),
          toDuration(config.max()).toMillis(),
          0);
    };
  }

  public boolean isEnabled() {
    return type != ThinkTime.Type.NONE;
  }

  /** Pauses for the configured think time, returning early when cancellation is observed. */
  public void pause(BooleanSupplier cancelled) throws InterruptedException {
    long delay =
        switch (type) {
          case NONE -> 0;
          case FIXED -> Math.max(0, fixed);
          case RANDOM -> computeRandomDelay();
        };
    var remaining = delay;
    while (remaining > 0) {
      if (cancelled.getAsBoolean()) {
        return;
      }
      var chunk = Math.min(SLEEP_CHUNK_MILLIS, remaining);
      TimeUnit.MILLISECONDS.sleep(chunk);
      remaining -= chunk;
    }
  }

  long computeRandomDelay() {
    var lower = Math.max(0, min);
    var upper = Math.max(lower, max);
    if (upper == lower) {
      return lower;
    }
    return ThreadLocalRandom.current().nextLong(lower, upper + 1);
  }
}
