package com.mk.fx.qa.rivet.execution.utils;

import java.time.Duration;
import java.util.UUID;

public final class LoadUtils {

  private LoadUtils() {
    // Utility class, no instantiation
  }

  public static Duration toDuration(Duration duration) {
    return duration != null ? duration : Duration.ZERO;
  }

  public static Duration orDefault(Duration duration, Duration fallback) {
    return duration != null ? duration : fallback;
  }

  /** Short random identifier used in thread names and log lines. */
  public static String newRunId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
