package com.mk.fx.qa.rivet.execution.metrics;

import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class ThroughputWindowTest {

  private static final long SECOND = TimeUnit.SECONDS.toNanos(1);

  @Test
  void rate_beforeWindowFills_dividesByElapsedTime() {
    var window = new ThroughputWindow(10, 0);
    for (int i = 0; i < 20; i++) {
      window.record(i * (SECOND / 10));
    }
    assertEquals(10.0, window.rate(2 * SECOND), 0.001);
  }

  @Test
  void rate_dropsBucketsOlderThanWindow() {
    var window = new ThroughputWindow(2, 0);
    for (int i = 0; i < 50; i++) {
      window.record(SECOND / 2);
    }
    window.record(5 * SECOND + 1);
    window.record(5 * SECOND + 2);

    assertEquals(1.0, window.rate(5 * SECOND + SECOND / 2), 0.001);
  }
}
