package com.mk.fx.qa.rivet.execution.metrics;

import static org.junit.jupiter.api.Assertions.*;

import java.util.stream.LongStream;
import org.junit.jupiter.api.Test;

class LatencyStatisticsTest {

  private static final long[] TENS_TO_THOUSAND =
      LongStream.rangeClosed(1, 100).map(i -> i * 10).toArray();

  @Test
  void percentile_usesNearestRank() {
    assertEquals(500, LatencyStatistics.percentile(TENS_TO_THOUSAND, 50));
    assertEquals(950, LatencyStatistics.percentile(TENS_TO_THOUSAND, 95));
    assertEquals(990, LatencyStatistics.percentile(TENS_TO_THOUSAND, 99));
    assertEquals(1000, LatencyStatistics.percentile(TENS_TO_THOUSAND, 100));
    assertEquals(10, LatencyStatistics.percentile(TENS_TO_THOUSAND, 0));
  }

  @Test
  void percentile_ofSingleValue_isThatValue() {
    assertEquals(42, LatencyStatistics.percentile(new long[] {42}, 99));
  }

  @Test
  void percentile_ofEmpty_isZero() {
    assertEquals(0, LatencyStatistics.percentile(new long[0], 50));
  }

  @Test
  void percentile_outOfRange_throws() {
    assertThrows(
        IllegalArgumentException.class, () -> LatencyStatistics.percentile(TENS_TO_THOUSAND, 101));
  }
}
