package com.mk.fx.qa.rivet.execution.metrics;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Random;
import java.util.stream.LongStream;
import org.junit.jupiter.api.Test;

class ReservoirTest {

  @Test
  void sortedSnapshot_belowCapacity_keepsEveryValue() {
    Reservoir r = new Reservoir(100);
    LongStream.of(5, 3, 9, 1).forEach(r::add);

    assertEquals(4, r.size());
    assertEquals(4, r.count());
    assertArrayEquals(new long[] {1, 3, 5, 9}, r.sortedSnapshot());
  }

  @Test
  void add_pastCapacity_retainsCapacityValuesAndCountsAll() {
    Reservoir r = new Reservoir(10, new Random(7));
    LongStream.rangeClosed(1, 1_000).forEach(r::add);

    assertEquals(10, r.size());
    assertEquals(1_000, r.count());
    for (long v : r.sortedSnapshot()) {
      assertTrue(v >= 1 && v <= 1_000);
    }
  }

  @Test
  void constructor_rejectsNonPositiveCapacity() {
    assertThrows(IllegalArgumentException.class, () -> new Reservoir(0));
  }
}
