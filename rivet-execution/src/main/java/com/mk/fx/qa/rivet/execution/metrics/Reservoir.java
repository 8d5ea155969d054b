package com.mk.fx.qa.rivet.execution.metrics;

import java.util.Arrays;
import java.util.Random;

/**
 * Fixed-size uniform sample of a stream (Algorithm R). Used once a run has produced more latencies
 * than the exact store may hold.
 */
public final class Reservoir {
  private final int capacity;
  private final long[] data;
  private final Random rnd;
  private long count;

  public Reservoir(int capacity) {
    this(capacity, new Random());
  }

  public Reservoir(int capacity, Random random) {
    if (capacity <= 0) throw new IllegalArgumentException("Capacity must be > 0");
    this.capacity = capacity;
    this.data = new long[capacity];
    this.rnd = random;
  }

  public synchronized void add(long value) {
    count++;
    if (count <= capacity) {
      data[(int) count - 1] = value;
    } else {
      long j = rnd.nextLong(count);
      if (j < capacity) {
        data[(int) j] = value;
      }
    }
  }

  /** Number of values offered, including those not retained. */
  public synchronized long count() {
    return count;
  }

  public synchronized int size() {
    return (int) Math.min(count, capacity);
  }

  public synchronized long[] sortedSnapshot() {
    long[] copy = Arrays.copyOf(data, size());
    Arrays.sort(copy);
    return copy;
  }
}
