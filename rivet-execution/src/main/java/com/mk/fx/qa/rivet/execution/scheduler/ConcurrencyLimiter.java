package com.mk.fx.qa.rivet.execution.scheduler;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Permit counter whose limit can change while permits are held. Lowering the limit never revokes
 * held permits; new acquisitions wait until the count in flight drops below the new limit.
 */
public final class ConcurrencyLimiter {

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition changed = lock.newCondition();
  private final int max;
  private int limit;
  private int inFlight;
  private int peak;

  public ConcurrencyLimiter(int initialLimit, int max) {
    if (max < 1) {
      throw new IllegalArgumentException("max must be >= 1");
    }
    this.max = max;
    this.limit = clamp(initialLimit);
  }

  /**
   * Waits up to {@code timeout} for a permit.
   *
   * @return {@code true} if a permit was acquired
   */
  public boolean tryAcquire(long timeout, TimeUnit unit) throws InterruptedException {
    var remaining = unit.toNanos(timeout);
    lock.lockInterruptibly();
    try {
      while (inFlight >= limit) {
        if (remaining <= 0) {
          return false;
        }
        remaining = changed.awaitNanos(remaining);
      }
      inFlight++;
      peak = Math.max(peak, inFlight);
      return true;
    } finally {
      lock.unlock();
    }
  }

  public void release() {
    lock.lock();
    try {
      if (inFlight > 0) {
        inFlight--;
      }
      changed.signalAll();
    } finally {
      lock.unlock();
    }
  }

  /** Sets the limit, clamped to [0, max]. */
  public void setLimit(int newLimit) {
    lock.lock();
    try {
      limit = clamp(newLimit);
      changed.signalAll();
    } finally {
      lock.unlock();
    }
  }

  public int limit() {
    lock.lock();
    try {
      return limit;
    } finally {
      lock.unlock();
    }
  }

  public int inFlight() {
    lock.lock();
    try {
      return inFlight;
    } finally {
      lock.unlock();
    }
  }

  /** Highest number of permits held at the same time since creation. */
  public int peakInFlight() {
    lock.lock();
    try {
      return peak;
    } finally {
      lock.unlock();
    }
  }

  public int max() {
    return max;
  }

  private int clamp(int value) {
    return Math.max(0, Math.min(max, value));
  }
}
