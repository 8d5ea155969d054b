package com.mk.fx.qa.rivet.execution.load;

import java.time.Duration;

/**
 * Pause a worker takes after each unit before releasing its slot.
 *
 * @param fixed pause for {@link Type#FIXED}
 * @param min lower bound for {@link Type#RANDOM}
 * @param max upper bound for {@link Type#RANDOM}
 */
public record ThinkTime(Type type, Duration fixed, Duration min, Duration max) {

  public enum Type {
    NONE,
    FIXED,
    RANDOM
  }

  public static ThinkTime none() {
    return new ThinkTime(Type.NONE, null, null, null);
  }

  public static ThinkTime fixed(Duration pause) {
    return new ThinkTime(Type.FIXED, pause, null, null);
  }

  public static ThinkTime random(Duration min, Duration max) {
    return new ThinkTime(Type.RANDOM, null, min, max);
  }
}
