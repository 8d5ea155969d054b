package com.mk.fx.qa.rivet.execution.assertion;

import java.util.List;

/** Result of evaluating all checks of a case: pass, or the ordered mismatches. */
public record Verdict(List<Mismatch> mismatches) {

  private static final Verdict PASS = new Verdict(List.of());

  public Verdict {
    mismatches = List.copyOf(mismatches);
  }

  public static Verdict pass() {
    return PASS;
  }

  public boolean passed() {
    return mismatches.isEmpty();
  }
}
