package com.mk.fx.qa.rivet.execution.coverage;

import java.util.List;

/**
 * Result of comparing executed calls with a catalog.
 *
 * @param uncatalogued executed calls no catalog entry matches
 * @param declaredTuples expected (entry, status) pairs; an entry without statuses counts once
 * @param coveredTuples declared pairs that were observed
 */
public record CoverageReport(
    List<EntryCoverage> entries,
    List<ExecutedCall> uncatalogued,
    int declaredTuples,
    int coveredTuples) {

  public CoverageReport {
    entries = List.copyOf(entries);
    uncatalogued = List.copyOf(uncatalogued);
  }

  /** Covered over declared tuples, 1.0 for an empty catalog. */
  public double ratio() {
    return declaredTuples == 0 ? 1.0 : (double) coveredTuples / declaredTuples;
  }

  public List<EntryCoverage> hitEntries() {
    return entries.stream().filter(EntryCoverage::hit).toList();
  }

  public List<EntryCoverage> missedEntries() {
    return entries.stream().filter(e -> !e.hit()).toList();
  }
}
