package com.mk.fx.qa.rivet.execution.coverage;

import java.util.Set;

/**
 * Coverage of one catalog entry.
 *
 * @param hitStatuses every status observed for the entry
 * @param missingStatuses declared statuses never observed
 * @param unexpectedStatuses observed statuses the entry does not declare
 */
public record EntryCoverage(
    CatalogEntry entry,
    Set<Integer> hitStatuses,
    Set<Integer> missingStatuses,
    Set<Integer> unexpectedStatuses) {

  public boolean hit() {
    return !hitStatuses.isEmpty();
  }
}
