package com.mk.fx.qa.rivet.execution.coverage;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * One declared operation.
 *
 * @param pathTemplate path with {@code {name}} placeholders, e.g. {@code /users/{id}}
 * @param expectedStatuses statuses the operation is documented to return, may be empty
 */
public record CatalogEntry(String method, String pathTemplate, Set<Integer> expectedStatuses) {

  public CatalogEntry {
    expectedStatuses =
        expectedStatuses == null
            ? Set.of()
            : Collections.unmodifiableSet(new TreeSet<>(expectedStatuses));
  }

  public static CatalogEntry of(String method, String pathTemplate, Integer... statuses) {
    return new CatalogEntry(method, pathTemplate, Set.of(statuses));
  }
}
