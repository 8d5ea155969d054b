package com.mk.fx.qa.rivet.execution.coverage;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import lombok.extern.slf4j.Slf4j;

/**
 * Matches executed (method, path, status) calls against a catalog of operations. When several
 * entries match a call, the one with the fewest path parameters wins, and declaration order breaks
 * ties, so {@code /users/me} beats {@code /users/{id}}.
 */
@Slf4j
public class CoverageCalculator {

  public CoverageReport evaluate(Collection<ExecutedCall> executed, List<CatalogEntry> catalog) {
    var entries = catalog == null ? List.<CatalogEntry>of() : catalog;
    List<PathTemplate> templates = new ArrayList<>(entries.size());
    List<Set<Integer>> observed = new ArrayList<>(entries.size());
    for (CatalogEntry entry : entries) {
      templates.add(new PathTemplate(entry.pathTemplate()));
      observed.add(new TreeSet<>());
    }

    List<ExecutedCall> uncatalogued = new ArrayList<>();
    if (executed != null) {
      for (ExecutedCall call : executed) {
        var match = bestMatch(call, entries, templates);
        if (match < 0) {
          uncatalogued.add(call);
        } else {
          observed.get(match).add(call.status());
        }
      }
    }

    List<EntryCoverage> coverage = new ArrayList<>(entries.size());
    int declared = 0;
    int covered = 0;
    for (int i = 0; i < entries.size(); i++) {
      var entry = entries.get(i);
      var hits = observed.get(i);
      var missing = new TreeSet<>(entry.expectedStatuses());
      missing.removeAll(hits);
      var unexpected = new TreeSet<>(hits);
      if (!entry.expectedStatuses().isEmpty()) {
        unexpected.removeAll(entry.expectedStatuses());
        declared += entry.expectedStatuses().size();
        covered += entry.expectedStatuses().size() - missing.size();
      } else {
        unexpected.clear();
        declared++;
        covered += hits.isEmpty() ? 0 : 1;
      }
      coverage.add(
          new EntryCoverage(
              entry,
              Collections.unmodifiableSet(hits),
              Collections.unmodifiableSet(missing),
              Collections.unmodifiableSet(unexpected)));
    }

    var report = new CoverageReport(coverage, uncatalogued, declared, covered);
    log.info(
        "Coverage: {}/{} tuples ({}%), {} of {} entries hit, {} uncatalogued calls",
        covered,
        declared,
        String.format("%.1f", report.ratio() * 100),
        report.hitEntries().size(),
        entries.size(),
        uncatalogued.size());
    return report;
  }

  private static int bestMatch(
      ExecutedCall call, List<CatalogEntry> entries, List<PathTemplate> templates) {
    var segments = PathTemplate.segments(PathTemplate.normalize(call.path()));
    var method = call.method() == null ? "" : call.method().toUpperCase(Locale.ROOT);
    var best = -1;
    for (int i = 0; i < entries.size(); i++) {
      var entryMethod = entries.get(i).method();
      if (entryMethod == null || !entryMethod.toUpperCase(Locale.ROOT).equals(method)) {
        continue;
      }
      var template = templates.get(i);
      if (template.matches(segments)
          && (best < 0 || template.parameterCount() < templates.get(best).parameterCount())) {
        best = i;
      }
    }
    return best;
  }
}
