package com.mk.fx.qa.rivet.execution.coverage;

import java.util.ArrayList;
import java.util.List;

/** Structural path matcher: {@code {name}} segments match any single non-empty segment. */
final class PathTemplate {

  private final String raw;
  private final List<String> segments;
  private final int parameterCount;

  PathTemplate(String template) {
    this.raw = template;
    this.segments = segments(normalize(template));
    this.parameterCount = (int) segments.stream().filter(PathTemplate::isParameter).count();
  }

  boolean matches(List<String> concrete) {
    if (concrete.size() != segments.size()) {
      return false;
    }
    for (int i = 0; i < segments.size(); i++) {
      var expected = segments.get(i);
      var actual = concrete.get(i);
      if (isParameter(expected)) {
        if (actual.isEmpty()) {
          return false;
        }
      } else if (!expected.equals(actual)) {
        return false;
      }
    }
    return true;
  }

  int parameterCount() {
    return parameterCount;
  }

  String raw() {
    return raw;
  }

  /**
   * Strips scheme and host, query and fragment, collapses repeated slashes and drops a trailing
   * slash except for the root path.
   */
  static String normalize(String path) {
    if (path == null || path.isBlank()) {
      return "/";
    }
    var p = path.trim();
    var scheme = p.indexOf("://");
    if (scheme >= 0) {
      var slash = p.indexOf('/', scheme + 3);
      p = slash >= 0 ? p.substring(slash) : "/";
    }
    var cut = indexOfAny(p, '?', '#');
    if (cut >= 0) {
      p = p.substring(0, cut);
    }
    if (!p.startsWith("/")) {
      p = "/" + p;
    }
    p = p.replaceAll("/{2,}", "/");
    if (p.length() > 1 && p.endsWith("/")) {
      p = p.substring(0, p.length() - 1);
    }
    return p;
  }

  static List<String> segments(String normalized) {
    List<String> out = new ArrayList<>();
    if ("/".equals(normalized)) {
      return out;
    }
    for (String s : normalized.substring(1).split("/", -1)) {
      out.add(s);
    }
    return out;
  }

  private static boolean isParameter(String segment) {
    return segment.length() > 2 && segment.startsWith("{") && segment.endsWith("}");
  }

  private static int indexOfAny(String s, char a, char b) {
    var ia = s.indexOf(a);
    var ib = s.indexOf(b);
    if (ia < 0) return ib;
    if (ib < 0) return ia;
    return Math.min(ia, ib);
  }
}
