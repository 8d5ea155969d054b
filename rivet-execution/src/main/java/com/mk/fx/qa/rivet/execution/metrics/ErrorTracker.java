package com.mk.fx.qa.rivet.execution.metrics;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/** Counts failures per category and keeps the first few as samples. */
final class ErrorTracker {
  static final int MAX_ERROR_SAMPLES = 5;

  private final AtomicLong totalErrors = new AtomicLong();
  private final Map<String, AtomicLong> errorBreakdown = new ConcurrentHashMap<>();
  private final List<ErrorSample> errorSamples = new CopyOnWriteArrayList<>();

  void recordFailure(String category, int statusCode, String message) {
    totalErrors.incrementAndGet();
    String key = category == null || category.isBlank() ? "UNKNOWN" : category.toUpperCase();
    errorBreakdown.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
    if (errorSamples.size() < MAX_ERROR_SAMPLES) {
      errorSamples.add(
          new ErrorSample(key, statusCode, message != null ? message : key + " occurred"));
    }
  }

  long totalErrors() {
    return totalErrors.get();
  }

  Map<String, Long> breakdownSnapshot() {
    Map<String, Long> map = new HashMap<>();
    for (var e : errorBreakdown.entrySet()) map.put(e.getKey(), e.getValue().get());
    return Map.copyOf(map);
  }

  List<ErrorSample> samplesSnapshot() {
    return List.copyOf(errorSamples);
  }
}
