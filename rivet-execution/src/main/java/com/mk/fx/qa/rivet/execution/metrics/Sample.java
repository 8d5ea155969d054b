package com.mk.fx.qa.rivet.execution.metrics;

import com.mk.fx.qa.rivet.execution.model.FailureDetail;
import com.mk.fx.qa.rivet.execution.model.Outcome;

/**
 * One completed operation.
 *
 * @param timestampNanos completion time on the {@link System#nanoTime()} scale
 * @param statusCode response status, 0 when the transport failed
 * @param errorCategory failure class for unsuccessful samples, {@code null} otherwise
 * @param errorMessage redacted failure description, {@code null} for successful samples
 */
public record Sample(
    long timestampNanos,
    long latencyMs,
    boolean success,
    int statusCode,
    String errorCategory,
    String errorMessage) {

  public static Sample success(long timestampNanos, long latencyMs, int statusCode) {
    return new Sample(timestampNanos, latencyMs, true, statusCode, null, null);
  }

  public static Sample failure(
      long timestampNanos, long latencyMs, int statusCode, String category) {
    return new Sample(timestampNanos, latencyMs, false, statusCode, category, null);
  }

  /**
   * Derives a sample from a terminal outcome. Failures are categorised by transport kind, then by
   * HTTP status class, then as assertion failures.
   */
  public static Sample fromOutcome(Outcome outcome, long timestampNanos) {
    var status = outcome.response() != null ? outcome.response().status() : 0;
    var latency = outcome.duration().toMillis();
    if (outcome.status().isSuccessful()) {
      return success(timestampNanos, latency, status);
    }
    var first = outcome.failures().isEmpty() ? null : outcome.failures().get(0);
    return new Sample(
        timestampNanos,
        latency,
        false,
        status,
        categorise(first, status),
        first != null ? first.message() : null);
  }

  private static String categorise(FailureDetail failure, int status) {
    if (failure != null && failure.kind().isTransport()) {
      return failure.kind().name();
    }
    if (status >= 500) {
      return "HTTP_5XX";
    }
    if (status >= 400) {
      return "HTTP_4XX";
    }
    return failure != null ? failure.kind().name() : "UNKNOWN";
  }
}
