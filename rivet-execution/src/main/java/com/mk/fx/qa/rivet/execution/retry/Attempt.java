package com.mk.fx.qa.rivet.execution.retry;

import com.mk.fx.qa.rivet.execution.assertion.Verdict;
import com.mk.fx.qa.rivet.rest.RestResponseData;
import com.mk.fx.qa.rivet.rest.TransportException;
import java.time.Duration;

/**
 * Result of one attempt: either a response with its verdict, or a transport failure.
 *
 * @param response received response, {@code null} on transport failure
 * @param verdict assertion verdict, {@code null} on transport failure
 * @param error transport failure, {@code null} when a response was received
 */
public record Attempt(
    int number,
    RestResponseData response,
    Verdict verdict,
    TransportException error,
    Duration duration) {

  public static Attempt received(
      int number, RestResponseData response, Verdict verdict, Duration duration) {
    return new Attempt(number, response, verdict, null, duration);
  }

  public static Attempt failed(int number, TransportException error, Duration duration) {
    return new Attempt(number, null, null, error, duration);
  }

  public boolean succeeded() {
    return error == null && verdict != null && verdict.passed();
  }

  /** Whether {@code policy} allows another attempt after this one. */
  boolean isTransient(RetryPolicy policy) {
    if (succeeded()) {
      return false;
    }
    if (error != null) {
      return policy.isRetryable(error.getKind());
    }
    return policy.isRetryableStatus(response.getStatusCode()) || policy.retryAssertionFailures();
  }
}
