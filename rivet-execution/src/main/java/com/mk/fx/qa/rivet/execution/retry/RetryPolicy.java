package com.mk.fx.qa.rivet.execution.retry;

import com.mk.fx.qa.rivet.execution.engine.RunConfigurationException;
import com.mk.fx.qa.rivet.rest.TransportException;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;
import lombok.Builder;

/**
 * Bounded exponential retry policy.
 *
 * <p>The backoff before attempt {@code k} (k &ge; 2) is {@code baseBackoff * multiplier^(k-2)},
 * capped at {@code maxBackoff} when one is set. Which HTTP statuses count as transient is a policy
 * parameter; 501 is not in the defaults.
 *
 * @param retryableKinds transport failure kinds treated as transient
 * @param retryableStatuses response statuses treated as transient
 * @param retryAssertionFailures also retry assertion mismatches on a received response
 * @param maxBackoff backoff cap, {@code null} for none
 */
@Builder(toBuilder = true)
public record RetryPolicy(
    int maxAttempts,
    Duration baseBackoff,
    double backoffMultiplier,
    Duration maxBackoff,
    Set<TransportException.Kind> retryableKinds,
    Set<Integer> retryableStatuses,
    boolean retryAssertionFailures) {

  public static final Set<Integer> DEFAULT_RETRYABLE_STATUSES = Set.of(502, 503, 504);

  public static final Set<TransportException.Kind> DEFAULT_RETRYABLE_KINDS =
      Set.copyOf(EnumSet.of(TransportException.Kind.CONNECTION, TransportException.Kind.TIMEOUT));

  public RetryPolicy {
    baseBackoff = baseBackoff == null ? Duration.ZERO : baseBackoff;
    retryableKinds =
        retryableKinds == null ? DEFAULT_RETRYABLE_KINDS : Set.copyOf(retryableKinds);
    retryableStatuses =
        retryableStatuses == null ? DEFAULT_RETRYABLE_STATUSES : Set.copyOf(retryableStatuses);
  }

  /** Single attempt, no retries. */
  public static RetryPolicy none() {
    return new RetryPolicy(1, Duration.ZERO, 1.0, null, null, null, false);
  }

  public static RetryPolicy of(int maxAttempts, Duration baseBackoff, double multiplier) {
    return new RetryPolicy(maxAttempts, baseBackoff, multiplier, null, null, null, false);
  }

  public RetryPolicy validate() {
    if (maxAttempts < 1) {
      throw new RunConfigurationException("Retry maxAttempts must be >= 1 but was " + maxAttempts);
    }
    if (baseBackoff.isNegative()) {
      throw new RunConfigurationException("Retry baseBackoff must not be negative");
    }
    if (Double.isNaN(backoffMultiplier) || backoffMultiplier < 1.0) {
      throw new RunConfigurationException(
          "Retry backoffMultiplier must be >= 1.0 but was " + backoffMultiplier);
    }
    if (maxBackoff != null && maxBackoff.isNegative()) {
      throw new RunConfigurationException("Retry maxBackoff must not be negative");
    }
    return this;
  }

  /** Delay to wait before {@code attempt} (1-based). Zero for the first attempt. */
  public Duration backoffBefore(int attempt) {
    if (attempt <= 1 || baseBackoff.isZero()) {
      return Duration.ZERO;
    }
    var millis = baseBackoff.toMillis() * Math.pow(backoffMultiplier, attempt - 2);
    var capped = maxBackoff != null ? Math.min(millis, maxBackoff.toMillis()) : millis;
    return Duration.ofMillis(Math.round(Math.min(capped, Long.MAX_VALUE / 2.0)));
  }

  public boolean isRetryable(TransportException.Kind kind) {
    return retryableKinds.contains(kind);
  }

  public boolean isRetryableStatus(int status) {
    return retryableStatuses.contains(status);
  }
}
