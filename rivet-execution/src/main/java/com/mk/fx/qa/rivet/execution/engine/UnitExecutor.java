package com.mk.fx.qa.rivet.execution.engine;

import com.mk.fx.qa.rivet.execution.assertion.AssertionEvaluator;
import com.mk.fx.qa.rivet.execution.assertion.Mismatch;
import com.mk.fx.qa.rivet.execution.model.ExecutionUnit;
import com.mk.fx.qa.rivet.execution.model.FailureDetail;
import com.mk.fx.qa.rivet.execution.model.FailureKind;
import com.mk.fx.qa.rivet.execution.model.Outcome;
import com.mk.fx.qa.rivet.execution.model.OutcomeStatus;
import com.mk.fx.qa.rivet.execution.model.ResponseSnapshot;
import com.mk.fx.qa.rivet.execution.redact.RedactionPolicy;
import com.mk.fx.qa.rivet.execution.retry.Attempt;
import com.mk.fx.qa.rivet.execution.retry.RetryController;
import com.mk.fx.qa.rivet.execution.retry.RetryOutcome;
import com.mk.fx.qa.rivet.execution.retry.RetryPolicy;
import com.mk.fx.qa.rivet.execution.scheduler.UnitWorker;
import com.mk.fx.qa.rivet.rest.Request;
import com.mk.fx.qa.rivet.rest.Transport;
import com.mk.fx.qa.rivet.rest.TransportException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BooleanSupplier;
import java.util.function.IntConsumer;
import lombok.extern.slf4j.Slf4j;

/**
 * Executes one unit: sends its resolved request through the {@link Transport}, evaluates the
 * response and retries transient failures. The returned outcome carries only redacted data.
 */
@Slf4j
public class UnitExecutor implements UnitWorker {

  private final Transport transport;
  private final AssertionEvaluator evaluator;
  private final RetryController retryController;
  private final RedactionPolicy redaction;
  private final Duration defaultTimeout;
  private final RetryPolicy defaultRetry;

  public UnitExecutor(
      Transport transport,
      AssertionEvaluator evaluator,
      RetryController retryController,
      RedactionPolicy redaction,
      Duration defaultTimeout,
      RetryPolicy defaultRetry) {
    if (transport == null) {
      throw new RunConfigurationException("A transport is required");
    }
    this.transport = transport;
    this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
    this.retryController = Objects.requireNonNull(retryController, "retryController");
    this.redaction = Objects.requireNonNull(redaction, "redaction");
    this.defaultTimeout = Objects.requireNonNull(defaultTimeout, "defaultTimeout");
    this.defaultRetry = Objects.requireNonNull(defaultRetry, "defaultRetry").validate();
  }

  @Override
  public Outcome run(ExecutionUnit unit, BooleanSupplier cancelled) throws InterruptedException {
    return run(unit, cancelled, number -> {});
  }

  @Override
  public Outcome run(ExecutionUnit unit, BooleanSupplier cancelled, IntConsumer attemptStarted)
      throws InterruptedException {
    var testCase = unit.testCase();
    var policy = testCase.retry() != null ? testCase.retry() : defaultRetry;
    var timeout = testCase.timeout() != null ? testCase.timeout() : defaultTimeout;

    var result =
        retryController.execute(
            unit.name(),
            policy,
            number -> {
              attemptStarted.accept(number);
              return attempt(unit, number, timeout);
            },
            cancelled);
    var outcome = toOutcome(unit, result);
    log.debug(
        "Unit #{} '{}' finished {} after {} attempt(s) in {} ms",
        unit.sequenceIndex(),
        unit.name(),
        outcome.status(),
        outcome.attempts(),
        outcome.duration().toMillis());
    return outcome;
  }

  private Attempt attempt(ExecutionUnit unit, int number, Duration timeout)
      throws InterruptedException {
    var start = System.nanoTime();
    try {
      var response = transport.send(unit.request(), timeout);
      var verdict = evaluator.evaluate(response, unit.checks());
      return Attempt.received(number, response, verdict, since(start));
    } catch (TransportException e) {
      return Attempt.failed(number, e, since(start));
    }
  }

  private Outcome toOutcome(ExecutionUnit unit, RetryOutcome result) {
    var last = result.lastAttempt();
    List<FailureDetail> failures = new ArrayList<>();
    if (result.status() == OutcomeStatus.CANCELLED) {
      failures.add(
          FailureDetail.of(FailureKind.CANCELLED, "cancelled: run stopped during backoff"));
    } else if (result.status() == OutcomeStatus.FAILED && last != null) {
      failures.addAll(describeFailure(last));
    }
    return new Outcome(
        unit.sequenceIndex(),
        unit.name(),
        unit.phase(),
        unit.rowIndex(),
        result.status(),
        result.attempts(),
        result.elapsed(),
        last != null ? snapshot(unit.request(), last) : null,
        failures);
  }

  private List<FailureDetail> describeFailure(Attempt attempt) {
    if (attempt.error() != null) {
      var kind = FailureKind.valueOf(attempt.error().getKind().name());
      return List.of(FailureDetail.of(kind, redaction.text(attempt.error().getMessage())));
    }
    List<FailureDetail> details = new ArrayList<>();
    for (Mismatch mismatch : attempt.verdict().mismatches()) {
      details.add(FailureDetail.assertion(redact(mismatch)));
    }
    return details;
  }

  private Mismatch redact(Mismatch mismatch) {
    if (redaction.isSensitiveLocator(mismatch.locator())) {
      return new Mismatch(
          mismatch.check(),
          mismatch.locator(),
          mismatch.kind(),
          mismatch.expected() == null ? null : RedactionPolicy.MASK,
          mismatch.actual() == null ? null : RedactionPolicy.MASK);
    }
    return new Mismatch(
        mismatch.check(),
        mismatch.locator(),
        mismatch.kind(),
        redaction.text(mismatch.expected()),
        redaction.body(mismatch.actual()));
  }

  private ResponseSnapshot snapshot(Request request, Attempt attempt) {
    var method = request.getMethod() != null ? request.getMethod().name() : null;
    var url = redaction.text(request.getUrl());
    var response = attempt.response();
    if (response == null) {
      return new ResponseSnapshot(method, url, 0, null, null);
    }
    return new ResponseSnapshot(
        method,
        url,
        response.getStatusCode(),
        redaction.headers(response.getHeaders()),
        redaction.body(response.getBody()));
  }

  private static Duration since(long startNanos) {
    return Duration.ofNanos(System.nanoTime() - startNanos);
  }
}
