package com.mk.fx.qa.rivet.execution.engine;

import static com.mk.fx.qa.rivet.execution.Fixtures.response;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.mk.fx.qa.rivet.execution.assertion.AssertionEvaluator;
import com.mk.fx.qa.rivet.execution.assertion.Check;
import com.mk.fx.qa.rivet.execution.assertion.PathCheck;
import com.mk.fx.qa.rivet.execution.cfg.ObjectMapperConfig;
import com.mk.fx.qa.rivet.execution.model.ExecutionUnit;
import com.mk.fx.qa.rivet.execution.model.FailureKind;
import com.mk.fx.qa.rivet.execution.model.OutcomeStatus;
import com.mk.fx.qa.rivet.execution.model.Phase;
import com.mk.fx.qa.rivet.execution.model.RequestTemplate;
import com.mk.fx.qa.rivet.execution.model.TestCase;
import com.mk.fx.qa.rivet.execution.redact.RedactionPolicy;
import com.mk.fx.qa.rivet.execution.retry.RetryController;
import com.mk.fx.qa.rivet.execution.retry.RetryPolicy;
import com.mk.fx.qa.rivet.rest.HttpMethod;
import com.mk.fx.qa.rivet.rest.Request;
import com.mk.fx.qa.rivet.rest.Transport;
import com.mk.fx.qa.rivet.rest.TransportException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class UnitExecutorTest {

  private Transport transport;
  private UnitExecutor executor;

  @BeforeEach
  void setUp() {
    transport = mock(Transport.class);
    executor =
        new UnitExecutor(
            transport,
            new AssertionEvaluator(new ObjectMapperConfig().objectMapper()),
            new RetryController((duration, cancelled) -> !cancelled.getAsBoolean()),
            RedactionPolicy.defaults(),
            Duration.ofSeconds(5),
            RetryPolicy.none());
  }

  private static ExecutionUnit unit(TestCase testCase, String url) {
    var request = new Request();
    request.setMethod(HttpMethod.GET);
    request.setUrl(url);
    return new ExecutionUnit(0, Phase.TEST, testCase, null, request, testCase.checks());
  }

  private static TestCase testCase(List<Check> checks) {
    return TestCase.builder()
        .name("get user")
        .request(RequestTemplate.get("/users/1"))
        .checks(checks)
        .build();
  }

  @Test
  void passingResponse_isPassedWithSnapshot() throws Exception {
    when(transport.send(any(), any())).thenReturn(response(200, "{\"id\":1}"));

    var outcome =
        executor.run(
            unit(testCase(List.of(PathCheck.equalTo("$.id", 1L))), "http://h/users/1"),
            () -> false);

    assertEquals(OutcomeStatus.PASSED, outcome.status());
    assertEquals(1, outcome.attempts());
    assertEquals("GET", outcome.response().method());
    assertEquals(200, outcome.response().status());
    assertTrue(outcome.failures().isEmpty());
    verify(transport).send(any(), eq(Duration.ofSeconds(5)));
  }

  @Test
  void caseTimeout_overridesTheDefault() throws Exception {
    when(transport.send(any(), any())).thenReturn(response(200, "{}"));
    var testCase = testCase(List.of()).toBuilder().timeout(Duration.ofMillis(250)).build();

    executor.run(unit(testCase, "http://h/users/1"), () -> false);

    verify(transport).send(any(), eq(Duration.ofMillis(250)));
  }

  @Test
  void transportFailure_mapsToFailureKind() throws Exception {
    when(transport.send(any(), any()))
        .thenThrow(new TransportException(TransportException.Kind.TIMEOUT, "no response in 5s"));

    var outcome = executor.run(unit(testCase(List.of()), "http://h/users/1"), () -> false);

    assertEquals(OutcomeStatus.FAILED, outcome.status());
    assertEquals(FailureKind.TIMEOUT, outcome.failures().get(0).kind());
    assertEquals("no response in 5s", outcome.failures().get(0).message());
    assertEquals(0, outcome.response().status());
  }

  @Test
  void transientStatus_isRetried_andReportedFlaky() throws Exception {
    when(transport.send(any(), any()))
        .thenReturn(response(503, "{}"))
        .thenReturn(response(200, "{}"));
    var testCase =
        testCase(List.of()).toBuilder().retry(RetryPolicy.of(3, Duration.ZERO, 1.0)).build();

    var outcome = executor.run(unit(testCase, "http://h/users/1"), () -> false);

    assertEquals(OutcomeStatus.FLAKY, outcome.status());
    assertEquals(2, outcome.attempts());
    verify(transport, times(2)).send(any(), any());
  }

  @Test
  void retries_reportEachAttemptAsItStarts() throws Exception {
    when(transport.send(any(), any()))
        .thenReturn(response(503, "{}"))
        .thenReturn(response(503, "{}"))
        .thenReturn(response(200, "{}"));
    var testCase =
        testCase(List.of()).toBuilder().retry(RetryPolicy.of(3, Duration.ZERO, 1.0)).build();
    List<Integer> started = new ArrayList<>();

    var outcome = executor.run(unit(testCase, "http://h/users/1"), () -> false, started::add);

    assertEquals(List.of(1, 2, 3), started);
    assertEquals(3, outcome.attempts());
  }

  @Test
  void cancellationDuringBackoff_isCancelled() throws Exception {
    when(transport.send(any(), any())).thenReturn(response(503, "{}"));
    var testCase =
        testCase(List.of()).toBuilder()
            .retry(RetryPolicy.of(3, Duration.ofMillis(100), 2.0))
            .build();

    var outcome = executor.run(unit(testCase, "http://h/users/1"), () -> true);

    assertEquals(OutcomeStatus.CANCELLED, outcome.status());
    assertEquals(
        "cancelled: run stopped during backoff", outcome.failures().get(0).message());
    verify(transport, times(1)).send(any(), any());
  }

  @Test
  void secrets_neverLeaveTheExecutor() throws Exception {
    var leaky = response(200, "{\"access_token\":\"tok-123\",\"user\":\"ann\"}");
    leaky.setHeaders(Map.of("Set-Cookie", "session=abc", "Content-Type", "application/json"));
    when(transport.send(any(), any())).thenReturn(leaky);
    var checks = List.<Check>of(PathCheck.equalTo("$.access_token", "other"));

    var outcome =
        executor.run(unit(testCase(checks), "http://h/login?password=hunter2"), () -> false);

    var snapshot = outcome.response();
    assertEquals("http://h/login?password=[REDACTED]", snapshot.url());
    assertEquals(RedactionPolicy.MASK, snapshot.headers().get("Set-Cookie"));
    assertFalse(snapshot.body().contains("tok-123"));
    var failure = outcome.failures().get(0);
    assertEquals(FailureKind.ASSERTION, failure.kind());
    assertFalse(failure.message().contains("tok-123"));
    assertEquals(RedactionPolicy.MASK, failure.mismatch().actual());
  }

  @Test
  void missingTransport_isAConfigurationError() {
    assertThrows(
        RunConfigurationException.class,
        () ->
            new UnitExecutor(
                null,
                new AssertionEvaluator(new ObjectMapperConfig().objectMapper()),
                new RetryController(),
                RedactionPolicy.defaults(),
                Duration.ofSeconds(1),
                RetryPolicy.none()));
  }
}
