package com.mk.fx.qa.rivet.execution;

import com.mk.fx.qa.rivet.execution.model.ExecutionUnit;
import com.mk.fx.qa.rivet.execution.model.FailureDetail;
import com.mk.fx.qa.rivet.execution.model.FailureKind;
import com.mk.fx.qa.rivet.execution.model.Outcome;
import com.mk.fx.qa.rivet.execution.model.OutcomeStatus;
import com.mk.fx.qa.rivet.execution.model.Phase;
import com.mk.fx.qa.rivet.execution.model.RequestTemplate;
import com.mk.fx.qa.rivet.execution.model.TestCase;
import com.mk.fx.qa.rivet.rest.HttpMethod;
import com.mk.fx.qa.rivet.rest.Request;
import com.mk.fx.qa.rivet.rest.RestResponseData;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Builders shared by the engine tests. */
public final class Fixtures {

  private Fixtures() {}

  public static TestCase testCase(String name, String url) {
    return TestCase.builder().name(name).request(RequestTemplate.get(url)).build();
  }

  public static ExecutionUnit unit(int index) {
    var request = new Request();
    request.setMethod(HttpMethod.GET);
    request.setUrl("http://localhost/items/" + index);
    return new ExecutionUnit(
        index, Phase.TEST, testCase("case-" + index, "/items/" + index), null, request, List.of());
  }

  public static List<ExecutionUnit> units(int count) {
    List<ExecutionUnit> units = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      units.add(unit(i));
    }
    return units;
  }

  public static Outcome passed(ExecutionUnit unit) {
    return outcome(unit, OutcomeStatus.PASSED, List.of());
  }

  public static Outcome failed(ExecutionUnit unit) {
    return outcome(
        unit, OutcomeStatus.FAILED, List.of(FailureDetail.of(FailureKind.ASSERTION, "boom")));
  }

  public static Outcome outcome(
      ExecutionUnit unit, OutcomeStatus status, List<FailureDetail> failures) {
    return new Outcome(
        unit.sequenceIndex(),
        unit.name(),
        unit.phase(),
        unit.rowIndex(),
        status,
        1,
        Duration.ofMillis(1),
        null,
        failures);
  }

  public static RestResponseData response(int status, String body) {
    var response = new RestResponseData();
    response.setStatusCode(status);
    response.setHeaders(Map.of("Content-Type", "application/json"));
    response.setBody(body);
    return response;
  }
}
