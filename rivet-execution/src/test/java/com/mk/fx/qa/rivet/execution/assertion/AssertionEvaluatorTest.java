package com.mk.fx.qa.rivet.execution.assertion;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.rivet.execution.cfg.ObjectMapperConfig;
import com.mk.fx.qa.rivet.rest.RestResponseData;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AssertionEvaluatorTest {

  private final ObjectMapper mapper = new ObjectMapperConfig().objectMapper();
  private final AssertionEvaluator evaluator = new AssertionEvaluator(mapper);

  private static RestResponseData response(int status, Map<String, String> headers, String body) {
    var r = new RestResponseData();
    r.setStatusCode(status);
    r.setHeaders(headers);
    r.setBody(body);
    return r;
  }

  private static RestResponseData json(String body) {
    return response(200, Map.of("Content-Type", "application/json"), body);
  }

  @Test
  void noChecks_passesBelow400_andFailsOtherwise() {
    assertTrue(evaluator.evaluate(response(302, Map.of(), null), List.of()).passed());

    var verdict = evaluator.evaluate(response(404, Map.of(), null), null);

    assertFalse(verdict.passed());
    assertEquals(1, verdict.mismatches().size());
    assertEquals(CheckKind.STATUS, verdict.mismatches().get(0).check());
    assertEquals("404", verdict.mismatches().get(0).actual());
  }

  @Test
  void status_acceptsClassesAndAlternatives() {
    assertTrue(
        evaluator.evaluate(response(204, null, ""), List.of(new StatusCheck("2xx"))).passed());
    assertTrue(
        evaluator.evaluate(response(404, null, ""), List.of(new StatusCheck("200|404"))).passed());
    assertFalse(
        evaluator.evaluate(response(500, null, ""), List.of(new StatusCheck("200|4xx"))).passed());
  }

  @Test
  void status_invalidToken_isRejectedByValidation() {
    assertThrows(IllegalArgumentException.class, () -> new StatusCheck("2x").validate());
    assertThrows(IllegalArgumentException.class, () -> new StatusCheck("700").validate());
    assertDoesNotThrow(() -> new StatusCheck("200|3xx").validate());
  }

  @Test
  void header_nameIsCaseInsensitive_valueIsTrimmedExact() {
    var r = response(200, Map.of("Content-Type", " application/json "), "{}");

    assertTrue(
        evaluator
            .evaluate(r, List.of(new HeaderCheck("content-type", "application/json")))
            .passed());
    assertTrue(evaluator.evaluate(r, List.of(HeaderCheck.present("CONTENT-TYPE"))).passed());

    var wrong = evaluator.evaluate(r, List.of(new HeaderCheck("content-type", "text/plain")));
    assertEquals(MismatchKind.NOT_EQUAL, wrong.mismatches().get(0).kind());
  }

  @Test
  void header_missing_isNotFound() {
    var verdict =
        evaluator.evaluate(response(200, Map.of(), "{}"), List.of(HeaderCheck.present("ETag")));
    assertEquals(MismatchKind.NOT_FOUND, verdict.mismatches().get(0).kind());
    assertEquals("header ETag", verdict.mismatches().get(0).locator());
  }

  @Test
  void path_distinguishesMissingFromUnequal_andReportsEveryFailure() {
    var body = "{\"user\":{\"id\":1,\"name\":\"ann\"}}";

    var verdict =
        evaluator.evaluate(
            json(body),
            List.of(
                PathCheck.equalTo("user.id", 2L),
                PathCheck.equalTo("$.user.email", "ann@example.com"),
                PathCheck.equalTo("$.user.name", "ann")));

    assertEquals(2, verdict.mismatches().size());
    var unequal = verdict.mismatches().get(0);
    assertEquals(MismatchKind.NOT_EQUAL, unequal.kind());
    assertEquals("$.user.id", unequal.locator());
    assertEquals("2", unequal.expected());
    assertEquals("1", unequal.actual());
    var missing = verdict.mismatches().get(1);
    assertEquals(MismatchKind.NOT_FOUND, missing.kind());
    assertEquals("$.user.email", missing.locator());
  }

  @Test
  void path_comparesNumbersByValue() {
    var body = "{\"a\":1.0,\"b\":1,\"c\":2.50}";
    var verdict =
        evaluator.evaluate(
            json(body),
            List.of(
                PathCheck.equalTo("$.a", 1L),
                PathCheck.equalTo("$.b", 1.0),
                PathCheck.equalTo("$.c", 2.5)));
    assertTrue(verdict.passed(), () -> verdict.mismatches().toString());
  }

  @Test
  void path_comparesStructuredValues() {
    var body = "{\"tags\":[\"a\",\"b\"],\"meta\":{\"x\":1,\"y\":null}}";
    var meta = new LinkedHashMap<String, Object>();
    meta.put("x", 1);
    meta.put("y", null);

    var verdict =
        evaluator.evaluate(
            json(body),
            List.of(
                PathCheck.equalTo("$.tags", List.of("a", "b")), PathCheck.equalTo("meta", meta)));

    assertTrue(verdict.passed(), () -> verdict.mismatches().toString());
  }

  @Test
  void path_existsAndNullValues() {
    var body = "{\"deleted\":null}";
    assertTrue(evaluator.evaluate(json(body), List.of(PathCheck.exists("$.deleted"))).passed());
    assertTrue(
        evaluator.evaluate(json(body), List.of(PathCheck.equalTo("$.deleted", null))).passed());
    assertFalse(evaluator.evaluate(json(body), List.of(PathCheck.exists("$.other"))).passed());
  }

  @Test
  void path_onNonJsonBody_isInvalidBody() {
    var verdict =
        evaluator.evaluate(
            response(200, Map.of(), "<html>oops</html>"), List.of(PathCheck.exists("$.a")));
    assertEquals(MismatchKind.INVALID_BODY, verdict.mismatches().get(0).kind());

    var empty = evaluator.evaluate(response(200, Map.of(), ""), List.of(PathCheck.exists("$.a")));
    assertEquals(MismatchKind.INVALID_BODY, empty.mismatches().get(0).kind());
  }

  @Test
  void schema_violation_reportsPointer() throws Exception {
    var schema =
        mapper.readTree(
            "{\"type\":\"object\",\"required\":[\"id\"],"
                + "\"properties\":{\"id\":{\"type\":\"integer\"}}}");

    var wrongType = evaluator.evaluate(json("{\"id\":\"x\"}"), List.of(SchemaCheck.body(schema)));
    assertEquals(MismatchKind.SCHEMA_VIOLATION, wrongType.mismatches().get(0).kind());
    assertTrue(wrongType.mismatches().get(0).locator().contains("/id"));

    var missing = evaluator.evaluate(json("{}"), List.of(SchemaCheck.body(schema)));
    assertEquals(MismatchKind.SCHEMA_VIOLATION, missing.mismatches().get(0).kind());

    assertTrue(evaluator.evaluate(json("{\"id\":3}"), List.of(SchemaCheck.body(schema))).passed());
  }

  @Test
  void evaluate_isPure() {
    var r = json("{\"id\":1}");
    List<Check> checks = List.of(StatusCheck.of(201), PathCheck.equalTo("$.id", 2L));
    assertEquals(evaluator.evaluate(r, checks), evaluator.evaluate(r, checks));
  }
}
