package com.mk.fx.qa.rivet.execution.assertion;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.NullNode;
import com.jayway.jsonpath.Configuration;
import com.jayway.jsonpath.InvalidPathException;
import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.PathNotFoundException;
import com.jayway.jsonpath.spi.json.JacksonJsonNodeJsonProvider;
import com.jayway.jsonpath.spi.mapper.JacksonMappingProvider;
import com.mk.fx.qa.rivet.rest.RestResponseData;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Evaluates a response against a list of checks. Pure: it performs no substitution and no I/O, and
 * the same inputs always give the same verdict. Every check is evaluated, so the verdict lists all
 * failed checks in declaration order.
 */
public class AssertionEvaluator {

  private final ObjectMapper mapper;
  private final Configuration jsonPathConfig;
  private final JsonSchemaValidator schemaValidator = new JsonSchemaValidator();

  public AssertionEvaluator(ObjectMapper mapper) {
    this.mapper =
        Objects.requireNonNull(mapper, "mapper")
            .copy()
            .setDefaultPropertyInclusion(JsonInclude.Include.ALWAYS)
            .disable(SerializationFeature.INDENT_OUTPUT);
    this.jsonPathConfig =
        Configuration.builder()
            .jsonProvider(new JacksonJsonNodeJsonProvider(this.mapper))
            .mappingProvider(new JacksonMappingProvider(this.mapper))
            .build();
  }

  /**
   * Evaluates {@code checks} against {@code response}. An empty list applies {@link
   * StatusCheck#BELOW_400}.
   */
  public Verdict evaluate(RestResponseData response, List<Check> checks) {
    Objects.requireNonNull(response, "response");
    var effective =
        checks == null || checks.isEmpty() ? List.<Check>of(StatusCheck.BELOW_400) : checks;
    var body = new ParsedBody(response.getBody());
    List<Mismatch> mismatches = new ArrayList<>();

    for (Check check : effective) {
      Optional<Mismatch> mismatch =
          switch (check.kind()) {
            case STATUS -> checkStatus((StatusCheck) check, response.getStatusCode());
            case HEADER -> checkHeader((HeaderCheck) check, response.getHeaders());
            case PATH -> checkPath((PathCheck) check, body);
            case SCHEMA -> checkSchema((SchemaCheck) check, body);
          };
      mismatch.ifPresent(mismatches::add);
    }
    return mismatches.isEmpty() ? Verdict.pass() : new Verdict(mismatches);
  }

  private Optional<Mismatch> checkStatus(StatusCheck check, int status) {
    if (check.matches(status)) {
      return Optional.empty();
    }
    return Optional.of(
        new Mismatch(
            CheckKind.STATUS,
            check.locator(),
            MismatchKind.NOT_EQUAL,
            check.expected(),
            String.valueOf(status)));
  }

  private Optional<Mismatch> checkHeader(HeaderCheck check, Map<String, String> headers) {
    String actual = null;
    var found = false;
    if (headers != null) {
      for (var entry : headers.entrySet()) {
        if (entry.getKey() != null && entry.getKey().equalsIgnoreCase(check.name())) {
          actual = entry.getValue();
          found = true;
          break;
        }
      }
    }
    var expected = check.expected() == null ? "<present>" : check.expected();
    if (!found) {
      return Optional.of(
          new Mismatch(CheckKind.HEADER, check.locator(), MismatchKind.NOT_FOUND, expected, null));
    }
    if (check.expected() != null
        && (actual == null || !check.expected().trim().equals(actual.trim()))) {
      return Optional.of(
          new Mismatch(
              CheckKind.HEADER, check.locator(), MismatchKind.NOT_EQUAL, expected, actual));
    }
    return Optional.empty();
  }

  private Optional<Mismatch> checkPath(PathCheck check, ParsedBody body) {
    var expectedText = check.existsOnly() ? "<exists>" : describe(check.expected());
    if (body.node() == null) {
      return Optional.of(
          new Mismatch(
              CheckKind.PATH,
              check.locator(),
              MismatchKind.INVALID_BODY,
              expectedText,
              body.error()));
    }

    JsonNode actual;
    try {
      actual = read(body.node(), check.normalizedPath());
    } catch (PathNotFoundException e) {
      actual = null;
    }
    if (actual == null || (actual.isArray() && actual.isEmpty() && !isDefinite(check))) {
      return Optional.of(
          new Mismatch(
              CheckKind.PATH, check.locator(), MismatchKind.NOT_FOUND, expectedText, null));
    }
    if (check.existsOnly()) {
      return Optional.empty();
    }

    JsonNode expected = toNode(check.expected());
    if (!isDefinite(check) && actual.isArray() && actual.size() == 1 && !expected.isArray()) {
      actual = actual.get(0);
    }
    if (JsonValues.sameValue(expected, actual)) {
      return Optional.empty();
    }
    return Optional.of(
        new Mismatch(
            CheckKind.PATH,
            check.locator(),
            MismatchKind.NOT_EQUAL,
            expectedText,
            actual.toString()));
  }

  private Optional<Mismatch> checkSchema(SchemaCheck check, ParsedBody body) {
    if (body.node() == null) {
      return Optional.of(
          new Mismatch(
              CheckKind.SCHEMA,
              check.locator(),
              MismatchKind.INVALID_BODY,
              "JSON document",
              body.error()));
    }
    JsonNode target = body.node();
    if (check.path() != null) {
      try {
        target = read(body.node(), new PathCheck(check.path(), null, true).normalizedPath());
      } catch (PathNotFoundException e) {
        target = null;
      }
      if (target == null) {
        return Optional.of(
            new Mismatch(
                CheckKind.SCHEMA, check.locator(), MismatchKind.NOT_FOUND, "<exists>", null));
      }
    }
    return schemaValidator
        .validate(check.schema(), target)
        .map(
            v ->
                new Mismatch(
                    CheckKind.SCHEMA,
                    check.locator() + " " + v.keyword() + " at '" + v.pointer() + "'",
                    MismatchKind.SCHEMA_VIOLATION,
                    v.expected(),
                    v.actual()));
  }

  private JsonNode read(JsonNode document, String path) {
    Object value = JsonPath.using(jsonPathConfig).parse(document).read(path);
    if (value == null) {
      return NullNode.getInstance();
    }
    return mapper.valueToTree(value);
  }

  private static boolean isDefinite(PathCheck check) {
    try {
      return JsonPath.compile(check.normalizedPath()).isDefinite();
    } catch (InvalidPathException e) {
      return true;
    }
  }

  private JsonNode toNode(Object value) {
    if (value == null) {
      return NullNode.getInstance();
    }
    JsonNode node = mapper.valueToTree(value);
    return node == null ? NullNode.getInstance() : node;
  }

  private String describe(Object value) {
    try {
      return mapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      return String.valueOf(value);
    }
  }

  /** Body parsed at most once per evaluation, and only when a check needs it. */
  private final class ParsedBody {
    private final String raw;
    private boolean parsed;
    private JsonNode node;
    private String error;

    private ParsedBody(String raw) {
      this.raw = raw;
    }

    JsonNode node() {
      parse();
      return node;
    }

    String error() {
      parse();
      return error;
    }

    private void parse() {
      if (parsed) {
        return;
      }
      parsed = true;
      if (raw == null || raw.isBlank()) {
        error = "empty body";
        return;
      }
      try {
        node = mapper.readTree(raw);
      } catch (JsonProcessingException e) {
        error = e.getOriginalMessage();
      }
    }
  }
}
