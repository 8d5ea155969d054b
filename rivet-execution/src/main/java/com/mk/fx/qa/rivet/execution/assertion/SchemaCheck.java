package com.mk.fx.qa.rivet.execution.assertion;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Validates the body, or the value at {@code path}, against a JSON schema document.
 *
 * @param path JSONPath of the validated value, {@code null} for the whole body
 */
public record SchemaCheck(String path, JsonNode schema) implements Check {

  public static SchemaCheck body(JsonNode schema) {
    return new SchemaCheck(null, schema);
  }

  @Override
  public CheckKind kind() {
    return CheckKind.SCHEMA;
  }

  @Override
  public String locator() {
    return path == null ? "schema" : "schema " + path;
  }

  @Override
  public void validate() {
    if (schema == null || !schema.isObject()) {
      throw new IllegalArgumentException("Schema check requires a schema object");
    }
  }
}
