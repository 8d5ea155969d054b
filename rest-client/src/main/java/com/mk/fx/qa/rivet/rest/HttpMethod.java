package com.mk.fx.qa.rivet.rest;

import java.util.Arrays;

/** HTTP methods accepted by the transport. */
public enum HttpMethod {
  GET,
  POST,
  PUT,
  PATCH,
  DELETE,
  HEAD,
  OPTIONS;

  public static HttpMethod fromValue(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Request method is required");
    }
    return Arrays.stream(values())
        .filter(m -> m.name().equalsIgnoreCase(value.trim()))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unsupported HTTP method: " + value));
  }
}
