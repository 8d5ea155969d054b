package com.mk.fx.qa.rivet.execution.model;

import java.util.Map;

/** Redacted capture of the last exchange of a unit. Status is 0 when no response arrived. */
public record ResponseSnapshot(
    String method, String url, int status, Map<String, String> headers, String body) {

  public ResponseSnapshot {
    headers = headers == null ? Map.of() : Map.copyOf(headers);
  }
}
