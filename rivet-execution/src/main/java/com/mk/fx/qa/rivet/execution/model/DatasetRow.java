package com.mk.fx.qa.rivet.execution.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** One dataset row. Values stay strings until template resolution. */
public record DatasetRow(int index, Map<String, String> values) {

  public DatasetRow {
    values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }
}
