package com.mk.fx.qa.rivet.execution.model;

import com.mk.fx.qa.rivet.rest.HttpMethod;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;

/** Request declaration whose url, headers, query values and body may contain placeholders. */
@Builder(toBuilder = true)
public record RequestTemplate(
    HttpMethod method,
    String url,
    Map<String, String> headers,
    Map<String, String> query,
    String body) {

  public RequestTemplate {
    headers = copy(headers);
    query = copy(query);
  }

  public static RequestTemplate get(String url) {
    return RequestTemplate.builder().method(HttpMethod.GET).url(url).build();
  }

  private static Map<String, String> copy(Map<String, String> map) {
    return map == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(map));
  }
}
