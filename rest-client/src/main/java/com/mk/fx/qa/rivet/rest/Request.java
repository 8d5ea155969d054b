package com.mk.fx.qa.rivet.rest;

import java.util.Map;
import lombok.Data;

/** A fully resolved request: every placeholder has already been substituted. */
@Data
public class Request {
  private HttpMethod method;
  private String url;
  private Map<String, String> headers;
  private Map<String, String> query;
  private String body;
}
