package com.mk.fx.qa.rivet.execution.metrics;

/** A redacted example of one failure category. */
public record ErrorSample(String type, int statusCode, String message) {}
