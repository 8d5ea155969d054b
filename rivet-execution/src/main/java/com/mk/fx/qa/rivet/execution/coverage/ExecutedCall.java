package com.mk.fx.qa.rivet.execution.coverage;

/**
 * One executed request.
 *
 * @param path concrete path or full URL; normalised before matching
 */
public record ExecutedCall(String method, String path, int status) {}
