package com.mk.fx.qa.rivet.execution.engine;

/**
 * Raised before any dispatch when a run cannot start: a malformed suite, load plan or retry policy,
 * or an invalid concurrency bound. Nothing has been executed when this is thrown.
 */
public class RunConfigurationException extends IllegalArgumentException {

  public RunConfigurationException(String message) {
    super(message);
  }

  public RunConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
