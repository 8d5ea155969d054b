package com.mk.fx.qa.rivet.execution.assertion;

/**
 * First structural violation found while validating a document.
 *
 * @param pointer JSON pointer of the offending value, empty for the root
 * @param keyword schema keyword that failed
 */
public record SchemaViolation(String pointer, String keyword, String expected, String actual) {}
