package com.mk.fx.qa.rivet.execution.model;

/**
 * Reference to the dataset a suite is driven by.
 *
 * @param name dataset name, informational
 * @param parallel concurrency override for dataset runs, {@code null} keeps the run's bound
 */
public record DatasetRef(String name, Integer parallel) {}
