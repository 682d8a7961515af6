package com.juno.core.oracle;

/**
 * A task description produced for a category.
 */
public record GeneratedTask(String task) {}
