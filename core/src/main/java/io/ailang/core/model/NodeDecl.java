package io.ailang.core.model;

/**
 * Graph node declaration ({@code +name:type[range]}). Retained for consumers, never executed.
 *
 * @param range text between the brackets, or {@code null} when absent
 */
public record NodeDecl(String name, String type, String range) {}
