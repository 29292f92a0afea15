package io.ailang.core.model;

/** Graph edge declaration ({@code ->from=>to}). Retained for consumers, never executed. */
public record EdgeDecl(String from, String to) {}
