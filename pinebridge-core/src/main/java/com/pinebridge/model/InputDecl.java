package com.pinebridge.model;

/**
 * A user-facing input parameter. {@code title}, {@code min}, {@code max} and
 * {@code step} are null when the call did not set them.
 */
public record InputDecl(
    String name,
    InputType type,
    String defaultValue,
    String title,
    Double min,
    Double max,
    Double step,
    int line
) {}
