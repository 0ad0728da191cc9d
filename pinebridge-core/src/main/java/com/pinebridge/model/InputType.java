package com.pinebridge.model;

import java.util.Locale;

/**
 * Declared type of a script input.
 */
public enum InputType {
    INT,
    FLOAT,
    BOOL,
    STRING,
    SOURCE,
    COLOR;

    /**
     * Map the suffix of an {@code input.<type>} call. Timeframe, session and
     * symbol inputs are plain strings.
     */
    public static InputType fromCallSuffix(String suffix) {
        return switch (suffix.toLowerCase(Locale.ROOT)) {
            case "int", "integer" -> INT;
            case "float", "price" -> FLOAT;
            case "bool" -> BOOL;
            case "source" -> SOURCE;
            case "color" -> COLOR;
            case "string", "timeframe", "session", "symbol", "text_area", "resolution" -> STRING;
            default -> throw new IllegalArgumentException("Unknown input type: " + suffix);
        };
    }

    /**
     * Infer a type from the default literal of an untyped {@code input(...)} call.
     */
    public static InputType inferFromDefault(String literal) {
        if (literal == null || literal.isEmpty()) {
            return FLOAT;
        }
        if (literal.equals("true") || literal.equals("false")) {
            return BOOL;
        }
        if (literal.startsWith("\"") || literal.startsWith("'")) {
            return STRING;
        }
        if (literal.startsWith("#") || literal.startsWith("color.")) {
            return COLOR;
        }
        if (literal.matches("-?\\d+")) {
            return INT;
        }
        if (literal.matches("-?\\d*\\.\\d+(?:[eE][-+]?\\d+)?|-?\\d+\\.")) {
            return FLOAT;
        }
        return SOURCE;
    }
}
