package com.pinebridge.indicators.registry;

/**
 * Lookup of a qualified name that is not registered.
 */
public class UnknownIndicatorError extends RuntimeException {

    private final String name;

    public UnknownIndicatorError(String name) {
        super("Unknown indicator: " + name);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
