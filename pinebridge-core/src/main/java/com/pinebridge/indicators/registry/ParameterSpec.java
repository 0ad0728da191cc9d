package com.pinebridge.indicators.registry;

/**
 * One indicator parameter.
 *
 * @param defaultValue null when the parameter is required
 * @param implicit     a price series (high, low, close, volume) the script language
 *                     supplies implicitly; it can only be passed by name
 */
public record ParameterSpec(String name, Object defaultValue, boolean implicit) {

    public static ParameterSpec required(String name) {
        return new ParameterSpec(name, null, false);
    }

    public static ParameterSpec optional(String name, Object defaultValue) {
        return new ParameterSpec(name, defaultValue, false);
    }

    public static ParameterSpec implicit(String name) {
        return new ParameterSpec(name, null, true);
    }

    public boolean isRequired() {
        return defaultValue == null;
    }
}
