package com.pinebridge.indicators.registry;

import java.util.Map;

/**
 * Parameter values after positional, named and default resolution.
 */
public final class ResolvedParams {

    private final String indicator;
    private final Map<String, Object> values;

    ResolvedParams(String indicator, Map<String, Object> values) {
        this.indicator = indicator;
        this.values = values;
    }

    public double[] series(String name) {
        Object value = values.get(name);
        if (value instanceof double[] array) {
            return array;
        }
        throw new IllegalArgumentException(indicator + ": parameter '" + name + "' must be a series, got "
            + (value == null ? "nothing" : value.getClass().getSimpleName()));
    }

    public int intValue(String name) {
        return (int) Math.round(number(name));
    }

    public double doubleValue(String name) {
        return number(name);
    }

    private double number(String name) {
        Object value = values.get(name);
        if (value instanceof Number num) {
            return num.doubleValue();
        }
        throw new IllegalArgumentException(indicator + ": parameter '" + name + "' must be a number, got "
            + (value == null ? "nothing" : value.getClass().getSimpleName()));
    }

    public Map<String, Object> asMap() {
        return values;
    }
}
