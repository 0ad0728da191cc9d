package com.pinebridge.indicators.registry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of a registry calculation: one series, or named components in declared order.
 */
public record IndicatorResult(String indicator, double[] series, Map<String, double[]> components) {

    public static IndicatorResult single(String indicator, double[] series) {
        return new IndicatorResult(indicator, series, Map.of());
    }

    public static IndicatorResult multiple(String indicator, List<String> names, double[][] values) {
        if (names.size() != values.length) {
            throw new IllegalStateException(indicator + " produced " + values.length
                + " series for " + names.size() + " result names");
        }
        Map<String, double[]> ordered = new LinkedHashMap<>();
        for (int i = 0; i < values.length; i++) {
            ordered.put(names.get(i), values[i]);
        }
        return new IndicatorResult(indicator, null, Collections.unmodifiableMap(ordered));
    }

    public boolean isMultiple() {
        return series == null;
    }

    public double[] component(String name) {
        double[] value = components.get(name);
        if (value == null) {
            throw new IllegalArgumentException(indicator + " has no result named " + name);
        }
        return value;
    }

    /**
     * Components in declared order, matching a destructuring assignment.
     */
    public List<double[]> asTuple() {
        return isMultiple() ? new ArrayList<>(components.values()) : List.of(series);
    }
}
