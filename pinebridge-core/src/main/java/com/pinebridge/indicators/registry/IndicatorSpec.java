package com.pinebridge.indicators.registry;

import com.pinebridge.indicators.IndicatorKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Registry entry describing one qualified indicator.
 *
 * @param resultNames component names in return order; empty for single-series indicators
 */
public record IndicatorSpec(
    String qualifiedName,
    IndicatorKind kind,
    String description,
    List<ParameterSpec> parameters,
    List<String> resultNames
) {
    public IndicatorSpec {
        parameters = List.copyOf(parameters);
        resultNames = List.copyOf(resultNames);
    }

    public static IndicatorSpec single(String name, IndicatorKind kind, String description,
                                       ParameterSpec... parameters) {
        return new IndicatorSpec(name, kind, description, List.of(parameters), List.of());
    }

    public static IndicatorSpec multiple(String name, IndicatorKind kind, String description,
                                         List<String> resultNames, ParameterSpec... parameters) {
        return new IndicatorSpec(name, kind, description, List.of(parameters), resultNames);
    }

    public boolean returnsMultiple() {
        return !resultNames.isEmpty();
    }

    /**
     * Parameters that may be passed by position, in order.
     */
    public List<ParameterSpec> positionalParameters() {
        List<ParameterSpec> result = new ArrayList<>();
        for (ParameterSpec p : parameters) {
            if (!p.implicit()) {
                result.add(p);
            }
        }
        return result;
    }

    public List<String> parameterNames() {
        List<String> names = new ArrayList<>();
        for (ParameterSpec p : positionalParameters()) {
            names.add(p.name());
        }
        return names;
    }

    public int arity() {
        return positionalParameters().size();
    }

    /**
     * Name used for the indicator handle in generated code, e.g. {@code ta_ema}.
     */
    public String handleName() {
        return qualifiedName.replace('.', '_');
    }

    public boolean hasParameter(String name) {
        for (ParameterSpec p : parameters) {
            if (p.name().equals(name)) {
                return true;
            }
        }
        return false;
    }
}
