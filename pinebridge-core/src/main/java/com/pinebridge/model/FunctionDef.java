package com.pinebridge.model;

import java.util.List;

/**
 * A user-defined function. The body is kept as uninterpreted text.
 */
public record FunctionDef(String name, List<String> parameters, String body, int line) {

    public FunctionDef {
        parameters = List.copyOf(parameters);
    }
}
