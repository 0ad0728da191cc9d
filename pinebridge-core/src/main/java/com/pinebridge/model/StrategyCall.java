package com.pinebridge.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A {@code strategy.entry/close/exit} call.
 *
 * @param whenCondition conjunction of enclosing block guards and any {@code when=}
 *                      argument, null when the call is unconditional
 * @param nestingLevel  block depth at the call site
 * @param options       remaining named arguments (qty, stop, limit, from_entry ...) as raw text
 */
public record StrategyCall(
    StrategyCallKind kind,
    String idLabel,
    Direction direction,
    String whenCondition,
    int nestingLevel,
    Map<String, String> options,
    int line
) {
    public StrategyCall {
        options = options == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }
}
