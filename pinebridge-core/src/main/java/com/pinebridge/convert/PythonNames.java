package com.pinebridge.convert;

import java.util.Set;

/**
 * Maps script identifiers to Python names that cannot collide with keywords,
 * names the generated code relies on, or runtime attributes. A colliding name
 * gets a trailing underscore: {@code lambda} becomes {@code lambda_}.
 */
final class PythonNames {

    private static final Set<String> KEYWORDS = Set.of(
        "False", "None", "True", "and", "as", "assert", "async", "await", "break",
        "class", "continue", "def", "del", "elif", "else", "except", "finally", "for",
        "from", "global", "if", "import", "in", "is", "lambda", "nonlocal", "not", "or",
        "pass", "raise", "return", "try", "while", "with", "yield"
    );

    /** Names the generated module and expressions refer to. */
    private static final Set<String> GENERATED = Set.of(
        "self", "math", "abs", "max", "min", "round", "int", "float", "bool", "str",
        "LONG", "SHORT", RuleBasedGenerator.BASE_CLASS
    );

    /** Attributes and methods the runtime base class defines. */
    private static final Set<String> RUNTIME_ATTRIBUTES = Set.of(
        "initialize", "decide", "indicator", "source", "entry", "close", "close_all", "exit",
        "nz", "na", "fixnan", "bar_index", "last_bar_index", "time", "timenow",
        "barstate", "syminfo", "strategy", "timeframe", "math_sign", "math_avg", "math_sum"
    );

    private PythonNames() {}

    /**
     * Name for a local variable or an expression reference.
     */
    static String local(String name) {
        return KEYWORDS.contains(name) || GENERATED.contains(name) ? name + "_" : name;
    }

    /**
     * Name for a class field or {@code self} attribute.
     */
    static String attribute(String name) {
        return KEYWORDS.contains(name) || RUNTIME_ATTRIBUTES.contains(name) || name.startsWith("ta_")
            ? name + "_" : name;
    }
}
