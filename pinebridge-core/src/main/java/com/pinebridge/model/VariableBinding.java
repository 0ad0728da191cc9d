package com.pinebridge.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A variable assignment in source order.
 *
 * @param expression    raw right-hand side text
 * @param declaredType  type annotation, null when inferred
 * @param persists      declared with {@code var} or {@code varip}
 * @param realtime      declared with {@code varip}
 * @param reassignment  written with {@code :=} or a compound operator
 * @param sourceCall    callee of a destructured multi-return binding
 * @param resultIndex   position within the destructuring list, -1 otherwise
 * @param guard         condition of the enclosing blocks, null at top level
 * @param depth         block nesting depth
 */
public record VariableBinding(
    String name,
    String expression,
    String declaredType,
    boolean persists,
    boolean realtime,
    boolean reassignment,
    String sourceCall,
    int resultIndex,
    String guard,
    int depth,
    int line
) {
    @JsonIgnore
    public boolean isDestructured() {
        return resultIndex >= 0;
    }
}
