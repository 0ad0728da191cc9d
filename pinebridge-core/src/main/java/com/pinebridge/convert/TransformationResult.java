package com.pinebridge.convert;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Outcome of transforming one expression.
 *
 * @param targetExpression Python expression text, empty on failure
 * @param indicatorsUsed   qualified indicators the expression calls
 */
public record TransformationResult(
    boolean success,
    String targetExpression,
    List<String> diagnostics,
    Set<String> indicatorsUsed
) {
    public TransformationResult {
        diagnostics = List.copyOf(diagnostics);
        indicatorsUsed = Collections.unmodifiableSet(new TreeSet<>(indicatorsUsed));
    }

    public static TransformationResult success(String targetExpression, Set<String> indicatorsUsed) {
        return new TransformationResult(true, targetExpression, List.of(), indicatorsUsed);
    }

    public static TransformationResult failure(List<String> diagnostics) {
        return new TransformationResult(false, "", diagnostics, Set.of());
    }
}
