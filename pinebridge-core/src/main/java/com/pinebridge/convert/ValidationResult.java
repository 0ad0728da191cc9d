package com.pinebridge.convert;

import java.util.List;

/**
 * Gate decision with one error per violated criterion. Warnings never fail the gate.
 */
public record ValidationResult(
    boolean valid,
    double complexityScore,
    List<String> errors,
    List<String> warnings,
    Recommendation recommendation
) {
    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }
}
