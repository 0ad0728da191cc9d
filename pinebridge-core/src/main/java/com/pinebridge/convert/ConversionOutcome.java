package com.pinebridge.convert;

import com.pinebridge.model.ProgramAst;

import java.util.List;

/**
 * Result of running a script through the converter pipeline.
 */
public sealed interface ConversionOutcome {

    ProgramAst ast();

    ValidationResult validation();

    /**
     * Deterministic code was produced.
     */
    record Generated(String code, ProgramAst ast, ValidationResult validation) implements ConversionOutcome {}

    /**
     * The script goes to the fallback converter. {@code reasons} lists every cause.
     */
    record Handoff(ProgramAst ast, ValidationResult validation, List<String> reasons) implements ConversionOutcome {
        public Handoff {
            reasons = List.copyOf(reasons);
        }
    }
}
