package com.pinebridge.convert;

import com.pinebridge.config.ConverterConfig;
import com.pinebridge.indicators.registry.IndicatorRegistry;
import com.pinebridge.model.ProgramAst;
import com.pinebridge.model.StrategyCall;
import com.pinebridge.model.TypeDef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Decides whether a script can be converted by rules or must go to the fallback converter.
 * Pure: the same AST always yields an equal result.
 */
public class ComplexityGate {

    private static final Logger log = LoggerFactory.getLogger(ComplexityGate.class);

    private final double ceiling;
    private final double manualReviewMargin;
    private final int maxStrategyNesting;
    private final int indicatorWarningThreshold;
    private final IndicatorRegistry registry;

    /**
     * Threshold values are copied from {@code settings} at construction.
     */
    public ComplexityGate(ConverterConfig.Gate settings, IndicatorRegistry registry) {
        this.ceiling = settings.getCeiling();
        this.manualReviewMargin = settings.getManualReviewMargin();
        this.maxStrategyNesting = settings.getMaxStrategyNesting();
        this.indicatorWarningThreshold = settings.getIndicatorWarningThreshold();
        this.registry = registry;
    }

    public ValidationResult validate(ProgramAst ast) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        double score = ast.complexityScore();

        if (score >= ceiling) {
            errors.add(String.format(Locale.ROOT, "Complexity score %.3f is not below the ceiling %.3f",
                score, ceiling));
        }
        if (!ast.functions().isEmpty()) {
            errors.add("Custom functions are not supported: " + ast.functions().size()
                + " defined (" + functionNames(ast) + ")");
        }
        if (ast.hasCustomTypes()) {
            errors.add("Custom types are not supported: " + typeNames(ast));
        }
        if (ast.usesCollections()) {
            errors.add("Arrays and other collections are not supported");
        }
        if (ast.usesLoops()) {
            errors.add("Loops (for/while) are not supported");
        }
        for (StrategyCall call : ast.strategyCalls()) {
            if (call.nestingLevel() > maxStrategyNesting) {
                errors.add(String.format(Locale.ROOT,
                    "Strategy call '%s' at line %d is nested %d levels deep (max %d)",
                    call.idLabel(), call.line(), call.nestingLevel(), maxStrategyNesting));
            }
        }

        // Warnings
        int indicatorCount = ast.indicatorReferences().size();
        if (indicatorCount > indicatorWarningThreshold) {
            warnings.add("Many indicators used (" + indicatorCount + ")");
        }
        for (String name : ast.indicatorReferences()) {
            if (!registry.contains(name)) {
                warnings.add("Indicator not in registry: " + name);
            }
        }

        boolean valid = errors.isEmpty();
        Recommendation recommendation = recommend(valid, score);
        if (valid) {
            log.info("Script '{}' passed the complexity gate (score {})", ast.name(), score);
        } else {
            log.warn("Script '{}' failed the complexity gate: {}", ast.name(), errors);
        }
        return new ValidationResult(valid, score, errors, warnings, recommendation);
    }

    private Recommendation recommend(boolean valid, double score) {
        if (valid) {
            return Recommendation.USE_RULE_BASED;
        }
        return score - ceiling > manualReviewMargin
            ? Recommendation.MANUAL_REVIEW
            : Recommendation.USE_FALLBACK_CONVERTER;
    }

    private static String functionNames(ProgramAst ast) {
        List<String> names = new ArrayList<>();
        ast.functions().forEach(f -> names.add(f.name()));
        return String.join(", ", names);
    }

    private static String typeNames(ProgramAst ast) {
        List<String> names = new ArrayList<>();
        for (TypeDef type : ast.typeDefs()) {
            names.add(type.name());
        }
        return String.join(", ", names);
    }
}
