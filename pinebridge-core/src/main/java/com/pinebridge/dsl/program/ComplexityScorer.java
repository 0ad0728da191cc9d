package com.pinebridge.dsl.program;

import com.pinebridge.config.ConverterConfig;
import com.pinebridge.model.ProgramAst;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Weighted sum of five normalized structural factors.
 *
 * Each factor is clamped to [0,1] before weighting, so the score is additive and
 * monotonic in every factor. Condition call depth adds to the nesting factor rather
 * than multiplying it.
 */
public class ComplexityScorer {

    public static final String LINES = "lines";
    public static final String FUNCTIONS = "functions";
    public static final String INDICATORS = "indicators";
    public static final String NESTING = "nesting";
    public static final String COLLECTIONS = "collections";

    private final double lineCap;
    private final double functionCap;
    private final double indicatorCap;
    private final double nestingCap;
    private final double conditionNestingWeight;
    private final Map<String, Double> weights;

    /**
     * Values are copied; later changes to {@code settings} do not affect this scorer.
     */
    public ComplexityScorer(ConverterConfig.Complexity settings) {
        this.lineCap = settings.getLineCap();
        this.functionCap = settings.getFunctionCap();
        this.indicatorCap = settings.getIndicatorCap();
        this.nestingCap = settings.getNestingCap();
        this.conditionNestingWeight = settings.getConditionNestingWeight();
        ConverterConfig.Weights w = settings.getWeights();
        Map<String, Double> byFactor = new LinkedHashMap<>();
        byFactor.put(LINES, w.getLines());
        byFactor.put(FUNCTIONS, w.getFunctions());
        byFactor.put(INDICATORS, w.getIndicators());
        byFactor.put(NESTING, w.getNesting());
        byFactor.put(COLLECTIONS, w.getCollections());
        this.weights = Collections.unmodifiableMap(byFactor);
    }

    /**
     * Return a copy of the AST carrying its score, factors and contributions.
     */
    public ProgramAst score(ProgramAst ast) {
        Map<String, Double> factors = new LinkedHashMap<>();
        factors.put(LINES, clamp(ast.codeLines() / lineCap));
        factors.put(FUNCTIONS, clamp(ast.functions().size() / functionCap));
        factors.put(INDICATORS, clamp(ast.indicatorReferences().size() / indicatorCap));
        factors.put(NESTING, clamp((ast.maxNestingDepth()
            + conditionNestingWeight * ast.maxConditionCallDepth()) / nestingCap));
        factors.put(COLLECTIONS, ast.hasCustomTypes() || ast.usesCollections() ? 1.0 : 0.0);

        Map<String, Double> contributions = new LinkedHashMap<>();
        for (Map.Entry<String, Double> factor : factors.entrySet()) {
            contributions.put(factor.getKey(), factor.getValue() * weights.get(factor.getKey()));
        }

        double total = 0;
        for (double c : contributions.values()) {
            total += c;
        }
        return ast.withComplexity(clamp(total), factors, contributions);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value) || value < 0) {
            return 0;
        }
        return Math.min(1.0, value);
    }
}
