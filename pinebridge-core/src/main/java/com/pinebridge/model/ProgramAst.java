package com.pinebridge.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Structured representation of one script. Never holds the raw source.
 *
 * @param indicatorReferences distinct qualified indicator calls, sorted
 * @param complexityFactors   normalized factor values in [0,1], by factor name
 * @param contributions       weighted contribution of each factor to the score
 */
public record ProgramAst(
    int version,
    String scriptKind,
    String name,
    List<InputDecl> inputs,
    List<VariableBinding> variables,
    List<FunctionDef> functions,
    List<TypeDef> typeDefs,
    SortedSet<String> indicatorReferences,
    List<StrategyCall> strategyCalls,
    List<PlotDecl> plots,
    boolean usesCollections,
    boolean usesLoops,
    int totalLines,
    int codeLines,
    int maxNestingDepth,
    int maxConditionCallDepth,
    double complexityScore,
    Map<String, Double> complexityFactors,
    Map<String, Double> contributions,
    List<ParseWarning> warnings
) {
    public ProgramAst {
        inputs = List.copyOf(inputs);
        variables = List.copyOf(variables);
        functions = List.copyOf(functions);
        typeDefs = List.copyOf(typeDefs);
        indicatorReferences = Collections.unmodifiableSortedSet(new TreeSet<>(indicatorReferences));
        strategyCalls = List.copyOf(strategyCalls);
        plots = List.copyOf(plots);
        complexityFactors = Collections.unmodifiableMap(new LinkedHashMap<>(complexityFactors));
        contributions = Collections.unmodifiableMap(new LinkedHashMap<>(contributions));
        warnings = List.copyOf(warnings);
    }

    /**
     * Copy with a computed complexity score.
     */
    public ProgramAst withComplexity(double score, Map<String, Double> factors, Map<String, Double> weighted) {
        return new ProgramAst(version, scriptKind, name, inputs, variables, functions, typeDefs,
            indicatorReferences, strategyCalls, plots, usesCollections, usesLoops, totalLines,
            codeLines, maxNestingDepth, maxConditionCallDepth, score, factors, weighted, warnings);
    }

    @JsonIgnore
    public boolean isStrategy() {
        return "strategy".equals(scriptKind);
    }

    public boolean hasCustomTypes() {
        return !typeDefs.isEmpty();
    }

    /**
     * Variables declared with {@code var}/{@code varip}, first declaration only.
     */
    public List<VariableBinding> persistentVariables() {
        Map<String, VariableBinding> seen = new LinkedHashMap<>();
        for (VariableBinding v : variables) {
            if (v.persists()) {
                seen.putIfAbsent(v.name(), v);
            }
        }
        return List.copyOf(seen.values());
    }
}
