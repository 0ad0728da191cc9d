package com.pinebridge.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Tunable constants for complexity scoring and the complexity gate.
 * Defaults live in code; {@code pinebridge.yaml} on the classpath or any YAML
 * document may override them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConverterConfig {

    private static final Logger log = LoggerFactory.getLogger(ConverterConfig.class);
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());
    private static final String DEFAULT_RESOURCE = "/pinebridge.yaml";

    private Complexity complexity = new Complexity();
    private Gate gate = new Gate();

    public ConverterConfig() {
    }

    // ==================== Accessors ====================

    public Complexity getComplexity() {
        return complexity;
    }

    public void setComplexity(Complexity complexity) {
        this.complexity = complexity != null ? complexity : new Complexity();
    }

    public Gate getGate() {
        return gate;
    }

    public void setGate(Gate gate) {
        this.gate = gate != null ? gate : new Gate();
    }

    // ==================== Loading ====================

    /**
     * Built-in defaults, no I/O.
     */
    public static ConverterConfig defaults() {
        return new ConverterConfig();
    }

    /**
     * Parse a YAML document. Missing keys keep their defaults.
     */
    public static ConverterConfig fromYaml(String yaml) {
        try {
            return YAML.readValue(yaml, ConverterConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Invalid converter config: " + e.getMessage(), e);
        }
    }

    /**
     * Load from the classpath resource, falling back to defaults when absent.
     */
    public static ConverterConfig load() {
        try (InputStream in = ConverterConfig.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                log.debug("No {} on classpath, using defaults", DEFAULT_RESOURCE);
                return defaults();
            }
            return YAML.readValue(in, ConverterConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load " + DEFAULT_RESOURCE, e);
        }
    }

    // ==================== Sections ====================

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Complexity {
        private double lineCap = 150;
        private double functionCap = 3;
        private double indicatorCap = 8;
        private double nestingCap = 3;
        private double conditionNestingWeight = 0.5;
        private Weights weights = new Weights();

        public double getLineCap() { return lineCap; }
        public void setLineCap(double lineCap) { this.lineCap = lineCap; }

        public double getFunctionCap() { return functionCap; }
        public void setFunctionCap(double functionCap) { this.functionCap = functionCap; }

        public double getIndicatorCap() { return indicatorCap; }
        public void setIndicatorCap(double indicatorCap) { this.indicatorCap = indicatorCap; }

        public double getNestingCap() { return nestingCap; }
        public void setNestingCap(double nestingCap) { this.nestingCap = nestingCap; }

        public double getConditionNestingWeight() { return conditionNestingWeight; }
        public void setConditionNestingWeight(double w) { this.conditionNestingWeight = w; }

        public Weights getWeights() { return weights; }
        public void setWeights(Weights weights) { this.weights = weights != null ? weights : new Weights(); }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Weights {
        private double lines = 0.25;
        private double functions = 0.20;
        private double indicators = 0.20;
        private double nesting = 0.10;
        private double collections = 0.25;

        public double getLines() { return lines; }
        public void setLines(double lines) { this.lines = lines; }

        public double getFunctions() { return functions; }
        public void setFunctions(double functions) { this.functions = functions; }

        public double getIndicators() { return indicators; }
        public void setIndicators(double indicators) { this.indicators = indicators; }

        public double getNesting() { return nesting; }
        public void setNesting(double nesting) { this.nesting = nesting; }

        public double getCollections() { return collections; }
        public void setCollections(double collections) { this.collections = collections; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Gate {
        private double ceiling = 0.3;
        private double manualReviewMargin = 0.4;
        private int maxStrategyNesting = 1;
        private int indicatorWarningThreshold = 5;

        public double getCeiling() { return ceiling; }
        public void setCeiling(double ceiling) { this.ceiling = ceiling; }

        public double getManualReviewMargin() { return manualReviewMargin; }
        public void setManualReviewMargin(double margin) { this.manualReviewMargin = margin; }

        public int getMaxStrategyNesting() { return maxStrategyNesting; }
        public void setMaxStrategyNesting(int maxStrategyNesting) { this.maxStrategyNesting = maxStrategyNesting; }

        public int getIndicatorWarningThreshold() { return indicatorWarningThreshold; }
        public void setIndicatorWarningThreshold(int threshold) { this.indicatorWarningThreshold = threshold; }
    }
}
