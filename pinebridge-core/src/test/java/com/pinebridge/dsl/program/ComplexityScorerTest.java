package com.pinebridge.dsl.program;

import com.pinebridge.SampleScripts;
import com.pinebridge.config.ConverterConfig;
import com.pinebridge.model.FunctionDef;
import com.pinebridge.model.ProgramAst;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for complexity scoring.
 */
class ComplexityScorerTest {

    private final ComplexityScorer scorer = new ComplexityScorer(ConverterConfig.defaults().getComplexity());
    private final ProgramParser parser = new ProgramParser();

    /**
     * Unscored AST with the given structural counts.
     */
    private static ProgramAst shape(int codeLines, int functions, int indicators, int depth, int callDepth,
                                    boolean collections) {
        List<FunctionDef> defs = new ArrayList<>();
        for (int i = 0; i < functions; i++) {
            defs.add(new FunctionDef("f" + i, List.of(), "", i + 1));
        }
        TreeSet<String> refs = new TreeSet<>();
        for (int i = 0; i < indicators; i++) {
            refs.add("ta.ind" + i);
        }
        return new ProgramAst(5, "strategy", "shape", List.of(), List.of(), defs, List.of(), refs,
            List.of(), List.of(), collections, false, codeLines, codeLines, depth, callDepth,
            0.0, Map.of(), Map.of(), List.of());
    }

    @Nested
    @DisplayName("Factors")
    class FactorTests {

        @Test
        @DisplayName("Contributions are weighted factors and sum to the score")
        void contributionsSumToScore() {
            ProgramAst ast = scorer.score(shape(30, 1, 4, 1, 1, false));

            assertEquals(0.2, ast.complexityFactors().get(ComplexityScorer.LINES), 1e-9);
            assertEquals(1.0 / 3, ast.complexityFactors().get(ComplexityScorer.FUNCTIONS), 1e-9);
            assertEquals(0.5, ast.complexityFactors().get(ComplexityScorer.INDICATORS), 1e-9);
            assertEquals(0.5, ast.complexityFactors().get(ComplexityScorer.NESTING), 1e-9);
            assertEquals(0.0, ast.complexityFactors().get(ComplexityScorer.COLLECTIONS), 1e-9);

            double sum = ast.contributions().values().stream().mapToDouble(Double::doubleValue).sum();
            assertEquals(sum, ast.complexityScore(), 1e-12);
            assertEquals(0.05 + 0.2 / 3 + 0.1 + 0.05, ast.complexityScore(), 1e-9);
        }

        @Test
        @DisplayName("Factors saturate at 1 and the score never exceeds 1")
        void saturates() {
            ProgramAst ast = scorer.score(shape(10_000, 50, 100, 20, 20, true));

            for (double factor : ast.complexityFactors().values()) {
                assertEquals(1.0, factor, 1e-12);
            }
            assertEquals(1.0, ast.complexityScore(), 1e-9);
        }

        @Test
        @DisplayName("Empty program scores zero")
        void emptyProgram() {
            assertEquals(0.0, scorer.score(shape(0, 0, 0, 0, 0, false)).complexityScore());
        }

        @Test
        @DisplayName("Condition call depth adds to nesting with its own weight")
        void conditionDepthIsAdditive() {
            ConverterConfig config = ConverterConfig.defaults();
            config.getComplexity().setConditionNestingWeight(0.0);
            ComplexityScorer ignoring = new ComplexityScorer(config.getComplexity());

            ProgramAst deepConditions = shape(10, 0, 1, 1, 3, false);
            assertEquals(1.0 / 3, ignoring.score(deepConditions).complexityFactors().get(ComplexityScorer.NESTING),
                1e-9);
            assertEquals(2.5 / 3, scorer.score(deepConditions).complexityFactors().get(ComplexityScorer.NESTING),
                1e-9);
        }

        @Test
        @DisplayName("Settings are copied at construction")
        void copiesSettings() {
            ConverterConfig config = ConverterConfig.defaults();
            ComplexityScorer copied = new ComplexityScorer(config.getComplexity());
            ProgramAst ast = shape(75, 1, 4, 1, 0, false);
            double before = copied.score(ast).complexityScore();

            config.getComplexity().setLineCap(1);
            config.getComplexity().getWeights().setCollections(1.0);

            assertEquals(before, copied.score(ast).complexityScore(), 1e-12);
            assertEquals(scorer.score(ast).complexityScore(), before, 1e-12);
        }
    }

    @Nested
    @DisplayName("Monotonicity")
    class MonotonicityTests {

        @Test
        @DisplayName("More indicators never lower the score")
        void indicators() {
            double previous = -1;
            for (int n = 0; n <= 12; n++) {
                double score = scorer.score(shape(20, 0, n, 1, 0, false)).complexityScore();
                assertTrue(score >= previous, "Score dropped at " + n + " indicators");
                previous = score;
            }
        }

        @Test
        @DisplayName("More functions never lower the score")
        void functions() {
            double previous = -1;
            for (int n = 0; n <= 5; n++) {
                double score = scorer.score(shape(20, n, 2, 1, 0, false)).complexityScore();
                assertTrue(score >= previous, "Score dropped at " + n + " functions");
                previous = score;
            }
        }

        @Test
        @DisplayName("Deeper nesting never lowers the score")
        void nesting() {
            double previous = -1;
            for (int depth = 0; depth <= 5; depth++) {
                double score = scorer.score(shape(20, 0, 2, depth, 1, false)).complexityScore();
                assertTrue(score >= previous, "Score dropped at depth " + depth);
                previous = score;
            }
        }
    }

    @Nested
    @DisplayName("Calibration")
    class CalibrationTests {

        @Test
        @DisplayName("One input and one moving average stays well below the ceiling")
        void simpleScript() {
            ProgramAst ast = parser.parse(SampleScripts.SIMPLE_MA);

            assertEquals(1, ast.inputs().size());
            assertTrue(ast.complexityScore() < 0.3, "Score " + ast.complexityScore());
        }

        @Test
        @DisplayName("Crossover strategy with four inputs lands in the middle band")
        void mediumScript() {
            ProgramAst ast = parser.parse(SampleScripts.EMA_RSI_CROSS);

            assertTrue(ast.inputs().size() >= 4);
            assertTrue(ast.indicatorReferences().size() >= 3);
            assertTrue(ast.strategyCalls().size() >= 2);
            assertTrue(ast.complexityScore() >= 0.1 && ast.complexityScore() < 0.5,
                "Score " + ast.complexityScore());
        }

        @Test
        @DisplayName("Functions, arrays and many indicators score at least 0.5")
        void heavyScript() {
            ProgramAst ast = parser.parse(SampleScripts.HEAVY);

            assertTrue(ast.indicatorReferences().size() >= 8);
            assertTrue(ast.complexityScore() >= 0.5, "Score " + ast.complexityScore());
        }
    }
}
