package com.pinebridge.dsl.program;

import com.fasterxml.jackson.databind.JsonNode;
import com.pinebridge.SampleScripts;
import com.pinebridge.io.JsonSupport;
import com.pinebridge.model.Direction;
import com.pinebridge.model.InputDecl;
import com.pinebridge.model.InputType;
import com.pinebridge.model.ProgramAst;
import com.pinebridge.model.StrategyCall;
import com.pinebridge.model.StrategyCallKind;
import com.pinebridge.model.VariableBinding;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for building program trees from script source.
 */
class ProgramParserTest {

    private ProgramParser parser;

    @BeforeEach
    void setUp() {
        parser = new ProgramParser();
    }

    private static VariableBinding variable(ProgramAst ast, String name) {
        return ast.variables().stream()
            .filter(v -> v.name().equals(name))
            .findFirst()
            .orElseThrow(() -> new AssertionError("No variable " + name));
    }

    @Nested
    @DisplayName("Declarations")
    class DeclarationTests {

        @Test
        @DisplayName("Reads version, kind and title")
        void readsHeader() {
            ProgramAst ast = parser.parse(SampleScripts.SIMPLE_MA);

            assertEquals(5, ast.version());
            assertEquals("strategy", ast.scriptKind());
            assertEquals("Simple MA", ast.name());
            assertTrue(ast.isStrategy());
        }

        @Test
        @DisplayName("study() is read as an indicator")
        void legacyStudy() {
            ProgramAst ast = parser.parse("//@version=4\nstudy(title=\"Old\")\nplot(close)");

            assertEquals(4, ast.version());
            assertEquals("indicator", ast.scriptKind());
            assertEquals("Old", ast.name());
            assertFalse(ast.isStrategy());
        }

        @Test
        @DisplayName("Counts code lines without comments or blanks")
        void countsLines() {
            ProgramAst ast = parser.parse(SampleScripts.SIMPLE_MA);

            assertEquals(8, ast.codeLines());
            assertEquals(10, ast.totalLines());
        }
    }

    @Nested
    @DisplayName("Inputs")
    class InputTests {

        @Test
        @DisplayName("Typed inputs keep default, title and bounds")
        void typedInputs() {
            ProgramAst ast = parser.parse(SampleScripts.EMA_RSI_CROSS);

            assertEquals(4, ast.inputs().size());
            InputDecl fast = ast.inputs().get(0);
            assertEquals("fastLen", fast.name());
            assertEquals(InputType.INT, fast.type());
            assertEquals("9", fast.defaultValue());
            assertEquals("Fast EMA", fast.title());
            assertEquals(1.0, fast.min());
            assertNull(fast.max());

            InputDecl limit = ast.inputs().get(3);
            assertEquals(InputType.FLOAT, limit.type());
            assertEquals("70.0", limit.defaultValue());
            assertEquals(0.5, limit.step());
        }

        @Test
        @DisplayName("Legacy input() calls take their type from the type argument or the default")
        void legacyInputs() {
            ProgramAst ast = parser.parse("""
                //@version=4
                study("Legacy")
                length = input(14, title="Length", type=input.integer)
                src = input(close, "Source")
                show = input(true, "Show")
                """);

            assertEquals(3, ast.inputs().size());
            assertEquals(InputType.INT, ast.inputs().get(0).type());
            assertEquals("Length", ast.inputs().get(0).title());
            assertEquals(InputType.SOURCE, ast.inputs().get(1).type());
            assertEquals(InputType.BOOL, ast.inputs().get(2).type());
        }

        @Test
        @DisplayName("Inputs are not recorded as variables")
        void inputsAreNotVariables() {
            ProgramAst ast = parser.parse(SampleScripts.SIMPLE_MA);

            assertTrue(ast.variables().stream().noneMatch(v -> v.name().equals("length")));
        }
    }

    @Nested
    @DisplayName("Variables")
    class VariableTests {

        @Test
        @DisplayName("Collects distinct indicator references in sorted order")
        void indicatorReferences() {
            ProgramAst ast = parser.parse(SampleScripts.EMA_RSI_CROSS);

            assertEquals(List.of("ta.crossover", "ta.crossunder", "ta.ema", "ta.rsi"),
                List.copyOf(ast.indicatorReferences()));
        }

        @Test
        @DisplayName("Destructuring binds each name to its result position")
        void destructuring() {
            ProgramAst ast = parser.parse(SampleScripts.MACD_STATE);

            VariableBinding signal = variable(ast, "signalLine");
            assertTrue(signal.isDestructured());
            assertEquals(1, signal.resultIndex());
            assertEquals("ta.macd", signal.sourceCall());
            assertEquals("ta.macd(close, 12, 26, 9)", signal.expression());
            assertEquals(2, variable(ast, "hist").resultIndex());
        }

        @Test
        @DisplayName("var declarations persist; later := updates carry the branch guard")
        void persistentVariable() {
            ProgramAst ast = parser.parse(SampleScripts.MACD_STATE);

            List<VariableBinding> persistent = ast.persistentVariables();
            assertEquals(1, persistent.size());
            assertEquals("entryPrice", persistent.get(0).name());
            assertEquals("float", persistent.get(0).declaredType());
            assertFalse(persistent.get(0).realtime());

            VariableBinding update = ast.variables().stream()
                .filter(v -> v.name().equals("entryPrice") && v.reassignment())
                .findFirst()
                .orElseThrow();
            assertEquals("ta.crossover(macdLine, signalLine)", update.guard());
            assertEquals(1, update.depth());
        }

        @Test
        @DisplayName("Compound assignment is rewritten as a reassignment")
        void compoundAssignment() {
            ProgramAst ast = parser.parse("indicator(\"C\")\nvar total = 0.0\ntotal += close - open");

            VariableBinding update = ast.variables().get(1);
            assertEquals("total + (close - open)", update.expression());
            assertTrue(update.reassignment());
        }

        @Test
        @DisplayName("Lines ending in an operator continue on the next line")
        void continuationLines() {
            ProgramAst ast = parser.parse("indicator(\"C\")\ncond = close > open and\n     volume > 0\nplot(close)");

            assertEquals("close > open and volume > 0", variable(ast, "cond").expression());
            assertEquals(1, ast.plots().size());
        }
    }

    @Nested
    @DisplayName("Strategy calls")
    class StrategyCallTests {

        @Test
        @DisplayName("Entry and close carry id, direction and the enclosing condition")
        void entryAndClose() {
            ProgramAst ast = parser.parse(SampleScripts.EMA_RSI_CROSS);

            assertEquals(2, ast.strategyCalls().size());
            StrategyCall entry = ast.strategyCalls().get(0);
            assertEquals(StrategyCallKind.ENTRY, entry.kind());
            assertEquals("Long", entry.idLabel());
            assertEquals(Direction.LONG, entry.direction());
            assertEquals("ta.crossover(fast, slow) and rsi < rsiLimit", entry.whenCondition());
            assertEquals(1, entry.nestingLevel());

            StrategyCall close = ast.strategyCalls().get(1);
            assertEquals(StrategyCallKind.CLOSE, close.kind());
            assertEquals("ta.crossunder(fast, slow)", close.whenCondition());
        }

        @Test
        @DisplayName("else branches negate the preceding condition")
        void elseBranch() {
            ProgramAst ast = parser.parse(SampleScripts.MACD_STATE);

            StrategyCall close = ast.strategyCalls().get(1);
            assertEquals("not (ta.crossover(macdLine, signalLine))", close.whenCondition());
        }

        @Test
        @DisplayName("Named when, positional short direction and exit options")
        void namedArguments() {
            ProgramAst ast = parser.parse("""
                strategy("Opts")
                strategy.entry("S", false, when=close < open, comment="go")
                strategy.exit("X", "S", stop=high * 1.02, limit=low)
                strategy.close_all()
                """);

            StrategyCall entry = ast.strategyCalls().get(0);
            assertEquals(Direction.SHORT, entry.direction());
            assertEquals("close < open", entry.whenCondition());
            assertTrue(entry.options().isEmpty(), "comment is dropped");
            assertEquals(0, entry.nestingLevel());

            StrategyCall exit = ast.strategyCalls().get(1);
            assertEquals(StrategyCallKind.EXIT, exit.kind());
            assertEquals("S", exit.options().get("from_entry").replace("\"", ""));
            assertEquals("high * 1.02", exit.options().get("stop"));
            assertEquals("low", exit.options().get("limit"));

            StrategyCall closeAll = ast.strategyCalls().get(2);
            assertEquals(StrategyCallKind.CLOSE, closeAll.kind());
            assertNull(closeAll.idLabel());
        }
    }

    @Nested
    @DisplayName("Unsupported constructs")
    class UnsupportedTests {

        @Test
        @DisplayName("Function definitions are kept as opaque bodies")
        void functionDefinition() {
            ProgramAst ast = parser.parse(SampleScripts.HEAVY);

            assertEquals(1, ast.functions().size());
            assertEquals("scaled", ast.functions().get(0).name());
            assertEquals(List.of("x"), ast.functions().get(0).parameters());
            assertEquals("x * 2", ast.functions().get(0).body());
            assertTrue(ast.usesCollections());
        }

        @Test
        @DisplayName("Unrecognized statements are recorded and parsing continues")
        void unrecognizedStatement() {
            ProgramAst ast = parser.parse(SampleScripts.HEAVY);

            assertTrue(ast.warnings().stream().anyMatch(w -> w.line() == 5
                && w.statement().equals("array.push(closes, close)")
                && w.reason().equals("Unrecognized statement")), "Got " + ast.warnings());
            assertEquals(1, ast.strategyCalls().size(), "Statements after the warning are still read");
        }

        @Test
        @DisplayName("Loops are detected and their assignments flagged")
        void loops() {
            ProgramAst ast = parser.parse("""
                indicator("Loop")
                total = 0.0
                for i = 0 to 9
                    total := total + close[i]
                plot(total)
                """);

            assertTrue(ast.usesLoops());
            assertEquals(1, ast.maxNestingDepth());
            assertTrue(ast.warnings().stream().anyMatch(w -> w.reason().equals("Assignment inside a loop body")));
        }

        @Test
        @DisplayName("User-defined types are recorded")
        void typeDefinitions() {
            ProgramAst ast = parser.parse("""
                //@version=5
                indicator("Types")
                type Pivot
                    float price
                    int bar
                plot(close)
                """);

            assertTrue(ast.hasCustomTypes());
            assertEquals("Pivot", ast.typeDefs().get(0).name());
            assertEquals(List.of("float price", "int bar"), ast.typeDefs().get(0).fields());
        }
    }

    @Nested
    @DisplayName("Malformed input")
    class MalformedInputTests {

        @Test
        @DisplayName("Out-of-range version keeps the default and records a warning")
        void versionOutOfRange() {
            ProgramAst ast = parser.parse("//@version=99999999999\nindicator(\"x\")\nplot(close)\n");

            assertEquals(5, ast.version());
            assertEquals("x", ast.name());
            assertTrue(ast.warnings().stream().anyMatch(w -> w.line() == 1
                && w.statement().equals("//@version=99999999999")
                && w.reason().equals("Version number out of range, assuming 5")), "Got " + ast.warnings());
        }

        @Test
        @DisplayName("Deeply nested conditions still produce a tree")
        void deepCondition() {
            String condition = "(".repeat(20000) + "close > open" + ")".repeat(20000);
            ProgramAst ast = assertDoesNotThrow(() -> parser.parse(
                "strategy(\"Deep\")\nif " + condition + "\n    strategy.entry(\"L\", strategy.long)"));

            assertEquals(1, ast.strategyCalls().size());
            String when = ast.strategyCalls().get(0).whenCondition();
            assertTrue(when.startsWith("((((") && when.contains("close > open"));
        }
    }

    @Test
    @DisplayName("Serializes to JSON without the raw source")
    void serializesToJson() throws Exception {
        ProgramAst ast = parser.parse(SampleScripts.SIMPLE_MA);

        JsonNode json = JsonSupport.mapper().readTree(JsonSupport.toJson(ast));

        assertEquals("Simple MA", json.get("name").asText());
        assertEquals("ta.sma", json.get("indicatorReferences").get(0).asText());
        assertTrue(json.has("complexityFactors"));
        assertFalse(json.has("source"));
        assertEquals(ast.complexityScore(), json.get("complexityScore").asDouble(), 1e-12);
    }
}
