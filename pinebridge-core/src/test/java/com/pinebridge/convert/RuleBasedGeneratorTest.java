package com.pinebridge.convert;

import com.pinebridge.SampleScripts;
import com.pinebridge.config.ConverterConfig;
import com.pinebridge.dsl.program.ProgramParser;
import com.pinebridge.indicators.registry.IndicatorRegistry;
import com.pinebridge.indicators.registry.IndicatorRegistryInitializer;
import com.pinebridge.model.ProgramAst;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Python strategy generation.
 */
class RuleBasedGeneratorTest {

    private ProgramParser parser;
    private RuleBasedGenerator generator;

    @BeforeEach
    void setUp() {
        ConverterConfig config = ConverterConfig.defaults();
        IndicatorRegistry registry = IndicatorRegistryInitializer.shared();
        parser = new ProgramParser(config);
        generator = new RuleBasedGenerator(new ComplexityGate(config.getGate(), registry),
            new ExpressionTransformer(registry), registry);
    }

    @Nested
    @DisplayName("Output shape")
    class ShapeTests {

        @Test
        @DisplayName("Simple strategy renders the full class")
        void simpleStrategy() {
            String expected = """
                # Generated by PineBridge rule-based converter. Do not edit.
                # Source script: Simple MA (version 5)

                import math

                from pinebridge_runtime import RuleBasedStrategy, LONG, SHORT


                class SimpleMAStrategy(RuleBasedStrategy):
                    "Simple MA"

                    # Parameters
                    length: int = 20  # int, title="Length", min=1

                    def initialize(self):
                        self.ta_sma = self.indicator("ta.sma", "source", "length")

                    def decide(self, open, high, low, close, volume):
                        length = self.length
                        ma = self.ta_sma(source=close, length=length)
                        if close > ma:
                            self.entry("Long", LONG)
                        if close < ma:
                            self.close("Long")
                """;

            assertEquals(expected, generator.generate(parser.parse(SampleScripts.SIMPLE_MA)));
        }

        @Test
        @DisplayName("Blocks appear as parameters, initialize, decide")
        void blockOrder() {
            String code = generator.generate(parser.parse(SampleScripts.EMA_RSI_CROSS));

            int parameters = code.indexOf("# Parameters");
            int initialize = code.indexOf("def initialize(self):");
            int decide = code.indexOf("def decide(self, open, high, low, close, volume):");
            assertTrue(parameters > 0 && parameters < initialize && initialize < decide, code);
            assertTrue(code.contains("    rsiLimit: float = 70.0  # float, title=\"RSI Limit\", step=0.5\n"), code);
            assertTrue(code.contains(
                "        if self.ta_crossover(source1=fast, source2=slow) and (rsi < rsiLimit):\n"
                + "            self.entry(\"Long\", LONG)\n"), code);
        }

        @Test
        @DisplayName("Equal trees generate byte-identical code")
        void deterministic() {
            ProgramAst ast = parser.parse(SampleScripts.EMA_RSI_CROSS);

            String first = generator.generate(ast);
            assertEquals(first, generator.generate(ast));
            assertEquals(first, generator.generate(parser.parse(SampleScripts.EMA_RSI_CROSS)));
        }
    }

    @Nested
    @DisplayName("State and destructuring")
    class StateTests {

        @Test
        @DisplayName("Destructured results are assigned together")
        void destructuring() {
            String code = generator.generate(parser.parse(SampleScripts.MACD_STATE));

            assertTrue(code.contains("        macdLine, signalLine, hist = self.ta_macd(source=close, "
                + "fast_length=12, slow_length=26, signal_length=9)\n"), code);
        }

        @Test
        @DisplayName("Persistent variables are initialized once and written back every bar")
        void persistentVariables() {
            String code = generator.generate(parser.parse(SampleScripts.MACD_STATE));

            assertTrue(code.contains("        self.entryPrice = None\n"), code);
            assertTrue(code.contains("        entryPrice = self.entryPrice\n"), code);
            assertTrue(code.contains("        if entryPrice is None:\n            entryPrice = None\n"), code);
            assertTrue(code.contains("        if self.ta_crossover(source1=macdLine, source2=signalLine):\n"
                + "            entryPrice = close\n"), code);
            assertTrue(code.indexOf("self.entryPrice = entryPrice") < code.indexOf("self.entry(\"Long\", LONG)"));
        }

        @Test
        @DisplayName("else branches use the negated condition")
        void elseBranch() {
            String code = generator.generate(parser.parse(SampleScripts.MACD_STATE));

            assertTrue(code.contains("        if not self.ta_crossover(source1=macdLine, source2=signalLine):\n"
                + "            self.close(\"Long\")\n"), code);
        }

        @Test
        @DisplayName("Exit options and close_all")
        void exitAndCloseAll() {
            String code = generator.generate(parser.parse("""
                strategy("Exits")
                strategy.entry("L", strategy.long, when=close > open)
                strategy.exit("X", "L", stop=low * 0.98)
                strategy.close_all(when=close < open)
                """));

            assertTrue(code.contains("        self.exit(\"X\", from_entry=\"L\", stop=low * 0.98)\n"), code);
            assertTrue(code.contains("        if close < open:\n            self.close_all()\n"), code);
        }

        @Test
        @DisplayName("Python reserved and runtime names are renamed consistently")
        void reservedNames() {
            String code = generator.generate(parser.parse("""
                strategy("Reserved")
                entry = input.int(10, "Entry")
                lambda = ta.sma(close, entry)
                var float self = na
                self := close
                if close > lambda
                    strategy.entry("L", strategy.long)
                """));

            assertTrue(code.contains("    entry_: int = 10  # int, title=\"Entry\"\n"), code);
            assertTrue(code.contains("        entry = self.entry_\n"), code);
            assertTrue(code.contains("        lambda_ = self.ta_sma(source=close, length=entry)\n"), code);
            assertTrue(code.contains("        self_ = self.self\n"), code);
            assertTrue(code.contains("        if self_ is None:\n            self_ = None\n"), code);
            assertTrue(code.contains("        self_ = close\n"), code);
            assertTrue(code.contains("        self.self = self_\n"), code);
            assertTrue(code.contains("        if close > lambda_:\n            self.entry(\"L\", LONG)\n"), code);
            assertFalse(code.contains("lambda ="), code);
        }
    }

    @Nested
    @DisplayName("Refusals")
    class RefusalTests {

        @Test
        @DisplayName("Scripts failing the gate are refused with the gate errors")
        void failsGate() {
            ConversionException e = assertThrows(ConversionException.class,
                () -> generator.generate(parser.parse(SampleScripts.HEAVY)));

            assertTrue(e.getCauses().contains("Custom functions are not supported: 1 defined (scaled)"),
                "Causes: " + e.getCauses());
        }

        @Test
        @DisplayName("Untranslatable expressions refuse the whole script")
        void untranslatableExpression() {
            ConversionException e = assertThrows(ConversionException.class, () -> generator.generate(parser.parse("""
                strategy("Sec")
                d = request.security(syminfo.tickerid, "D", close)
                if close > d
                    strategy.entry("L", strategy.long)
                """)));

            assertEquals(1, e.getCauses().size(), "Causes: " + e.getCauses());
            assertEquals("variable 'd': Unsupported namespace 'request' in request.security", e.getCauses().get(0));
        }

        @Test
        @DisplayName("Entries without a direction are refused")
        void entryWithoutDirection() {
            ConversionException e = assertThrows(ConversionException.class,
                () -> generator.generate(parser.parse("strategy(\"NoDir\")\nstrategy.entry(\"L\")")));

            assertEquals("Strategy entry 'L' at line 2 has no recognizable direction", e.getCauses().get(0));
        }
    }

    @Test
    @DisplayName("Class names are PascalCase with a Strategy suffix")
    void classNames() {
        assertEquals("EMACrossV2Strategy", RuleBasedGenerator.className("EMA Cross v2"));
        assertEquals("MyStrategy", RuleBasedGenerator.className("my strategy"));
        assertEquals("Converted3BarPlayStrategy", RuleBasedGenerator.className("3 Bar Play"));
        assertEquals("ConvertedStrategy", RuleBasedGenerator.className(""));
    }
}
