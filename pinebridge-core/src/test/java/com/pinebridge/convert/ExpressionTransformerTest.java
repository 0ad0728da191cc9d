package com.pinebridge.convert;

import com.pinebridge.indicators.registry.IndicatorRegistryInitializer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for script-to-Python expression translation.
 */
class ExpressionTransformerTest {

    private final ExpressionTransformer transformer = new ExpressionTransformer(IndicatorRegistryInitializer.shared());

    private String target(String expression) {
        TransformationResult result = transformer.transform(expression);
        assertTrue(result.success(), "Diagnostics for '" + expression + "': " + result.diagnostics());
        return result.targetExpression();
    }

    @Nested
    @DisplayName("Operators and literals")
    class OperatorTests {

        @Test
        @DisplayName("Ternary becomes a Python conditional expression")
        void ternary() {
            assertEquals("(1 if (rsi < 30) else 0)", target("rsi < 30 ? 1 : 0"));
        }

        @Test
        @DisplayName("Nested operands are parenthesized")
        void parenthesizes() {
            assertEquals("((close - open) / open) * 100", target("(close - open) / open * 100"));
            assertEquals("a and (b or c)", target("a and (b or c)"));
            assertEquals("True and (not False)", target("true and not false"));
        }

        @Test
        @DisplayName("na, history and derived price series")
        void seriesAndLiterals() {
            assertEquals("None", target("na"));
            assertEquals("close[1]", target("close[1]"));
            assertEquals("((high + low) / 2) > close[1]", target("hl2 > close[1]"));
            assertEquals("self.bar_index % 2", target("bar_index % 2"));
        }
    }

    @Nested
    @DisplayName("Calls")
    class CallTests {

        @Test
        @DisplayName("Indicator calls bind positional arguments to parameter names")
        void indicatorCall() {
            TransformationResult result = transformer.transform("close > ta.sma(close, 20)");

            assertTrue(result.success());
            assertEquals("close > self.ta_sma(source=close, length=20)", result.targetExpression());
            assertEquals(Set.of("ta.sma"), result.indicatorsUsed());
        }

        @Test
        @DisplayName("Named indicator arguments keep their names")
        void namedIndicatorArguments() {
            assertEquals("self.ta_bb(source=close, length=20, mult=2.5)", target("ta.bb(close, 20, mult=2.5)"));
        }

        @Test
        @DisplayName("Argument-free indicators read like variables")
        void argumentFreeIndicator() {
            assertEquals("self.ta_tr()", target("ta.tr"));
        }

        @Test
        @DisplayName("Math, nz and state namespaces")
        void builtins() {
            assertEquals("abs(close - open)", target("math.abs(close - open)"));
            assertEquals("math.sqrt(x)", target("math.sqrt(x)"));
            assertEquals("math.pi * 2", target("math.pi * 2"));
            assertEquals("self.nz(x[1])", target("nz(x[1])"));
            assertEquals("self.na(x)", target("na(x)"));
            assertEquals("self.barstate.isconfirmed", target("barstate.isconfirmed"));
            assertEquals("int(x)", target("int(x)"));
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("Unregistered namespace fails with a diagnostic")
        void unknownNamespace() {
            TransformationResult result = transformer.transform("request.security(syminfo.tickerid, \"D\", close)");

            assertFalse(result.success());
            assertEquals("", result.targetExpression());
            assertEquals(List.of("Unsupported namespace 'request' in request.security"), result.diagnostics());
        }

        @Test
        @DisplayName("A failing expression does not affect its siblings")
        void siblingsUnaffected() {
            List<TransformationResult> results = transformer.transformAll(List.of(
                "close > open",
                "str.tostring(close)",
                "rsi < 30 ? 1 : 0"));

            assertTrue(results.get(0).success());
            assertFalse(results.get(1).success());
            assertFalse(results.get(1).diagnostics().isEmpty());
            assertTrue(results.get(2).success());
            assertEquals("(1 if (rsi < 30) else 0)", results.get(2).targetExpression());
        }

        @Test
        @DisplayName("Unknown indicators and functions are reported, not thrown")
        void unknownCallables() {
            TransformationResult indicator = transformer.transform("ta.nothing(close)");
            assertEquals(List.of("Unknown indicator 'ta.nothing'"), indicator.diagnostics());

            TransformationResult function = transformer.transform("myFunc(close)");
            assertEquals(List.of("Unknown function 'myFunc'"), function.diagnostics());
        }

        @Test
        @DisplayName("Argument errors are collected")
        void argumentErrors() {
            TransformationResult tooMany = transformer.transform("ta.sma(close, 14, 3)");
            assertEquals(List.of("ta.sma takes at most 2 positional arguments"), tooMany.diagnostics());

            TransformationResult badName = transformer.transform("ta.sma(close, len=14)");
            assertEquals(List.of("ta.sma has no parameter 'len'"), badName.diagnostics());
        }

        @Test
        @DisplayName("Syntax errors become diagnostics")
        void syntaxError() {
            TransformationResult result = transformer.transform("close >");

            assertFalse(result.success());
            assertTrue(result.diagnostics().get(0).startsWith("Syntax error"));
            assertFalse(transformer.transform("  ").success());
        }

        @Test
        @DisplayName("Pathological nesting becomes a diagnostic")
        void deepNesting() {
            TransformationResult result = transformer.transform(
                "(".repeat(20000) + "close > open" + ")".repeat(20000));

            assertFalse(result.success());
            assertTrue(result.diagnostics().get(0).contains("nested too deeply"), "Got " + result.diagnostics());
        }
    }

    @Test
    @DisplayName("Identifiers that are Python reserved names get a trailing underscore")
    void reservedIdentifiers() {
        assertEquals("close > lambda_", target("close > lambda"));
        assertEquals("(None_ + self_) + max_", target("None + self + max"));
        assertEquals("class_[1]", target("class[1]"));
        assertEquals("entry + length", target("entry + length"), "Runtime attribute names are fine as locals");
    }
}
