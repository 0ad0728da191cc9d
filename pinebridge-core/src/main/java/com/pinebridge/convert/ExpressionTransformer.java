package com.pinebridge.convert;

import com.pinebridge.dsl.LexException;
import com.pinebridge.dsl.expr.ExprNode;
import com.pinebridge.dsl.expr.ExpressionParseException;
import com.pinebridge.dsl.expr.ExpressionParser;
import com.pinebridge.indicators.registry.IndicatorRegistry;
import com.pinebridge.indicators.registry.IndicatorSpec;
import com.pinebridge.indicators.registry.ParameterSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Translates script expressions into Python expressions evaluated once per bar.
 *
 * Series are plain names, history stays {@code x[n]}, indicators become calls on
 * handles created during strategy initialization. Never throws: anything it cannot
 * map is reported as a failed {@link TransformationResult}.
 */
public class ExpressionTransformer {

    private static final Logger log = LoggerFactory.getLogger(ExpressionTransformer.class);

    /** Script operator to Python operator. */
    private static final Map<String, String> OPERATORS = Map.ofEntries(
        Map.entry("and", "and"),
        Map.entry("or", "or"),
        Map.entry("not", "not"),
        Map.entry("==", "=="),
        Map.entry("!=", "!="),
        Map.entry("<", "<"),
        Map.entry(">", ">"),
        Map.entry("<=", "<="),
        Map.entry(">=", ">="),
        Map.entry("+", "+"),
        Map.entry("-", "-"),
        Map.entry("*", "*"),
        Map.entry("/", "/"),
        Map.entry("%", "%")
    );

    private static final Map<String, String> MATH_FUNCTIONS = Map.ofEntries(
        Map.entry("abs", "abs"),
        Map.entry("max", "max"),
        Map.entry("min", "min"),
        Map.entry("round", "round"),
        Map.entry("sqrt", "math.sqrt"),
        Map.entry("pow", "math.pow"),
        Map.entry("log", "math.log"),
        Map.entry("log10", "math.log10"),
        Map.entry("exp", "math.exp"),
        Map.entry("floor", "math.floor"),
        Map.entry("ceil", "math.ceil"),
        Map.entry("sin", "math.sin"),
        Map.entry("cos", "math.cos"),
        Map.entry("tan", "math.tan"),
        Map.entry("asin", "math.asin"),
        Map.entry("acos", "math.acos"),
        Map.entry("atan", "math.atan"),
        Map.entry("sign", "self.math_sign"),
        Map.entry("avg", "self.math_avg"),
        Map.entry("sum", "self.math_sum")
    );

    private static final Map<String, String> MATH_CONSTANTS = Map.of(
        "pi", "math.pi",
        "e", "math.e",
        "phi", "1.618033988749895"
    );

    /** Namespaces whose members are runtime state, read as {@code self.<ns>.<member>}. */
    private static final Set<String> VALUE_NAMESPACES = Set.of("barstate", "syminfo", "strategy", "timeframe");

    private static final Map<String, String> FREE_FUNCTIONS = Map.of(
        "nz", "self.nz",
        "fixnan", "self.fixnan",
        "int", "int",
        "float", "float",
        "bool", "bool",
        "string", "str"
    );

    private static final Map<String, String> DERIVED_SERIES = Map.of(
        "hl2", "((high + low) / 2)",
        "hlc3", "((high + low + close) / 3)",
        "ohlc4", "((open + high + low + close) / 4)",
        "hlcc4", "((high + low + close + close) / 4)",
        "bar_index", "self.bar_index",
        "last_bar_index", "self.last_bar_index",
        "time", "self.time",
        "timenow", "self.timenow"
    );

    private final IndicatorRegistry registry;

    public ExpressionTransformer(IndicatorRegistry registry) {
        this.registry = registry;
    }

    /**
     * Transform one expression. Each call is independent of every other.
     */
    public TransformationResult transform(String expression) {
        if (expression == null || expression.isBlank()) {
            return TransformationResult.failure(List.of("Empty expression"));
        }
        ExprNode tree;
        try {
            tree = ExpressionParser.parse(expression);
        } catch (ExpressionParseException | LexException e) {
            log.debug("Cannot parse '{}': {}", expression, e.getMessage());
            return TransformationResult.failure(List.of("Syntax error: " + e.getMessage()));
        }
        return transform(tree);
    }

    public TransformationResult transform(ExprNode tree) {
        Emitter emitter = new Emitter();
        String target = emitter.emit(tree, false);
        if (!emitter.diagnostics.isEmpty()) {
            return TransformationResult.failure(emitter.diagnostics);
        }
        return TransformationResult.success(target, emitter.indicators);
    }

    /**
     * Transform several expressions; a failure in one leaves the others untouched.
     */
    public List<TransformationResult> transformAll(List<String> expressions) {
        List<TransformationResult> results = new ArrayList<>();
        for (String expression : expressions) {
            results.add(transform(expression));
        }
        return results;
    }

    // ========== Emission ==========

    /**
     * Per-expression state: collected diagnostics and indicators.
     */
    private final class Emitter {

        private final List<String> diagnostics = new ArrayList<>();
        private final Set<String> indicators = new TreeSet<>();

        String emit(ExprNode node, boolean nested) {
            if (node instanceof ExprNode.NumberLiteral n) {
                return n.text();
            } else if (node instanceof ExprNode.StringLiteral s) {
                return s.text().startsWith("#") ? "\"" + s.text() + "\"" : s.text();
            } else if (node instanceof ExprNode.BoolLiteral b) {
                return b.value() ? "True" : "False";
            } else if (node instanceof ExprNode.NaLiteral) {
                return "None";
            } else if (node instanceof ExprNode.Identifier id) {
                String derived = DERIVED_SERIES.get(id.name());
                return derived != null ? derived : PythonNames.local(id.name());
            } else if (node instanceof ExprNode.Qualified q) {
                return qualifiedValue(q);
            } else if (node instanceof ExprNode.Member m) {
                return emit(m.target(), true) + "." + m.member();
            } else if (node instanceof ExprNode.Index idx) {
                return emit(idx.target(), true) + "[" + emit(idx.offset(), false) + "]";
            } else if (node instanceof ExprNode.Unary u) {
                String op = OPERATORS.get(u.operator());
                String text = op.equals("not") ? "not " + emit(u.operand(), true) : op + emit(u.operand(), true);
                return nested ? "(" + text + ")" : text;
            } else if (node instanceof ExprNode.Binary b) {
                String op = OPERATORS.get(b.operator());
                if (op == null) {
                    diagnostics.add("Unsupported operator '" + b.operator() + "'");
                    return "";
                }
                String text = emit(b.left(), true) + " " + op + " " + emit(b.right(), true);
                return nested ? "(" + text + ")" : text;
            } else if (node instanceof ExprNode.Ternary t) {
                return "(" + emit(t.whenTrue(), true) + " if " + emit(t.condition(), true)
                    + " else " + emit(t.whenFalse(), true) + ")";
            } else if (node instanceof ExprNode.Call call) {
                return call(call);
            } else if (node instanceof ExprNode.ArrayLiteral) {
                diagnostics.add("Array literals are not supported");
                return "";
            }
            diagnostics.add("Unsupported expression: " + node);
            return "";
        }

        private String qualifiedValue(ExprNode.Qualified q) {
            String ns = q.namespace();
            if (VALUE_NAMESPACES.contains(ns)) {
                return "self." + ns + "." + q.member();
            }
            if (ns.equals("math") && MATH_CONSTANTS.containsKey(q.member())) {
                return MATH_CONSTANTS.get(q.member());
            }
            if (ns.equals("ta")) {
                // Argument-free indicators such as ta.tr or ta.obv read like variables
                return indicatorCall(q.qualifiedName(), List.of());
            }
            diagnostics.add("Unsupported namespace '" + ns + "' in " + q.qualifiedName());
            return "";
        }

        private String call(ExprNode.Call call) {
            ExprNode callee = call.callee();
            if (callee instanceof ExprNode.Qualified q) {
                String ns = q.namespace();
                if (ns.equals("ta")) {
                    return indicatorCall(q.qualifiedName(), call.arguments());
                }
                if (ns.equals("math")) {
                    String fn = MATH_FUNCTIONS.get(q.member());
                    if (fn == null) {
                        diagnostics.add("Unknown math function '" + q.qualifiedName() + "'");
                        return "";
                    }
                    return fn + "(" + positionalOnly(call) + ")";
                }
                if (VALUE_NAMESPACES.contains(ns)) {
                    return "self." + ns + "." + q.member() + "(" + positionalOnly(call) + ")";
                }
                diagnostics.add("Unsupported namespace '" + ns + "' in " + q.qualifiedName());
                return "";
            }
            if (callee instanceof ExprNode.NaLiteral) {
                return "self.na(" + positionalOnly(call) + ")";
            }
            if (callee instanceof ExprNode.Identifier id && FREE_FUNCTIONS.containsKey(id.name())) {
                return FREE_FUNCTIONS.get(id.name()) + "(" + positionalOnly(call) + ")";
            }
            if (callee instanceof ExprNode.Identifier id) {
                diagnostics.add("Unknown function '" + id.name() + "'");
                return "";
            }
            diagnostics.add("Unsupported call target");
            return "";
        }

        /**
         * {@code ta.fn(a, b, x=c)} becomes {@code self.ta_fn(p1=a, p2=b, x=c)} using the
         * registry's parameter names.
         */
        private String indicatorCall(String qualifiedName, List<ExprNode.Argument> arguments) {
            IndicatorSpec spec = registry.getSpec(qualifiedName).orElse(null);
            if (spec == null) {
                diagnostics.add("Unknown indicator '" + qualifiedName + "'");
                return "";
            }
            indicators.add(qualifiedName);

            List<ParameterSpec> slots = spec.positionalParameters();
            List<String> rendered = new ArrayList<>();
            int position = 0;
            for (ExprNode.Argument arg : arguments) {
                String name;
                if (arg.isNamed()) {
                    name = arg.name();
                    if (!spec.hasParameter(name)) {
                        diagnostics.add(qualifiedName + " has no parameter '" + name + "'");
                        continue;
                    }
                } else if (position < slots.size()) {
                    name = slots.get(position++).name();
                } else {
                    diagnostics.add(qualifiedName + " takes at most " + slots.size() + " positional arguments");
                    continue;
                }
                rendered.add(name + "=" + emit(arg.value(), false));
            }
            return "self." + spec.handleName() + "(" + String.join(", ", rendered) + ")";
        }

        private String positionalOnly(ExprNode.Call call) {
            List<String> rendered = new ArrayList<>();
            for (ExprNode.Argument arg : call.arguments()) {
                String value = emit(arg.value(), false);
                rendered.add(arg.isNamed() ? arg.name() + "=" + value : value);
            }
            return String.join(", ", rendered);
        }
    }
}
