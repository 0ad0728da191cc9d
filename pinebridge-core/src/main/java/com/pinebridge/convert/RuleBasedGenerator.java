package com.pinebridge.convert;

import com.pinebridge.indicators.registry.IndicatorRegistry;
import com.pinebridge.indicators.registry.IndicatorSpec;
import com.pinebridge.model.Direction;
import com.pinebridge.model.InputDecl;
import com.pinebridge.model.InputType;
import com.pinebridge.model.ProgramAst;
import com.pinebridge.model.StrategyCall;
import com.pinebridge.model.VariableBinding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Generates a Python strategy class from a gate-approved AST.
 *
 * Output has three blocks in fixed order: class-level parameter declarations,
 * {@code initialize(self)} and {@code decide(self, open, high, low, close, volume)}.
 * Generation reads only the AST, so equal ASTs give byte-identical code.
 */
public class RuleBasedGenerator {

    private static final Logger log = LoggerFactory.getLogger(RuleBasedGenerator.class);

    public static final String RUNTIME_MODULE = "pinebridge_runtime";
    public static final String BASE_CLASS = "RuleBasedStrategy";

    private final ComplexityGate gate;
    private final ExpressionTransformer transformer;
    private final IndicatorRegistry registry;

    public RuleBasedGenerator(ComplexityGate gate, ExpressionTransformer transformer, IndicatorRegistry registry) {
        this.gate = gate;
        this.transformer = transformer;
        this.registry = registry;
    }

    /**
     * @throws ConversionException if the AST fails the gate or any expression cannot be transformed
     */
    public String generate(ProgramAst ast) {
        ValidationResult validation = gate.validate(ast);
        if (!validation.valid()) {
            throw new ConversionException("Script is not eligible for rule-based conversion", validation.errors());
        }

        List<String> causes = new ArrayList<>();
        PythonWriter out = new PythonWriter();
        String className = className(ast.name());

        writeHeader(out, ast, className);
        writeParameters(out, ast, causes);
        out.blank();
        writeInitialize(out, ast, causes);
        out.blank();
        writeDecide(out, ast, causes);
        out.dedent();

        if (!causes.isEmpty()) {
            log.warn("Generation of '{}' refused: {}", ast.name(), causes);
            throw new ConversionException("Cannot generate code for '" + ast.name() + "'", causes);
        }
        log.info("Generated {} for '{}'", className, ast.name());
        return out.toString();
    }

    // ========== Blocks ==========

    private void writeHeader(PythonWriter out, ProgramAst ast, String className) {
        out.line("# Generated by PineBridge rule-based converter. Do not edit.")
            .line("# Source script: " + (ast.name().isEmpty() ? "(unnamed)" : ast.name().replace('\n', ' '))
                + " (version " + ast.version() + ")")
            .blank()
            .line("import math")
            .blank()
            .line("from " + RUNTIME_MODULE + " import " + BASE_CLASS + ", LONG, SHORT")
            .blank()
            .blank()
            .line("class " + className + "(" + BASE_CLASS + "):")
            .indent()
            .line(PythonWriter.quote(ast.name()))
            .blank();
    }

    /**
     * One typed, defaulted class field per input.
     */
    private void writeParameters(PythonWriter out, ProgramAst ast, List<String> causes) {
        out.line("# Parameters");
        if (ast.inputs().isEmpty()) {
            out.line("# (none)");
            return;
        }
        for (InputDecl input : ast.inputs()) {
            String value = defaultValue(input, causes);
            out.line(PythonNames.attribute(input.name()) + ": " + pythonType(input) + " = " + value + "  # " + describe(input));
        }
    }

    /**
     * One indicator handle per distinct reference, then persistent variable slots.
     */
    private void writeInitialize(PythonWriter out, ProgramAst ast, List<String> causes) {
        out.line("def initialize(self):").indent();
        int statements = 0;
        for (String name : ast.indicatorReferences()) {
            Optional<IndicatorSpec> spec = registry.getSpec(name);
            if (spec.isEmpty()) {
                causes.add("Unknown indicator '" + name + "'");
                continue;
            }
            List<String> args = new ArrayList<>();
            args.add(PythonWriter.quote(name));
            for (String param : spec.get().parameterNames()) {
                args.add(PythonWriter.quote(param));
            }
            out.line("self." + spec.get().handleName() + " = self.indicator(" + String.join(", ", args) + ")");
            statements++;
        }
        for (VariableBinding v : ast.persistentVariables()) {
            out.line("self." + PythonNames.attribute(v.name()) + " = None");
            statements++;
        }
        if (statements == 0) {
            out.line("pass");
        }
        out.dedent();
    }

    private void writeDecide(PythonWriter out, ProgramAst ast, List<String> causes) {
        out.line("def decide(self, open, high, low, close, volume):").indent();

        for (InputDecl input : ast.inputs()) {
            String local = PythonNames.local(input.name());
            String field = PythonNames.attribute(input.name());
            if (input.type() == InputType.SOURCE) {
                out.line(local + " = self.source(self." + field + ")");
            } else {
                out.line(local + " = self." + field);
            }
        }
        List<VariableBinding> persistent = ast.persistentVariables();
        for (VariableBinding v : persistent) {
            out.line(PythonNames.local(v.name()) + " = self." + PythonNames.attribute(v.name()));
        }

        writeBindings(out, ast.variables(), causes);

        for (VariableBinding v : persistent) {
            out.line("self." + PythonNames.attribute(v.name()) + " = " + PythonNames.local(v.name()));
        }

        for (StrategyCall call : ast.strategyCalls()) {
            writeStrategyCall(out, call, causes);
        }

        if (ast.inputs().isEmpty() && ast.variables().isEmpty() && ast.strategyCalls().isEmpty()) {
            out.line("pass");
        }
        out.dedent();
    }

    private void writeBindings(PythonWriter out, List<VariableBinding> variables, List<String> causes) {
        for (int i = 0; i < variables.size(); i++) {
            VariableBinding v = variables.get(i);
            String target;
            if (v.isDestructured()) {
                if (v.resultIndex() > 0) {
                    continue;
                }
                List<String> names = new ArrayList<>();
                for (int j = i; j < variables.size(); j++) {
                    VariableBinding part = variables.get(j);
                    if (j > i && (!part.isDestructured() || part.resultIndex() == 0 || part.line() != v.line())) {
                        break;
                    }
                    names.add(PythonNames.local(part.name()));
                }
                target = String.join(", ", names);
            } else {
                target = PythonNames.local(v.name());
            }

            String value = expression(v.expression(), "variable '" + v.name() + "'", causes);
            if (v.guard() != null) {
                out.line("if " + expression(v.guard(), "guard of '" + v.name() + "'", causes) + ":").indent();
            }
            if (v.persists() && !v.reassignment()) {
                // var/varip: initialized once, kept across bars
                out.line("if " + PythonNames.local(v.name()) + " is None:").indent();
                out.line(target + " = " + value);
                out.dedent();
            } else {
                out.line(target + " = " + value);
            }
            if (v.guard() != null) {
                out.dedent();
            }
        }
    }

    private void writeStrategyCall(PythonWriter out, StrategyCall call, List<String> causes) {
        String what = call.kind().name().toLowerCase(Locale.ROOT) + " '" + call.idLabel() + "'";
        List<String> args = new ArrayList<>();
        String method;
        switch (call.kind()) {
            case ENTRY -> {
                method = "entry";
                args.add(PythonWriter.quote(call.idLabel() == null ? "" : call.idLabel()));
                if (call.direction() == Direction.NONE) {
                    causes.add("Strategy " + what + " at line " + call.line() + " has no recognizable direction");
                } else {
                    args.add(call.direction().name());
                }
            }
            case CLOSE -> {
                method = call.idLabel() == null ? "close_all" : "close";
                if (call.idLabel() != null) {
                    args.add(PythonWriter.quote(call.idLabel()));
                }
            }
            default -> {
                method = "exit";
                args.add(PythonWriter.quote(call.idLabel() == null ? "" : call.idLabel()));
            }
        }
        for (Map.Entry<String, String> option : call.options().entrySet()) {
            args.add(option.getKey() + "=" + expression(option.getValue(), what + " argument " + option.getKey(), causes));
        }

        String statement = "self." + method + "(" + String.join(", ", args) + ")";
        if (call.whenCondition() != null) {
            out.line("if " + expression(call.whenCondition(), "condition of " + what, causes) + ":")
                .indent()
                .line(statement)
                .dedent();
        } else {
            out.line(statement);
        }
    }

    // ========== Helpers ==========

    private String expression(String source, String context, List<String> causes) {
        TransformationResult result = transformer.transform(source);
        if (!result.success()) {
            for (String diagnostic : result.diagnostics()) {
                causes.add(context + ": " + diagnostic);
            }
            return "None";
        }
        return result.targetExpression();
    }

    private String defaultValue(InputDecl input, List<String> causes) {
        String raw = input.defaultValue();
        if (raw == null) {
            return "None";
        }
        return switch (input.type()) {
            case SOURCE, COLOR -> raw.startsWith("\"") || raw.startsWith("'")
                ? expression(raw, "input '" + input.name() + "'", causes)
                : PythonWriter.quote(raw);
            default -> expression(raw, "input '" + input.name() + "'", causes);
        };
    }

    private static String pythonType(InputDecl input) {
        return switch (input.type()) {
            case INT -> "int";
            case FLOAT -> "float";
            case BOOL -> "bool";
            case STRING, SOURCE, COLOR -> "str";
        };
    }

    private static String describe(InputDecl input) {
        StringBuilder sb = new StringBuilder(input.type().name().toLowerCase(Locale.ROOT));
        if (input.title() != null) {
            sb.append(", title=").append(PythonWriter.quote(input.title()));
        }
        if (input.min() != null) {
            sb.append(", min=").append(number(input.min()));
        }
        if (input.max() != null) {
            sb.append(", max=").append(number(input.max()));
        }
        if (input.step() != null) {
            sb.append(", step=").append(number(input.step()));
        }
        return sb.toString();
    }

    private static String number(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    /**
     * "EMA Cross v2" -> "EMACrossV2Strategy".
     */
    static String className(String scriptName) {
        StringBuilder sb = new StringBuilder();
        for (String word : scriptName.split("[^A-Za-z0-9]+")) {
            if (!word.isEmpty()) {
                sb.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
            }
        }
        if (sb.length() == 0 || Character.isDigit(sb.charAt(0))) {
            sb.insert(0, "Converted");
        }
        if (!sb.toString().endsWith("Strategy")) {
            sb.append("Strategy");
        }
        return sb.toString();
    }
}
