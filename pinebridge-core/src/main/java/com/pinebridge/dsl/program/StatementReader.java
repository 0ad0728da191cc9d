package com.pinebridge.dsl.program;

import com.pinebridge.dsl.Token;
import com.pinebridge.dsl.TokenStream;
import com.pinebridge.dsl.TokenType;
import com.pinebridge.dsl.expr.ExprNode;
import com.pinebridge.dsl.expr.ExpressionParseException;
import com.pinebridge.dsl.expr.ExpressionParser;
import com.pinebridge.model.Direction;
import com.pinebridge.model.FunctionDef;
import com.pinebridge.model.InputDecl;
import com.pinebridge.model.InputType;
import com.pinebridge.model.ParseWarning;
import com.pinebridge.model.PlotDecl;
import com.pinebridge.model.ProgramAst;
import com.pinebridge.model.StrategyCall;
import com.pinebridge.model.StrategyCallKind;
import com.pinebridge.model.TypeDef;
import com.pinebridge.model.VariableBinding;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Single-use walker that turns one token stream into an unscored {@link ProgramAst}.
 *
 * Statements are logical lines: physical lines joined while a bracket is open or the
 * line ends in an operator or comma. Blocks are tracked by the indentation column of
 * their first token; a statement at or left of an open block's column closes it.
 */
final class StatementReader {

    private static final Pattern VERSION = Pattern.compile("//\\s*@version\\s*=\\s*(\\d+)");
    private static final Set<String> ASSIGNMENT_OPS = Set.of("=", ":=", "+=", "-=", "*=", "/=", "%=");
    private static final Set<String> COLLECTION_NAMESPACES = Set.of("array", "matrix", "map");
    private static final Set<String> PLOT_FUNCTIONS = Set.of(
        "plot", "plotshape", "plotchar", "plotarrow", "plotcandle", "plotbar",
        "hline", "bgcolor", "barcolor", "fill"
    );
    private static final Set<String> DECLARATIONS = Set.of("indicator", "strategy", "study", "library");

    /** Positional argument slots after the id, per call kind. */
    private static final List<String> ENTRY_POSITIONAL = List.of("id", "direction", "qty", "limit", "stop");
    private static final List<String> EXIT_POSITIONAL = List.of(
        "id", "from_entry", "qty", "qty_percent", "profit", "limit", "loss", "stop");
    private static final List<String> CLOSE_POSITIONAL = List.of("id", "when");
    private static final List<String> INPUT_POSITIONAL = List.of("defval", "title", "minval", "maxval", "step");
    private static final List<String> LEGACY_INPUT_POSITIONAL = List.of("defval", "title", "type");

    private final TokenStream stream;

    private int version = 5;
    private String scriptKind = "indicator";
    private String name = "";
    private final List<InputDecl> inputs = new ArrayList<>();
    private final List<VariableBinding> variables = new ArrayList<>();
    private final List<FunctionDef> functions = new ArrayList<>();
    private final List<TypeDef> typeDefs = new ArrayList<>();
    private final Set<String> indicators = new TreeSet<>();
    private final List<StrategyCall> strategyCalls = new ArrayList<>();
    private final List<PlotDecl> plots = new ArrayList<>();
    private final List<ParseWarning> warnings = new ArrayList<>();
    private boolean usesCollections = false;
    private boolean usesLoops = false;
    private int maxDepth = 0;
    private int maxConditionCallDepth = 0;

    private final Deque<Block> blocks = new ArrayDeque<>();
    private Block lastClosed;

    StatementReader(TokenStream stream) {
        this.stream = stream;
    }

    ProgramAst read() {
        readVersion();
        List<Token> clean = stream.clean().tokens();
        scanReferences(clean);

        List<Statement> statements = group(clean);
        for (Statement statement : statements) {
            closeBlocks(statement.indent());
            readStatement(statement);
        }
        while (!blocks.isEmpty()) {
            finish(blocks.pop());
        }

        int totalLines = stream.get(stream.size() - 1).line();
        return new ProgramAst(version, scriptKind, name, inputs, variables, functions, typeDefs,
            new TreeSet<>(indicators), strategyCalls, plots, usesCollections, usesLoops,
            totalLines, countCodeLines(clean), maxDepth, maxConditionCallDepth,
            0.0, Map.of(), Map.of(), warnings);
    }

    // ========== Whole-stream scans ==========

    private void readVersion() {
        for (Token t : stream.ofType(TokenType.COMMENT)) {
            Matcher m = VERSION.matcher(t.text());
            if (m.find()) {
                try {
                    version = Integer.parseInt(m.group(1));
                } catch (NumberFormatException e) {
                    warnings.add(new ParseWarning(t.line(), t.text().strip(),
                        "Version number out of range, assuming " + version));
                }
                return;
            }
        }
    }

    /**
     * Qualified indicator names and collection usage anywhere in the script.
     */
    private void scanReferences(List<Token> clean) {
        for (int i = 0; i + 1 < clean.size(); i++) {
            Token t = clean.get(i);
            Token next = clean.get(i + 1);
            if (t.is(TokenType.NAMESPACE) && next.isSymbol(".") && i + 2 < clean.size()) {
                Token member = clean.get(i + 2);
                if (t.text().equals("ta") && member.isWord()) {
                    indicators.add("ta." + member.text());
                }
                if (COLLECTION_NAMESPACES.contains(t.text())) {
                    usesCollections = true;
                }
            }
            if (t.is(TokenType.KEYWORD) && COLLECTION_NAMESPACES.contains(t.text()) && next.isSymbol("<")) {
                usesCollections = true;
            }
            // float[] x
            if (t.is(TokenType.KEYWORD) && next.isSymbol("[") && i + 2 < clean.size()
                    && clean.get(i + 2).isSymbol("]")) {
                usesCollections = true;
            }
        }
    }

    private static int countCodeLines(List<Token> clean) {
        Set<Integer> lines = new TreeSet<>();
        for (Token t : clean) {
            if (t.type() != TokenType.EOF) {
                lines.add(t.line());
            }
        }
        return lines.size();
    }

    /**
     * Join physical lines into logical statements.
     */
    private static List<Statement> group(List<Token> clean) {
        List<Statement> statements = new ArrayList<>();
        List<Token> current = new ArrayList<>();
        int depth = 0;
        for (Token t : clean) {
            if (t.type() == TokenType.EOF) {
                break;
            }
            if (!current.isEmpty() && depth <= 0) {
                Token last = current.get(current.size() - 1);
                boolean continues = (last.is(TokenType.OPERATOR) && !last.text().equals("=>"))
                    || last.isSymbol(",")
                    || last.is(TokenType.KEYWORD, "and") || last.is(TokenType.KEYWORD, "or");
                if (t.line() > last.line() && !continues) {
                    statements.add(Statement.of(current));
                    current = new ArrayList<>();
                    depth = 0;
                }
            }
            if (TokenSlices.opens(t)) {
                depth++;
            } else if (TokenSlices.closes(t)) {
                depth--;
            }
            current.add(t);
        }
        if (!current.isEmpty()) {
            statements.add(Statement.of(current));
        }
        return statements;
    }

    // ========== Blocks ==========

    private void closeBlocks(int indent) {
        lastClosed = null;
        while (!blocks.isEmpty() && blocks.peek().indent >= indent) {
            Block closed = blocks.pop();
            finish(closed);
            lastClosed = closed;
        }
    }

    private void finish(Block block) {
        if (block.kind == BlockKind.FUNCTION) {
            String body = String.join("\n", block.collected);
            functions.add(new FunctionDef(block.label, block.parameters, body, block.line));
        } else if (block.kind == BlockKind.TYPE) {
            typeDefs.add(new TypeDef(block.label, block.collected, block.line));
        }
    }

    private void open(Block block) {
        blocks.push(block);
        maxDepth = Math.max(maxDepth, controlDepth());
    }

    /**
     * Number of enclosing conditional and loop blocks.
     */
    private int controlDepth() {
        int depth = 0;
        for (Block b : blocks) {
            if (b.kind.isControl()) {
                depth++;
            }
        }
        return depth;
    }

    /**
     * Conjunction of every enclosing branch condition, null at top level.
     */
    private String currentGuard() {
        List<String> parts = new ArrayList<>();
        Iterator<Block> outermostFirst = blocks.descendingIterator();
        while (outermostFirst.hasNext()) {
            Block b = outermostFirst.next();
            if (b.kind == BlockKind.BRANCH) {
                parts.addAll(b.guardParts());
            }
        }
        return conjunction(parts);
    }

    private boolean insideLoop() {
        for (Block b : blocks) {
            if (b.kind == BlockKind.LOOP) {
                return true;
            }
        }
        return false;
    }

    private Block enclosing(BlockKind kind) {
        for (Block b : blocks) {
            if (b.kind == kind) {
                return b;
            }
        }
        return null;
    }

    private static String conjunction(List<String> parts) {
        if (parts.isEmpty()) {
            return null;
        }
        if (parts.size() == 1) {
            return parts.get(0);
        }
        List<String> wrapped = new ArrayList<>();
        for (String p : parts) {
            wrapped.add("(" + p + ")");
        }
        return String.join(" and ", wrapped);
    }

    // ========== Statements ==========

    private void readStatement(Statement statement) {
        List<Token> t = statement.tokens();
        Token first = t.get(0);

        // Bodies of functions and types are collected, not interpreted
        Block function = enclosing(BlockKind.FUNCTION);
        if (function != null) {
            function.collected.add(statement.text());
            return;
        }
        Block type = enclosing(BlockKind.TYPE);
        if (type != null) {
            type.collected.add(statement.text());
            return;
        }
        if (enclosing(BlockKind.VALUE) != null) {
            warn(statement, "Branch of a conditional expression is not interpreted");
            return;
        }

        if (first.is(TokenType.KEYWORD)) {
            switch (first.text()) {
                case "if" -> {
                    openBranch(statement, join(t.subList(1, t.size())), List.of());
                    return;
                }
                case "else" -> {
                    readElse(statement);
                    return;
                }
                case "for", "while" -> {
                    usesLoops = true;
                    open(new Block(BlockKind.LOOP, statement.indent(), first.text(), statement.line()));
                    return;
                }
                case "switch" -> {
                    open(new Block(BlockKind.VALUE, statement.indent(), "switch", statement.line()));
                    warn(statement, "Switch statements are not interpreted");
                    return;
                }
                case "type" -> {
                    readType(statement);
                    return;
                }
                case "import" -> {
                    warn(statement, "Library imports are not resolved");
                    return;
                }
                case "export", "method" -> {
                    if (t.size() > 1) {
                        readStatement(new Statement(List.copyOf(t.subList(1, t.size())), statement.indent()));
                    }
                    return;
                }
                case "break", "continue" -> {
                    return;
                }
                default -> {
                    if (DECLARATIONS.contains(first.text()) && t.size() > 1 && t.get(1).isSymbol("(")) {
                        readDeclaration(statement);
                        return;
                    }
                }
            }
        }

        if (isFunctionDefinition(t)) {
            readFunction(statement);
            return;
        }
        if (first.isSymbol("[")) {
            readDestructuring(statement);
            return;
        }
        int assign = TokenSlices.findTopLevel(t, ASSIGNMENT_OPS);
        if (assign > 0) {
            readAssignment(statement, assign);
            return;
        }
        if (isQualifiedCall(t, "strategy")) {
            readStrategyCall(statement);
            return;
        }
        if (first.is(TokenType.BUILTIN) && PLOT_FUNCTIONS.contains(first.text()) && t.size() > 1
                && t.get(1).isSymbol("(")) {
            readPlot(statement);
            return;
        }
        if (first.is(TokenType.BUILTIN) && first.text().startsWith("alert")) {
            return;
        }
        warn(statement, "Unrecognized statement");
    }

    private void openBranch(Statement statement, String condition, List<String> negatedBefore) {
        Block block = new Block(BlockKind.BRANCH, statement.indent(), "if", statement.line());
        block.condition = condition;
        block.negatedBefore = negatedBefore;
        open(block);
        trackConditionDepth(condition);
    }

    private void readElse(Statement statement) {
        List<Token> t = statement.tokens();
        if (lastClosed == null || lastClosed.kind != BlockKind.BRANCH || lastClosed.condition == null
                || lastClosed.indent != statement.indent()) {
            warn(statement, "'else' without a matching 'if'");
            return;
        }
        List<String> negated = new ArrayList<>(lastClosed.negatedBefore);
        negated.add("not (" + lastClosed.condition + ")");
        if (t.size() > 1 && t.get(1).is(TokenType.KEYWORD, "if")) {
            openBranch(statement, join(t.subList(2, t.size())), negated);
        } else {
            openBranch(statement, null, negated);
        }
    }

    private void readType(Statement statement) {
        List<Token> t = statement.tokens();
        if (t.size() < 2 || !t.get(1).isWord()) {
            warn(statement, "Type declaration without a name");
            return;
        }
        Block block = new Block(BlockKind.TYPE, statement.indent(), t.get(1).text(), statement.line());
        open(block);
    }

    private void readDeclaration(Statement statement) {
        List<Token> t = statement.tokens();
        String kind = t.get(0).text();
        scriptKind = kind.equals("study") ? "indicator" : kind;
        for (TokenSlices.Arg arg : TokenSlices.arguments(t, 1)) {
            if ((arg.name() == null || arg.name().equals("title")) && isStringLiteral(arg.value())) {
                name = unquote(arg.value().get(0).text());
                return;
            }
        }
    }

    private static boolean isFunctionDefinition(List<Token> t) {
        if (t.size() < 4 || !t.get(0).is(TokenType.IDENTIFIER) || !t.get(1).isSymbol("(")) {
            return false;
        }
        int close = TokenSlices.matching(t, 1);
        return close > 0 && close + 1 < t.size() && t.get(close + 1).is(TokenType.OPERATOR, "=>");
    }

    private void readFunction(Statement statement) {
        List<Token> t = statement.tokens();
        int close = TokenSlices.matching(t, 1);
        List<String> params = new ArrayList<>();
        for (TokenSlices.Arg arg : TokenSlices.arguments(t, 1)) {
            // "simple int len = 14" parses as named "len"; "int len" keeps the last word
            if (arg.name() != null) {
                params.add(arg.name());
            } else {
                params.add(arg.value().get(arg.value().size() - 1).text());
            }
        }
        Block block = new Block(BlockKind.FUNCTION, statement.indent(), t.get(0).text(), statement.line());
        block.parameters = params;
        if (close + 2 < t.size()) {
            block.collected.add(join(t.subList(close + 2, t.size())));
        }
        open(block);
    }

    private void readDestructuring(Statement statement) {
        List<Token> t = statement.tokens();
        int close = TokenSlices.matching(t, 0);
        if (close < 0 || close + 1 >= t.size() || !(t.get(close + 1).is(TokenType.OPERATOR, "=")
                || t.get(close + 1).is(TokenType.OPERATOR, ":="))) {
            warn(statement, "Unrecognized statement");
            return;
        }
        List<String> names = new ArrayList<>();
        for (TokenSlices.Arg element : TokenSlices.arguments(t, 0)) {
            names.add(join(element.value()));
        }
        List<Token> rhs = t.subList(close + 2, t.size());
        String expression = join(rhs);
        String sourceCall = calleeName(rhs);
        boolean reassignment = t.get(close + 1).text().equals(":=");
        for (int i = 0; i < names.size(); i++) {
            addVariable(statement, names.get(i), expression, null, false, false, reassignment, sourceCall, i);
        }
    }

    private void readAssignment(Statement statement, int assign) {
        List<Token> t = statement.tokens();
        String op = t.get(assign).text();
        List<Token> lhs = new ArrayList<>(t.subList(0, assign));
        List<Token> rhs = t.subList(assign + 1, t.size());
        if (rhs.isEmpty()) {
            warn(statement, "Assignment without a value");
            return;
        }

        boolean persists = false;
        boolean realtime = false;
        if (lhs.get(0).is(TokenType.KEYWORD, "var") || lhs.get(0).is(TokenType.KEYWORD, "varip")) {
            persists = true;
            realtime = lhs.get(0).text().equals("varip");
            lhs.remove(0);
        }
        if (lhs.isEmpty() || !lhs.get(lhs.size() - 1).isWord()) {
            warn(statement, "Unrecognized assignment target");
            return;
        }
        String target = lhs.get(lhs.size() - 1).text();
        String declaredType = lhs.size() > 1 ? join(lhs.subList(0, lhs.size() - 1)) : null;

        if (isQualifiedCall(rhs, "input") || (rhs.get(0).is(TokenType.BUILTIN, "input")
                && rhs.size() > 1 && rhs.get(1).isSymbol("("))) {
            readInput(statement, target, rhs);
            return;
        }

        Token head = rhs.get(0);
        if (head.is(TokenType.KEYWORD, "if") || head.is(TokenType.KEYWORD, "switch")) {
            open(new Block(BlockKind.VALUE, statement.indent(), head.text(), statement.line()));
        }

        String expression = join(rhs);
        if (!op.equals("=") && !op.equals(":=")) {
            // x += y  ->  x := x + (y)
            expression = target + " " + op.charAt(0) + " (" + expression + ")";
        }
        addVariable(statement, target, expression, declaredType, persists, realtime,
            !op.equals("="), null, -1);
    }

    private void addVariable(Statement statement, String target, String expression, String declaredType,
                             boolean persists, boolean realtime, boolean reassignment,
                             String sourceCall, int resultIndex) {
        if (insideLoop()) {
            warn(statement, "Assignment inside a loop body");
        }
        variables.add(new VariableBinding(target, expression, declaredType, persists, realtime,
            reassignment, sourceCall, resultIndex, currentGuard(), controlDepth(), statement.line()));
    }

    // ========== Inputs ==========

    private void readInput(Statement statement, String target, List<Token> rhs) {
        boolean legacy = rhs.get(0).is(TokenType.BUILTIN, "input");
        int open = legacy ? 1 : 3;
        String suffix = legacy ? null : rhs.get(2).text();

        Map<String, String> args = bind(TokenSlices.arguments(rhs, open),
            legacy ? LEGACY_INPUT_POSITIONAL : INPUT_POSITIONAL);
        String defaultValue = args.get("defval");

        InputType type;
        try {
            if (suffix != null) {
                type = InputType.fromCallSuffix(suffix);
            } else if (args.containsKey("type")) {
                String declared = args.get("type");
                type = InputType.fromCallSuffix(declared.substring(declared.lastIndexOf('.') + 1));
            } else {
                type = InputType.inferFromDefault(defaultValue);
            }
        } catch (IllegalArgumentException e) {
            warn(statement, e.getMessage());
            return;
        }

        String title = args.get("title");
        if (title != null && (title.startsWith("\"") || title.startsWith("'"))) {
            title = unquote(title);
        }
        inputs.add(new InputDecl(target, type, defaultValue, title,
            number(args.get("minval")), number(args.get("maxval")), number(args.get("step")),
            statement.line()));
    }

    // ========== Strategy calls and plots ==========

    private void readStrategyCall(Statement statement) {
        List<Token> t = statement.tokens();
        String function = t.get(2).text();
        StrategyCallKind kind = StrategyCallKind.fromFunction(function);
        if (kind == null) {
            // strategy.cancel, strategy.risk.* and friends carry no entry/exit semantics
            warn(statement, "strategy." + function + " is not converted");
            return;
        }

        List<String> slots = switch (kind) {
            case ENTRY -> ENTRY_POSITIONAL;
            case EXIT -> EXIT_POSITIONAL;
            case CLOSE -> CLOSE_POSITIONAL;
        };
        Map<String, String> args = bind(TokenSlices.arguments(t, 3), slots);

        String id = args.remove("id");
        String idLabel = id == null ? null : (isQuoted(id) ? unquote(id) : id);

        Direction direction = Direction.NONE;
        String directionArg = args.remove("direction");
        String longArg = args.remove("long");
        if (kind == StrategyCallKind.ENTRY) {
            direction = directionOf(directionArg != null ? directionArg : longArg);
        }

        List<String> conditionParts = new ArrayList<>();
        String guard = currentGuard();
        if (guard != null) {
            conditionParts.add(guard);
        }
        String when = args.remove("when");
        if (when != null) {
            conditionParts.add(when);
        }
        String condition = conjunction(conditionParts);
        trackConditionDepth(condition);

        args.remove("comment");
        args.remove("alert_message");
        strategyCalls.add(new StrategyCall(kind, idLabel, direction, condition, controlDepth(), args,
            statement.line()));
    }

    private static Direction directionOf(String text) {
        if (text == null) {
            return Direction.NONE;
        }
        return switch (text) {
            case "strategy.long", "true", "strategy.direction.long" -> Direction.LONG;
            case "strategy.short", "false", "strategy.direction.short" -> Direction.SHORT;
            default -> Direction.NONE;
        };
    }

    private void readPlot(Statement statement) {
        List<Token> t = statement.tokens();
        Map<String, String> args = bind(TokenSlices.arguments(t, 1), List.of("series", "title"));
        String title = args.get("title");
        if (title != null && isQuoted(title)) {
            title = unquote(title);
        }
        String series = args.containsKey("series") ? args.get("series") : args.get("price");
        plots.add(new PlotDecl(t.get(0).text(), series, title, statement.line()));
    }

    // ========== Helpers ==========

    /**
     * Assign positional arguments to slot names, then add named ones. Extra positionals
     * are dropped.
     */
    private static Map<String, String> bind(List<TokenSlices.Arg> args, List<String> slots) {
        Map<String, String> bound = new LinkedHashMap<>();
        int position = 0;
        for (TokenSlices.Arg arg : args) {
            if (arg.name() == null) {
                if (position < slots.size()) {
                    bound.put(slots.get(position), arg.text());
                }
                position++;
            }
        }
        for (TokenSlices.Arg arg : args) {
            if (arg.name() != null) {
                bound.put(arg.name(), arg.text());
            }
        }
        return bound;
    }

    private void trackConditionDepth(String condition) {
        if (condition == null) {
            return;
        }
        try {
            maxConditionCallDepth = Math.max(maxConditionCallDepth,
                ExprNode.callDepth(ExpressionParser.parse(condition)));
        } catch (ExpressionParseException e) {
            // Unparseable conditions fail later in transformation; depth stays as is
            maxConditionCallDepth = Math.max(maxConditionCallDepth, 1);
        }
    }

    private static boolean isQualifiedCall(List<Token> t, String namespace) {
        return t.size() > 3 && t.get(0).is(TokenType.NAMESPACE, namespace) && t.get(1).isSymbol(".")
            && t.get(2).isWord() && t.get(3).isSymbol("(");
    }

    private static String calleeName(List<Token> rhs) {
        if (rhs.size() > 3 && rhs.get(0).is(TokenType.NAMESPACE) && rhs.get(3).isSymbol("(")) {
            return rhs.get(0).text() + "." + rhs.get(2).text();
        }
        if (rhs.size() > 1 && rhs.get(0).isWord() && rhs.get(1).isSymbol("(")) {
            return rhs.get(0).text();
        }
        return null;
    }

    private static boolean isStringLiteral(List<Token> value) {
        return value.size() == 1 && value.get(0).is(TokenType.STRING) && isQuoted(value.get(0).text());
    }

    private static boolean isQuoted(String text) {
        return text.length() >= 2 && (text.startsWith("\"") || text.startsWith("'"));
    }

    private static String unquote(String text) {
        return text.substring(1, text.length() - 1);
    }

    private static Double number(String text) {
        if (text == null) {
            return null;
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String join(List<Token> tokens) {
        return TokenSlices.join(tokens);
    }

    private void warn(Statement statement, String reason) {
        warnings.add(new ParseWarning(statement.line(), statement.text(), reason));
    }

    // ========== Types ==========

    private record Statement(List<Token> tokens, int indent) {
        static Statement of(List<Token> tokens) {
            return new Statement(List.copyOf(tokens), tokens.get(0).column());
        }

        int line() {
            return tokens.get(0).line();
        }

        String text() {
            return TokenSlices.join(tokens);
        }
    }

    private enum BlockKind {
        BRANCH, LOOP, VALUE, FUNCTION, TYPE;

        boolean isControl() {
            return this == BRANCH || this == LOOP || this == VALUE;
        }
    }

    private static final class Block {
        final BlockKind kind;
        final int indent;
        final String label;
        final int line;
        final List<String> collected = new ArrayList<>();
        List<String> parameters = List.of();
        String condition;
        List<String> negatedBefore = List.of();

        Block(BlockKind kind, int indent, String label, int line) {
            this.kind = kind;
            this.indent = indent;
            this.label = label;
            this.line = line;
        }

        List<String> guardParts() {
            List<String> parts = new ArrayList<>(negatedBefore);
            if (condition != null) {
                parts.add(condition);
            }
            return parts;
        }
    }
}
