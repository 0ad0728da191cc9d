package com.pinebridge.dsl.expr;

import java.util.List;

/**
 * Expression tree for one script expression.
 */
public sealed interface ExprNode {

    record NumberLiteral(String text) implements ExprNode {}

    record StringLiteral(String text) implements ExprNode {}

    record BoolLiteral(boolean value) implements ExprNode {}

    record NaLiteral() implements ExprNode {}

    record Identifier(String name) implements ExprNode {}

    /** {@code namespace.member}, e.g. ta.ema or barstate.isconfirmed */
    record Qualified(String namespace, String member) implements ExprNode {
        public String qualifiedName() {
            return namespace + "." + member;
        }
    }

    /** Field access on a value, e.g. {@code trade.price}. */
    record Member(ExprNode target, String member) implements ExprNode {}

    record Call(ExprNode callee, List<Argument> arguments) implements ExprNode {
        public Call {
            arguments = List.copyOf(arguments);
        }
    }

    /** History reference {@code series[offset]}. */
    record Index(ExprNode target, ExprNode offset) implements ExprNode {}

    record Unary(String operator, ExprNode operand) implements ExprNode {}

    record Binary(String operator, ExprNode left, ExprNode right) implements ExprNode {}

    record Ternary(ExprNode condition, ExprNode whenTrue, ExprNode whenFalse) implements ExprNode {}

    record ArrayLiteral(List<ExprNode> elements) implements ExprNode {
        public ArrayLiteral {
            elements = List.copyOf(elements);
        }
    }

    /**
     * Call argument; {@code name} is null for positional arguments.
     */
    record Argument(String name, ExprNode value) {
        public boolean isNamed() {
            return name != null;
        }
    }

    /**
     * Deepest chain of calls nested inside each other, 0 for call-free expressions.
     */
    static int callDepth(ExprNode node) {
        if (node instanceof Call call) {
            int inner = callDepth(call.callee());
            for (Argument arg : call.arguments()) {
                inner = Math.max(inner, callDepth(arg.value()));
            }
            return inner + 1;
        } else if (node instanceof Member m) {
            return callDepth(m.target());
        } else if (node instanceof Index idx) {
            return Math.max(callDepth(idx.target()), callDepth(idx.offset()));
        } else if (node instanceof Unary u) {
            return callDepth(u.operand());
        } else if (node instanceof Binary b) {
            return Math.max(callDepth(b.left()), callDepth(b.right()));
        } else if (node instanceof Ternary t) {
            return Math.max(callDepth(t.condition()), Math.max(callDepth(t.whenTrue()), callDepth(t.whenFalse())));
        } else if (node instanceof ArrayLiteral a) {
            int max = 0;
            for (ExprNode e : a.elements()) {
                max = Math.max(max, callDepth(e));
            }
            return max;
        }
        return 0;
    }
}
