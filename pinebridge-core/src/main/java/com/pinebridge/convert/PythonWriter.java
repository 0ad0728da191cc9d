package com.pinebridge.convert;

/**
 * Line-oriented Python source builder with four-space indentation.
 */
final class PythonWriter {

    private static final String INDENT = "    ";

    private final StringBuilder out = new StringBuilder();
    private int level = 0;

    PythonWriter line(String text) {
        out.append(INDENT.repeat(level)).append(text).append('\n');
        return this;
    }

    PythonWriter blank() {
        out.append('\n');
        return this;
    }

    PythonWriter indent() {
        level++;
        return this;
    }

    PythonWriter dedent() {
        if (level == 0) {
            throw new IllegalStateException("Unbalanced dedent");
        }
        level--;
        return this;
    }

    /**
     * Double-quoted Python string literal.
     */
    static String quote(String text) {
        StringBuilder sb = new StringBuilder("\"");
        for (char c : text.toCharArray()) {
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    @Override
    public String toString() {
        return out.toString();
    }
}
