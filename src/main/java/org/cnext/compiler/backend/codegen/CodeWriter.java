package org.cnext.compiler.backend.codegen;

/**
 * Accumulates generated C text with four-space indentation.
 */
public class CodeWriter {

    private static final String INDENT = "    ";

    private final StringBuilder out = new StringBuilder();
    private int depth = 0;

    /**
     * Writes one indented line.
     */
    public CodeWriter line(String text) {
        out.append(INDENT.repeat(depth)).append(text).append('\n');
        return this;
    }

    public CodeWriter blankLine() {
        out.append('\n');
        return this;
    }

    /**
     * Writes a line ending in {@code {} and indents the following lines.
     */
    public CodeWriter open(String text) {
        line(text);
        depth++;
        return this;
    }

    /**
     * Dedents and writes a closing line.
     */
    public CodeWriter close(String text) {
        depth = Math.max(0, depth - 1);
        line(text);
        return this;
    }

    /**
     * Dedents, writes a line such as {@code } else {} and indents again.
     */
    public CodeWriter reopen(String text) {
        depth = Math.max(0, depth - 1);
        line(text);
        depth++;
        return this;
    }

    public boolean isEmpty() {
        return out.length() == 0;
    }

    @Override
    public String toString() {
        return out.toString();
    }
}
