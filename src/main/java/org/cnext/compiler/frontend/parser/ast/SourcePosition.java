package org.cnext.compiler.frontend.parser.ast;

import org.cnext.compiler.frontend.lexer.Token;

/**
 * A location in a source file.
 *
 * @param fileName The source file.
 * @param line     The 1-based line.
 * @param column   The 1-based column.
 */
public record SourcePosition(String fileName, int line, int column) {

    public static SourcePosition of(Token token) {
        return new SourcePosition(token.fileName(), token.line(), token.column());
    }

    @Override
    public String toString() {
        return fileName + ":" + line + ":" + column;
    }
}
