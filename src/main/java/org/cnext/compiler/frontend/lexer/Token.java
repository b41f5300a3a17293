package org.cnext.compiler.frontend.lexer;

/**
 * A token of C-Next source.
 *
 * @param type     The token type.
 * @param text     The token text as written. For {@link TokenType#INCLUDE} the include target
 *                 including its delimiters, e.g. {@code <stdio.h>}.
 * @param line     The 1-based line number.
 * @param column   The 1-based column number.
 * @param fileName The source file.
 */
public record Token(TokenType type, String text, int line, int column, String fileName) {

    @Override
    public String toString() {
        return type + " '" + text + "' at " + line + ":" + column;
    }
}
