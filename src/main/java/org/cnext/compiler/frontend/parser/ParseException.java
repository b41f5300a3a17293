package org.cnext.compiler.frontend.parser;

import org.cnext.compiler.frontend.lexer.Token;

/**
 * Signals a syntax error that has already been reported. The parser catches it at the
 * nearest declaration or statement boundary and resynchronizes.
 */
public class ParseException extends RuntimeException {

    private final transient Token token;

    public ParseException(String message, Token token) {
        super(message);
        this.token = token;
    }

    public Token getToken() {
        return token;
    }
}
