package org.cnext.compiler.frontend.headers;

/**
 * Raised inside a header collector when a declaration cannot be parsed. The collector
 * reports it and resynchronizes at the next declaration boundary.
 */
public class HeaderParseException extends RuntimeException {

    private final int line;

    public HeaderParseException(String message, int line) {
        super(message);
        this.line = line;
    }

    public int getLine() {
        return line;
    }
}
