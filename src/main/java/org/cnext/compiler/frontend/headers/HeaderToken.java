package org.cnext.compiler.frontend.headers;

/**
 * A token of the foreign header grammars.
 *
 * @param type The token classification.
 * @param text The token text; for directives the whole logical line without the leading {@code #}.
 * @param line The 1-based line the token starts on.
 */
public record HeaderToken(Type type, String text, int line) {

    public enum Type {
        IDENTIFIER,
        NUMBER,
        STRING,
        CHAR,
        PUNCTUATION,
        DIRECTIVE,
        END_OF_FILE
    }

    public boolean is(String value) {
        return (type == Type.PUNCTUATION || type == Type.IDENTIFIER) && text.equals(value);
    }
}
