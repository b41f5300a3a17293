package org.cnext.compiler.frontend.headers;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizer shared by the C and C++ header grammars. Preprocessor lines are returned as
 * single {@link HeaderToken.Type#DIRECTIVE} tokens with line continuations joined.
 */
public final class HeaderLexer {

    private static final String[] MULTI_CHAR_PUNCTUATION = {"...", "::", "->", "<<", ">>", "&&", "||", "==", "!=", "<=", ">="};

    private final String source;
    private final List<HeaderToken> tokens = new ArrayList<>();
    private int current = 0;
    private int line = 1;
    private boolean atLineStart = true;

    public HeaderLexer(String source) {
        this.source = source;
    }

    /**
     * Scans the whole source.
     *
     * @return The tokens, terminated by an {@link HeaderToken.Type#END_OF_FILE} token.
     */
    public List<HeaderToken> scanTokens() {
        while (!isAtEnd()) {
            scanToken();
        }
        tokens.add(new HeaderToken(HeaderToken.Type.END_OF_FILE, "", line));
        return tokens;
    }

    private void scanToken() {
        char c = source.charAt(current);
        if (c == '\n') {
            line++;
            current++;
            atLineStart = true;
            return;
        }
        if (Character.isWhitespace(c)) {
            current++;
            return;
        }
        if (c == '/' && peek(1) == '/') {
            while (!isAtEnd() && source.charAt(current) != '\n') current++;
            return;
        }
        if (c == '/' && peek(1) == '*') {
            skipBlockComment();
            return;
        }
        if (c == '#' && atLineStart) {
            scanDirective();
            return;
        }
        atLineStart = false;
        int startLine = line;
        if (Character.isLetter(c) || c == '_') {
            int start = current;
            while (!isAtEnd() && (Character.isLetterOrDigit(source.charAt(current)) || source.charAt(current) == '_')) {
                current++;
            }
            tokens.add(new HeaderToken(HeaderToken.Type.IDENTIFIER, source.substring(start, current), startLine));
        } else if (Character.isDigit(c) || (c == '.' && Character.isDigit(peek(1)))) {
            int start = current;
            while (!isAtEnd() && (Character.isLetterOrDigit(source.charAt(current)) || source.charAt(current) == '.'
                    || source.charAt(current) == '\'')) {
                current++;
            }
            tokens.add(new HeaderToken(HeaderToken.Type.NUMBER, source.substring(start, current), startLine));
        } else if (c == '"' || c == '\'') {
            int start = current++;
            while (!isAtEnd() && source.charAt(current) != c && source.charAt(current) != '\n') {
                if (source.charAt(current) == '\\') current++;
                current++;
            }
            current = Math.min(current + 1, source.length());
            HeaderToken.Type type = c == '"' ? HeaderToken.Type.STRING : HeaderToken.Type.CHAR;
            tokens.add(new HeaderToken(type, source.substring(start, current), startLine));
        } else {
            for (String punctuation : MULTI_CHAR_PUNCTUATION) {
                if (source.startsWith(punctuation, current)) {
                    tokens.add(new HeaderToken(HeaderToken.Type.PUNCTUATION, punctuation, startLine));
                    current += punctuation.length();
                    return;
                }
            }
            tokens.add(new HeaderToken(HeaderToken.Type.PUNCTUATION, String.valueOf(c), startLine));
            current++;
        }
    }

    private void scanDirective() {
        int startLine = line;
        current++;
        StringBuilder text = new StringBuilder();
        while (!isAtEnd()) {
            char c = source.charAt(current);
            if (c == '\\' && peek(1) == '\n') {
                current += 2;
                line++;
                text.append(' ');
                continue;
            }
            if (c == '\n') {
                break;
            }
            if (c == '/' && peek(1) == '/') {
                while (!isAtEnd() && source.charAt(current) != '\n') current++;
                break;
            }
            if (c == '/' && peek(1) == '*') {
                skipBlockComment();
                text.append(' ');
                continue;
            }
            text.append(c);
            current++;
        }
        tokens.add(new HeaderToken(HeaderToken.Type.DIRECTIVE, text.toString().trim(), startLine));
    }

    private void skipBlockComment() {
        current += 2;
        while (!isAtEnd() && !(source.charAt(current) == '*' && peek(1) == '/')) {
            if (source.charAt(current) == '\n') line++;
            current++;
        }
        current = Math.min(current + 2, source.length());
    }

    private char peek(int offset) {
        int index = current + offset;
        return index < source.length() ? source.charAt(index) : '\0';
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }
}
