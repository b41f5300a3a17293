package org.cnext.compiler.frontend.lexer;

import org.cnext.compiler.diagnostics.DiagnosticCode;
import org.cnext.compiler.diagnostics.DiagnosticsEngine;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Converts C-Next source text into tokens. Operators are matched longest first, so
 * {@code a<-1} is an assignment and {@code x<<<-2} a compound shift assignment.
 */
public class Lexer {

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            Map.entry("const", TokenType.CONST),
            Map.entry("enum", TokenType.ENUM),
            Map.entry("struct", TokenType.STRUCT),
            Map.entry("register", TokenType.REGISTER),
            Map.entry("scope", TokenType.SCOPE),
            Map.entry("public", TokenType.PUBLIC),
            Map.entry("private", TokenType.PRIVATE),
            Map.entry("if", TokenType.IF),
            Map.entry("else", TokenType.ELSE),
            Map.entry("while", TokenType.WHILE),
            Map.entry("do", TokenType.DO),
            Map.entry("for", TokenType.FOR),
            Map.entry("switch", TokenType.SWITCH),
            Map.entry("case", TokenType.CASE),
            Map.entry("default", TokenType.DEFAULT),
            Map.entry("return", TokenType.RETURN),
            Map.entry("true", TokenType.TRUE),
            Map.entry("false", TokenType.FALSE),
            Map.entry("NULL", TokenType.NULL),
            Map.entry("this", TokenType.THIS),
            Map.entry("global", TokenType.GLOBAL),
            Map.entry("string", TokenType.STRING_TYPE));

    // Longest spelling first.
    private static final String[][] OPERATORS = {
            {"<<<-", "SHL_ASSIGN"}, {">><-", "SHR_ASSIGN"},
            {"+<-", "PLUS_ASSIGN"}, {"-<-", "MINUS_ASSIGN"}, {"*<-", "STAR_ASSIGN"}, {"/<-", "SLASH_ASSIGN"},
            {"%<-", "PERCENT_ASSIGN"}, {"&<-", "AMP_ASSIGN"}, {"|<-", "PIPE_ASSIGN"}, {"^<-", "CARET_ASSIGN"},
            {"<-", "ASSIGN"}, {"<<", "SHL"}, {">>", "SHR"}, {"<=", "LESS_EQUAL"}, {">=", "GREATER_EQUAL"},
            {"!=", "NOT_EQUAL"}, {"&&", "AND_AND"}, {"||", "OR_OR"},
            {"=", "EQUAL"}, {"<", "LESS"}, {">", "GREATER"}, {"+", "PLUS"}, {"-", "MINUS"}, {"*", "STAR"},
            {"/", "SLASH"}, {"%", "PERCENT"}, {"&", "AMP"}, {"|", "PIPE"}, {"^", "CARET"}, {"~", "TILDE"},
            {"!", "BANG"}, {"(", "LEFT_PAREN"}, {")", "RIGHT_PAREN"}, {"{", "LEFT_BRACE"}, {"}", "RIGHT_BRACE"},
            {"[", "LEFT_BRACKET"}, {"]", "RIGHT_BRACKET"}, {",", "COMMA"}, {".", "DOT"}, {";", "SEMICOLON"},
            {":", "COLON"}, {"?", "QUESTION"}, {"@", "AT"}
    };

    private final String source;
    private final String fileName;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;

    /**
     * Creates a lexer for one source file.
     * @param source      The source text.
     * @param fileName    The file name used in tokens and diagnostics.
     * @param diagnostics The engine for reporting lexical errors.
     */
    public Lexer(String source, String fileName, DiagnosticsEngine diagnostics) {
        this.source = source;
        this.fileName = fileName;
        this.diagnostics = diagnostics;
    }

    /**
     * Scans the whole source.
     * @return The tokens, terminated by {@link TokenType#END_OF_FILE}.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", line, current - lineStart + 1, fileName));
        return tokens;
    }

    private void scanToken() {
        char c = source.charAt(current);
        if (c == '\n') {
            current++;
            line++;
            lineStart = current;
            return;
        }
        if (Character.isWhitespace(c)) {
            current++;
            return;
        }
        if (c == '/' && peekNext() == '/') {
            while (!isAtEnd() && source.charAt(current) != '\n') current++;
            return;
        }
        if (c == '/' && peekNext() == '*') {
            blockComment();
            return;
        }
        if (c == '#') {
            directive();
            return;
        }
        if (c == '"') {
            quoted('"', TokenType.STRING);
            return;
        }
        if (c == '\'') {
            quoted('\'', TokenType.CHAR);
            return;
        }
        if (Character.isDigit(c)) {
            number();
            return;
        }
        if (Character.isLetter(c) || c == '_') {
            identifier();
            return;
        }
        for (String[] operator : OPERATORS) {
            if (source.startsWith(operator[0], current)) {
                current += operator[0].length();
                addToken(TokenType.valueOf(operator[1]));
                return;
            }
        }
        diagnostics.reportError(DiagnosticCode.UNEXPECTED_TOKEN, "Unexpected character '" + c + "'",
                fileName, line, column());
        current++;
    }

    private void blockComment() {
        int startLine = line;
        int startColumn = column();
        current += 2;
        while (!isAtEnd() && !(source.charAt(current) == '*' && peekNext() == '/')) {
            if (source.charAt(current) == '\n') {
                line++;
                lineStart = current + 1;
            }
            current++;
        }
        if (isAtEnd()) {
            diagnostics.reportError(DiagnosticCode.UNTERMINATED_LITERAL, "Unterminated block comment",
                    fileName, startLine, startColumn);
            return;
        }
        current += 2;
    }

    private void directive() {
        while (!isAtEnd() && source.charAt(current) != '\n') current++;
        String text = source.substring(start, current).trim();
        String body = text.substring(1).trim();
        if (body.startsWith("include")) {
            String target = body.substring("include".length()).trim();
            tokens.add(new Token(TokenType.INCLUDE, target, line, start - lineStart + 1, fileName));
        } else {
            tokens.add(new Token(TokenType.DIRECTIVE, text, line, start - lineStart + 1, fileName));
        }
    }

    private void quoted(char delimiter, TokenType type) {
        current++;
        while (!isAtEnd() && source.charAt(current) != delimiter && source.charAt(current) != '\n') {
            if (source.charAt(current) == '\\') current++;
            current++;
        }
        if (isAtEnd() || source.charAt(current) != delimiter) {
            diagnostics.reportError(DiagnosticCode.UNTERMINATED_LITERAL,
                    type == TokenType.STRING ? "Unterminated string literal" : "Unterminated character literal",
                    fileName, line, start - lineStart + 1);
            return;
        }
        current++;
        addToken(type);
    }

    private void number() {
        if (source.charAt(current) == '0' && (peekNext() == 'x' || peekNext() == 'X'
                || peekNext() == 'b' || peekNext() == 'B')) {
            current += 2;
            while (!isAtEnd() && (Character.isLetterOrDigit(source.charAt(current)) || source.charAt(current) == '_')) {
                current++;
            }
            addToken(TokenType.INTEGER);
            return;
        }
        boolean isFloat = false;
        while (!isAtEnd() && (Character.isDigit(source.charAt(current)) || source.charAt(current) == '_')) current++;
        if (!isAtEnd() && source.charAt(current) == '.' && Character.isDigit(peekNext())) {
            isFloat = true;
            current++;
            while (!isAtEnd() && Character.isDigit(source.charAt(current))) current++;
        }
        if (!isAtEnd() && (source.charAt(current) == 'e' || source.charAt(current) == 'E')) {
            int save = current;
            current++;
            if (!isAtEnd() && (source.charAt(current) == '+' || source.charAt(current) == '-')) current++;
            if (!isAtEnd() && Character.isDigit(source.charAt(current))) {
                isFloat = true;
                while (!isAtEnd() && Character.isDigit(source.charAt(current))) current++;
            } else {
                current = save;
            }
        }
        // Type suffixes such as u8, i32 or f32 are kept in the token text.
        while (!isAtEnd() && Character.isLetterOrDigit(source.charAt(current))) current++;
        addToken(isFloat ? TokenType.FLOAT : TokenType.INTEGER);
    }

    private void identifier() {
        while (!isAtEnd() && (Character.isLetterOrDigit(source.charAt(current)) || source.charAt(current) == '_')) {
            current++;
        }
        String text = source.substring(start, current);
        addToken(KEYWORDS.getOrDefault(text, TokenType.IDENTIFIER));
    }

    private void addToken(TokenType type) {
        tokens.add(new Token(type, source.substring(start, current), line, start - lineStart + 1, fileName));
    }

    private int column() {
        return current - lineStart + 1;
    }

    private char peekNext() {
        return current + 1 < source.length() ? source.charAt(current + 1) : '\0';
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }
}
