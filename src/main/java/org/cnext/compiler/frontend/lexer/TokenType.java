package org.cnext.compiler.frontend.lexer;

/**
 * The token types of the C-Next grammar.
 */
public enum TokenType {
    // Literals and names
    IDENTIFIER,
    INTEGER,
    FLOAT,
    STRING,
    CHAR,

    // Keywords
    CONST, ENUM, STRUCT, REGISTER, SCOPE, PUBLIC, PRIVATE,
    IF, ELSE, WHILE, DO, FOR, SWITCH, CASE, DEFAULT, RETURN,
    TRUE, FALSE, NULL, THIS, GLOBAL, STRING_TYPE,

    // Preprocessor lines
    INCLUDE,
    DIRECTIVE,

    // Punctuation
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACE, RIGHT_BRACE, LEFT_BRACKET, RIGHT_BRACKET,
    COMMA, DOT, SEMICOLON, COLON, QUESTION, AT,

    // Assignment
    ASSIGN, PLUS_ASSIGN, MINUS_ASSIGN, STAR_ASSIGN, SLASH_ASSIGN, PERCENT_ASSIGN,
    AMP_ASSIGN, PIPE_ASSIGN, CARET_ASSIGN, SHL_ASSIGN, SHR_ASSIGN,

    // Operators
    EQUAL, NOT_EQUAL, LESS, LESS_EQUAL, GREATER, GREATER_EQUAL,
    PLUS, MINUS, STAR, SLASH, PERCENT, AMP, PIPE, CARET, TILDE, BANG,
    AND_AND, OR_OR, SHL, SHR,

    END_OF_FILE;

    /**
     * True for {@code <-} and every compound assignment.
     */
    public boolean isAssignment() {
        return ordinal() >= ASSIGN.ordinal() && ordinal() <= SHR_ASSIGN.ordinal();
    }
}
