package org.cnext.compiler.frontend.parser;

import org.cnext.compiler.diagnostics.DiagnosticsEngine;
import org.cnext.compiler.frontend.lexer.Token;
import org.cnext.compiler.frontend.lexer.TokenType;
import org.cnext.compiler.frontend.parser.ast.Declaration;
import org.cnext.compiler.frontend.parser.ast.Expression;
import org.cnext.compiler.frontend.parser.ast.Statement;
import org.cnext.compiler.frontend.parser.ast.TypeRef;

import java.util.List;

/**
 * Provides declaration handlers with access to the token stream and to the shared
 * sub-grammars. This interface decouples handlers from the concrete {@link Parser}.
 */
public interface ParsingContext {
    /**
     * Checks if the current token matches any of the given types. If so, consumes it.
     * @param types The token types to match.
     * @return true if the current token matches one of the types, false otherwise.
     */
    boolean match(TokenType... types);

    /**
     * Checks if the current token is of the given type without consuming it.
     * @param type The token type to check.
     * @return true if the current token is of the given type, false otherwise.
     */
    boolean check(TokenType type);

    /**
     * Consumes the current token and returns it.
     * @return The consumed token.
     */
    Token advance();

    /**
     * Returns the current token without consuming it.
     * @return The current token.
     */
    Token peek();

    /**
     * Returns the previously consumed token.
     * @return The previous token.
     */
    Token previous();

    /**
     * Consumes the current token if it is of the expected type.
     * If not, it reports an error and abandons the current declaration.
     * @param type The expected token type.
     * @param errorMessage The error message to report if the token type does not match.
     * @return The consumed token.
     */
    Token consume(TokenType type, String errorMessage);

    /**
     * Gets the diagnostics engine for reporting errors.
     * @return The diagnostics engine.
     */
    DiagnosticsEngine getDiagnostics();

    /**
     * Checks if the end of the token stream has been reached.
     * @return true if at the end of the stream, false otherwise.
     */
    boolean isAtEnd();

    /**
     * Parses an expression.
     */
    Expression expression();

    /**
     * Parses a type, including {@code string<N>}.
     */
    TypeRef typeRef();

    /**
     * Parses array dimensions {@code [N][M]...} following a declared name.
     */
    List<Expression> arrayDimensions();

    /**
     * Parses a brace-delimited block of statements.
     */
    Statement.Block block();

    /**
     * Parses a function or variable declaration, starting at its optional {@code const}.
     * @param isPublic  The visibility to record.
     * @param scopeName The enclosing scope, or {@code null} at top level.
     */
    Declaration functionOrVariable(boolean isPublic, String scopeName);
}
