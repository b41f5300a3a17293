package org.cnext.compiler.frontend.parser.features.scope;

import org.cnext.compiler.diagnostics.DiagnosticCode;
import org.cnext.compiler.frontend.lexer.Token;
import org.cnext.compiler.frontend.lexer.TokenType;
import org.cnext.compiler.frontend.parser.IDeclarationHandler;
import org.cnext.compiler.frontend.parser.ParseException;
import org.cnext.compiler.frontend.parser.ParsingContext;
import org.cnext.compiler.frontend.parser.ast.Declaration;
import org.cnext.compiler.frontend.parser.ast.SourcePosition;

import java.util.ArrayList;
import java.util.List;

/**
 * Handler for {@code scope Name { [public|private] member ... }}. Members are private
 * unless marked {@code public}.
 */
public class ScopeDeclarationHandler implements IDeclarationHandler {

    @Override
    public Declaration parse(ParsingContext context) {
        Token keyword = context.advance();
        Token name = context.consume(TokenType.IDENTIFIER, "Expected a scope name after 'scope'.");
        context.consume(TokenType.LEFT_BRACE, "Expected '{' after scope name.");
        List<Declaration> members = new ArrayList<>();
        while (!context.check(TokenType.RIGHT_BRACE) && !context.isAtEnd()) {
            boolean isPublic = false;
            if (context.match(TokenType.PUBLIC)) {
                isPublic = true;
            } else {
                context.match(TokenType.PRIVATE);
            }
            if (context.check(TokenType.SCOPE) || context.check(TokenType.REGISTER)) {
                Token unexpected = context.peek();
                context.getDiagnostics().reportError(DiagnosticCode.SYNTAX_ERROR,
                        "'" + unexpected.text() + "' declarations are not allowed inside a scope",
                        unexpected.fileName(), unexpected.line(), unexpected.column());
                throw new ParseException("Nested declaration in scope", unexpected);
            }
            members.add(context.functionOrVariable(isPublic, name.text()));
        }
        context.consume(TokenType.RIGHT_BRACE, "Expected '}' after scope members.");
        return new Declaration.ScopeDecl(name.text(), members, SourcePosition.of(keyword));
    }
}
