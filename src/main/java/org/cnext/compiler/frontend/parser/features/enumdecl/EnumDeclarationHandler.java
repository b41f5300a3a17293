package org.cnext.compiler.frontend.parser.features.enumdecl;

import org.cnext.compiler.frontend.lexer.Token;
import org.cnext.compiler.frontend.lexer.TokenType;
import org.cnext.compiler.frontend.parser.IDeclarationHandler;
import org.cnext.compiler.frontend.parser.ParsingContext;
import org.cnext.compiler.frontend.parser.ast.Declaration;
import org.cnext.compiler.frontend.parser.ast.Expression;
import org.cnext.compiler.frontend.parser.ast.SourcePosition;

import java.util.ArrayList;
import java.util.List;

/**
 * Handler for {@code enum Name { A, B <- 5, C }}.
 */
public class EnumDeclarationHandler implements IDeclarationHandler {

    @Override
    public Declaration parse(ParsingContext context) {
        Token keyword = context.advance();
        Token name = context.consume(TokenType.IDENTIFIER, "Expected an enum name after 'enum'.");
        context.consume(TokenType.LEFT_BRACE, "Expected '{' after enum name.");
        List<Declaration.EnumMember> members = new ArrayList<>();
        while (!context.check(TokenType.RIGHT_BRACE) && !context.isAtEnd()) {
            Token member = context.consume(TokenType.IDENTIFIER, "Expected an enum member name.");
            Expression value = null;
            if (context.match(TokenType.ASSIGN)) {
                value = context.expression();
            }
            members.add(new Declaration.EnumMember(member.text(), value, SourcePosition.of(member)));
            if (!context.match(TokenType.COMMA)) {
                break;
            }
        }
        context.consume(TokenType.RIGHT_BRACE, "Expected '}' after enum members.");
        context.match(TokenType.SEMICOLON);
        return new Declaration.EnumDecl(name.text(), members, SourcePosition.of(keyword));
    }
}
