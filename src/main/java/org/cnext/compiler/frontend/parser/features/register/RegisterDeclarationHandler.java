package org.cnext.compiler.frontend.parser.features.register;

import org.cnext.compiler.diagnostics.DiagnosticCode;
import org.cnext.compiler.frontend.lexer.Token;
import org.cnext.compiler.frontend.lexer.TokenType;
import org.cnext.compiler.frontend.parser.IDeclarationHandler;
import org.cnext.compiler.frontend.parser.ParseException;
import org.cnext.compiler.frontend.parser.ParsingContext;
import org.cnext.compiler.frontend.parser.ast.Declaration;
import org.cnext.compiler.frontend.parser.ast.Expression;
import org.cnext.compiler.frontend.parser.ast.SourcePosition;
import org.cnext.compiler.frontend.parser.ast.TypeRef;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Handler for memory-mapped register blocks:
 * {@code register GPIO @ 0x40000000 { DR: u32 rw @ 0x00, SR: u32 ro @ 0x04 }}.
 */
public class RegisterDeclarationHandler implements IDeclarationHandler {

    private static final Set<String> ACCESS_MODES = Set.of("rw", "ro", "wo", "w1c", "w1s");

    @Override
    public Declaration parse(ParsingContext context) {
        Token keyword = context.advance();
        Token name = context.consume(TokenType.IDENTIFIER, "Expected a register name after 'register'.");
        context.consume(TokenType.AT, "Expected '@' and a base address after register name.");
        Expression baseAddress = context.expression();
        context.consume(TokenType.LEFT_BRACE, "Expected '{' after register base address.");
        List<Declaration.RegisterMember> members = new ArrayList<>();
        while (!context.check(TokenType.RIGHT_BRACE) && !context.isAtEnd()) {
            Token member = context.consume(TokenType.IDENTIFIER, "Expected a register field name.");
            context.consume(TokenType.COLON, "Expected ':' after register field name.");
            TypeRef type = context.typeRef();
            Token access = context.consume(TokenType.IDENTIFIER, "Expected an access mode (rw, ro, wo, w1c, w1s).");
            if (!ACCESS_MODES.contains(access.text())) {
                context.getDiagnostics().reportError(DiagnosticCode.SYNTAX_ERROR,
                        "Unknown register access mode '" + access.text() + "'", access.fileName(), access.line(),
                        access.column(), "Use one of rw, ro, wo, w1c, w1s");
                throw new ParseException("Unknown access mode", access);
            }
            context.consume(TokenType.AT, "Expected '@' and an offset after access mode.");
            Expression offset = context.expression();
            members.add(new Declaration.RegisterMember(member.text(), type, access.text(), offset,
                    SourcePosition.of(member)));
            if (!context.match(TokenType.COMMA, TokenType.SEMICOLON)) {
                break;
            }
        }
        context.consume(TokenType.RIGHT_BRACE, "Expected '}' after register fields.");
        context.match(TokenType.SEMICOLON);
        return new Declaration.RegisterDecl(name.text(), baseAddress, members, SourcePosition.of(keyword));
    }
}
