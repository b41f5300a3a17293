package org.cnext.compiler.frontend.parser.features.struct;

import org.cnext.compiler.frontend.lexer.Token;
import org.cnext.compiler.frontend.lexer.TokenType;
import org.cnext.compiler.frontend.parser.IDeclarationHandler;
import org.cnext.compiler.frontend.parser.ParsingContext;
import org.cnext.compiler.frontend.parser.ast.Declaration;
import org.cnext.compiler.frontend.parser.ast.SourcePosition;
import org.cnext.compiler.frontend.parser.ast.TypeRef;

import java.util.ArrayList;
import java.util.List;

/**
 * Handler for {@code struct Name { type field; ... }}.
 */
public class StructDeclarationHandler implements IDeclarationHandler {

    @Override
    public Declaration parse(ParsingContext context) {
        Token keyword = context.advance();
        Token name = context.consume(TokenType.IDENTIFIER, "Expected a struct name after 'struct'.");
        context.consume(TokenType.LEFT_BRACE, "Expected '{' after struct name.");
        List<Declaration.Field> fields = new ArrayList<>();
        while (!context.check(TokenType.RIGHT_BRACE) && !context.isAtEnd()) {
            TypeRef type = context.typeRef();
            Token fieldName = context.consume(TokenType.IDENTIFIER, "Expected a field name.");
            type = type.withArrayDimensions(context.arrayDimensions());
            context.consume(TokenType.SEMICOLON, "Expected ';' after struct field.");
            fields.add(new Declaration.Field(type, fieldName.text(), SourcePosition.of(fieldName)));
        }
        context.consume(TokenType.RIGHT_BRACE, "Expected '}' after struct fields.");
        context.match(TokenType.SEMICOLON);
        return new Declaration.StructDecl(name.text(), fields, SourcePosition.of(keyword));
    }
}
