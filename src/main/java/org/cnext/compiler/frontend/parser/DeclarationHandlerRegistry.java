package org.cnext.compiler.frontend.parser;

import org.cnext.compiler.frontend.lexer.TokenType;
import org.cnext.compiler.frontend.parser.features.enumdecl.EnumDeclarationHandler;
import org.cnext.compiler.frontend.parser.features.include.IncludeDeclarationHandler;
import org.cnext.compiler.frontend.parser.features.register.RegisterDeclarationHandler;
import org.cnext.compiler.frontend.parser.features.scope.ScopeDeclarationHandler;
import org.cnext.compiler.frontend.parser.features.struct.StructDeclarationHandler;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry for keyword-introduced declaration handlers.
 */
public class DeclarationHandlerRegistry {

    private final Map<TokenType, IDeclarationHandler> handlers = new EnumMap<>(TokenType.class);

    /**
     * Registers a handler for a keyword.
     * @param keyword The token type that introduces the declaration.
     * @param handler The handler for this declaration.
     */
    public void register(TokenType keyword, IDeclarationHandler handler) {
        handlers.put(keyword, handler);
    }

    /**
     * Looks up the handler for a keyword.
     * @param keyword The token type.
     * @return The handler, or empty if the keyword does not introduce a declaration.
     */
    public Optional<IDeclarationHandler> get(TokenType keyword) {
        return Optional.ofNullable(handlers.get(keyword));
    }

    /**
     * Creates a registry with all built-in declaration handlers.
     * @return A new registry instance.
     */
    public static DeclarationHandlerRegistry initialize() {
        DeclarationHandlerRegistry registry = new DeclarationHandlerRegistry();
        registry.register(TokenType.INCLUDE, new IncludeDeclarationHandler());
        registry.register(TokenType.STRUCT, new StructDeclarationHandler());
        registry.register(TokenType.ENUM, new EnumDeclarationHandler());
        registry.register(TokenType.REGISTER, new RegisterDeclarationHandler());
        registry.register(TokenType.SCOPE, new ScopeDeclarationHandler());
        return registry;
    }
}
