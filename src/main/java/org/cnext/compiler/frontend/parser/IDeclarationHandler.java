package org.cnext.compiler.frontend.parser;

import org.cnext.compiler.frontend.parser.ast.Declaration;

/**
 * Handler interface for keyword-introduced declarations ({@code struct}, {@code enum},
 * {@code register}, {@code scope}, {@code #include}).
 */
public interface IDeclarationHandler {

    /**
     * Parses the declaration starting at its keyword.
     *
     * @param context The parsing context providing access to the token stream.
     * @return The declaration node.
     */
    Declaration parse(ParsingContext context);
}
