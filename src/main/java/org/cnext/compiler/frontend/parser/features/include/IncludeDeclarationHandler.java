package org.cnext.compiler.frontend.parser.features.include;

import org.cnext.compiler.diagnostics.DiagnosticCode;
import org.cnext.compiler.frontend.lexer.Token;
import org.cnext.compiler.frontend.parser.IDeclarationHandler;
import org.cnext.compiler.frontend.parser.ParseException;
import org.cnext.compiler.frontend.parser.ParsingContext;
import org.cnext.compiler.frontend.parser.ast.Declaration;
import org.cnext.compiler.frontend.parser.ast.SourcePosition;

/**
 * Handler for {@code #include} lines. The lexer delivers the whole include target,
 * delimiters included, as one token.
 */
public class IncludeDeclarationHandler implements IDeclarationHandler {

    @Override
    public Declaration parse(ParsingContext context) {
        Token include = context.advance();
        String raw = include.text();
        boolean angled = raw.startsWith("<") && raw.endsWith(">");
        boolean quoted = raw.length() >= 2 && raw.startsWith("\"") && raw.endsWith("\"");
        if (!angled && !quoted) {
            context.getDiagnostics().reportError(DiagnosticCode.SYNTAX_ERROR,
                    "Malformed #include: expected \"file\" or <file>", include.fileName(), include.line(),
                    include.column());
            throw new ParseException("Malformed #include", include);
        }
        return new Declaration.IncludeDecl(raw.substring(1, raw.length() - 1).trim(), angled,
                SourcePosition.of(include));
    }
}
