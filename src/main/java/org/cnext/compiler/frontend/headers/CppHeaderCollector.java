package org.cnext.compiler.frontend.headers;

import org.cnext.compiler.frontend.semantics.SourceLanguage;
import org.cnext.compiler.frontend.semantics.Symbol;
import org.cnext.compiler.frontend.semantics.TypeInfo;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Collects symbols from C++ headers. On top of the C grammar it understands namespaces
 * (names are qualified as {@code ns::name}), classes with access specifiers, scoped enums
 * with an underlying type, {@code using} aliases and overloaded functions. Template
 * declarations are skipped.
 */
public class CppHeaderCollector extends AbstractHeaderCollector {

    @Override
    protected SourceLanguage language() {
        return SourceLanguage.CPP;
    }

    @Override
    protected boolean parseLanguageExtension() {
        if (check("namespace")) {
            parseNamespace();
            return true;
        }
        if (match("template")) {
            skipBalanced("<", ">");
            skipDeclaration();
            return true;
        }
        if (check("using")) {
            parseUsing();
            return true;
        }
        return false;
    }

    @Override
    protected boolean skipMemberExtension(String aggregateName) {
        if (match("template")) {
            skipBalanced("<", ">");
            skipDeclaration();
            return true;
        }
        if (check("~") || (check(aggregateName) && peekAt(1).is("("))) {
            skipDeclaration();
            return true;
        }
        return false;
    }

    @Override
    protected String qualify(String name) {
        List<String> parts = new ArrayList<>();
        // The deque iterates innermost first.
        Iterator<String> outerFirst = blocks.descendingIterator();
        while (outerFirst.hasNext()) {
            String block = outerFirst.next();
            if (!block.isEmpty()) {
                parts.add(block);
            }
        }
        if (parts.isEmpty()) {
            return name;
        }
        return String.join("::", parts) + "::" + name;
    }

    private void parseNamespace() {
        int line = advance().line();
        StringBuilder name = new StringBuilder();
        while (peek().type() == HeaderToken.Type.IDENTIFIER || check("::")) {
            HeaderToken token = advance();
            if (token.is("inline")) {
                continue;
            }
            name.append(token.text());
        }
        if (match("=")) {
            // Namespace alias.
            skipDeclaration();
            return;
        }
        if (!match("{")) {
            throw new HeaderParseException("Expected '{' after namespace " + name, line);
        }
        blocks.push(name.toString());
    }

    private void parseUsing() {
        int line = advance().line();
        if (check("namespace") || peekAt(1).is("::") || !peekAt(1).is("=")) {
            // using-directive or using-declaration: no new symbol.
            skipDeclaration();
            return;
        }
        String alias = consumeIdentifier("Expected alias name").text();
        consume("=", "Expected '=' in alias declaration");
        TypeSpec spec = parseTypeSpec();
        if (spec == null) {
            throw new HeaderParseException("Expected a type in alias declaration", line);
        }
        int pointers = 0;
        while (match("*") || match("&")) {
            pointers++;
        }
        TypeInfo aliased = pointers > 0 ? pointerTo(spec.type(), pointers) : spec.type();
        define(new Symbol.TypedefSymbol(qualify(alias), origin(line), aliased));
        consume(";", "Expected ';' after alias declaration");
    }
}
