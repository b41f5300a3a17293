package org.cnext.compiler;

import org.cnext.compiler.backend.codegen.CodeGenerator;
import org.cnext.compiler.backend.codegen.GeneratedUnit;
import org.cnext.compiler.diagnostics.DiagnosticsEngine;
import org.cnext.compiler.frontend.headers.HeaderCollectorRegistry;
import org.cnext.compiler.frontend.lexer.Lexer;
import org.cnext.compiler.frontend.lexer.Token;
import org.cnext.compiler.frontend.module.DependencyNode;
import org.cnext.compiler.frontend.module.LanguageDetector;
import org.cnext.compiler.frontend.parser.Parser;
import org.cnext.compiler.frontend.parser.ast.Program;
import org.cnext.compiler.frontend.semantics.SourceLanguage;
import org.cnext.compiler.frontend.semantics.SystemHeaderCatalog;
import org.cnext.compiler.frontend.semantics.scope.ScopeFlattener;

import java.util.List;

/**
 * Runs the in-memory part of the pipeline on source strings: optional foreign headers are
 * collected into the symbol table, then a C-Next unit is lexed, parsed, flattened and generated.
 */
public final class CompilationFixture {

    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();
    private final CompilationContext context = new CompilationContext(diagnostics);

    /**
     * Makes the symbols of a built-in system header available, as {@code #include <name>} would.
     */
    public CompilationFixture withSystemHeader(String name) {
        context.getSymbolTable().defineAll(SystemHeaderCatalog.symbolsFor(name));
        return this;
    }

    /**
     * Collects a foreign header from text. The language is detected from name and content.
     */
    public CompilationFixture withHeader(String path, String content) {
        SourceLanguage language = LanguageDetector.detect(path, content);
        DependencyNode node = new DependencyNode(path, language, content, 1L, List.of(), List.of(), false);
        HeaderCollectorRegistry.initializeWithDefaults().resolve(language).orElseThrow()
                .collect(node, context.getSymbolTable(), diagnostics);
        return this;
    }

    /**
     * Compiles one unit named {@code test.cnx}.
     */
    public GeneratedUnit compile(String source) {
        return compile("test.cnx", source);
    }

    public GeneratedUnit compile(String fileName, String source) {
        List<Token> tokens = new Lexer(source, fileName, diagnostics).scanTokens();
        Program program = new Parser(tokens, diagnostics).parse();
        Program flat = new ScopeFlattener(context.getScopes(), diagnostics).flatten(program);
        String baseName = fileName.substring(fileName.lastIndexOf('/') + 1).replace(".cnx", "");
        return new CodeGenerator(context).generate(flat, baseName);
    }

    public DiagnosticsEngine diagnostics() {
        return diagnostics;
    }

    public CompilationContext context() {
        return context;
    }
}
