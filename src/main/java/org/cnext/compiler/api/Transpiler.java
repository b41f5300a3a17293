package org.cnext.compiler.api;

import org.cnext.compiler.CompilationContext;
import org.cnext.compiler.backend.codegen.CodeGenerator;
import org.cnext.compiler.backend.codegen.GeneratedUnit;
import org.cnext.compiler.cache.CacheException;
import org.cnext.compiler.cache.CacheManager;
import org.cnext.compiler.diagnostics.DiagnosticCode;
import org.cnext.compiler.diagnostics.DiagnosticsEngine;
import org.cnext.compiler.frontend.headers.HeaderCollectorRegistry;
import org.cnext.compiler.frontend.headers.HeaderSymbolCache;
import org.cnext.compiler.frontend.headers.SymbolCollectionPhase;
import org.cnext.compiler.frontend.io.SourceDiscovery;
import org.cnext.compiler.frontend.io.SourceLoader;
import org.cnext.compiler.frontend.lexer.Lexer;
import org.cnext.compiler.frontend.lexer.Token;
import org.cnext.compiler.frontend.module.DependencyGraph;
import org.cnext.compiler.frontend.module.DependencyNode;
import org.cnext.compiler.frontend.module.DependencyScanner;
import org.cnext.compiler.frontend.module.IncludeCacheLookup;
import org.cnext.compiler.frontend.parser.Parser;
import org.cnext.compiler.frontend.parser.ast.Program;
import org.cnext.compiler.frontend.semantics.scope.ScopeFlattener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Runs the whole pipeline for a file or a directory of C-Next sources.
 *
 * <p>Every discovered source is scanned for its includes and the resulting trees are merged,
 * so a header or unit shared by several sources is handled once. Foreign header symbols are
 * collected before any unit is generated; header errors end the run before generation.
 * Units are then compiled dependencies first. A unit with errors produces no output, but the
 * remaining units are still compiled so that all diagnostics are reported together.</p>
 */
public class Transpiler {

    private static final Logger log = LoggerFactory.getLogger(Transpiler.class);

    public static final String VERSION = "1.0.0";

    /**
     * Transpiles the configured input.
     *
     * @return the units written.
     * @throws CompilationException if any diagnostic was reported.
     * @throws UncheckedIOException if a generated file cannot be written.
     */
    public TranspileResult transpile(TranspileOptions options) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        List<Path> sources;
        Path projectRoot;
        try {
            sources = SourceDiscovery.discover(options.input());
            Path canonicalInput = SourceLoader.canonicalize(options.input());
            projectRoot = Files.isDirectory(canonicalInput) ? canonicalInput : canonicalInput.getParent();
        } catch (IOException e) {
            diagnostics.reportError(DiagnosticCode.IO_ERROR, e.getMessage(),
                    SourceLoader.toLogicalName(options.input()), 0, 0);
            throw failure(diagnostics);
        }
        if (sources.isEmpty()) {
            diagnostics.reportError(DiagnosticCode.IO_ERROR, "No " + SourceDiscovery.CNEXT_EXTENSION
                    + " sources found", SourceLoader.toLogicalName(options.input()), 0, 0);
            throw failure(diagnostics);
        }
        log.info("Compiling {} source file(s) from {}", sources.size(), options.input());

        CacheManager cache = null;
        if (options.cacheEnabled()) {
            cache = CacheManager.open(projectRoot.resolve(options.cacheDirectory()), VERSION);
        }
        IncludeCacheLookup includeCache = cache != null ? cache : IncludeCacheLookup.NONE;
        HeaderSymbolCache symbolCache = cache != null ? cache : HeaderSymbolCache.NONE;

        DependencyGraph graph = resolve(sources, options.includePaths(), includeCache, diagnostics);
        if (cache != null && !diagnostics.hasErrors()) {
            cache.retainOnly(graph.foreignHeaders().stream()
                    .map(DependencyNode::absolutePath)
                    .collect(Collectors.toSet()));
        }
        CompilationContext context = new CompilationContext(diagnostics);
        SymbolCollectionPhase collection = new SymbolCollectionPhase(context.getSymbolTable(), diagnostics,
                HeaderCollectorRegistry.initializeWithDefaults(), symbolCache);
        boolean headersOk = collection.collect(graph);
        if (!headersOk || diagnostics.hasErrors()) {
            saveCache(cache);
            throw failure(diagnostics);
        }

        List<TranspileResult.UnitOutput> outputs = new ArrayList<>();
        for (DependencyNode unit : graph.cnextUnits()) {
            GeneratedUnit generated = compileUnit(unit, context, options.headerExtension());
            if (generated != null) {
                outputs.add(write(unit, generated, projectRoot, options));
            }
        }
        saveCache(cache);

        if (diagnostics.hasErrors()) {
            throw failure(diagnostics);
        }
        log.info("Generated {} unit(s)", outputs.size());
        return new TranspileResult(outputs, graph.foreignHeaders().size());
    }

    private DependencyGraph resolve(List<Path> sources, List<Path> includePaths, IncludeCacheLookup cache,
                                    DiagnosticsEngine diagnostics) {
        DependencyScanner scanner = new DependencyScanner(diagnostics, includePaths, cache);
        Map<String, DependencyNode> merged = new LinkedHashMap<>();
        DependencyNode firstRoot = null;
        for (Path source : sources) {
            DependencyGraph graph = scanner.scan(source);
            if (firstRoot == null) {
                firstRoot = graph.root();
            }
            for (DependencyNode node : graph.leavesFirstOrder()) {
                merged.putIfAbsent(node.absolutePath(), node);
            }
        }
        return new DependencyGraph(firstRoot, new ArrayList<>(merged.values()));
    }

    // Returns null when the unit reported errors.
    private GeneratedUnit compileUnit(DependencyNode unit, CompilationContext context, String headerExtension) {
        DiagnosticsEngine diagnostics = context.getDiagnostics();
        int errorsBefore = diagnostics.errorCount();
        log.debug("Compiling {}", unit.absolutePath());

        List<Token> tokens = new Lexer(unit.rawContent(), unit.absolutePath(), diagnostics).scanTokens();
        if (diagnostics.errorCount() > errorsBefore) {
            return null;
        }
        Program program = new Parser(tokens, diagnostics).parse();
        if (diagnostics.errorCount() > errorsBefore) {
            return null;
        }
        Program flat = new ScopeFlattener(context.getScopes(), diagnostics).flatten(program);
        if (diagnostics.errorCount() > errorsBefore) {
            return null;
        }
        GeneratedUnit generated = new CodeGenerator(context, headerExtension).generate(flat, baseName(unit));
        return diagnostics.errorCount() > errorsBefore ? null : generated;
    }

    private TranspileResult.UnitOutput write(DependencyNode unit, GeneratedUnit generated, Path projectRoot,
                                             TranspileOptions options) {
        Path source = Path.of(unit.absolutePath());
        Path relativeDir = source.startsWith(projectRoot) && source.getParent() != null
                ? projectRoot.relativize(source.getParent())
                : Path.of("");
        Path sourceDir = options.outputDirectory() == null
                ? source.getParent()
                : options.outputDirectory().resolve(relativeDir);
        Path headerDir = options.headerOutputDirectory() == null
                ? sourceDir
                : options.headerOutputDirectory().resolve(relativeDir);
        Path sourceFile = sourceDir.resolve(generated.baseName() + options.sourceExtension());
        Path headerFile = headerDir.resolve(generated.baseName() + options.headerExtension());
        try {
            Files.createDirectories(sourceDir);
            Files.createDirectories(headerDir);
            Files.writeString(sourceFile, generated.source(), StandardCharsets.UTF_8);
            Files.writeString(headerFile, generated.header(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write output for " + unit.absolutePath(), e);
        }
        log.info("Wrote {} and {}", sourceFile, headerFile);
        return new TranspileResult.UnitOutput(source, sourceFile, headerFile, generated);
    }

    private static void saveCache(CacheManager cache) {
        if (cache == null) {
            return;
        }
        try {
            cache.save();
        } catch (CacheException e) {
            log.warn("{}; the next run will rescan all headers", e.getMessage(), e);
        }
    }

    private static String baseName(DependencyNode unit) {
        String fileName = Path.of(unit.absolutePath()).getFileName().toString();
        return fileName.substring(0, fileName.length() - SourceDiscovery.CNEXT_EXTENSION.length());
    }

    private static CompilationException failure(DiagnosticsEngine diagnostics) {
        return new CompilationException("Compilation failed with " + diagnostics.errorCount() + " error(s)",
                diagnostics.getDiagnostics());
    }
}
