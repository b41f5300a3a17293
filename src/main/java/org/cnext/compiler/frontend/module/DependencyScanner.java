package org.cnext.compiler.frontend.module;

import org.cnext.compiler.diagnostics.DiagnosticCode;
import org.cnext.compiler.diagnostics.DiagnosticsEngine;
import org.cnext.compiler.frontend.io.SourceLoader;
import org.cnext.compiler.frontend.semantics.SourceLanguage;
import org.cnext.compiler.frontend.semantics.SystemHeaderCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Resolves the {@code #include} tree of a C-Next entry file.
 *
 * <p>This is a lightweight line-based scan; it does not invoke any grammar. Every file is
 * keyed by its canonical absolute path and descended at most once, so include cycles
 * terminate without an error. The post-order of the walk is the leaves-first order in which
 * later phases process the tree.</p>
 */
public final class DependencyScanner {

    private static final Logger log = LoggerFactory.getLogger(DependencyScanner.class);

    private static final Pattern INCLUDE_PATTERN = Pattern.compile(
            "^\\s*#\\s*include\\s*(?:<([^>]+)>|\"([^\"]+)\")");
    private static final Pattern DEFINE_PATTERN = Pattern.compile(
            "^\\s*#\\s*define\\s+(\\w+)(\\()?(.*)$");

    private final DiagnosticsEngine diagnostics;
    private final List<Path> searchPaths;
    private final IncludeCacheLookup cache;
    private final Set<String> visited = new HashSet<>();
    private final List<DependencyNode> order = new ArrayList<>();

    public DependencyScanner(DiagnosticsEngine diagnostics, List<Path> searchPaths) {
        this(diagnostics, searchPaths, IncludeCacheLookup.NONE);
    }

    /**
     * @param diagnostics The diagnostics engine for include errors.
     * @param searchPaths The include search path, in lookup order.
     * @param cache       Cached include lists of unchanged foreign headers.
     */
    public DependencyScanner(DiagnosticsEngine diagnostics, List<Path> searchPaths, IncludeCacheLookup cache) {
        this.diagnostics = diagnostics;
        this.searchPaths = List.copyOf(searchPaths);
        this.cache = cache;
    }

    /**
     * Scans an entry file and everything it includes transitively.
     *
     * @param entry The entry file, normally a {@code .cnx} source.
     * @return The include tree with its leaves-first order.
     */
    public DependencyGraph scan(Path entry) {
        visited.clear();
        order.clear();
        DependencyNode root;
        try {
            Path canonical = SourceLoader.canonicalize(entry);
            visited.add(SourceLoader.toLogicalName(canonical));
            root = scanFile(canonical);
        } catch (IOException e) {
            diagnostics.reportError(DiagnosticCode.IO_ERROR, "Could not read source file: " + e.getMessage(),
                    SourceLoader.toLogicalName(entry), 0, 0);
            return new DependencyGraph(null, List.of());
        }
        log.debug("Resolved {} file(s) for {}", order.size(), root.absolutePath());
        return new DependencyGraph(root, order);
    }

    private DependencyNode scanFile(Path file) throws IOException {
        String logicalName = SourceLoader.toLogicalName(file);
        long lastModified = SourceLoader.lastModified(file);
        Optional<IncludeCacheLookup.CachedHeader> cached = isHeaderName(logicalName)
                ? cache.lookup(logicalName, lastModified)
                : Optional.empty();

        String content;
        SourceLanguage language;
        List<IncludeDirective> includes;
        if (cached.isPresent()) {
            content = "";
            includes = cached.get().includes();
            language = cached.get().language();
            log.debug("Using cached include list for {}", logicalName);
        } else {
            SourceLoader.LoadResult loaded = SourceLoader.loadFile(file);
            content = loaded.content();
            language = LanguageDetector.detect(logicalName, content);
            includes = scanDirectives(logicalName, content, language);
        }

        List<DependencyNode> children = new ArrayList<>();
        for (IncludeDirective include : includes) {
            resolveInclude(include, file, language).ifPresent(children::add);
        }

        DependencyNode node = new DependencyNode(logicalName, language, content, lastModified, includes, children,
                cached.isPresent());
        order.add(node);
        return node;
    }

    private List<IncludeDirective> scanDirectives(String fileName, String content, SourceLanguage language) {
        List<IncludeDirective> includes = new ArrayList<>();
        String[] lines = LanguageDetector.stripComments(content).split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            Matcher includeMatcher = INCLUDE_PATTERN.matcher(line);
            if (includeMatcher.find()) {
                boolean angled = includeMatcher.group(1) != null;
                String target = angled ? includeMatcher.group(1) : includeMatcher.group(2);
                includes.add(new IncludeDirective(target.trim(), angled, i + 1));
                continue;
            }
            if (language == SourceLanguage.CNEXT) {
                Matcher defineMatcher = DEFINE_PATTERN.matcher(line);
                if (defineMatcher.find()) {
                    reportDefine(fileName, i + 1, defineMatcher);
                }
            }
        }
        return includes;
    }

    private void reportDefine(String fileName, int line, Matcher defineMatcher) {
        String name = defineMatcher.group(1);
        if (defineMatcher.group(2) != null) {
            diagnostics.reportError(DiagnosticCode.FUNCTION_LIKE_MACRO,
                    "Function-like macro '" + name + "' is not allowed in C-Next source",
                    fileName, line, 1, "Use an inline function instead");
        } else {
            String value = defineMatcher.group(3).trim();
            diagnostics.reportError(DiagnosticCode.VALUE_MACRO,
                    "Macro '" + name + "' is not allowed in C-Next source",
                    fileName, line, 1,
                    value.isEmpty() ? "Use a const declaration instead"
                            : "Use 'const u32 " + name + " <- " + value + ";' instead");
        }
    }

    private Optional<DependencyNode> resolveInclude(IncludeDirective include, Path includingFile,
                                                    SourceLanguage includingLanguage) throws IOException {
        String fileName = SourceLoader.toLogicalName(includingFile);
        if (LanguageDetector.isImplementationFile(include.target())) {
            diagnostics.reportError(DiagnosticCode.IMPLEMENTATION_FILE_INCLUDE,
                    "Including implementation file '" + include.target() + "' is not allowed",
                    fileName, include.line(), 1, "Include the corresponding header instead");
            return Optional.empty();
        }

        if (include.angled() && SystemHeaderCatalog.isSystemHeader(include.target())) {
            String key = SystemHeaderCatalog.logicalPath(include.target());
            if (!visited.add(key)) {
                return Optional.empty();
            }
            DependencyNode node = new DependencyNode(key, SourceLanguage.SYSTEM, "", -1L, List.of(), List.of(), false);
            order.add(node);
            return Optional.of(node);
        }

        List<Path> candidates = new ArrayList<>();
        if (!include.angled() && includingFile.getParent() != null) {
            candidates.add(includingFile.getParent().resolve(include.target()));
        }
        for (Path searchPath : searchPaths) {
            candidates.add(searchPath.resolve(include.target()));
        }

        Path resolved = null;
        for (Path candidate : candidates) {
            if (Files.isRegularFile(candidate)) {
                resolved = SourceLoader.canonicalize(candidate);
                break;
            }
        }
        if (resolved == null) {
            String tried = candidates.stream()
                    .map(p -> SourceLoader.toLogicalName(p.toAbsolutePath().normalize()))
                    .collect(Collectors.joining(", "));
            diagnostics.reportError(DiagnosticCode.UNRESOLVED_INCLUDE,
                    "Cannot resolve " + include.text() + " (searched: " + (tried.isEmpty() ? "no paths" : tried) + ")",
                    fileName, include.line(), 1, "Add the header's directory with -I");
            return Optional.empty();
        }

        if (!include.angled() && includingLanguage == SourceLanguage.CNEXT && isHeaderName(include.target())) {
            Path alternative = cnextAlternative(resolved);
            if (Files.isRegularFile(alternative)) {
                String suggested = replaceExtension(include.target(), ".cnx");
                diagnostics.reportError(DiagnosticCode.CNEXT_ALTERNATIVE_EXISTS,
                        "'" + include.target() + "' is generated from C-Next source '"
                                + alternative.getFileName() + "'",
                        fileName, include.line(), 1, "Use #include \"" + suggested + "\" instead");
                return Optional.empty();
            }
        }

        if (!visited.add(SourceLoader.toLogicalName(resolved))) {
            return Optional.empty();
        }
        return Optional.of(scanFile(resolved));
    }

    private static boolean isHeaderName(String name) {
        String extension = LanguageDetector.extensionOf(name);
        return ".h".equals(extension) || LanguageDetector.detect(name, null) == SourceLanguage.CPP;
    }

    private static Path cnextAlternative(Path header) {
        return header.resolveSibling(replaceExtension(header.getFileName().toString(), ".cnx"));
    }

    private static String replaceExtension(String name, String extension) {
        int dot = name.lastIndexOf('.');
        return (dot < 0 ? name : name.substring(0, dot)) + extension;
    }
}
