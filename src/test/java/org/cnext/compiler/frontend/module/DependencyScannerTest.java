package org.cnext.compiler.frontend.module;

import org.cnext.compiler.diagnostics.DiagnosticCode;
import org.cnext.compiler.diagnostics.DiagnosticsEngine;
import org.cnext.compiler.frontend.semantics.SourceLanguage;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.endsWith;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests include resolution: visit uniqueness, cycles, system headers, search paths and the
 * preprocessor errors raised while scanning.
 */
public class DependencyScannerTest {

    @TempDir
    Path tempDir;

    @Test
    @Tag("integration")
    void sharedHeaderIsVisitedOnceAndOrderedLeavesFirst() throws Exception {
        Files.writeString(tempDir.resolve("common.h"), "typedef unsigned int word_t;\n");
        Files.writeString(tempDir.resolve("a.h"), "#include \"common.h\"\n");
        Files.writeString(tempDir.resolve("b.h"), "#include \"common.h\"\n");
        Path main = tempDir.resolve("main.cnx");
        Files.writeString(main, "#include \"a.h\"\n#include \"b.h\"\nvoid main() { }\n");

        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        DependencyGraph graph = new DependencyScanner(diagnostics, List.of()).scan(main);

        assertThat(diagnostics.hasErrors()).as(diagnostics.summary()).isFalse();
        List<String> names = fileNames(graph);
        assertThat(names).containsExactly("common.h", "a.h", "b.h", "main.cnx");
        assertThat(graph.root().children()).hasSize(2);
        assertThat(graph.root().children().get(1).children()).isEmpty();
    }

    @Test
    @Tag("integration")
    void includeCycleTerminatesWithoutError() throws Exception {
        Files.writeString(tempDir.resolve("x.h"), "#include \"y.h\"\nint x;\n");
        Files.writeString(tempDir.resolve("y.h"), "#include \"x.h\"\nint y;\n");
        Path main = tempDir.resolve("main.cnx");
        Files.writeString(main, "#include \"x.h\"\n");

        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        DependencyGraph graph = new DependencyScanner(diagnostics, List.of()).scan(main);

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(fileNames(graph)).containsExactly("y.h", "x.h", "main.cnx");
    }

    @Test
    @Tag("integration")
    void systemHeadersBecomeSystemNodesWithoutReading() throws Exception {
        Path main = tempDir.resolve("main.cnx");
        Files.writeString(main, "#include <stdio.h>\n#include <stdint.h>\n");

        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        DependencyGraph graph = new DependencyScanner(diagnostics, List.of()).scan(main);

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(graph.systemHeaders()).hasSize(2);
        assertThat(graph.systemHeaders()).allSatisfy(node -> {
            assertThat(node.language()).isEqualTo(SourceLanguage.SYSTEM);
            assertThat(node.rawContent()).isEmpty();
        });
    }

    @Test
    @Tag("integration")
    void angleIncludesAreResolvedAlongTheSearchPath() throws Exception {
        Path vendor = Files.createDirectories(tempDir.resolve("vendor"));
        Files.writeString(vendor.resolve("hal.h"), "void hal_init(void);\n");
        Path main = tempDir.resolve("main.cnx");
        Files.writeString(main, "#include <hal.h>\n");

        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        DependencyGraph graph = new DependencyScanner(diagnostics, List.of(vendor)).scan(main);

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(graph.foreignHeaders()).hasSize(1);
        assertThat(graph.foreignHeaders().get(0).language()).isEqualTo(SourceLanguage.C);
    }

    @Test
    @Tag("integration")
    void unresolvedIncludeNamesEveryPathTried() throws Exception {
        Path vendor = Files.createDirectories(tempDir.resolve("vendor"));
        Path main = tempDir.resolve("main.cnx");
        Files.writeString(main, "#include \"missing.h\"\n");

        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        new DependencyScanner(diagnostics, List.of(vendor)).scan(main);

        assertThat(diagnostics.hasCode(DiagnosticCode.UNRESOLVED_INCLUDE)).isTrue();
        assertThat(diagnostics.summary())
                .contains("#include \"missing.h\"")
                .contains("vendor/missing.h");
    }

    @Test
    @Tag("integration")
    void includingAnImplementationFileIsRejected() throws Exception {
        Files.writeString(tempDir.resolve("util.c"), "int util(void) { return 0; }\n");
        Path main = tempDir.resolve("main.cnx");
        Files.writeString(main, "#include \"util.c\"\n");

        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        new DependencyScanner(diagnostics, List.of()).scan(main);

        assertThat(diagnostics.hasCode(DiagnosticCode.IMPLEMENTATION_FILE_INCLUDE)).isTrue();
    }

    @Test
    @Tag("integration")
    void generatedHeaderNextToItsSourceSuggestsTheSource() throws Exception {
        Files.writeString(tempDir.resolve("motor.cnx"), "void spin() { }\n");
        Files.writeString(tempDir.resolve("motor.h"), "void spin(void);\n");
        Path main = tempDir.resolve("main.cnx");
        Files.writeString(main, "#include \"motor.h\"\n");

        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        new DependencyScanner(diagnostics, List.of()).scan(main);

        assertThat(diagnostics.hasCode(DiagnosticCode.CNEXT_ALTERNATIVE_EXISTS)).isTrue();
        assertThat(diagnostics.summary()).contains("#include \"motor.cnx\"");
    }

    @Test
    @Tag("integration")
    void definesInCNextSourcesAreRejected() throws Exception {
        Path main = tempDir.resolve("main.cnx");
        Files.writeString(main, "#define SQUARE(x) ((x) * (x))\n#define LIMIT 10\n");

        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        new DependencyScanner(diagnostics, List.of()).scan(main);

        assertThat(diagnostics.hasCode(DiagnosticCode.FUNCTION_LIKE_MACRO)).isTrue();
        assertThat(diagnostics.hasCode(DiagnosticCode.VALUE_MACRO)).isTrue();
        assertThat(diagnostics.summary()).contains("const u32 LIMIT <- 10;");
    }

    @Test
    @Tag("integration")
    void cnextIncludesArePartOfTheTree() throws Exception {
        Files.writeString(tempDir.resolve("util.cnx"), "u32 twice(u32 v) { return v * 2; }\n");
        Path main = tempDir.resolve("main.cnx");
        Files.writeString(main, "#include \"util.cnx\"\n");

        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        DependencyGraph graph = new DependencyScanner(diagnostics, List.of()).scan(main);

        assertThat(graph.cnextUnits()).hasSize(2);
        assertThat(graph.cnextUnits().get(1)).isSameAs(graph.root());
    }

    @Test
    @Tag("integration")
    void cachedIncludeListIsUsedInsteadOfReadingTheHeader() throws Exception {
        Files.writeString(tempDir.resolve("dep.h"), "int dep;\n");
        Files.writeString(tempDir.resolve("cached.h"), "/* stale text that is never read */\n");
        Path main = tempDir.resolve("main.cnx");
        Files.writeString(main, "#include \"cached.h\"\n");

        IncludeCacheLookup cache = mock(IncludeCacheLookup.class);
        when(cache.lookup(anyString(), anyLong())).thenReturn(Optional.empty());
        when(cache.lookup(endsWith("cached.h"), anyLong())).thenReturn(Optional.of(
                new IncludeCacheLookup.CachedHeader(SourceLanguage.C,
                        List.of(new IncludeDirective("dep.h", false, 1)))));

        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        DependencyGraph graph = new DependencyScanner(diagnostics, List.of(), cache).scan(main);

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(fileNames(graph)).containsExactly("dep.h", "cached.h", "main.cnx");
        DependencyNode cached = graph.foreignHeaders().get(1);
        assertThat(cached.fromCache()).isTrue();
        assertThat(cached.rawContent()).isEmpty();
    }

    @Test
    @Tag("unit")
    void missingEntryFileIsAnIoError() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        DependencyGraph graph = new DependencyScanner(diagnostics, List.of()).scan(tempDir.resolve("none.cnx"));

        assertThat(graph.root()).isNull();
        assertThat(diagnostics.hasCode(DiagnosticCode.IO_ERROR)).isTrue();
    }

    private static List<String> fileNames(DependencyGraph graph) {
        return graph.leavesFirstOrder().stream()
                .map(node -> Path.of(node.absolutePath()).getFileName().toString())
                .collect(Collectors.toList());
    }
}
