package org.cnext.compiler.api;

import org.cnext.compiler.diagnostics.DiagnosticCode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end runs of the transpiler over projects laid out in a temporary directory.
 */
public class TranspilerTest {

    @TempDir
    Path tempDir;

    private final Transpiler transpiler = new Transpiler();

    private Path write(String relative, String content) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    @Test
    @Tag("integration")
    void writesSourceAndHeaderNextToUnit() throws IOException {
        write("board.h", """
                #ifndef BOARD_H
                #define BOARD_H
                #include <stdint.h>
                typedef struct {
                    uint32_t raw;
                    uint8_t flags;
                } Sensor;
                #endif
                """);
        write("app.cnx", """
                #include "board.h"

                void main() {
                    Sensor s;
                    u32 bits <- s.raw.length;
                }
                """);

        TranspileResult result = transpiler.transpile(TranspileOptions.builder(tempDir).build());

        assertThat(result.units()).hasSize(1);
        assertThat(result.headersScanned()).isGreaterThanOrEqualTo(1);
        assertThat(tempDir.resolve("app.c")).exists();
        assertThat(tempDir.resolve("app.h")).exists();
        String source = Files.readString(tempDir.resolve("app.c"));
        assertThat(source).contains("#include \"app.h\"", "int main(void) {", "uint32_t bits = 32;",
                "Sensor s = {0};");
        assertThat(source).doesNotContain("struct Sensor");
        assertThat(Files.readString(tempDir.resolve("app.h"))).contains("#include \"board.h\"");
    }

    @Test
    @Tag("integration")
    void headerCacheIsWrittenUnderProjectRoot() throws IOException {
        write("board.h", "#define LED_COUNT 4\n");
        write("app.cnx", "#include \"board.h\"\n\nu8 leds <- LED_COUNT;\n");

        transpiler.transpile(TranspileOptions.builder(tempDir).build());

        assertThat(tempDir.resolve(".cnx").resolve("config.json")).exists();
        assertThat(tempDir.resolve(".cnx").resolve("cache").resolve("symbols.json")).exists();

        // A second run is served from the cache and produces the same output.
        String first = Files.readString(tempDir.resolve("app.c"));
        transpiler.transpile(TranspileOptions.builder(tempDir).build());
        assertThat(Files.readString(tempDir.resolve("app.c"))).isEqualTo(first);
    }

    @Test
    @Tag("integration")
    void secondRunTakesHeaderSymbolsFromCache() throws IOException {
        Path header = write("sensor.h", "#include <stdint.h>\ntypedef struct { uint32_t raw; } Sensor;\n");
        write("app.cnx", """
                #include "sensor.h"

                void main() {
                    Sensor s;
                    u32 bits <- s.raw.length;
                }
                """);
        transpiler.transpile(TranspileOptions.builder(tempDir).build());
        String first = Files.readString(tempDir.resolve("app.c"));
        assertThat(first).contains("uint32_t bits = 32;");

        // Same modification time, different content: only a cache hit still sees the 32-bit field.
        FileTime scanned = Files.getLastModifiedTime(header);
        Files.writeString(header, "#include <stdint.h>\ntypedef struct { uint16_t raw; } Sensor;\n");
        Files.setLastModifiedTime(header, scanned);
        transpiler.transpile(TranspileOptions.builder(tempDir).build());
        assertThat(Files.readString(tempDir.resolve("app.c"))).isEqualTo(first);

        // A newer modification time invalidates the entry.
        Files.setLastModifiedTime(header, FileTime.fromMillis(scanned.toMillis() + 60_000));
        transpiler.transpile(TranspileOptions.builder(tempDir).build());
        assertThat(Files.readString(tempDir.resolve("app.c"))).contains("uint32_t bits = 16;");
    }

    @Test
    @Tag("integration")
    void headersNoLongerIncludedAreDroppedFromCache() throws IOException {
        write("board.h", "#define LED_COUNT 4\n");
        write("legacy.h", "#define OLD_COUNT 2\n");
        write("app.cnx", "#include \"board.h\"\n#include \"legacy.h\"\n\nu8 leds <- LED_COUNT;\n");
        transpiler.transpile(TranspileOptions.builder(tempDir).build());
        Path symbols = tempDir.resolve(".cnx").resolve("cache").resolve("symbols.json");
        assertThat(Files.readString(symbols)).contains("legacy.h", "board.h");

        write("app.cnx", "#include \"board.h\"\n\nu8 leds <- LED_COUNT;\n");
        transpiler.transpile(TranspileOptions.builder(tempDir).build());

        assertThat(Files.readString(symbols)).contains("board.h").doesNotContain("legacy.h");
    }

    @Test
    @Tag("integration")
    void disabledCacheLeavesNoDirectory() throws IOException {
        write("board.h", "#define LED_COUNT 4\n");
        write("app.cnx", "#include \"board.h\"\n\nu8 leds <- LED_COUNT;\n");

        transpiler.transpile(TranspileOptions.builder(tempDir).cacheEnabled(false).build());

        assertThat(tempDir.resolve(".cnx")).doesNotExist();
    }

    @Test
    @Tag("integration")
    void outputDirectoriesMirrorSourceLayout() throws IOException {
        write("src/drivers/motor.cnx", "scope Motor {\n    public void start() { }\n}\n");
        write("src/app.cnx", "#include \"drivers/motor.cnx\"\n\nvoid main() {\n    Motor.start();\n}\n");
        Path out = tempDir.resolve("build");
        Path include = tempDir.resolve("include");

        transpiler.transpile(TranspileOptions.builder(tempDir.resolve("src"))
                .outputDirectory(out)
                .headerOutputDirectory(include)
                .cacheEnabled(false)
                .build());

        assertThat(out.resolve("drivers").resolve("motor.c")).exists();
        assertThat(include.resolve("drivers").resolve("motor.h")).exists();
        assertThat(out.resolve("app.c")).exists();
        assertThat(include.resolve("app.h")).exists();
        assertThat(Files.readString(out.resolve("app.c"))).contains("Motor_start();");
        assertThat(Files.readString(include.resolve("app.h"))).contains("#include \"drivers/motor.h\"");
        assertThat(tempDir.resolve("src").resolve("app.c")).doesNotExist();
    }

    @Test
    @Tag("integration")
    void failingUnitProducesNoOutput() throws IOException {
        write("good.cnx", "void ok() { }\n");
        write("bad.cnx", "void broken() {\n    u8 level <- 256;\n}\n");

        assertThatThrownBy(() -> transpiler.transpile(TranspileOptions.builder(tempDir).cacheEnabled(false).build()))
                .isInstanceOfSatisfying(CompilationException.class, e -> assertThat(e.getDiagnostics())
                        .anySatisfy(d -> assertThat(d.code()).isEqualTo(DiagnosticCode.LITERAL_OUT_OF_RANGE)));
        assertThat(tempDir.resolve("good.c")).exists();
        assertThat(tempDir.resolve("bad.c")).doesNotExist();
        assertThat(tempDir.resolve("bad.h")).doesNotExist();
    }

    @Test
    @Tag("integration")
    void emptyDirectoryIsAnError() {
        assertThatThrownBy(() -> transpiler.transpile(TranspileOptions.builder(tempDir).build()))
                .isInstanceOfSatisfying(CompilationException.class, e -> assertThat(e.getDiagnostics())
                        .anySatisfy(d -> assertThat(d.code()).isEqualTo(DiagnosticCode.IO_ERROR)));
    }

    @Test
    @Tag("integration")
    void missingInputIsAnError() {
        Path missing = tempDir.resolve("nowhere.cnx");

        assertThatThrownBy(() -> transpiler.transpile(TranspileOptions.builder(missing).build()))
                .isInstanceOf(CompilationException.class);
    }
}
