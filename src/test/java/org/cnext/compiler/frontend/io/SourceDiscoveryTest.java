package org.cnext.compiler.frontend.io;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests how a command-line argument is turned into the list of sources to compile.
 */
public class SourceDiscoveryTest {

    @TempDir
    Path tempDir;

    @Test
    @Tag("integration")
    void directoryIsWalkedRecursivelyAndSortedByPath() throws Exception {
        Files.createDirectories(tempDir.resolve("drivers"));
        Files.writeString(tempDir.resolve("main.cnx"), "");
        Files.writeString(tempDir.resolve("drivers/uart.cnx"), "");
        Files.writeString(tempDir.resolve("drivers/adc.cnx"), "");
        Files.writeString(tempDir.resolve("notes.txt"), "");

        List<Path> sources = SourceDiscovery.discover(tempDir);
        Path root = tempDir.toRealPath();

        assertThat(sources).extracting(p -> root.relativize(p).toString().replace('\\', '/'))
                .containsExactly("drivers/adc.cnx", "drivers/uart.cnx", "main.cnx");
    }

    @Test
    @Tag("integration")
    void hiddenDirectoriesAreSkipped() throws Exception {
        Files.createDirectories(tempDir.resolve(".cnx"));
        Files.writeString(tempDir.resolve(".cnx/stale.cnx"), "");
        Files.writeString(tempDir.resolve("main.cnx"), "");

        assertThat(SourceDiscovery.discover(tempDir)).hasSize(1);
    }

    @Test
    @Tag("integration")
    void singleFileIsReturnedAsIs() throws Exception {
        Path file = tempDir.resolve("blink.cnx");
        Files.writeString(file, "");

        assertThat(SourceDiscovery.discover(file)).containsExactly(file.toRealPath());
    }

    @Test
    @Tag("unit")
    void missingInputAndWrongExtensionAreRejected() throws Exception {
        Path header = tempDir.resolve("board.h");
        Files.writeString(header, "");

        assertThatThrownBy(() -> SourceDiscovery.discover(tempDir.resolve("nope")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Input not found");
        assertThatThrownBy(() -> SourceDiscovery.discover(header))
                .isInstanceOf(IOException.class)
                .hasMessageContaining(".cnx");
    }
}
