package org.cnext.cli.commands;

import org.cnext.cli.CommandLineInterface;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Smoke tests for the clean command.
 */
@Tag("integration")
public class CleanCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void testRemovesCacheDirectory() throws Exception {
        Path cache = tempDir.resolve(".cnx").resolve("cache");
        Files.createDirectories(cache);
        Files.writeString(cache.resolve("symbols.json"), "{}");

        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        StringWriter out = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));

        int exitCode = cmdLine.execute("clean", tempDir.toString());

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString()).contains("Removed");
        assertThat(tempDir.resolve(".cnx")).doesNotExist();
    }

    @Test
    void testNothingToRemove() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        StringWriter out = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));

        int exitCode = cmdLine.execute("clean", tempDir.toString());

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString()).contains("No cache at");
    }
}
