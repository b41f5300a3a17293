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
 * Smoke tests for the compile command.
 * Runs the command line entry point against small projects in a temporary directory.
 */
@Tag("integration")
public class CompileCommandTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private CommandLine commandLine() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
        return cmdLine;
    }

    @Test
    void testCommandParses() {
        assertThat(commandLine().getSubcommands()).containsKeys("compile", "clean");
    }

    @Test
    void testHelpOutput() {
        commandLine().execute("help", "compile");

        String output = out.toString() + err.toString();
        assertThat(output).contains("compile", "--output", "--include", "--no-cache", "--header-out");
    }

    @Test
    void testCompileDirectory() throws Exception {
        Files.writeString(tempDir.resolve("blink.cnx"), """
                u32 ticks <- 0;

                void main() {
                    ticks +<- 1;
                }
                """);

        int exitCode = commandLine().execute("compile", tempDir.toString());

        assertThat(exitCode)
            .describedAs("Exit code should be 0. stderr: %s, stdout: %s", err.toString(), out.toString())
            .isEqualTo(0);
        assertThat(out.toString()).contains("Compiled 1 unit(s)");
        assertThat(tempDir.resolve("blink.c")).exists();
        assertThat(Files.readString(tempDir.resolve("blink.h"))).contains("extern uint32_t ticks;");
    }

    @Test
    void testCompileWithOutputDirectories() throws Exception {
        Path source = tempDir.resolve("blink.cnx");
        Files.writeString(source, "void main() { }\n");
        Path generated = tempDir.resolve("gen");
        Path headers = tempDir.resolve("inc");

        int exitCode = commandLine().execute("compile", source.toString(), "-o", generated.toString(),
            "--header-out", headers.toString(), "--no-cache");

        assertThat(exitCode).isEqualTo(0);
        assertThat(generated.resolve("blink.c")).exists();
        assertThat(headers.resolve("blink.h")).exists();
        assertThat(tempDir.resolve(".cnx")).doesNotExist();
    }

    @Test
    void testDiagnosticsAreReportedOnStderr() throws Exception {
        Files.writeString(tempDir.resolve("bad.cnx"), "void main() {\n    u8 level <- 300;\n}\n");

        int exitCode = commandLine().execute("compile", tempDir.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("bad.cnx:2:", "E0605");
        assertThat(tempDir.resolve("bad.c")).doesNotExist();
    }

    @Test
    void testCompileNonexistentInputReturnsError() {
        int exitCode = commandLine().execute("compile", tempDir.resolve("missing.cnx").toString());

        assertThat(exitCode).isNotEqualTo(0);
    }

    @Test
    void testMissingInputParameter() {
        int exitCode = commandLine().execute("compile");

        assertThat(exitCode).isNotEqualTo(0);
        assertThat(err.toString()).contains("<file|dir>");
    }
}
