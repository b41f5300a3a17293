package org.cnext.cli.commands;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.cnext.cli.CommandLineInterface;
import org.cnext.compiler.api.CompilationException;
import org.cnext.compiler.api.TranspileOptions;
import org.cnext.compiler.api.TranspileResult;
import org.cnext.compiler.api.Transpiler;
import org.cnext.compiler.diagnostics.Diagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Transpiles a C-Next file, or every C-Next file below a directory, to C.
 * <p>
 * Diagnostics are printed to stderr as {@code file:line:col error[CODE]: message}; any
 * diagnostic makes the command exit with status 1.
 */
@Command(
    name = "compile",
    description = "Transpile C-Next sources to C source and header files"
)
public class CompileCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CompileCommand.class);

    @Parameters(
        index = "0",
        paramLabel = "<file|dir>",
        description = "A .cnx file or a directory of .cnx files"
    )
    private Path input;

    @Option(
        names = {"-o", "--output"},
        paramLabel = "<dir>",
        description = "Output directory for generated .c files (default: next to the source)"
    )
    private Path outputDirectory;

    @Option(
        names = {"-I", "--include"},
        paramLabel = "<dir>",
        description = "Additional include search directory (repeatable)"
    )
    private List<Path> includeDirectories = new ArrayList<>();

    @Option(
        names = {"--no-cache"},
        description = "Neither read nor write the header symbol cache"
    )
    private boolean noCache;

    @Option(
        names = {"--header-out"},
        paramLabel = "<dir>",
        description = "Output directory for generated .h files (default: with the .c files)"
    )
    private Path headerOutputDirectory;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            TranspileOptions options = buildOptions(parent.getConfig());
            TranspileResult result = new Transpiler().transpile(options);
            out.printf("Compiled %d unit(s) (%d foreign header(s))%n",
                result.units().size(), result.headersScanned());
            return 0;
        } catch (CompilationException e) {
            for (Diagnostic diagnostic : e.getDiagnostics()) {
                err.println(diagnostic);
            }
            log.error(e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            log.error("Compilation failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    TranspileOptions buildOptions(Config config) {
        List<Path> includes = new ArrayList<>(includeDirectories);
        for (String configured : config.getStringList("cnext.include-paths")) {
            includes.add(Paths.get(configured));
        }
        return TranspileOptions.builder(input)
            .outputDirectory(outputDirectory)
            .headerOutputDirectory(headerOutputDirectory)
            .includePaths(includes)
            .cacheEnabled(!noCache && config.getBoolean("cnext.cache.enabled"))
            .cacheDirectory(config.getString("cnext.cache.directory"))
            .sourceExtension(config.getString("cnext.output.source-extension"))
            .headerExtension(config.getString("cnext.output.header-extension"))
            .build();
    }
}
