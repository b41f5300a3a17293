package org.cnext.cli.commands;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.cnext.cli.CommandLineInterface;
import org.cnext.compiler.cache.CacheManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Removes the header symbol cache of a project.
 */
@Command(
    name = "clean",
    description = "Remove the symbol cache directory of a project"
)
public class CleanCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CleanCommand.class);

    @Parameters(index = "0", arity = "0..1", paramLabel = "<dir>", defaultValue = ".",
        description = "Project root containing the cache (default: current directory)")
    private Path projectRoot;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            Path cacheDirectory = projectRoot.resolve(parent.getConfig().getString("cnext.cache.directory"));
            if (CacheManager.clear(cacheDirectory)) {
                out.println("Removed " + cacheDirectory);
            } else {
                out.println("No cache at " + cacheDirectory);
            }
            return 0;
        } catch (Exception e) {
            log.error("Clean failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
