package org.cnext.cli;

import java.io.File;
import java.net.URL;
import java.util.concurrent.Callable;

import org.cnext.cli.commands.CleanCommand;
import org.cnext.cli.commands.CompileCommand;
import org.cnext.cli.config.ConfigLoader;
import org.cnext.compiler.api.Transpiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "cnext",
    mixinStandardHelpOptions = true,
    version = "C-Next " + Transpiler.VERSION,
    description = "C-Next - transpiles C-Next sources to portable C",
    subcommands = {
        CompileCommand.class,
        CleanCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/cnext.conf)"
    )
    private File configFile;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // Without a subcommand, show the usage.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = createCommandLine();
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates a fully configured CommandLine instance.
     * <p>
     * Use this method in tests to get the same configuration as the CLI entry point.
     *
     * @return A configured CommandLine instance.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("cnext");
        return commandLine;
    }

    /**
     * @throws IllegalArgumentException             if the configuration file named on the command line is missing.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed.
     */
    private void initialize() {
        if (initialized) {
            return;
        }
        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        this.config = ConfigLoader.resolve(this.configFile, (level, message) -> {
            switch (level) {
                case INFO -> logger.debug(message);
                case WARN -> logger.warn(message);
            }
        });

        boolean reconfigure = false;
        if (config.hasPath("logging.format")) {
            final String format = config.getString("logging.format");
            System.setProperty("cnext.logging.format", "PLAIN".equalsIgnoreCase(format) ? "STDOUT_PLAIN" : "STDOUT");
            reconfigure = true;
        }
        if (config.hasPath("logging.level")) {
            System.setProperty("cnext.logging.level", config.getString("logging.level"));
            reconfigure = true;
        }
        if (reconfigure) {
            reconfigureLogback();
        }
        initialized = true;
    }

    private void reconfigureLogback() {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        final URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        try {
            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            configurator.doConfigure(configUrl);
        } catch (JoranException e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }

    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
