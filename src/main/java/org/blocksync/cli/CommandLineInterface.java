package org.blocksync.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.blocksync.cli.commands.CatalogCommand;
import org.blocksync.cli.commands.CompileCommand;
import org.blocksync.cli.commands.ExtractCommand;
import org.blocksync.cli.commands.RoundtripCommand;
import org.blocksync.cli.config.ConfigLoader;
import org.blocksync.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "blocksync",
    mixinStandardHelpOptions = true,
    version = "blocksync 1.0",
    description = "Converts micro:bit block programs to Python and back",
    subcommands = {
        CompileCommand.class,
        ExtractCommand.class,
        RoundtripCommand.class,
        CatalogCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/blocksync.conf)"
    )
    private File configFile;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // No subcommand: show usage.
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
        commandLine.setCommandName("blocksync");
        return commandLine;
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        try {
            this.config = ConfigLoader.resolve(this.configFile, (level, message) -> {
                switch (level) {
                    case INFO -> logger.debug(message);
                    case WARN -> logger.warn(message);
                }
            });
        } catch (IllegalArgumentException e) {
            logger.error(e.getMessage());
            throw e;
        } catch (ConfigException e) {
            logger.error("Failed to load or parse configuration: {}", e.getMessage());
            throw e;
        }

        if (config.hasPath("logging.format")) {
            final String format = config.getString("logging.format");
            System.setProperty("blocksync.logging.format", "PLAIN".equalsIgnoreCase(format) ? "STDOUT_PLAIN" : "STDOUT");
            reconfigureLogback();
        }
        LoggingConfigurator.configure(config);

        initialized = true;
    }

    private void reconfigureLogback() {
        if (!(LoggerFactory.getILoggerFactory() instanceof ch.qos.logback.classic.LoggerContext context)) {
            return;
        }
        java.net.URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        try {
            ch.qos.logback.classic.joran.JoranConfigurator configurator = new ch.qos.logback.classic.joran.JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            configurator.doConfigure(configUrl);
        } catch (ch.qos.logback.core.joran.spi.JoranException e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }

    /**
     * @return The resolved configuration, loaded on first access.
     * @throws IllegalArgumentException if an explicitly named configuration file does not exist.
     * @throws ConfigException          if the configuration is invalid.
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
