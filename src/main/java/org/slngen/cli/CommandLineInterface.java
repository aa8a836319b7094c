package org.slngen.cli;

import java.io.File;
import java.net.URL;
import java.util.concurrent.Callable;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slngen.cli.commands.ExtractTemplatesCommand;
import org.slngen.cli.commands.GenerateCommand;
import org.slngen.cli.commands.InitManifestCommand;
import org.slngen.cli.config.ConfigLoader;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "slngen",
    mixinStandardHelpOptions = true,
    version = "slngen 1.0",
    description = "Regenerates .csproj and .sln files for a Unity project without opening the editor",
    subcommands = {
        GenerateCommand.class,
        ExtractTemplatesCommand.class,
        InitManifestCommand.class,
        CommandLine.HelpCommand.class
    },
    footer = {
        "",
        "Configuration:",
        "  Defaults come from reference.conf. Override them in config/slngen.conf,",
        "  with --config, or with -Dslngen.<key>=<value>."
    }
)
public class CommandLineInterface implements Callable<Integer> {

    static final String BASE_LOGGER = "org.slngen";
    static final String FORMAT_PROPERTY = "slngen.logging.format";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/slngen.conf)"
    )
    private File configFile;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
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
        commandLine.setCommandName("slngen");
        return commandLine;
    }

    /**
     * Resolves the configuration on first use.
     *
     * @return the resolved configuration.
     * @throws IllegalArgumentException if an explicitly named config file does not exist.
     * @throws ConfigException          if the configuration cannot be parsed.
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }

    /**
     * Raises the application loggers to DEBUG for the rest of the process.
     */
    public static void enableVerboseLogging() {
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext context) {
            context.getLogger(BASE_LOGGER).setLevel(Level.DEBUG);
        }
    }

    private void initialize() {
        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        this.config = ConfigLoader.resolve(this.configFile, (level, message) -> {
            switch (level) {
                case INFO -> logger.debug(message);
                case WARN -> logger.debug(message);
            }
        });

        if (config.hasPath("logging.format")) {
            final String format = config.getString("logging.format");
            final String appender = "PLAIN".equalsIgnoreCase(format) ? "STDOUT_PLAIN" : "STDOUT";
            if (!appender.equals(System.getProperty(FORMAT_PROPERTY))) {
                System.setProperty(FORMAT_PROPERTY, appender);
                reconfigureLogback();
            }
        }

        initialized = true;
    }

    private static void reconfigureLogback() {
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
}
