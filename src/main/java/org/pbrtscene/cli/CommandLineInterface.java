package org.pbrtscene.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.pbrtscene.cli.commands.DumpCommand;
import org.pbrtscene.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "pbrt-scene",
    mixinStandardHelpOptions = true,
    version = "pbrt-scene 1.0",
    description = "Loads pbrt scene description files",
    subcommands = {
        DumpCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to a HOCON configuration file overriding the built-in defaults"
    )
    private File configFile;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private Config config;

    @Override
    public Integer call() {
        // No subcommand: show usage.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first use and applies its logging overrides.
     * Load order: system properties, then environment, then the {@code --config} file, then classpath defaults.
     *
     * @return The resolved configuration.
     * @throws CommandLine.ParameterException if the {@code --config} file is missing or malformed.
     */
    public Config getConfig() {
        if (config != null) {
            return config;
        }

        if (configFile != null && !configFile.isFile()) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Configuration file specified via --config was not found: " + configFile.getAbsolutePath());
        }

        try {
            Config fileConfig = ConfigFactory.empty();
            if (configFile != null) {
                LOG.info("Using configuration file specified via --config: {}", configFile.getAbsolutePath());
                fileConfig = ConfigFactory.parseFile(configFile);
            }
            config = ConfigFactory.systemProperties()
                    .withFallback(ConfigFactory.systemEnvironment())
                    .withFallback(fileConfig)
                    .withFallback(ConfigFactory.load())
                    .resolve();
        } catch (ConfigException e) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Failed to load or parse configuration: " + e.getMessage(), e, null, null);
        }

        LoggingConfigurator.configure(config);
        return config;
    }
}
