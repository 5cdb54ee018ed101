package org.kaleido.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.kaleido.cli.commands.CompileCommand;
import org.kaleido.cli.commands.ReplCommand;
import org.kaleido.cli.config.ConfigLoader;
import org.kaleido.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "kaleido",
    mixinStandardHelpOptions = true,
    version = "Kaleido 1.0",
    description = "Kaleido - compiles a small expression language to IR",
    subcommands = {
        ReplCommand.class,
        CompileCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    private Config config;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("kaleido");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     *
     * @return The resolved configuration.
     * @throws ConfigException if the configuration cannot be loaded.
     */
    public Config getConfig() {
        if (config == null) {
            try {
                config = ConfigLoader.load(configFile);
            } catch (ConfigException e) {
                LOG.error("Failed to load or parse configuration: {}", e.getMessage());
                throw e;
            }
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}
