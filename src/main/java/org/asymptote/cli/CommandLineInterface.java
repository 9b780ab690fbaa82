package org.asymptote.cli;

import com.typesafe.config.Config;
import org.asymptote.cli.commands.AnalyzeCommand;
import org.asymptote.cli.commands.SolveCommand;
import org.asymptote.cli.commands.TokensCommand;
import org.asymptote.config.ConfigLoader;
import org.asymptote.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "asymptote",
    mixinStandardHelpOptions = true,
    version = "Asymptote 1.0",
    description = "Asymptote - asymptotic complexity analysis of pseudocode",
    subcommands = {
        AnalyzeCommand.class,
        TokensCommand.class,
        SolveCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    public static final int EXIT_OK = 0;
    public static final int EXIT_ANALYSIS_FAILED = 1;
    public static final int EXIT_IO_FAILED = 2;

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to a configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + " in the working directory)"
    )
    private File configFile;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private Config config;

    @Override
    public Integer call() {
        // Without a subcommand, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return EXIT_OK;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("asymptote");
        System.exit(commandLine.execute(args));
    }

    /**
     * Loads the configuration on first use and applies its logging section.
     *
     * @return The resolved configuration.
     * @throws com.typesafe.config.ConfigException if the configuration file is missing or malformed.
     */
    public Config getConfig() {
        if (config == null) {
            if (configFile != null) {
                LOG.info("Using configuration file specified via --config: {}", configFile.getAbsolutePath());
                config = ConfigLoader.load(configFile);
            } else {
                config = ConfigLoader.load();
            }
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}
