package org.agentworld.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.agentworld.cli.commands.InspectCommand;
import org.agentworld.cli.commands.PathfindCommand;
import org.agentworld.cli.commands.node.NodeCommand;
import org.agentworld.node.config.ConfigLoader;
import org.agentworld.node.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "agentworld",
    mixinStandardHelpOptions = true,
    version = "AgentWorld 1.0",
    description = "AgentWorld - persistent multi-agent world server",
    subcommands = {
        NodeCommand.class,
        InspectCommand.class,
        PathfindCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to the configuration file (default: " + ConfigLoader.DEFAULT_CONFIG_FILE + ")"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // no subcommand given
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("agentworld");
        System.exit(commandLine.execute(args));
    }

    /**
     * Loads the configuration on first use and applies its {@code logging} block.
     *
     * @throws CommandLine.ParameterException if {@code --config} names a missing file.
     * @throws ConfigException if the configuration cannot be parsed.
     */
    public Config getConfig() {
        if (config != null) {
            return config;
        }
        if (configFile != null) {
            if (!configFile.isFile()) {
                throw new CommandLine.ParameterException(new CommandLine(this),
                    "Configuration file not found: " + configFile.getAbsolutePath());
            }
            config = ConfigLoader.load(configFile);
        } else {
            config = ConfigLoader.load();
        }
        LoggingConfigurator.configure(config);
        LOGGER.debug("Configuration loaded");
        return config;
    }
}
