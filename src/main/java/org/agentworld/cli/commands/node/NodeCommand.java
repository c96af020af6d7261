package org.agentworld.cli.commands.node;

import org.agentworld.cli.CommandLineInterface;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * Groups the commands that operate a node. Prints its usage when called without a subcommand.
 */
@Command(
    name = "node",
    description = "Run and operate an AgentWorld node",
    subcommands = {
        NodeRunCommand.class
    }
)
public class NodeCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface cli;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public CommandLineInterface getParent() {
        return cli;
    }
}
