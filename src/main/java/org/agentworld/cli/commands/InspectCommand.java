package org.agentworld.cli.commands;

import org.agentworld.cli.CommandLineInterface;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

@Command(
    name = "inspect",
    description = "Read persisted worlds without starting a node",
    subcommands = {
        InspectSnapshotSubcommand.class
    }
)
public class InspectCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface cli;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        // no subcommand given
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public CommandLineInterface getParent() {
        return cli;
    }
}
