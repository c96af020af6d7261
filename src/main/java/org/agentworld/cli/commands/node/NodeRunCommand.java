package org.agentworld.cli.commands.node;

import com.typesafe.config.Config;
import org.agentworld.node.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

import java.util.concurrent.Callable;

@Command(
    name = "run",
    description = "Starts the node in the foreground. Stop it with Ctrl+C."
)
public class NodeRunCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(NodeRunCommand.class);

    @ParentCommand
    private NodeCommand parent;

    @Override
    public Integer call() {
        final Config config = parent.getParent().getConfig();
        LOGGER.info("Starting node...");

        final Node node = new Node(config);
        node.start();

        // the node's shutdown hook stops all processes
        try {
            Thread.currentThread().join();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            node.stop();
        }
        return 0;
    }
}
