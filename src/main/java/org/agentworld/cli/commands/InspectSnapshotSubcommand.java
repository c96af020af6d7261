package org.agentworld.cli.commands;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.agentworld.pipeline.resources.WorldRegistry;
import org.agentworld.runtime.store.IWorldStore;
import org.agentworld.runtime.store.StoredSnapshot;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Prints the latest committed snapshot of a world, read directly from the store configured for
 * the world registry resource.
 */
@Command(
    name = "snapshot",
    description = "Print the latest committed snapshot of a world"
)
public class InspectSnapshotSubcommand implements Callable<Integer> {

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @Option(names = {"-w", "--world"}, required = true, description = "World ID")
    private String worldId;

    @Option(names = {"-p", "--process"}, description = "Pipeline process name (default: pipeline)")
    private String processName = "pipeline";

    @Option(names = {"-r", "--resource"}, description = "World registry resource name (default: worlds)")
    private String resourceName = "worlds";

    @Option(names = {"-f", "--format"}, description = "Output format: json, summary (default: json)")
    private String format = "json";

    @ParentCommand
    private InspectCommand parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();
        final Config storeOptions = storeOptions(parent.getParent().getConfig(), processName, resourceName);

        try (IWorldStore store = WorldRegistry.openStore(resourceName, storeOptions)) {
            final Optional<StoredSnapshot> snapshot = store.loadSnapshot(worldId);
            if (snapshot.isEmpty()) {
                err.println("No snapshot found for world " + worldId);
                return 1;
            }
            final StoredSnapshot stored = snapshot.get();
            if ("summary".equalsIgnoreCase(format)) {
                out.printf("world=%s processedInputNumber=%d savedAt=%d bytes=%d%n",
                    stored.worldId(), stored.processedInputNumber(), stored.savedAt(), stored.json().length());
            } else {
                out.println(MAPPER.writeValueAsString(MAPPER.readTree(stored.json())));
            }
            return 0;
        }
    }

    static Config storeOptions(final Config config, final String processName, final String resourceName) {
        final String path = "node.processes." + processName + ".options.resources." + resourceName + ".options.store";
        return config.hasPath(path) ? config.getConfig(path) : ConfigFactory.empty();
    }
}
