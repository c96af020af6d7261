package org.agentworld.cli.commands;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.agentworld.pipeline.resources.WorldRegistry;
import org.agentworld.runtime.pathfinding.PathResult;
import org.agentworld.runtime.pathfinding.Pathfinder;
import org.agentworld.runtime.pathfinding.Tile;
import org.agentworld.runtime.pathfinding.TileGrid;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * Runs the pathfinder over a grid given on the command line, e.g.
 * {@code agentworld pathfind --grid "{width=10, height=10, blocked=[[1,0],[1,1]]}" --from 0,0 --to 3,0}.
 */
@Command(
    name = "pathfind",
    description = "Find a path between two tiles of a grid"
)
public class PathfindCommand implements Callable<Integer> {

    @Option(names = {"-g", "--grid"}, description = "Grid definition in HOCON (width, height, connectivity, blocked)")
    private String gridDefinition = "{}";

    @Option(names = "--from", required = true, converter = TileConverter.class, description = "Start tile as x,y")
    private Tile from;

    @Option(names = "--to", required = true, converter = TileConverter.class, description = "Goal tile as x,y")
    private Tile to;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final Config gridConfig = ConfigFactory.parseString(gridDefinition);
        final TileGrid grid = WorldRegistry.readGrid(gridConfig);

        final PathResult result = Pathfinder.findPath(grid, Set.of(), from, to);
        if (!result.isFound()) {
            out.println("No path from " + from + " to " + to);
            return 1;
        }
        out.printf("cost=%.3f steps=%d%n", result.getCost(), result.getWaypoints().size() - 1);
        out.println(result.getWaypoints().stream()
            .map(t -> "(" + t.x() + "," + t.y() + ")")
            .collect(Collectors.joining(" -> ")));
        return 0;
    }

    public static final class TileConverter implements CommandLine.ITypeConverter<Tile> {
        @Override
        public Tile convert(final String value) {
            final String[] parts = value.split(",");
            if (parts.length != 2) {
                throw new CommandLine.TypeConversionException("Expected x,y but got '" + value + "'");
            }
            try {
                return new Tile(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()));
            } catch (final NumberFormatException e) {
                throw new CommandLine.TypeConversionException("Expected x,y but got '" + value + "'");
            }
        }
    }
}
