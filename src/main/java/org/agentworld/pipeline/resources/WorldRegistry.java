package org.agentworld.pipeline.resources;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.agentworld.runtime.engine.EngineSettings;
import org.agentworld.runtime.engine.IWorldEngines;
import org.agentworld.runtime.engine.WorldEngine;
import org.agentworld.runtime.instances.IWorldDirectory;
import org.agentworld.runtime.instances.InstanceManager;
import org.agentworld.runtime.pathfinding.Connectivity;
import org.agentworld.runtime.pathfinding.Tile;
import org.agentworld.runtime.pathfinding.TileGrid;
import org.agentworld.runtime.recovery.OwnerDirectory;
import org.agentworld.runtime.recovery.RecoverySettings;
import org.agentworld.runtime.recovery.RecoverySweeper;
import org.agentworld.runtime.store.H2WorldStore;
import org.agentworld.runtime.store.IWorldStore;
import org.agentworld.runtime.store.InMemoryWorldStore;
import org.agentworld.runtime.store.StoreException;
import org.agentworld.runtime.store.WorldRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * The shared world runtime of a node: the store, one {@link WorldEngine} per world, the
 * {@link InstanceManager}, the owner directory and the {@link RecoverySweeper}.
 * <p>
 * Declared once under {@code pipeline.resources} and bound to every service and controller that
 * needs worlds. On construction all worlds found in the store are restored. The owner directory
 * is loaded from the same store; {@code owners} lists owners that are registered on every start.
 *
 * <pre>
 * options {
 *   grid { width = 64, height = 48, connectivity = FOUR, blocked = [[3, 4], [3, 5]] }
 *   engine { stepIntervalMs = 1000, maxInputsPerStep = 32, ... }
 *   recovery { stuckInputThresholdMs = 300000, ... }
 *   instances { defaultZone = "downtown", emptyDrainAfterMs = 600000, initializeDefault = true }
 *   store { type = "h2", jdbcUrl = "jdbc:h2:./data/agentworld" }
 *   owners = ["owner-1"]
 * }
 * </pre>
 */
public class WorldRegistry extends AbstractResource implements IWorldEngines, IWorldDirectory, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorldRegistry.class);

    private final Clock clock;
    private final TileGrid grid;
    private final EngineSettings engineSettings;
    private final IWorldStore store;
    private final Map<String, WorldEngine> engines = new ConcurrentSkipListMap<>();
    private final OwnerDirectory owners;
    private final InstanceManager instanceManager;
    private final RecoverySweeper sweeper;

    public WorldRegistry(final String name, final Config options) {
        this(name, options, Clock.systemUTC());
    }

    public WorldRegistry(final String name, final Config options, final Clock clock) {
        super(name, options);
        this.clock = clock;
        this.grid = readGrid(section(options, "grid"));
        this.engineSettings = readEngineSettings(section(options, "engine"));
        this.store = openStore(name, section(options, "store"));
        this.owners = new OwnerDirectory(store, options.hasPath("owners") ? options.getStringList("owners") : List.of());

        for (final WorldRecord world : store.listWorlds()) {
            engines.put(world.worldId(), WorldEngine.restore(world.worldId(), grid, engineSettings, store, clock));
        }

        final Config instances = section(options, "instances");
        this.instanceManager = new InstanceManager(this, store, clock,
            instances.hasPath("defaultZone") ? instances.getString("defaultZone") : "downtown",
            instances.hasPath("emptyDrainAfterMs") ? instances.getLong("emptyDrainAfterMs") : 600_000L);
        final boolean initializeDefault = !instances.hasPath("initializeDefault") || instances.getBoolean("initializeDefault");
        if (initializeDefault) {
            instanceManager.initializeDefaultInstance();
        }

        this.sweeper = new RecoverySweeper(this, this, instanceManager, owners,
            readRecoverySettings(section(options, "recovery")), clock);

        log.info("World registry '{}' ready: {} worlds, grid {}x{} ({}), store {}", name, engines.size(),
            grid.getWidth(), grid.getHeight(), grid.getConnectivity(), store.getClass().getSimpleName());
    }

    /**
     * Creates and registers a new, empty world.
     *
     * @throws StoreException if the world could not be persisted.
     */
    @Override
    public synchronized String createWorld() {
        final String worldId = "world-" + UUID.randomUUID();
        store.createWorld(new WorldRecord(worldId, clock.millis()));
        engines.put(worldId, WorldEngine.create(worldId, grid, engineSettings, store, clock));
        log.info("Created world {}", worldId);
        return worldId;
    }

    @Override
    public boolean isWorldAlive(final String worldId) {
        return engines.containsKey(worldId);
    }

    @Override
    public Collection<WorldEngine> allEngines() {
        return new ArrayList<>(engines.values());
    }

    @Override
    public Optional<WorldEngine> findEngine(final String worldId) {
        return Optional.ofNullable(engines.get(worldId));
    }

    /**
     * @throws IllegalArgumentException if no such world exists.
     */
    public WorldEngine getEngine(final String worldId) {
        return findEngine(worldId).orElseThrow(() -> new IllegalArgumentException("Unknown world " + worldId));
    }

    public List<String> listWorldIds() {
        return new ArrayList<>(engines.keySet());
    }

    public InstanceManager getInstanceManager() {
        return instanceManager;
    }

    public RecoverySweeper getSweeper() {
        return sweeper;
    }

    public OwnerDirectory getOwners() {
        return owners;
    }

    public IWorldStore getStore() {
        return store;
    }

    public TileGrid getGrid() {
        return grid;
    }

    public EngineSettings getEngineSettings() {
        return engineSettings;
    }

    public Clock getClock() {
        return clock;
    }

    @Override
    public UsageState getUsageState(final String usageType) {
        return isHealthy() ? UsageState.ACTIVE : UsageState.FAILED;
    }

    @Override
    protected void addCustomMetrics(final Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        int pending = 0;
        for (final WorldEngine engine : engines.values()) {
            pending += engine.pendingCount();
        }
        metrics.put("worlds_total", engines.size());
        metrics.put("inputs_pending", pending);
        metrics.put("instances_total", instanceManager.listInstances().size());
        metrics.put("owners_total", owners.listOwners().size());
    }

    @Override
    public void close() {
        store.close();
        log.debug("World registry '{}' closed", resourceName);
    }

    private static Config section(final Config options, final String path) {
        return options.hasPath(path) ? options.getConfig(path) : ConfigFactory.empty();
    }

    public static TileGrid readGrid(final Config grid) {
        final int width = grid.hasPath("width") ? grid.getInt("width") : 64;
        final int height = grid.hasPath("height") ? grid.getInt("height") : 48;
        final Connectivity connectivity = grid.hasPath("connectivity")
            ? Connectivity.valueOf(grid.getString("connectivity").toUpperCase(Locale.ROOT))
            : Connectivity.FOUR;
        final Collection<Tile> blocked = new HashSet<>();
        if (grid.hasPath("blocked")) {
            for (final Object entry : grid.getList("blocked").unwrapped()) {
                if (!(entry instanceof List<?> pair) || pair.size() != 2) {
                    throw new IllegalArgumentException("grid.blocked entries must be [x, y] pairs, got " + entry);
                }
                blocked.add(new Tile(((Number) pair.get(0)).intValue(), ((Number) pair.get(1)).intValue()));
            }
        }
        return new TileGrid(width, height, connectivity, blocked);
    }

    static EngineSettings readEngineSettings(final Config engine) {
        final EngineSettings d = EngineSettings.defaults();
        return new EngineSettings(
            engine.hasPath("stepIntervalMs") ? engine.getLong("stepIntervalMs") : d.stepIntervalMs(),
            engine.hasPath("maxInputsPerStep") ? engine.getInt("maxInputsPerStep") : d.maxInputsPerStep(),
            engine.hasPath("maxPendingInputs") ? engine.getInt("maxPendingInputs") : d.maxPendingInputs(),
            engine.hasPath("movementSpeed") ? engine.getDouble("movementSpeed") : d.movementSpeed(),
            engine.hasPath("pathfindingTimeoutMs") ? engine.getLong("pathfindingTimeoutMs") : d.pathfindingTimeoutMs(),
            engine.hasPath("operationTimeoutMs") ? engine.getLong("operationTimeoutMs") : d.operationTimeoutMs(),
            engine.hasPath("maxStepDurationMs") ? engine.getLong("maxStepDurationMs") : d.maxStepDurationMs());
    }

    static RecoverySettings readRecoverySettings(final Config recovery) {
        final RecoverySettings d = RecoverySettings.defaults();
        return new RecoverySettings(
            recovery.hasPath("stuckInputThresholdMs") ? recovery.getLong("stuckInputThresholdMs") : d.stuckInputThresholdMs(),
            recovery.hasPath("longRunningThresholdMs") ? recovery.getLong("longRunningThresholdMs") : d.longRunningThresholdMs(),
            recovery.hasPath("longRunningCommands") ? new HashSet<>(recovery.getStringList("longRunningCommands")) : d.longRunningCommands(),
            recovery.hasPath("stuckOperationThresholdMs") ? recovery.getLong("stuckOperationThresholdMs") : d.stuckOperationThresholdMs());
    }

    /**
     * Opens the store described by a {@code store} options block ({@code type = memory | h2}).
     */
    public static IWorldStore openStore(final String name, final Config store) {
        final String type = store.hasPath("type") ? store.getString("type") : "memory";
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "memory" -> new InMemoryWorldStore();
            case "h2" -> new H2WorldStore(name, store);
            default -> throw new IllegalArgumentException("Unknown store type '" + type + "' for resource '" + name + "'");
        };
    }
}
