package org.agentworld.runtime.recovery;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.agentworld.junit.extensions.logging.AllowLog;
import org.agentworld.junit.extensions.logging.ExpectLog;
import org.agentworld.junit.extensions.logging.LogLevel;
import org.agentworld.junit.extensions.logging.LogWatchExtension;
import org.agentworld.runtime.engine.EngineSettings;
import org.agentworld.runtime.engine.IWorldEngines;
import org.agentworld.runtime.engine.InputOutcome;
import org.agentworld.runtime.engine.InputReceipt;
import org.agentworld.runtime.engine.InputRecord;
import org.agentworld.runtime.engine.WorldEngine;
import org.agentworld.runtime.instances.Channel;
import org.agentworld.runtime.instances.IWorldDirectory;
import org.agentworld.runtime.instances.InstanceAllocation;
import org.agentworld.runtime.instances.InstanceManager;
import org.agentworld.runtime.pathfinding.Connectivity;
import org.agentworld.runtime.pathfinding.TileGrid;
import org.agentworld.runtime.store.InMemoryWorldStore;
import org.agentworld.runtime.store.WorldRecord;
import org.agentworld.test.utils.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class RecoverySweeperTest {

    private static final String WORLD = "world-r";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final TileGrid grid = TileGrid.open(10, 10, Connectivity.FOUR);
    private final EngineSettings engineSettings = new EngineSettings(1000, 32, 50, 0.75, 60_000, 5_000, 1000);
    private final RecoverySettings recoverySettings = new RecoverySettings(1_000, 10_000, Set.of("createAgent"), 3_000);

    private MutableClock clock;
    private InMemoryWorldStore store;
    private Worlds worlds;
    private WorldEngine engine;
    private OwnerDirectory owners;
    private InstanceManager instances;
    private RecoverySweeper sweeper;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(500_000L);
        store = new InMemoryWorldStore();
        worlds = new Worlds();
        store.createWorld(new WorldRecord(WORLD, clock.millis()));
        engine = WorldEngine.create(WORLD, grid, engineSettings, store, clock);
        worlds.add(engine);
        owners = new OwnerDirectory(store, List.of("owner-1"));
        instances = new InstanceManager(worlds, store, clock, "downtown", 60_000L);
        sweeper = new RecoverySweeper(worlds, worlds, instances, owners, recoverySettings, clock);
    }

    private static ObjectNode args(final String json) {
        try {
            return (ObjectNode) MAPPER.readTree(json);
        } catch (final Exception e) {
            throw new IllegalArgumentException(e);
        }
    }

    private JsonNode applied(final InputReceipt receipt) {
        engine.runStep();
        final InputRecord input = engine.findInput(receipt.inputNumber()).orElseThrow();
        assertThat(input.outcome().kind()).isEqualTo(InputOutcome.Kind.OK);
        return input.outcome().value();
    }

    @Test
    @DisplayName("Stuck inputs are failed once; long-running commands get the longer threshold")
    @ExpectLog(level = LogLevel.WARN, messagePattern = ".*Cleared stuck input #1 \\(join\\).*")
    void sweepStuckInputs_respectsThresholdsAndIsIdempotent() {
        engine.submit("join", args("{\"name\":\"Ann\"}"));
        engine.submit("createAgent", args("{\"name\":\"Bot\"}"));
        clock.advance(2_000);

        final SweepReport first = sweeper.sweepStuckInputs(null);
        assertThat(first.sweep()).isEqualTo("stuck-inputs");
        assertThat(first.affected()).containsExactly(WORLD + "#1");

        final InputOutcome outcome = engine.findInput(1).orElseThrow().outcome();
        assertThat(outcome.kind()).isEqualTo(InputOutcome.Kind.ERROR);
        assertThat(outcome.message()).contains(RecoverySweeper.STUCK_INPUT_REASON);
        assertThat(engine.findInput(2).orElseThrow().outcome()).isNull();

        assertThat(sweeper.sweepStuckInputs(null).count()).isZero();
    }

    @Test
    @DisplayName("A threshold override applies to every pending input")
    @AllowLog(level = LogLevel.WARN, messagePattern = ".*Cleared stuck input.*")
    void sweepStuckInputs_overrideClearsLongRunningToo() {
        engine.submit("join", args("{\"name\":\"Ann\"}"));
        engine.submit("createAgent", args("{\"name\":\"Bot\"}"));
        clock.advance(2_000);

        final SweepReport report = sweeper.sweepStuckInputs(500L);

        assertThat(report.count()).isEqualTo(2);
        assertThat(engine.pendingCount()).isZero();
    }

    @Test
    @DisplayName("Stuck operations are cleared through a single clearOperation input")
    @ExpectLog(level = LogLevel.WARN, messagePattern = ".*Requested clearing of stuck operation op-7.*", occurrences = 1)
    void sweepStuckOperations_submitsOneClearPerOperation() {
        final String agentId = applied(engine.submit("createAgent", args("{\"name\":\"Bot\",\"ownerId\":\"owner-1\"}")))
            .get("agentId").asText();
        applied(engine.submit("startOperation",
            args("{\"agentId\":\"" + agentId + "\",\"name\":\"agentRememberConversation\",\"operationId\":\"op-7\"}")));

        clock.advance(1_000);
        assertThat(sweeper.sweepStuckOperations().count()).isZero();

        clock.advance(3_000);
        final SweepReport report = sweeper.sweepStuckOperations();
        assertThat(report.affected()).containsExactly(WORLD + "/" + agentId);
        assertThat(engine.pendingInputs()).extracting(InputRecord::name).containsExactly("clearOperation");

        assertThat(sweeper.sweepStuckOperations().count()).isZero();

        engine.runStep();
        assertThat(engine.snapshot().state().agents().get(0).inProgressOperation()).isNull();
        assertThat(sweeper.sweepStuckOperations().count()).isZero();
    }

    @Test
    @DisplayName("Agents and players of unknown owners are archived exactly once")
    void sweepOrphans_archivesEntitiesOfUnknownOwners() {
        final String ghostAgent = applied(engine.submit("createAgent", args("{\"name\":\"Ghostbot\",\"ownerId\":\"ghost\"}")))
            .get("agentId").asText();
        final String ghostPlayer = applied(engine.submit("join", args("{\"name\":\"Casper\",\"ownerId\":\"ghost\"}")))
            .get("playerId").asText();
        applied(engine.submit("join", args("{\"name\":\"Ann\",\"ownerId\":\"owner-1\"}")));
        applied(engine.submit("join", args("{\"name\":\"Anonymous\"}")));

        final SweepReport first = sweeper.sweepOrphans();
        assertThat(first.affected()).containsExactlyInAnyOrder(WORLD + "/" + ghostAgent, WORLD + "/" + ghostPlayer);
        assertThat(sweeper.sweepOrphans().count()).isZero();

        engine.runStep();
        assertThat(engine.snapshot().state().agents()).isEmpty();
        assertThat(engine.snapshot().state().players()).hasSize(2);
        assertThat(engine.snapshot().state().archivedAgents()).hasSize(1);
        assertThat(sweeper.sweepOrphans().count()).isZero();
    }

    @Test
    @DisplayName("Registering the owner again stops the sweep from archiving")
    void sweepOrphans_knownOwnerIsLeftAlone() {
        applied(engine.submit("createAgent", args("{\"name\":\"Bot\",\"ownerId\":\"owner-2\"}")));
        owners.register("owner-2");

        assertThat(sweeper.sweepOrphans().count()).isZero();
        assertThat(engine.pendingCount()).isZero();
    }

    @Test
    @DisplayName("Instances whose world is gone are taken out of rotation")
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Instance market lost its world .*", occurrences = 1)
    void sweepOrphans_resetsInstancesOfDeadWorlds() {
        final InstanceAllocation allocation = instances.findOrCreateInstance("market");
        final Channel before = instances.findInstance(allocation.instanceId()).orElseThrow();
        worlds.kill(before.getWorldId());

        final SweepReport report = sweeper.sweepOrphans();

        assertThat(report.affected()).containsExactly("instance/" + allocation.instanceId());
        final Channel after = instances.findInstance(allocation.instanceId()).orElseThrow();
        assertThat(after.getWorldId()).isNull();
        assertThat(after.isNeedsWorldReassignment()).isTrue();
        assertThat(sweeper.sweepOrphans().count()).isZero();
    }

    private static final class Worlds implements IWorldEngines, IWorldDirectory {
        private final Map<String, WorldEngine> engines = new LinkedHashMap<>();
        private final Set<String> alive = new HashSet<>();
        private int counter;

        void add(final WorldEngine engine) {
            engines.put(engine.getWorldId(), engine);
            alive.add(engine.getWorldId());
        }

        void kill(final String worldId) {
            alive.remove(worldId);
        }

        @Override
        public Collection<WorldEngine> allEngines() {
            return List.copyOf(engines.values());
        }

        @Override
        public Optional<WorldEngine> findEngine(final String worldId) {
            return Optional.ofNullable(engines.get(worldId));
        }

        @Override
        public String createWorld() {
            final String id = "zone-world-" + (++counter);
            alive.add(id);
            return id;
        }

        @Override
        public boolean isWorldAlive(final String worldId) {
            return alive.contains(worldId);
        }
    }
}
