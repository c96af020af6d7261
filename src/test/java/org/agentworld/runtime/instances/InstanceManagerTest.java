package org.agentworld.runtime.instances;

import org.agentworld.junit.extensions.logging.ExpectLog;
import org.agentworld.junit.extensions.logging.LogLevel;
import org.agentworld.junit.extensions.logging.LogWatchExtension;
import org.agentworld.runtime.store.InMemoryWorldStore;
import org.agentworld.runtime.store.StoreException;
import org.agentworld.test.utils.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class InstanceManagerTest {

    private static final String MARKET = "market";
    private static final long DRAIN_AFTER = 60_000L;

    private FakeWorlds worlds;
    private InMemoryWorldStore store;
    private MutableClock clock;
    private InstanceManager manager;

    @BeforeEach
    void setUp() {
        worlds = new FakeWorlds();
        store = new InMemoryWorldStore();
        clock = new MutableClock(0L);
        manager = new InstanceManager(worlds, store, clock, "downtown", DRAIN_AFTER);
    }

    private void fill(final int bots) {
        for (int i = 0; i < bots; i++) {
            manager.findOrCreateInstance(MARKET);
        }
    }

    private static void assertStatusMatchesLoad(final Channel channel) {
        if (channel.getStatus() == ChannelStatus.ACTIVE || channel.getStatus() == ChannelStatus.FULL) {
            assertThat(channel.getStatus() == ChannelStatus.FULL)
                .as("status of %s with %d/%d bots", channel.getName(), channel.getCurrentBots(), channel.getMaxBots())
                .isEqualTo(channel.getCurrentBots() >= channel.getMaxBots());
        }
    }

    @Test
    @DisplayName("A full zone gets a new shard; released slots are reused")
    void marketFillsUpThenShards() {
        final InstanceAllocation first = manager.findOrCreateInstance(MARKET);
        assertThat(first.created()).isTrue();
        fill(29);

        final Channel market = manager.findInstance(first.instanceId()).orElseThrow();
        assertThat(market.getCurrentBots()).isEqualTo(30);
        assertThat(market.getStatus()).isEqualTo(ChannelStatus.FULL);

        final InstanceAllocation overflow = manager.findOrCreateInstance(MARKET);
        assertThat(overflow.created()).isTrue();
        assertThat(overflow.instanceId()).isNotEqualTo(first.instanceId());
        final Channel shard = manager.findInstance(overflow.instanceId()).orElseThrow();
        assertThat(shard.getName()).isEqualTo("market-shard-2");
        assertThat(shard.getWorldId()).isNotEqualTo(market.getWorldId());

        final Channel released = manager.releaseSlot(first.instanceId());
        assertThat(released.getStatus()).isEqualTo(ChannelStatus.ACTIVE);
        assertThat(released.getCurrentBots()).isEqualTo(29);

        manager.listInstances().forEach(InstanceManagerTest::assertStatusMatchesLoad);
    }

    @Test
    @DisplayName("Allocation picks the least loaded accepting instance")
    void findOrCreate_prefersLeastLoaded() {
        fill(31);
        final List<Channel> instances = manager.listInstances();
        final long marketId = instances.get(0).getId();
        final long shardId = instances.get(1).getId();
        manager.releaseSlot(marketId);

        final InstanceAllocation next = manager.findOrCreateInstance(MARKET);

        assertThat(next.instanceId()).isEqualTo(shardId);
        assertThat(next.created()).isFalse();
    }

    @Test
    @DisplayName("Draining instances never receive bots")
    void draining_isSkipped() {
        final InstanceAllocation first = manager.findOrCreateInstance(MARKET);
        manager.markDraining(first.instanceId());

        final InstanceAllocation next = manager.findOrCreateInstance(MARKET);

        assertThat(next.instanceId()).isNotEqualTo(first.instanceId());
        assertThat(manager.findInstance(first.instanceId()).orElseThrow().getCurrentBots()).isEqualTo(1);
    }

    @Test
    @DisplayName("Over-capacity grants let a full instance accept bots until they expire")
    void overCapacity_allowsTemporaryOverflow() {
        fill(30);
        final long marketId = manager.listInstances().get(0).getId();
        manager.grantOverCapacity(marketId, 5_000L);

        final InstanceAllocation extra = manager.findOrCreateInstance(MARKET);
        assertThat(extra.instanceId()).isEqualTo(marketId);
        assertThat(manager.findInstance(marketId).orElseThrow().getCurrentBots()).isEqualTo(31);

        clock.advance(10_000L);
        assertThat(manager.findOrCreateInstance(MARKET).created()).isTrue();
    }

    @Test
    void releaseSlot_neverGoesBelowZero() {
        final InstanceAllocation first = manager.findOrCreateInstance(MARKET);
        manager.releaseSlot(first.instanceId());

        final Channel channel = manager.releaseSlot(first.instanceId());

        assertThat(channel.getCurrentBots()).isZero();
        assertThat(channel.getEmptySince()).isEqualTo(0L);
    }

    @Test
    void unknownInstance_isRejected() {
        assertThatThrownBy(() -> manager.releaseSlot(99)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("A failing world directory surfaces as an allocation error")
    void findOrCreate_worldCreationFailure() {
        worlds.failing = true;

        assertThatThrownBy(() -> manager.findOrCreateInstance(MARKET))
            .isInstanceOf(InstanceAllocationException.class)
            .hasMessageContaining("market");
        assertThat(manager.listInstances()).isEmpty();
    }

    @Test
    @DisplayName("The default instance is created once and never recommended for draining")
    void defaultInstance_isCreatedOnce() {
        final Channel defaultInstance = manager.initializeDefaultInstance().orElseThrow();
        assertThat(defaultInstance.isDefaultInstance()).isTrue();
        assertThat(defaultInstance.getZoneType()).isEqualTo("downtown");
        assertThat(manager.initializeDefaultInstance()).isEmpty();

        clock.advance(DRAIN_AFTER * 2);
        assertThat(manager.healthReport().get(0).recommendations()).doesNotContain(HealthRecommendation.DRAIN);
    }

    @Test
    @DisplayName("Health report flags dead worlds, idle shards and near-full instances")
    void healthReport_recommendsActions() {
        fill(31);
        final List<Channel> instances = manager.listInstances();
        final Channel market = instances.get(0);
        final Channel shard = instances.get(1);
        manager.releaseSlot(shard.getId());
        worlds.alive.remove(market.getWorldId());
        clock.advance(DRAIN_AFTER + 1);

        final List<ChannelHealth> report = manager.healthReport();

        final ChannelHealth marketHealth = report.get(0);
        assertThat(marketHealth.healthy()).isFalse();
        assertThat(marketHealth.recommendations()).contains(HealthRecommendation.REASSIGN_WORLD, HealthRecommendation.SHARD);
        assertThat(marketHealth.issues()).contains("World is invalid or inaccessible", "Instance is at full capacity");

        final ChannelHealth shardHealth = report.get(1);
        assertThat(shardHealth.recommendations()).containsExactly(HealthRecommendation.DRAIN);
    }

    @Test
    @DisplayName("Resetting takes the instance out of rotation until a new world is bound")
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Instance market lost its world .*")
    void resetAndReassign() {
        final InstanceAllocation first = manager.findOrCreateInstance(MARKET);

        final Channel reset = manager.resetForReassignment(first.instanceId());
        assertThat(reset.getStatus()).isEqualTo(ChannelStatus.MAINTENANCE);
        assertThat(reset.isNeedsWorldReassignment()).isTrue();
        assertThat(reset.getWorldId()).isNull();
        assertThatThrownBy(() -> manager.setMaintenance(first.instanceId(), false)).isInstanceOf(IllegalStateException.class);

        final Channel reassigned = manager.reassignWorld(first.instanceId());
        assertThat(reassigned.getStatus()).isEqualTo(ChannelStatus.ACTIVE);
        assertThat(reassigned.getWorldId()).isNotNull().isNotEqualTo(first.worldId());
        assertThat(reassigned.getCurrentBots()).isEqualTo(1);
    }

    @Test
    @DisplayName("Instances survive a restart through the store")
    void restore_fromStore() {
        fill(3);

        final InstanceManager restarted = new InstanceManager(worlds, store, clock, "downtown", DRAIN_AFTER);

        assertThat(restarted.listInstances()).hasSize(1);
        assertThat(restarted.listInstances().get(0).getCurrentBots()).isEqualTo(3);
        restarted.markDraining(restarted.listInstances().get(0).getId());
        assertThat(restarted.findOrCreateInstance(MARKET).instanceId()).isEqualTo(2L);
    }

    @Test
    @DisplayName("A failed save leaves load, status and the instance list untouched")
    void failedSave_changesNothing() {
        final FlakyChannelStore flaky = new FlakyChannelStore();
        final InstanceManager flakyManager = new InstanceManager(worlds, flaky, clock, "downtown", DRAIN_AFTER);
        final long id = flakyManager.findOrCreateInstance(MARKET).instanceId();

        flaky.failing = true;
        for (int i = 0; i < 5; i++) {
            assertThatThrownBy(() -> flakyManager.findOrCreateInstance(MARKET)).isInstanceOf(StoreException.class);
        }
        assertThatThrownBy(() -> flakyManager.releaseSlot(id)).isInstanceOf(StoreException.class);
        assertThatThrownBy(() -> flakyManager.markDraining(id)).isInstanceOf(StoreException.class);
        assertThatThrownBy(() -> flakyManager.findOrCreateInstance("harbor")).isInstanceOf(StoreException.class);

        assertThat(flakyManager.listInstances()).hasSize(1);
        final Channel market = flakyManager.findInstance(id).orElseThrow();
        assertThat(market.getCurrentBots()).isEqualTo(1);
        assertThat(market.getStatus()).isEqualTo(ChannelStatus.ACTIVE);
        assertThat(flaky.loadInstances()).singleElement()
            .satisfies(saved -> assertThat(saved.getCurrentBots()).isEqualTo(1));

        flaky.failing = false;
        final InstanceAllocation harbor = flakyManager.findOrCreateInstance("harbor");
        assertThat(harbor.created()).isTrue();
        assertThat(harbor.instanceId()).isEqualTo(id + 1);
        assertThat(flakyManager.findInstance(harbor.instanceId()).orElseThrow().getName()).isEqualTo("harbor");
    }

    private static final class FlakyChannelStore implements IChannelStore {
        private final InMemoryWorldStore delegate = new InMemoryWorldStore();
        private boolean failing;

        @Override
        public void saveInstance(final Channel channel) {
            if (failing) {
                throw new StoreException("instances table is read-only");
            }
            delegate.saveInstance(channel);
        }

        @Override
        public List<Channel> loadInstances() {
            return delegate.loadInstances();
        }
    }

    private static final class FakeWorlds implements IWorldDirectory {
        private final Set<String> alive = new HashSet<>();
        private int counter;
        private boolean failing;

        @Override
        public String createWorld() {
            if (failing) {
                throw new IllegalStateException("no capacity for new worlds");
            }
            final String id = "world-" + (++counter);
            alive.add(id);
            return id;
        }

        @Override
        public boolean isWorldAlive(final String worldId) {
            return alive.contains(worldId);
        }
    }
}
