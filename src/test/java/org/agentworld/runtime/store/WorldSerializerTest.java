package org.agentworld.runtime.store;

import org.agentworld.runtime.model.Agent;
import org.agentworld.runtime.model.Conversation;
import org.agentworld.runtime.model.Facing;
import org.agentworld.runtime.model.InProgressOperation;
import org.agentworld.runtime.model.Player;
import org.agentworld.runtime.model.Position;
import org.agentworld.runtime.model.World;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class WorldSerializerTest {

    private final WorldSerializer serializer = new WorldSerializer();

    private static World sampleWorld() {
        final World world = new World("w-1");
        final String ann = world.allocateId(World.PLAYER_PREFIX);
        final String bot = world.allocateId(World.PLAYER_PREFIX);
        final String gone = world.allocateId(World.PLAYER_PREFIX);
        world.addPlayer(new Player(ann, "Ann", "owner-1", new Position(2, 3), new Facing(-1, 0), "downtown", 40));
        world.addPlayer(new Player(bot, "Bot", null, new Position(5, 5), Facing.DOWN, "downtown", 41));
        world.addPlayer(new Player(gone, "Gone", null, new Position(0, 0), new Facing(0, -1), null, 0));
        world.archivePlayer(gone, 50, "left");

        final Agent agent = new Agent(world.allocateId(World.AGENT_PREFIX), bot, null, "owner-1");
        agent.setInProgressOperation(new InProgressOperation("agentDoSomething", "op-1", 45));
        world.addAgent(agent);

        final Conversation conversation = new Conversation(world.allocateId(World.CONVERSATION_PREFIX), ann, 42);
        conversation.invite(bot);
        world.addConversation(conversation);
        return world;
    }

    @Test
    @DisplayName("A restored world has the same entities, archive and id counter")
    void fromJson_restoresEntitiesAndArchive() {
        final World original = sampleWorld();

        final World restored = serializer.fromJson(serializer.toJson(original));

        assertThat(restored.getWorldId()).isEqualTo("w-1");
        assertThat(restored.getNextId()).isEqualTo(original.getNextId());
        assertThat(restored.findPlayer("p:0").orElseThrow().getPosition()).isEqualTo(new Position(2, 3));
        assertThat(restored.findPlayer("p:0").orElseThrow().getOwnerId()).isEqualTo("owner-1");
        assertThat(restored.findAgent("a:3").orElseThrow().getInProgressOperation().operationId()).isEqualTo("op-1");
        assertThat(restored.findConversation("c:4").orElseThrow().getInvitee()).isEqualTo("p:1");
        assertThat(restored.getArchivedPlayers().get("p:2").reason()).isEqualTo("left");
        assertThat(restored.findPlayer("p:2")).isEmpty();
    }

    @Test
    @DisplayName("Archived ids remain reserved after a restore")
    void fromJson_keepsArchivedIdsReserved() {
        final World restored = serializer.fromJson(serializer.toJson(sampleWorld()));

        assertThatThrownBy(() -> restored.addPlayer(new Player("p:2", "Again", null, new Position(1, 1), Facing.DOWN, null, 0)))
            .isInstanceOf(IllegalStateException.class);
        assertThat(restored.allocateId(World.PLAYER_PREFIX)).isEqualTo("p:5");
    }

    @Test
    @DisplayName("Unknown snapshot fields are ignored")
    void readJson_ignoresUnknownFields() {
        final SerializedWorld world = serializer.readJson("{\"worldId\":\"w-9\",\"nextId\":7,\"futureField\":true}");

        assertThat(world.worldId()).isEqualTo("w-9");
        assertThat(world.nextId()).isEqualTo(7);
        assertThat(world.players()).isEmpty();
    }

    @Test
    @DisplayName("A corrupt snapshot fails with a store error")
    void readJson_corruptSnapshotFails() {
        assertThatThrownBy(() -> serializer.readJson("{\"worldId\":")).isInstanceOf(StoreException.class);
    }
}
