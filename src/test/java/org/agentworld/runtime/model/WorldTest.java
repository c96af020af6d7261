package org.agentworld.runtime.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class WorldTest {

    private static Player player(final String id) {
        return new Player(id, "name-" + id, null, new Position(1, 1), Facing.DOWN, null, 0);
    }

    @Test
    @DisplayName("Ids come from a single monotonic counter across entity kinds")
    void allocateId_isMonotonicAcrossPrefixes() {
        final World world = new World("w");

        assertThat(world.allocateId(World.PLAYER_PREFIX)).isEqualTo("p:0");
        assertThat(world.allocateId(World.AGENT_PREFIX)).isEqualTo("a:1");
        assertThat(world.allocateId(World.CONVERSATION_PREFIX)).isEqualTo("c:2");
        assertThat(world.getNextId()).isEqualTo(3);
    }

    @Test
    @DisplayName("Archived ids cannot be reused")
    void archivedIdsStayReserved() {
        final World world = new World("w");
        world.addPlayer(player("p:0"));
        world.archivePlayer("p:0", 10, "left");

        assertThat(world.findPlayer("p:0")).isEmpty();
        assertThat(world.getArchivedPlayers()).containsKey("p:0");
        assertThat(world.getArchivedPlayers().get("p:0").reason()).isEqualTo("left");
        assertThatThrownBy(() -> world.addPlayer(player("p:0"))).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("An agent must reference a live player")
    void addAgent_requiresPlayer() {
        final World world = new World("w");

        assertThatThrownBy(() -> world.addAgent(new Agent("a:1", "p:0", null, null)))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Only finished conversations can be archived")
    void archiveConversation_requiresFinished() {
        final World world = new World("w");
        world.addPlayer(player("p:0"));
        final Conversation c = new Conversation("c:1", "p:0", 0);
        world.addConversation(c);

        assertThatThrownBy(() -> world.archiveConversation("c:1", 5, "done")).isInstanceOf(IllegalStateException.class);

        c.finish(5);
        world.archiveConversation("c:1", 6, "done");
        assertThat(world.getConversations()).isEmpty();
        assertThat(world.getArchivedConversations()).containsKey("c:1");
    }

    @Test
    @DisplayName("Mutating a copy leaves the original untouched")
    void copy_isIndependent() {
        final World world = new World("w");
        world.addPlayer(player("p:0"));

        final World copy = world.copy();
        copy.findPlayer("p:0").orElseThrow().setPosition(new Position(5, 5));
        copy.allocateId(World.PLAYER_PREFIX);

        assertThat(world.findPlayer("p:0").orElseThrow().getPosition()).isEqualTo(new Position(1, 1));
        assertThat(world.getNextId()).isZero();
    }

    @Test
    @DisplayName("Removing the last participant finishes a conversation")
    void conversation_emptyParticipantsImpliesFinished() {
        final Conversation c = new Conversation("c:1", "p:0", 0);

        c.removeParticipant("p:0", 7);

        assertThat(c.isFinished()).isTrue();
        assertThat(c.getFinishedAt()).isEqualTo(7L);
    }
}
