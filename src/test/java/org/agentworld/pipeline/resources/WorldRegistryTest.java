package org.agentworld.pipeline.resources;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.agentworld.runtime.engine.InputOutcome;
import org.agentworld.runtime.engine.WorldEngine;
import org.agentworld.runtime.recovery.SweepReport;
import org.agentworld.runtime.store.SerializedWorld.SerializedAgent;
import org.agentworld.test.utils.MutableClock;
import org.agentworld.test.utils.TestWorlds;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("integration")
class WorldRegistryTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final MutableClock clock = new MutableClock(1_000_000L);
    private final Config h2 = ConfigFactory.parseString(
        "store { type = \"h2\", jdbcUrl = \"jdbc:h2:mem:registry-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1\" }");

    @Test
    void restart_keepsRegisteredOwnersSoTheirAgentsAreNotOrphaned() throws Exception {
        final String worldId;
        final String agentId;
        try (WorldRegistry first = TestWorlds.registry(clock, h2)) {
            assertThat(first.getOwners().register("owner-9")).isTrue();
            worldId = first.createWorld();
            final WorldEngine engine = first.getEngine(worldId);
            final long number = engine.submit("createAgent",
                MAPPER.readTree("{\"name\":\"Bot\",\"ownerId\":\"owner-9\"}")).inputNumber();
            engine.runStep();
            final InputOutcome outcome = engine.findInput(number).orElseThrow().outcome();
            assertThat(outcome.kind()).isEqualTo(InputOutcome.Kind.OK);
            agentId = outcome.value().get("agentId").asText();
        }

        try (WorldRegistry second = TestWorlds.registry(clock, h2)) {
            assertThat(second.getOwners().listOwners()).containsExactly("owner-1", "owner-9");

            final SweepReport report = second.getSweeper().sweepOrphans();

            assertThat(report.affected()).isEmpty();
            assertThat(second.getEngine(worldId).snapshot().state().agents())
                .extracting(SerializedAgent::id)
                .containsExactly(agentId);
        }
    }

    @Test
    void removedOwner_staysRemovedAfterRestart() {
        try (WorldRegistry first = TestWorlds.registry(clock, h2)) {
            first.getOwners().register("owner-9");
            assertThat(first.getOwners().remove("owner-9")).isTrue();
        }

        try (WorldRegistry second = TestWorlds.registry(clock, h2)) {
            assertThat(second.getOwners().isKnown("owner-9")).isFalse();
            assertThat(second.getOwners().isKnown("owner-1")).isTrue();
        }
    }
}
