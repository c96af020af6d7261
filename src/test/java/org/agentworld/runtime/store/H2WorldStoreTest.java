package org.agentworld.runtime.store;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("integration")
class H2WorldStoreTest extends WorldStoreContractTest {

    private final String jdbcUrl = "jdbc:h2:mem:test-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";

    private Config options() {
        return ConfigFactory.parseMap(Map.of("jdbcUrl", jdbcUrl, "maxPoolSize", 2, "minIdle", 1));
    }

    @Override
    protected IWorldStore createStore() {
        return new H2WorldStore("test-store", options());
    }

    @Test
    @DisplayName("Inputs, snapshots and owners survive reopening the store")
    void reopen_keepsInputsAndSnapshots() {
        store.appendInput(pending(1, "join"));
        store.commitStep(new StepCommit(WORLD, 0, "{\"v\":1}", List.of(), 10L));
        store.saveOwner("owner-1");
        store.close();

        store = createStore();

        assertThat(store.listWorlds()).extracting(WorldRecord::worldId).containsExactly(WORLD);
        assertThat(store.lastInputNumber(WORLD)).isEqualTo(1);
        assertThat(store.loadPendingInputs(WORLD)).hasSize(1);
        assertThat(store.loadSnapshot(WORLD).orElseThrow().json()).isEqualTo("{\"v\":1}");
        assertThat(store.loadOwners()).containsExactly("owner-1");
    }

    @Test
    @DisplayName("A store without jdbcUrl is rejected")
    void constructor_requiresJdbcUrl() {
        assertThatThrownBy(() -> new H2WorldStore("broken", ConfigFactory.empty()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("jdbcUrl");
    }
}
