package org.agentworld.runtime.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.agentworld.runtime.engine.InputOutcome;
import org.agentworld.runtime.engine.InputRecord;
import org.agentworld.runtime.instances.Channel;
import org.agentworld.runtime.instances.ChannelStatus;
import org.agentworld.runtime.instances.ChannelType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link IWorldStore} backed by an H2 database, using HikariCP for connection pooling.
 * <p>
 * Options:
 * <pre>
 * jdbcUrl     = "jdbc:h2:./data/agentworld"   (required)
 * username    = "sa"
 * password    = ""
 * maxPoolSize = 10
 * minIdle     = 2
 * </pre>
 * The schema is created on construction if it does not exist yet.
 */
public class H2WorldStore implements IWorldStore {

    private static final Logger log = LoggerFactory.getLogger(H2WorldStore.class);

    private static final String[] SCHEMA = {
        "CREATE TABLE IF NOT EXISTS worlds ("
            + "world_id VARCHAR(128) PRIMARY KEY, created_at BIGINT NOT NULL)",
        "CREATE TABLE IF NOT EXISTS inputs ("
            + "world_id VARCHAR(128) NOT NULL, input_number BIGINT NOT NULL, name VARCHAR(64) NOT NULL, "
            + "args CLOB, received_at BIGINT NOT NULL, outcome_kind VARCHAR(8), outcome_value CLOB, "
            + "outcome_message CLOB, completed_at BIGINT, PRIMARY KEY (world_id, input_number))",
        "CREATE INDEX IF NOT EXISTS idx_inputs_pending ON inputs (world_id, outcome_kind)",
        "CREATE TABLE IF NOT EXISTS world_snapshots ("
            + "world_id VARCHAR(128) PRIMARY KEY, processed_input_number BIGINT NOT NULL, "
            + "snapshot CLOB NOT NULL, saved_at BIGINT NOT NULL)",
        "CREATE TABLE IF NOT EXISTS instances ("
            + "instance_id BIGINT PRIMARY KEY, name VARCHAR(256) NOT NULL, zone_type VARCHAR(128) NOT NULL, "
            + "channel_type VARCHAR(16) NOT NULL, max_bots INT NOT NULL, default_instance BOOLEAN NOT NULL, "
            + "created_at BIGINT NOT NULL, world_id VARCHAR(128), status VARCHAR(16) NOT NULL, "
            + "current_bots INT NOT NULL, needs_world_reassignment BOOLEAN NOT NULL, "
            + "empty_since BIGINT, over_capacity_until BIGINT)",
        "CREATE TABLE IF NOT EXISTS owners (owner_id VARCHAR(256) PRIMARY KEY)"
    };

    private static final String INPUT_COLUMNS =
        "world_id, input_number, name, args, received_at, outcome_kind, outcome_value, outcome_message, completed_at";
    private static final String SET_OUTCOME =
        "UPDATE inputs SET outcome_kind = ?, outcome_value = ?, outcome_message = ?, completed_at = ? "
            + "WHERE world_id = ? AND input_number = ? AND outcome_kind IS NULL";

    private final String name;
    private final HikariDataSource dataSource;
    private final ObjectMapper mapper = new ObjectMapper();

    public H2WorldStore(final String name, final Config options) {
        this.name = name;
        if (!options.hasPath("jdbcUrl")) {
            throw new IllegalArgumentException("Store '" + name + "' requires option 'jdbcUrl'");
        }
        final String jdbcUrl = options.getString("jdbcUrl");
        final String username = options.hasPath("username") ? options.getString("username") : "sa";
        final String password = options.hasPath("password") ? options.getString("password") : "";

        final HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setDriverClassName("org.h2.Driver");
        hikariConfig.setMaximumPoolSize(options.hasPath("maxPoolSize") ? options.getInt("maxPoolSize") : 10);
        hikariConfig.setMinimumIdle(options.hasPath("minIdle") ? options.getInt("minIdle") : 2);
        hikariConfig.setUsername(username);
        hikariConfig.setPassword(password);
        hikariConfig.setPoolName(name);

        try {
            this.dataSource = new HikariDataSource(hikariConfig);
        } catch (final Exception e) {
            throw new StoreException(describeConnectFailure(jdbcUrl, e), e);
        }
        try {
            createSchema();
        } catch (final SQLException e) {
            dataSource.close();
            throw new StoreException("Failed to create schema in store '" + name + "': " + e.getMessage(), e);
        }
        log.debug("H2 store '{}' ready (url={}, maxPool={})", name, jdbcUrl, hikariConfig.getMaximumPoolSize());
    }

    private String describeConnectFailure(final String jdbcUrl, final Exception e) {
        Throwable cause = e;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        final String causeMsg = cause.getMessage() != null ? cause.getMessage() : "";
        if (causeMsg.contains("already in use") || causeMsg.contains("file is locked")) {
            return String.format("Cannot open H2 store '%s': database file is in use by another process. File: %s.mv.db",
                name, jdbcUrl.replace("jdbc:h2:", ""));
        }
        if (causeMsg.contains("Wrong user name or password")) {
            return String.format("Failed to connect to H2 store '%s': wrong username/password. URL=%s", name, jdbcUrl);
        }
        return String.format("Failed to initialize H2 store '%s': %s. Database: %s. Error: %s",
            name, cause.getClass().getSimpleName(), jdbcUrl, causeMsg);
    }

    private void createSchema() throws SQLException {
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            for (final String ddl : SCHEMA) {
                stmt.execute(ddl);
            }
        }
    }

    @Override
    public void createWorld(final WorldRecord world) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement("INSERT INTO worlds (world_id, created_at) VALUES (?, ?)")) {
            stmt.setString(1, world.worldId());
            stmt.setLong(2, world.createdAt());
            stmt.executeUpdate();
        } catch (final SQLException e) {
            throw new StoreException("Failed to create world " + world.worldId() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<WorldRecord> listWorlds() {
        final List<WorldRecord> worlds = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT world_id, created_at FROM worlds ORDER BY created_at, world_id")) {
            while (rs.next()) {
                worlds.add(new WorldRecord(rs.getString(1), rs.getLong(2)));
            }
        } catch (final SQLException e) {
            throw new StoreException("Failed to list worlds: " + e.getMessage(), e);
        }
        return worlds;
    }

    @Override
    public void appendInput(final InputRecord input) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(
                 "INSERT INTO inputs (world_id, input_number, name, args, received_at) VALUES (?, ?, ?, ?, ?)")) {
            stmt.setString(1, input.worldId());
            stmt.setLong(2, input.number());
            stmt.setString(3, input.name());
            stmt.setString(4, toJson(input.args()));
            stmt.setLong(5, input.receivedAt());
            stmt.executeUpdate();
        } catch (final SQLException e) {
            throw new StoreException("Failed to append input " + input.worldId() + "#" + input.number() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void commitStep(final StepCommit commit) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                try (PreparedStatement stmt = conn.prepareStatement(SET_OUTCOME)) {
                    for (final InputRecord completed : commit.completedInputs()) {
                        bindOutcome(stmt, commit.worldId(), completed.number(), completed.outcome());
                        stmt.addBatch();
                    }
                    stmt.executeBatch();
                }
                try (PreparedStatement stmt = conn.prepareStatement(
                        "MERGE INTO world_snapshots (world_id, processed_input_number, snapshot, saved_at) "
                            + "KEY (world_id) VALUES (?, ?, ?, ?)")) {
                    stmt.setString(1, commit.worldId());
                    stmt.setLong(2, commit.processedInputNumber());
                    stmt.setString(3, commit.snapshotJson());
                    stmt.setLong(4, commit.savedAt());
                    stmt.executeUpdate();
                }
                conn.commit();
            } catch (final SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (final SQLException e) {
            throw new StoreException("Failed to commit step of world " + commit.worldId() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean completeInput(final String worldId, final long inputNumber, final InputOutcome outcome) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SET_OUTCOME)) {
            bindOutcome(stmt, worldId, inputNumber, outcome);
            return stmt.executeUpdate() == 1;
        } catch (final SQLException e) {
            throw new StoreException("Failed to complete input " + worldId + "#" + inputNumber + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<InputRecord> findInput(final String worldId, final long inputNumber) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(
                 "SELECT " + INPUT_COLUMNS + " FROM inputs WHERE world_id = ? AND input_number = ?")) {
            stmt.setString(1, worldId);
            stmt.setLong(2, inputNumber);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(readInput(rs)) : Optional.empty();
            }
        } catch (final SQLException e) {
            throw new StoreException("Failed to read input " + worldId + "#" + inputNumber + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<InputRecord> loadPendingInputs(final String worldId) {
        final List<InputRecord> pending = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(
                 "SELECT " + INPUT_COLUMNS + " FROM inputs WHERE world_id = ? AND outcome_kind IS NULL ORDER BY input_number")) {
            stmt.setString(1, worldId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    pending.add(readInput(rs));
                }
            }
        } catch (final SQLException e) {
            throw new StoreException("Failed to load pending inputs of world " + worldId + ": " + e.getMessage(), e);
        }
        return pending;
    }

    @Override
    public long lastInputNumber(final String worldId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement("SELECT MAX(input_number) FROM inputs WHERE world_id = ?")) {
            stmt.setString(1, worldId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0;
            }
        } catch (final SQLException e) {
            throw new StoreException("Failed to read last input number of world " + worldId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<StoredSnapshot> loadSnapshot(final String worldId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(
                 "SELECT processed_input_number, snapshot, saved_at FROM world_snapshots WHERE world_id = ?")) {
            stmt.setString(1, worldId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new StoredSnapshot(worldId, rs.getLong(1), rs.getString(2), rs.getLong(3)));
            }
        } catch (final SQLException e) {
            throw new StoreException("Failed to load snapshot of world " + worldId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void saveInstance(final Channel channel) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(
                 "MERGE INTO instances (instance_id, name, zone_type, channel_type, max_bots, default_instance, created_at, "
                     + "world_id, status, current_bots, needs_world_reassignment, empty_since, over_capacity_until) "
                     + "KEY (instance_id) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
            stmt.setLong(1, channel.getId());
            stmt.setString(2, channel.getName());
            stmt.setString(3, channel.getZoneType());
            stmt.setString(4, channel.getType().name());
            stmt.setInt(5, channel.getMaxBots());
            stmt.setBoolean(6, channel.isDefaultInstance());
            stmt.setLong(7, channel.getCreatedAt());
            stmt.setString(8, channel.getWorldId());
            stmt.setString(9, channel.getStatus().name());
            stmt.setInt(10, channel.getCurrentBots());
            stmt.setBoolean(11, channel.isNeedsWorldReassignment());
            setNullableLong(stmt, 12, channel.getEmptySince());
            setNullableLong(stmt, 13, channel.getOverCapacityUntil());
            stmt.executeUpdate();
        } catch (final SQLException e) {
            throw new StoreException("Failed to save instance " + channel.getId() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<Channel> loadInstances() {
        final List<Channel> channels = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(
                 "SELECT instance_id, name, zone_type, channel_type, max_bots, default_instance, created_at, world_id, status, "
                     + "current_bots, needs_world_reassignment, empty_since, over_capacity_until "
                     + "FROM instances ORDER BY instance_id")) {
            while (rs.next()) {
                channels.add(Channel.restore(rs.getLong(1), rs.getString(2), rs.getString(3),
                    ChannelType.valueOf(rs.getString(4)), rs.getInt(5), rs.getBoolean(6), rs.getLong(7),
                    rs.getString(8), ChannelStatus.valueOf(rs.getString(9)), rs.getInt(10), rs.getBoolean(11),
                    getNullableLong(rs, 12), getNullableLong(rs, 13)));
            }
        } catch (final SQLException e) {
            throw new StoreException("Failed to load instances: " + e.getMessage(), e);
        }
        return channels;
    }

    @Override
    public void saveOwner(final String ownerId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement("MERGE INTO owners (owner_id) KEY (owner_id) VALUES (?)")) {
            stmt.setString(1, ownerId);
            stmt.executeUpdate();
        } catch (final SQLException e) {
            throw new StoreException("Failed to save owner " + ownerId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void deleteOwner(final String ownerId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement("DELETE FROM owners WHERE owner_id = ?")) {
            stmt.setString(1, ownerId);
            stmt.executeUpdate();
        } catch (final SQLException e) {
            throw new StoreException("Failed to delete owner " + ownerId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<String> loadOwners() {
        final List<String> owners = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT owner_id FROM owners ORDER BY owner_id")) {
            while (rs.next()) {
                owners.add(rs.getString(1));
            }
        } catch (final SQLException e) {
            throw new StoreException("Failed to load owners: " + e.getMessage(), e);
        }
        return owners;
    }

    @Override
    public void close() {
        if (!dataSource.isClosed()) {
            dataSource.close();
            log.debug("H2 store '{}' closed", name);
        }
    }

    private void bindOutcome(final PreparedStatement stmt, final String worldId, final long inputNumber,
                             final InputOutcome outcome) throws SQLException {
        stmt.setString(1, outcome.kind().name());
        stmt.setString(2, outcome.value() != null ? toJson(outcome.value()) : null);
        stmt.setString(3, outcome.message());
        stmt.setLong(4, outcome.completedAt());
        stmt.setString(5, worldId);
        stmt.setLong(6, inputNumber);
    }

    private InputRecord readInput(final ResultSet rs) throws SQLException {
        final String kind = rs.getString(6);
        InputOutcome outcome = null;
        if (kind != null) {
            outcome = new InputOutcome(InputOutcome.Kind.valueOf(kind), fromJson(rs.getString(7)), rs.getString(8), rs.getLong(9));
        }
        return new InputRecord(rs.getString(1), rs.getLong(2), rs.getString(3), fromJson(rs.getString(4)), rs.getLong(5), outcome);
    }

    private String toJson(final JsonNode node) {
        if (node == null) {
            return null;
        }
        try {
            return mapper.writeValueAsString(node);
        } catch (final JsonProcessingException e) {
            throw new StoreException("Failed to serialize JSON value: " + e.getOriginalMessage(), e);
        }
    }

    private JsonNode fromJson(final String json) {
        if (json == null) {
            return null;
        }
        try {
            return mapper.readTree(json);
        } catch (final JsonProcessingException e) {
            throw new StoreException("Corrupt JSON value in store '" + name + "': " + e.getOriginalMessage(), e);
        }
    }

    private static void setNullableLong(final PreparedStatement stmt, final int index, final Long value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.BIGINT);
        } else {
            stmt.setLong(index, value);
        }
    }

    private static Long getNullableLong(final ResultSet rs, final int index) throws SQLException {
        final long value = rs.getLong(index);
        return rs.wasNull() ? null : value;
    }
}
