package io.gamevault.state.storage;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

/**
 * Versioned key/value rows for engine-wide switches such as whether exclusivity enforcement is
 * installed.
 */
public final class EngineStateStore {
    public static final String ENFORCEMENT_KEY = "exclusivity_enforcement";
    public static final String ENABLED = "enabled";
    public static final String DISABLED = "disabled";

    private final Database database;

    public EngineStateStore(Database database) {
        this.database = database;
    }

    public Optional<StateValue> get(Connection c, String key) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT state_key,state_value,version,updated_at_ms FROM engine_state WHERE state_key=?")) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new StateValue(
                        rs.getString("state_key"),
                        rs.getString("state_value"),
                        rs.getLong("version"),
                        rs.getLong("updated_at_ms")
                ));
            }
        }
    }

    public Optional<StateValue> get(String key) {
        try (Connection c = database.openConnection()) {
            return get(c, key);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read engine state: " + key, e);
        }
    }

    /**
     * Stores {@code value} under {@code key}. Returns the previous value, or empty when the row
     * did not exist. Writing the value already stored leaves version and timestamp untouched.
     */
    public Optional<String> put(String key, String value, long nowMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                Optional<StateValue> current = get(c, key);
                if (current.isPresent() && current.get().value().equals(value)) {
                    c.commit();
                    return Optional.of(value);
                }
                if (current.isEmpty()) {
                    try (PreparedStatement ps = c.prepareStatement(
                            "INSERT INTO engine_state(state_key,state_value,version,updated_at_ms) VALUES(?,?,1,?)")) {
                        ps.setString(1, key);
                        ps.setString(2, value);
                        ps.setLong(3, nowMs);
                        ps.executeUpdate();
                    }
                } else {
                    try (PreparedStatement ps = c.prepareStatement(
                            "UPDATE engine_state SET state_value=?, version=version+1, updated_at_ms=? WHERE state_key=?")) {
                        ps.setString(1, value);
                        ps.setLong(2, nowMs);
                        ps.setString(3, key);
                        ps.executeUpdate();
                    }
                }
                c.commit();
                return current.map(StateValue::value);
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to write engine state: " + key, e);
        }
    }

    public boolean enforcementEnabled(Connection c) throws SQLException {
        return get(c, ENFORCEMENT_KEY).map(v -> ENABLED.equals(v.value())).orElse(true);
    }

    public record StateValue(String key, String value, long version, long updatedAtMs) {
    }
}
