package io.gamevault.state.storage;

import io.gamevault.state.model.ConflictLogEntry;
import io.gamevault.state.model.StateHistoryEntry;
import io.gamevault.state.model.StateKind;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only tables: the conflict resolution log and the state history. There is no update or
 * delete path here, and triggers installed by the schema reject both at the SQL level.
 */
public final class AuditTrailStore {
    private final Database database;

    public AuditTrailStore(Database database) {
        this.database = database;
    }

    public void appendConflictLog(Connection c, String runId, long userId, long gameKey, String conflictType,
                                  StateKind originalState, StateKind resolvedState, String reason, long resolvedAtMs)
            throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO conflict_resolution_log(run_id,user_id,game_key,conflict_type,original_state,resolved_state,reason,resolved_at_ms) VALUES(?,?,?,?,?,?,?,?)")) {
            ps.setString(1, runId);
            ps.setLong(2, userId);
            ps.setLong(3, gameKey);
            ps.setString(4, conflictType);
            ps.setString(5, originalState.label());
            ps.setString(6, resolvedState.label());
            ps.setString(7, reason);
            ps.setLong(8, resolvedAtMs);
            ps.executeUpdate();
        }
    }

    public List<ConflictLogEntry> listConflictLog(Long userId, String runId, int limit) {
        StringBuilder sql = new StringBuilder("""
                SELECT id,run_id,user_id,game_key,conflict_type,original_state,resolved_state,reason,resolved_at_ms
                FROM conflict_resolution_log WHERE 1=1
                """);
        if (userId != null) {
            sql.append(" AND user_id=?");
        }
        if (runId != null && !runId.isBlank()) {
            sql.append(" AND run_id=?");
        }
        sql.append(" ORDER BY id DESC LIMIT ?");
        List<ConflictLogEntry> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql.toString())) {
            int i = 1;
            if (userId != null) {
                ps.setLong(i++, userId);
            }
            if (runId != null && !runId.isBlank()) {
                ps.setString(i++, runId.trim());
            }
            ps.setInt(i, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new ConflictLogEntry(
                            rs.getLong("id"),
                            rs.getString("run_id"),
                            rs.getLong("user_id"),
                            rs.getLong("game_key"),
                            rs.getString("conflict_type"),
                            StateKind.fromString(rs.getString("original_state")),
                            StateKind.fromString(rs.getString("resolved_state")),
                            rs.getString("reason"),
                            rs.getLong("resolved_at_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list conflict resolution log", e);
        }
    }

    public long countConflictLog() {
        return count("SELECT COUNT(*) FROM conflict_resolution_log");
    }

    public long appendHistory(Connection c, long userId, long gameKey, StateKind previous, StateKind next, long changedAtMs)
            throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO game_state_history(user_id,game_key,previous_state,new_state,changed_at_ms) VALUES(?,?,?,?,?)",
                Statement.RETURN_GENERATED_KEYS)) {
            ps.setLong(1, userId);
            ps.setLong(2, gameKey);
            ps.setString(3, previous == null ? null : previous.label());
            ps.setString(4, next.label());
            ps.setLong(5, changedAtMs);
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                return keys.next() ? keys.getLong(1) : -1L;
            }
        }
    }

    public List<StateHistoryEntry> listHistory(long userId, Long gameKey, boolean newestFirst, int limit) {
        String sql = "SELECT id,user_id,game_key,previous_state,new_state,changed_at_ms FROM game_state_history WHERE user_id=?"
                + (gameKey == null ? "" : " AND game_key=?")
                + (newestFirst ? " ORDER BY changed_at_ms DESC, id DESC" : " ORDER BY changed_at_ms ASC, id ASC")
                + (limit > 0 ? " LIMIT ?" : "");
        List<StateHistoryEntry> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            int i = 1;
            ps.setLong(i++, userId);
            if (gameKey != null) {
                ps.setLong(i++, gameKey);
            }
            if (limit > 0) {
                ps.setInt(i, limit);
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new StateHistoryEntry(
                            rs.getLong("id"),
                            rs.getLong("user_id"),
                            rs.getLong("game_key"),
                            StateKind.fromLabelOrNull(rs.getString("previous_state")),
                            StateKind.fromString(rs.getString("new_state")),
                            rs.getLong("changed_at_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read state history for user " + userId, e);
        }
    }

    public long countHistory() {
        return count("SELECT COUNT(*) FROM game_state_history");
    }

    private long count(String sql) {
        try (Connection c = database.openConnection(); Statement st = c.createStatement(); ResultSet rs = st.executeQuery(sql)) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count rows: " + sql, e);
        }
    }
}
