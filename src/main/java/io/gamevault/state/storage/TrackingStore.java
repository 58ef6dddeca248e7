package io.gamevault.state.storage;

import io.gamevault.state.model.GameKeyRef;
import io.gamevault.state.model.StateKind;
import io.gamevault.state.model.TrackingRecord;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Row access for the three tracking sets. Methods taking a {@link Connection} run inside the
 * caller's transaction; the others open and close their own connection.
 */
public final class TrackingStore {
    private static final String ACTIVE_PROGRESS = "(started=1 OR completed=1)";

    private final Database database;

    public TrackingStore(Database database) {
        this.database = database;
    }

    public Database database() {
        return database;
    }

    public List<TrackingRecord> findByKey(Connection c, long userId, long gameKey) throws SQLException {
        List<TrackingRecord> out = new ArrayList<>();
        for (StateKind kind : StateKind.values()) {
            out.addAll(findByKind(c, kind, userId, gameKey));
        }
        return out;
    }

    public List<TrackingRecord> findByKind(Connection c, StateKind kind, long userId, long gameKey) throws SQLException {
        String sql = "SELECT * FROM " + kind.table() + " WHERE user_id=? AND game_key=? ORDER BY id";
        List<TrackingRecord> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, userId);
            ps.setLong(2, gameKey);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(map(kind, rs));
                }
            }
        }
        return out;
    }

    public List<TrackingRecord> listByUser(long userId, StateKind kind) {
        String order = kind == StateKind.PROGRESS ? "updated_at_ms DESC, id DESC" : "added_at_ms DESC, id DESC";
        String sql = "SELECT * FROM " + kind.table() + " WHERE user_id=?"
                + (kind == StateKind.PROGRESS ? " AND " + ACTIVE_PROGRESS : "")
                + " ORDER BY " + order;
        List<TrackingRecord> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, userId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(map(kind, rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list " + kind.label() + " records for user " + userId, e);
        }
    }

    public long insertWishlist(Connection c, long userId, long gameKey, long addedAtMs, Integer priority, String notes)
            throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO user_wishlist(user_id,game_key,added_at_ms,priority,notes) VALUES(?,?,?,?,?)",
                Statement.RETURN_GENERATED_KEYS)) {
            ps.setLong(1, userId);
            ps.setLong(2, gameKey);
            ps.setLong(3, addedAtMs);
            setNullableInt(ps, 4, priority);
            ps.setString(5, notes);
            ps.executeUpdate();
            return generatedId(ps);
        }
    }

    public void updateWishlistDetails(Connection c, long recordId, Integer priority, String notes) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "UPDATE user_wishlist SET priority=COALESCE(?,priority), notes=COALESCE(?,notes) WHERE id=?")) {
            setNullableInt(ps, 1, priority);
            ps.setString(2, notes);
            ps.setLong(3, recordId);
            ps.executeUpdate();
        }
    }

    public long insertCollection(Connection c, long userId, long gameKey, long addedAtMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO user_collection(user_id,game_key,added_at_ms) VALUES(?,?,?)",
                Statement.RETURN_GENERATED_KEYS)) {
            ps.setLong(1, userId);
            ps.setLong(2, gameKey);
            ps.setLong(3, addedAtMs);
            ps.executeUpdate();
            return generatedId(ps);
        }
    }

    public long insertProgress(Connection c, long userId, long gameKey, boolean completed, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO game_progress(user_id,game_key,started,started_at_ms,completed,completed_at_ms,updated_at_ms) VALUES(?,?,1,?,?,?,?)",
                Statement.RETURN_GENERATED_KEYS)) {
            ps.setLong(1, userId);
            ps.setLong(2, gameKey);
            ps.setLong(3, nowMs);
            ps.setInt(4, completed ? 1 : 0);
            if (completed) {
                ps.setLong(5, nowMs);
            } else {
                ps.setNull(5, Types.BIGINT);
            }
            ps.setLong(6, nowMs);
            ps.executeUpdate();
            return generatedId(ps);
        }
    }

    /**
     * Sets {@code started} (and {@code completed} when asked) on an existing progress row. Flags
     * already set keep their original timestamps.
     */
    public void markProgress(Connection c, long recordId, boolean completed, long nowMs) throws SQLException {
        String sql = completed
                ? """
                  UPDATE game_progress SET
                      started=1,
                      started_at_ms=COALESCE(started_at_ms, ?),
                      completed=1,
                      completed_at_ms=COALESCE(completed_at_ms, ?),
                      updated_at_ms=?
                  WHERE id=?
                  """
                : """
                  UPDATE game_progress SET
                      started=1,
                      started_at_ms=COALESCE(started_at_ms, ?),
                      updated_at_ms=?
                  WHERE id=?
                  """;
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            int i = 1;
            ps.setLong(i++, nowMs);
            if (completed) {
                ps.setLong(i++, nowMs);
            }
            ps.setLong(i++, nowMs);
            ps.setLong(i, recordId);
            ps.executeUpdate();
        }
    }

    public int delete(Connection c, StateKind kind, long recordId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("DELETE FROM " + kind.table() + " WHERE id=?")) {
            ps.setLong(1, recordId);
            return ps.executeUpdate();
        }
    }

    public int deleteByKey(Connection c, StateKind kind, long userId, long gameKey) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "DELETE FROM " + kind.table() + " WHERE user_id=? AND game_key=?")) {
            ps.setLong(1, userId);
            ps.setLong(2, gameKey);
            return ps.executeUpdate();
        }
    }

    public int deleteAll(Connection c, StateKind kind) throws SQLException {
        try (Statement st = c.createStatement()) {
            return st.executeUpdate("DELETE FROM " + kind.table());
        }
    }

    /**
     * Keys held by more than one active record across all sets, including same-set duplicates.
     */
    public List<GameKeyRef> findConflictingKeys(Connection c, int limit) throws SQLException {
        String sql = """
                SELECT user_id, game_key FROM (
                    SELECT user_id, game_key FROM user_wishlist
                    UNION ALL
                    SELECT user_id, game_key FROM user_collection
                    UNION ALL
                    SELECT user_id, game_key FROM game_progress WHERE %s
                )
                GROUP BY user_id, game_key
                HAVING COUNT(*) > 1
                ORDER BY user_id, game_key
                LIMIT ?
                """.formatted(ACTIVE_PROGRESS);
        List<GameKeyRef> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new GameKeyRef(rs.getLong("user_id"), rs.getLong("game_key")));
                }
            }
        }
        return out;
    }

    public int countConflictingKeys(Connection c) throws SQLException {
        String sql = """
                SELECT COUNT(*) FROM (
                    SELECT user_id, game_key FROM (
                        SELECT user_id, game_key FROM user_wishlist
                        UNION ALL
                        SELECT user_id, game_key FROM user_collection
                        UNION ALL
                        SELECT user_id, game_key FROM game_progress WHERE %s
                    )
                    GROUP BY user_id, game_key
                    HAVING COUNT(*) > 1
                )
                """.formatted(ACTIVE_PROGRESS);
        try (Statement st = c.createStatement(); ResultSet rs = st.executeQuery(sql)) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    /**
     * Distinct keys present (and active) in both sets.
     */
    public List<GameKeyRef> findOverlap(Connection c, StateKind left, StateKind right) throws SQLException {
        if (left == right) {
            throw new IllegalArgumentException("Overlap needs two different sets");
        }
        String sql = "SELECT DISTINCT a.user_id, a.game_key FROM " + left.table() + " a"
                + " JOIN " + right.table() + " b ON a.user_id=b.user_id AND a.game_key=b.game_key"
                + " WHERE " + activeFilter(left, "a") + " AND " + activeFilter(right, "b")
                + " ORDER BY a.user_id, a.game_key";
        List<GameKeyRef> out = new ArrayList<>();
        try (Statement st = c.createStatement(); ResultSet rs = st.executeQuery(sql)) {
            while (rs.next()) {
                out.add(new GameKeyRef(rs.getLong(1), rs.getLong(2)));
            }
        }
        return out;
    }

    public int countDuplicateKeys(Connection c, StateKind kind) throws SQLException {
        String sql = "SELECT COUNT(*) FROM (SELECT user_id, game_key FROM " + kind.table()
                + " WHERE " + activeFilter(kind, kind.table())
                + " GROUP BY user_id, game_key HAVING COUNT(*) > 1)";
        try (Statement st = c.createStatement(); ResultSet rs = st.executeQuery(sql)) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    public Map<StateKind, Integer> countRows(Connection c) throws SQLException {
        Map<StateKind, Integer> out = new EnumMap<>(StateKind.class);
        for (StateKind kind : StateKind.values()) {
            try (Statement st = c.createStatement();
                 ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM " + kind.table())) {
                out.put(kind, rs.next() ? rs.getInt(1) : 0);
            }
        }
        return out;
    }

    public Map<StateKind, Integer> countRows() {
        try (Connection c = database.openConnection()) {
            return countRows(c);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count tracking rows", e);
        }
    }

    public Map<StateKind, Map<Long, Integer>> countRowsByUser(Connection c) throws SQLException {
        Map<StateKind, Map<Long, Integer>> out = new EnumMap<>(StateKind.class);
        for (StateKind kind : StateKind.values()) {
            out.put(kind, countByUser(c, "SELECT user_id, COUNT(*) FROM " + kind.table() + " GROUP BY user_id", null));
        }
        return out;
    }

    static Map<Long, Integer> countByUser(Connection c, String sql, String param) throws SQLException {
        Map<Long, Integer> out = new TreeMap<>();
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            if (param != null) {
                ps.setString(1, param);
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.put(rs.getLong(1), rs.getInt(2));
                }
            }
        }
        return out;
    }

    static TrackingRecord map(StateKind kind, ResultSet rs) throws SQLException {
        long id = rs.getLong("id");
        long userId = rs.getLong("user_id");
        long gameKey = rs.getLong("game_key");
        return switch (kind) {
            case WISHLIST -> TrackingRecord.wishlist(
                    id,
                    userId,
                    gameKey,
                    rs.getLong("added_at_ms"),
                    nullableInt(rs, "priority"),
                    rs.getString("notes")
            );
            case COLLECTION -> TrackingRecord.collection(id, userId, gameKey, rs.getLong("added_at_ms"));
            case PROGRESS -> TrackingRecord.progress(
                    id,
                    userId,
                    gameKey,
                    rs.getInt("started") == 1,
                    nullableLong(rs, "started_at_ms"),
                    rs.getInt("completed") == 1,
                    nullableLong(rs, "completed_at_ms"),
                    rs.getLong("updated_at_ms")
            );
        };
    }

    private static String activeFilter(StateKind kind, String alias) {
        if (kind != StateKind.PROGRESS) {
            return "1=1";
        }
        return "(" + alias + ".started=1 OR " + alias + ".completed=1)";
    }

    private static long generatedId(PreparedStatement ps) throws SQLException {
        try (ResultSet keys = ps.getGeneratedKeys()) {
            if (!keys.next()) {
                throw new SQLException("Insert did not return a generated id");
            }
            return keys.getLong(1);
        }
    }

    private static void setNullableInt(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setInt(index, value);
        }
    }

    static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }
}
