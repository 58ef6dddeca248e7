package io.gamevault.state.storage;

import io.gamevault.state.model.SnapshotInfo;
import io.gamevault.state.model.StateKind;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Snapshot headers plus the per-set backup tables. Backup rows are copies, never references, so
 * deleting from a live set cannot change a snapshot.
 */
public final class SnapshotStore {
    private static final String HEADER_COLUMNS =
            "snapshot_id,label,created_at_ms,wishlist_rows,collection_rows,progress_rows,verified,restored_at_ms,restore_count,discarded_at_ms";

    private final Database database;

    public SnapshotStore(Database database) {
        this.database = database;
    }

    public void insertHeader(Connection c, String snapshotId, String label, long createdAtMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO backup_snapshots(snapshot_id,label,created_at_ms) VALUES(?,?,?)")) {
            ps.setString(1, snapshotId);
            ps.setString(2, label == null ? "" : label);
            ps.setLong(3, createdAtMs);
            ps.executeUpdate();
        }
    }

    /**
     * Copies every live row of {@code kind} into its backup table. Returns the number of copies.
     */
    public int copyLiveRows(Connection c, StateKind kind, String snapshotId, long snapshotAtMs) throws SQLException {
        String sql = switch (kind) {
            case WISHLIST -> """
                    INSERT INTO backup_wishlist(snapshot_id,snapshot_at_ms,id,user_id,game_key,added_at_ms,priority,notes)
                    SELECT ?,?,id,user_id,game_key,added_at_ms,priority,notes FROM user_wishlist
                    """;
            case COLLECTION -> """
                    INSERT INTO backup_collection(snapshot_id,snapshot_at_ms,id,user_id,game_key,added_at_ms)
                    SELECT ?,?,id,user_id,game_key,added_at_ms FROM user_collection
                    """;
            case PROGRESS -> """
                    INSERT INTO backup_progress(snapshot_id,snapshot_at_ms,id,user_id,game_key,started,started_at_ms,completed,completed_at_ms,updated_at_ms)
                    SELECT ?,?,id,user_id,game_key,started,started_at_ms,completed,completed_at_ms,updated_at_ms FROM game_progress
                    """;
        };
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, snapshotId);
            ps.setLong(2, snapshotAtMs);
            return ps.executeUpdate();
        }
    }

    /**
     * Re-inserts the snapshot rows of {@code kind} into the live set, keeping their original ids.
     */
    public int restoreRows(Connection c, StateKind kind, String snapshotId) throws SQLException {
        String sql = switch (kind) {
            case WISHLIST -> """
                    INSERT INTO user_wishlist(id,user_id,game_key,added_at_ms,priority,notes)
                    SELECT id,user_id,game_key,added_at_ms,priority,notes FROM backup_wishlist WHERE snapshot_id=? ORDER BY id
                    """;
            case COLLECTION -> """
                    INSERT INTO user_collection(id,user_id,game_key,added_at_ms)
                    SELECT id,user_id,game_key,added_at_ms FROM backup_collection WHERE snapshot_id=? ORDER BY id
                    """;
            case PROGRESS -> """
                    INSERT INTO game_progress(id,user_id,game_key,started,started_at_ms,completed,completed_at_ms,updated_at_ms)
                    SELECT id,user_id,game_key,started,started_at_ms,completed,completed_at_ms,updated_at_ms FROM backup_progress WHERE snapshot_id=? ORDER BY id
                    """;
        };
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, snapshotId);
            return ps.executeUpdate();
        }
    }

    public int countBackupRows(Connection c, StateKind kind, String snapshotId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT COUNT(*) FROM " + backupTable(kind) + " WHERE snapshot_id=?")) {
            ps.setString(1, snapshotId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        }
    }

    /**
     * Whether the snapshot holds a copy of the live record {@code recordId} for the same key.
     */
    public boolean containsRecord(Connection c, StateKind kind, String snapshotId, long recordId, long userId,
                                  long gameKey) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT 1 FROM " + backupTable(kind) + " WHERE snapshot_id=? AND id=? AND user_id=? AND game_key=?")) {
            ps.setString(1, snapshotId);
            ps.setLong(2, recordId);
            ps.setLong(3, userId);
            ps.setLong(4, gameKey);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    public Map<StateKind, Map<Long, Integer>> countBackupRowsByUser(Connection c, String snapshotId) throws SQLException {
        Map<StateKind, Map<Long, Integer>> out = new EnumMap<>(StateKind.class);
        for (StateKind kind : StateKind.values()) {
            out.put(kind, TrackingStore.countByUser(c,
                    "SELECT user_id, COUNT(*) FROM " + backupTable(kind) + " WHERE snapshot_id=? GROUP BY user_id",
                    snapshotId));
        }
        return out;
    }

    public void markVerified(Connection c, String snapshotId, Map<StateKind, Integer> counts) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "UPDATE backup_snapshots SET wishlist_rows=?, collection_rows=?, progress_rows=?, verified=1 WHERE snapshot_id=?")) {
            ps.setInt(1, counts.getOrDefault(StateKind.WISHLIST, 0));
            ps.setInt(2, counts.getOrDefault(StateKind.COLLECTION, 0));
            ps.setInt(3, counts.getOrDefault(StateKind.PROGRESS, 0));
            ps.setString(4, snapshotId);
            ps.executeUpdate();
        }
    }

    public void markRestored(Connection c, String snapshotId, long restoredAtMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "UPDATE backup_snapshots SET restored_at_ms=?, restore_count=restore_count+1 WHERE snapshot_id=?")) {
            ps.setLong(1, restoredAtMs);
            ps.setString(2, snapshotId);
            ps.executeUpdate();
        }
    }

    /**
     * Drops the copied rows and stamps the header. Returns false when the snapshot was already
     * discarded.
     */
    public boolean discard(String snapshotId, long nowMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                Optional<SnapshotInfo> current = find(c, snapshotId);
                if (current.isEmpty()) {
                    throw new IllegalArgumentException("Unknown snapshot: " + snapshotId);
                }
                if (current.get().discardedAtMs() != null) {
                    c.commit();
                    return false;
                }
                for (StateKind kind : StateKind.values()) {
                    try (PreparedStatement ps = c.prepareStatement(
                            "DELETE FROM " + backupTable(kind) + " WHERE snapshot_id=?")) {
                        ps.setString(1, snapshotId);
                        ps.executeUpdate();
                    }
                }
                try (PreparedStatement ps = c.prepareStatement(
                        "UPDATE backup_snapshots SET discarded_at_ms=? WHERE snapshot_id=?")) {
                    ps.setLong(1, nowMs);
                    ps.setString(2, snapshotId);
                    ps.executeUpdate();
                }
                c.commit();
                return true;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to discard snapshot: " + snapshotId, e);
        }
    }

    public Optional<SnapshotInfo> find(Connection c, String snapshotId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT " + HEADER_COLUMNS + " FROM backup_snapshots WHERE snapshot_id=?")) {
            ps.setString(1, snapshotId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapHeader(rs)) : Optional.empty();
            }
        }
    }

    public Optional<SnapshotInfo> find(String snapshotId) {
        try (Connection c = database.openConnection()) {
            return find(c, snapshotId);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read snapshot: " + snapshotId, e);
        }
    }

    public Optional<SnapshotInfo> latestUsable() {
        String sql = "SELECT " + HEADER_COLUMNS + " FROM backup_snapshots"
                + " WHERE verified=1 AND discarded_at_ms IS NULL ORDER BY created_at_ms DESC, rowid DESC LIMIT 1";
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? Optional.of(mapHeader(rs)) : Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read latest snapshot", e);
        }
    }

    public List<SnapshotInfo> list(int limit) {
        String sql = "SELECT " + HEADER_COLUMNS + " FROM backup_snapshots ORDER BY created_at_ms DESC, rowid DESC LIMIT ?";
        List<SnapshotInfo> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapHeader(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list snapshots", e);
        }
    }

    private static SnapshotInfo mapHeader(ResultSet rs) throws SQLException {
        return new SnapshotInfo(
                rs.getString("snapshot_id"),
                rs.getString("label"),
                rs.getLong("created_at_ms"),
                rs.getInt("wishlist_rows"),
                rs.getInt("collection_rows"),
                rs.getInt("progress_rows"),
                rs.getInt("verified") == 1,
                TrackingStore.nullableLong(rs, "restored_at_ms"),
                rs.getInt("restore_count"),
                TrackingStore.nullableLong(rs, "discarded_at_ms")
        );
    }

    private static String backupTable(StateKind kind) {
        return switch (kind) {
            case WISHLIST -> "backup_wishlist";
            case COLLECTION -> "backup_collection";
            case PROGRESS -> "backup_progress";
        };
    }
}
