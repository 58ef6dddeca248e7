package io.gamevault.state.engine;

import io.gamevault.state.model.SnapshotInfo;
import io.gamevault.state.model.StateKind;
import io.gamevault.state.model.TrackingRecord;
import io.gamevault.state.storage.SnapshotStore;
import io.gamevault.state.storage.TrackingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Copies the three tracking sets into backup tables before any destructive resolution. A snapshot
 * is only usable once its copied row counts have been checked against the live counts read in the
 * same transaction.
 */
public final class StateBackupService {
    private static final Logger LOG = LoggerFactory.getLogger(StateBackupService.class);

    private final TrackingStore trackingStore;
    private final SnapshotStore snapshotStore;

    public StateBackupService(TrackingStore trackingStore, SnapshotStore snapshotStore) {
        this.trackingStore = trackingStore;
        this.snapshotStore = snapshotStore;
    }

    public SnapshotInfo snapshot(String label, long nowMs) {
        String snapshotId = "snap_" + UUID.randomUUID();
        try (Connection c = trackingStore.database().openConnection()) {
            c.setAutoCommit(false);
            try {
                snapshotStore.insertHeader(c, snapshotId, label, nowMs);
                Map<StateKind, Integer> source = trackingStore.countRows(c);
                Map<StateKind, Integer> copied = new EnumMap<>(StateKind.class);
                for (StateKind kind : StateKind.values()) {
                    int inserted = snapshotStore.copyLiveRows(c, kind, snapshotId, nowMs);
                    int stored = snapshotStore.countBackupRows(c, kind, snapshotId);
                    int expected = source.getOrDefault(kind, 0);
                    if (inserted != expected || stored != expected) {
                        throw new BackupFailureException("Snapshot " + snapshotId + " row count mismatch for "
                                + kind.label() + ": source=" + expected + ", copied=" + inserted + ", stored=" + stored);
                    }
                    copied.put(kind, stored);
                }
                snapshotStore.markVerified(c, snapshotId, copied);
                c.commit();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (BackupFailureException e) {
            throw e;
        } catch (SQLException | RuntimeException e) {
            throw new BackupFailureException("Snapshot " + snapshotId + " failed: " + e.getMessage(), e);
        }
        SnapshotInfo info = snapshotStore.find(snapshotId)
                .orElseThrow(() -> new BackupFailureException("Snapshot " + snapshotId + " missing after commit"));
        LOG.info("Snapshot {} verified: wishlist={}, collection={}, progress={}",
                snapshotId, info.wishlistRows(), info.collectionRows(), info.progressRows());
        return info;
    }

    /**
     * Returns the named snapshot if the resolver may rely on it, otherwise fails with
     * {@link BackupFailureException}.
     */
    public SnapshotInfo requireUsable(String snapshotId) {
        if (snapshotId == null || snapshotId.isBlank()) {
            throw new BackupFailureException("A verified snapshot is required before resolving conflicts");
        }
        SnapshotInfo info = snapshotStore.find(snapshotId.trim())
                .orElseThrow(() -> new BackupFailureException("Unknown snapshot: " + snapshotId));
        if (!info.verified()) {
            throw new BackupFailureException("Snapshot " + snapshotId + " was never verified");
        }
        if (info.discardedAtMs() != null) {
            throw new BackupFailureException("Snapshot " + snapshotId + " has been discarded");
        }
        return info;
    }

    /**
     * Fails with {@link BackupFailureException} when {@code record} was written after the snapshot
     * was taken and deleting it would lose data.
     */
    void requireCovered(Connection c, String snapshotId, TrackingRecord record) throws SQLException {
        if (!snapshotStore.containsRecord(c, record.kind(), snapshotId, record.recordId(), record.userId(), record.gameKey())) {
            throw new BackupFailureException("Snapshot " + snapshotId + " has no copy of " + record.kind().label()
                    + " record " + record.recordId() + " for user " + record.userId() + ", game " + record.gameKey()
                    + "; take a new snapshot before resolving");
        }
    }

    public Optional<SnapshotInfo> latestUsable() {
        return snapshotStore.latestUsable();
    }

    public Optional<SnapshotInfo> find(String snapshotId) {
        return snapshotStore.find(snapshotId);
    }

    public List<SnapshotInfo> list(int limit) {
        return snapshotStore.list(limit);
    }

    public boolean discard(String snapshotId, long nowMs) {
        boolean discarded = snapshotStore.discard(snapshotId, nowMs);
        if (discarded) {
            LOG.info("Snapshot {} discarded", snapshotId);
        }
        return discarded;
    }
}
