package io.gamevault.state.engine;

import io.gamevault.state.model.SnapshotInfo;
import io.gamevault.state.model.StateKind;
import io.gamevault.state.storage.EngineStateStore;
import io.gamevault.state.storage.SnapshotStore;
import io.gamevault.state.storage.TrackingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Undoes the engine in two strengths.
 *
 * <p>Soft rollback switches write-time enforcement off and touches no data. Hard rollback
 * replaces the live tracking sets with a snapshot and then performs a soft rollback.
 *
 * <p><b>Hard rollback loses data.</b> Every tracking write committed after the snapshot was taken
 * is discarded. It must run with exclusive access to the tracking sets, in a maintenance window.
 */
public final class RollbackManager {
    private static final Logger LOG = LoggerFactory.getLogger(RollbackManager.class);

    private final TrackingStore trackingStore;
    private final SnapshotStore snapshotStore;
    private final EngineStateStore engineState;
    private final Clock clock;

    public RollbackManager(TrackingStore trackingStore, SnapshotStore snapshotStore, EngineStateStore engineState, Clock clock) {
        this.trackingStore = trackingStore;
        this.snapshotStore = snapshotStore;
        this.engineState = engineState;
        this.clock = clock;
    }

    public EnforcementChange softRollback() {
        return setEnforcement(EngineStateStore.DISABLED);
    }

    public EnforcementChange enableEnforcement() {
        return setEnforcement(EngineStateStore.ENABLED);
    }

    public boolean enforcementEnabled() {
        return engineState.get(EngineStateStore.ENFORCEMENT_KEY)
                .map(v -> EngineStateStore.ENABLED.equals(v.value()))
                .orElse(true);
    }

    private EnforcementChange setEnforcement(String target) {
        Optional<String> previous = engineState.put(EngineStateStore.ENFORCEMENT_KEY, target, clock.millis());
        String before = previous.orElse(EngineStateStore.ENABLED);
        boolean changed = !Objects.equals(before, target);
        if (changed) {
            LOG.warn("Exclusivity enforcement switched from {} to {}", before, target);
        }
        return new EnforcementChange(before, target, changed);
    }

    public HardRollbackOutcome hardRollback(String snapshotId) {
        if (snapshotId == null || snapshotId.isBlank()) {
            throw new IllegalArgumentException("snapshotId must not be blank");
        }
        String id = snapshotId.trim();
        long nowMs = clock.millis();
        SnapshotInfo snapshot;
        Map<StateKind, Integer> deleted = new EnumMap<>(StateKind.class);
        Map<StateKind, Integer> restored = new EnumMap<>(StateKind.class);
        try (Connection c = trackingStore.database().openConnection()) {
            c.setAutoCommit(false);
            try {
                snapshot = snapshotStore.find(c, id)
                        .orElseThrow(() -> new IllegalArgumentException("Unknown snapshot: " + id));
                if (!snapshot.usable()) {
                    throw new IllegalArgumentException("Snapshot " + id + " is not restorable (verified="
                            + snapshot.verified() + ", discarded=" + (snapshot.discardedAtMs() != null) + ")");
                }
                for (StateKind kind : StateKind.values()) {
                    deleted.put(kind, trackingStore.deleteAll(c, kind));
                }
                for (StateKind kind : StateKind.values()) {
                    restored.put(kind, snapshotStore.restoreRows(c, kind, id));
                }
                verifyRestore(c, snapshot);
                snapshotStore.markRestored(c, id, nowMs);
                c.commit();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RollbackFailureException("Hard rollback to " + id + " failed: " + e.getMessage(), e);
        }
        LOG.warn("Hard rollback restored snapshot {}: deleted={}, restored={}", id, deleted, restored);
        EnforcementChange enforcement = softRollback();
        return new HardRollbackOutcome(id, deleted, restored, snapshot.restoreCount() > 0, enforcement, nowMs);
    }

    private void verifyRestore(Connection c, SnapshotInfo snapshot) throws SQLException {
        Map<StateKind, Integer> live = trackingStore.countRows(c);
        for (StateKind kind : StateKind.values()) {
            int expected = snapshot.rowsFor(kind);
            int actual = live.getOrDefault(kind, 0);
            if (expected != actual) {
                throw new RollbackFailureException("Restore of " + snapshot.snapshotId() + " left " + actual + " "
                        + kind.label() + " rows, snapshot has " + expected);
            }
        }
        Map<StateKind, Map<Long, Integer>> liveByUser = trackingStore.countRowsByUser(c);
        Map<StateKind, Map<Long, Integer>> snapshotByUser = snapshotStore.countBackupRowsByUser(c, snapshot.snapshotId());
        for (StateKind kind : StateKind.values()) {
            if (!liveByUser.get(kind).equals(snapshotByUser.get(kind))) {
                throw new RollbackFailureException("Restore of " + snapshot.snapshotId() + " has per-user "
                        + kind.label() + " counts that differ from the snapshot");
            }
        }
    }

    public record EnforcementChange(String previous, String current, boolean changed) {
    }

    /**
     * @param previouslyRestored the snapshot had already been restored before this call
     */
    public record HardRollbackOutcome(
            String snapshotId,
            Map<StateKind, Integer> deletedRows,
            Map<StateKind, Integer> restoredRows,
            boolean previouslyRestored,
            EnforcementChange enforcement,
            long restoredAtMs
    ) {
    }
}
