package io.gamevault.state.engine;

import io.gamevault.state.model.StateHistoryEntry;
import io.gamevault.state.model.StateKind;
import io.gamevault.state.storage.AuditTrailStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * Append-only ledger of accepted state transitions. Reads are plain queries, so a timeline can be
 * re-read any number of times.
 */
public final class StateHistoryRecorder {
    private final AuditTrailStore auditTrail;

    public StateHistoryRecorder(AuditTrailStore auditTrail) {
        this.auditTrail = auditTrail;
    }

    /**
     * Appends one entry inside the writer's transaction, so the entry commits or rolls back with
     * the write it describes.
     */
    public long record(Connection c, long userId, long gameKey, StateKind previous, StateKind next, long atMs)
            throws SQLException {
        if (next == null) {
            throw new IllegalArgumentException("new state is required");
        }
        return auditTrail.appendHistory(c, userId, gameKey, previous, next, atMs);
    }

    public List<StateHistoryEntry> timeline(long userId, long gameKey) {
        return auditTrail.listHistory(userId, gameKey, false, 0);
    }

    public List<StateHistoryEntry> recent(long userId, int limit) {
        return auditTrail.listHistory(userId, null, true, Math.max(1, limit));
    }
}
