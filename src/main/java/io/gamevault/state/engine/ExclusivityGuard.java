package io.gamevault.state.engine;

import io.gamevault.state.model.GameKeyRef;
import io.gamevault.state.model.StateKind;
import io.gamevault.state.model.TrackingRecord;
import io.gamevault.state.storage.EngineStateStore;
import io.gamevault.state.storage.TrackingStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Write-time enforcement of one state per (user, game).
 *
 * <p>Runs inside the writer's transaction while the key's advisory lock is held:
 * <ul>
 *   <li>an existing record of a strictly higher kind rejects the write with
 *       {@link StateConflictException};</li>
 *   <li>existing records of a strictly lower kind are deleted with the write (promotion);</li>
 *   <li>an existing record of the same kind is updated in place; older rows of that kind for the
 *       same key are deleted with the write.</li>
 * </ul>
 * Every accepted enforced write is handed to {@link StateHistoryRecorder} in the same transaction.
 */
public final class ExclusivityGuard {
    private static final Comparator<TrackingRecord> NEWEST_FIRST = Comparator
            .comparingLong(TrackingRecord::recordedAtMs)
            .thenComparingLong(TrackingRecord::recordId)
            .reversed();

    private final TrackingStore trackingStore;
    private final EngineStateStore engineState;
    private final StateHistoryRecorder historyRecorder;

    public ExclusivityGuard(TrackingStore trackingStore, EngineStateStore engineState, StateHistoryRecorder historyRecorder) {
        this.trackingStore = trackingStore;
        this.engineState = engineState;
        this.historyRecorder = historyRecorder;
    }

    public GuardOutcome apply(Connection c, TrackingWrite write, long nowMs) throws SQLException {
        boolean enforced = !write.options().bypass() && engineState.enforcementEnabled(c);
        GameKeyRef key = write.key();
        StateKind target = write.target();
        List<TrackingRecord> existing = trackingStore.findByKey(c, key.userId(), key.gameKey());
        List<TrackingRecord> active = existing.stream().filter(TrackingRecord::active).toList();
        StateKind previous = active.stream()
                .map(TrackingRecord::kind)
                .max(Comparator.comparingInt(StateKind::priority))
                .orElse(null);

        List<TrackingRecord> demoted = new ArrayList<>();
        if (enforced) {
            Optional<TrackingRecord> blocker = active.stream()
                    .filter(r -> r.kind().outranks(target))
                    .max(Comparator.comparingInt((TrackingRecord r) -> r.kind().priority()));
            if (blocker.isPresent()) {
                throw new StateConflictException(key, target, blocker.get().kind(), blocker.get().recordId());
            }
            for (TrackingRecord lower : active) {
                if (target.outranks(lower.kind())) {
                    trackingStore.delete(c, lower.kind(), lower.recordId());
                    demoted.add(lower);
                }
            }
        }

        // Active rows outrank inert progress rows; an inert row is reused rather than shadowed.
        List<TrackingRecord> sameKind = existing.stream()
                .filter(r -> r.kind() == target)
                .sorted(Comparator.comparing((TrackingRecord r) -> !r.active()).thenComparing(NEWEST_FIRST))
                .toList();
        List<TrackingRecord> duplicates = new ArrayList<>();
        if (enforced) {
            for (TrackingRecord older : sameKind.subList(Math.min(1, sameKind.size()), sameKind.size())) {
                trackingStore.delete(c, older.kind(), older.recordId());
                duplicates.add(older);
            }
        }
        long recordId = writeRecord(c, write, sameKind.isEmpty() ? null : sameKind.get(0), nowMs);

        long historyId = -1L;
        if (enforced) {
            historyId = historyRecorder.record(c, key.userId(), key.gameKey(), previous, target, nowMs);
        }
        return new GuardOutcome(key, previous, target, recordId, List.copyOf(demoted), List.copyOf(duplicates), enforced,
                historyId, nowMs);
    }

    private long writeRecord(Connection c, TrackingWrite write, TrackingRecord current, long nowMs) throws SQLException {
        GameKeyRef key = write.key();
        return switch (write.target()) {
            case WISHLIST -> {
                if (current == null) {
                    yield trackingStore.insertWishlist(c, key.userId(), key.gameKey(), nowMs, write.priority(), write.notes());
                }
                trackingStore.updateWishlistDetails(c, current.recordId(), write.priority(), write.notes());
                yield current.recordId();
            }
            case COLLECTION -> current == null
                    ? trackingStore.insertCollection(c, key.userId(), key.gameKey(), nowMs)
                    : current.recordId();
            case PROGRESS -> {
                if (current == null) {
                    yield trackingStore.insertProgress(c, key.userId(), key.gameKey(), write.completed(), nowMs);
                }
                trackingStore.markProgress(c, current.recordId(), write.completed(), nowMs);
                yield current.recordId();
            }
        };
    }
}
