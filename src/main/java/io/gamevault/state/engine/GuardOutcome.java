package io.gamevault.state.engine;

import io.gamevault.state.model.GameKeyRef;
import io.gamevault.state.model.StateKind;
import io.gamevault.state.model.TrackingRecord;

import java.util.List;

/**
 * Result of an accepted write.
 *
 * @param enforced   false when the write skipped the guard (enforcement disabled or bypassed)
 * @param demoted    lower-priority records removed by promotion
 * @param duplicates older records of the written kind removed so one row remains
 * @param historyId  id of the recorded history entry, or -1 when none was recorded
 */
public record GuardOutcome(
        GameKeyRef key,
        StateKind previous,
        StateKind current,
        long recordId,
        List<TrackingRecord> demoted,
        List<TrackingRecord> duplicates,
        boolean enforced,
        long historyId,
        long atMs
) {
    public boolean promoted() {
        return !demoted.isEmpty();
    }
}
