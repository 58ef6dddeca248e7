package io.gamevault.state.engine;

import io.gamevault.state.model.GameKeyRef;
import io.gamevault.state.model.StateKind;
import io.gamevault.state.storage.TrackingStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Read-only scan for keys tracked in more than one set. Serves as the pre-flight report of a
 * cleanup run and as its acceptance check afterwards, where every count must be zero.
 */
public final class ConflictAuditor {
    private static final List<StateKind[]> PAIRS = List.of(
            new StateKind[]{StateKind.WISHLIST, StateKind.COLLECTION},
            new StateKind[]{StateKind.COLLECTION, StateKind.PROGRESS},
            new StateKind[]{StateKind.WISHLIST, StateKind.PROGRESS}
    );

    private final TrackingStore trackingStore;

    public ConflictAuditor(TrackingStore trackingStore) {
        this.trackingStore = trackingStore;
    }

    public AuditReport audit(long nowMs) {
        try (Connection c = trackingStore.database().openConnection()) {
            Map<String, PairOverlap> pairs = new LinkedHashMap<>();
            for (StateKind[] pair : PAIRS) {
                List<GameKeyRef> keys = trackingStore.findOverlap(c, pair[0], pair[1]);
                TreeSet<Long> users = new TreeSet<>();
                for (GameKeyRef key : keys) {
                    users.add(key.userId());
                }
                pairs.put(StateKind.pairLabel(pair[0], pair[1]), new PairOverlap(keys.size(), List.copyOf(users)));
            }
            Map<StateKind, Integer> duplicates = new EnumMap<>(StateKind.class);
            for (StateKind kind : StateKind.values()) {
                duplicates.put(kind, trackingStore.countDuplicateKeys(c, kind));
            }
            int conflictingKeys = trackingStore.countConflictingKeys(c);
            return new AuditReport(pairs, duplicates, conflictingKeys, nowMs);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to audit tracking sets", e);
        }
    }

    public record PairOverlap(int count, List<Long> affectedUsers) {
    }

    /**
     * @param pairs           overlap per pair type, keyed by label such as {@code Wishlist-Progress}
     * @param duplicates      keys repeated inside a single set
     * @param conflictingKeys distinct keys held by more than one record anywhere
     */
    public record AuditReport(
            Map<String, PairOverlap> pairs,
            Map<StateKind, Integer> duplicates,
            int conflictingKeys,
            long checkedAtMs
    ) {
        public boolean clean() {
            return conflictingKeys == 0;
        }

        public int pairCount(String label) {
            PairOverlap overlap = pairs.get(label);
            return overlap == null ? 0 : overlap.count();
        }
    }
}
