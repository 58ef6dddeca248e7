package io.gamevault.state.engine;

import io.gamevault.state.model.SnapshotInfo;
import io.gamevault.state.model.StateKind;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.util.Map;

final class RollbackManagerTest {

    @Test
    void softRollbackIsIdempotentAndTouchesNoData() throws Exception {
        try (EngineHarness h = EngineHarness.create("gamevault-soft-rollback-")) {
            h.tracking.addToCollection(1L, 1L);
            Map<StateKind, Integer> before = h.rowCounts();

            RollbackManager.EnforcementChange first = h.rollback.softRollback();
            RollbackManager.EnforcementChange second = h.rollback.softRollback();

            Assertions.assertTrue(first.changed());
            Assertions.assertEquals("enabled", first.previous());
            Assertions.assertFalse(second.changed());
            Assertions.assertEquals("disabled", second.current());
            Assertions.assertFalse(h.rollback.enforcementEnabled());
            Assertions.assertEquals(before, h.rowCounts());

            Assertions.assertTrue(h.rollback.enableEnforcement().changed());
            Assertions.assertTrue(h.rollback.enforcementEnabled());
        }
    }

    @Test
    void hardRollbackRestoresSnapshotCountsForEveryUser() throws Exception {
        try (EngineHarness h = EngineHarness.create("gamevault-hard-rollback-")) {
            long wishlistId = h.seedWishlist(7L, 100L, 100L);
            h.seedProgress(7L, 100L, false, 50L);
            h.seedCollection(8L, 200L, 100L);
            h.seedWishlist(9L, 300L, 100L);
            SnapshotInfo snap = h.backup.snapshot("pre", h.clock.millis());
            Map<StateKind, Map<Long, Integer>> expectedByUser;
            try (Connection c = h.database.openConnection()) {
                expectedByUser = h.trackingStore.countRowsByUser(c);
            }

            h.resolver.resolve(snap.snapshotId(), 10, null);
            h.tracking.addToCollection(10L, 400L);
            h.tracking.markCompleted(9L, 300L);

            RollbackManager.HardRollbackOutcome out = h.rollback.hardRollback(snap.snapshotId());

            Assertions.assertFalse(out.previouslyRestored());
            Assertions.assertEquals(snap.rowsFor(StateKind.WISHLIST), h.rowCounts().get(StateKind.WISHLIST));
            Assertions.assertEquals(snap.rowsFor(StateKind.COLLECTION), h.rowCounts().get(StateKind.COLLECTION));
            Assertions.assertEquals(snap.rowsFor(StateKind.PROGRESS), h.rowCounts().get(StateKind.PROGRESS));
            try (Connection c = h.database.openConnection()) {
                Assertions.assertEquals(expectedByUser, h.trackingStore.countRowsByUser(c));
            }
            Assertions.assertEquals(wishlistId, h.tracking.listByState(7L, StateKind.WISHLIST).get(0).recordId());
            Assertions.assertFalse(h.rollback.enforcementEnabled());
            Assertions.assertTrue(out.enforcement().changed());

            RollbackManager.HardRollbackOutcome again = h.rollback.hardRollback(snap.snapshotId());
            Assertions.assertTrue(again.previouslyRestored());
            Assertions.assertFalse(again.enforcement().changed());
        }
    }

    @Test
    void hardRollbackRejectsUnknownOrDiscardedSnapshots() throws Exception {
        try (EngineHarness h = EngineHarness.create("gamevault-hard-rollback-invalid-")) {
            h.seedWishlist(1L, 1L, 100L);
            Assertions.assertThrows(IllegalArgumentException.class, () -> h.rollback.hardRollback("snap_missing"));

            SnapshotInfo snap = h.backup.snapshot("pre", h.clock.millis());
            h.backup.discard(snap.snapshotId(), h.clock.millis());
            Assertions.assertThrows(IllegalArgumentException.class, () -> h.rollback.hardRollback(snap.snapshotId()));
            Assertions.assertEquals(1, h.rowCounts().get(StateKind.WISHLIST));
            Assertions.assertTrue(h.rollback.enforcementEnabled());
        }
    }
}
