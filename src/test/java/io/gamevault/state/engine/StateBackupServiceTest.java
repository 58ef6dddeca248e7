package io.gamevault.state.engine;

import io.gamevault.state.model.SnapshotInfo;
import io.gamevault.state.model.StateKind;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.sql.Connection;

final class StateBackupServiceTest {

    @Test
    void snapshotCopiesEverySetAndIsVerified() throws Exception {
        try (EngineHarness h = EngineHarness.create("gamevault-backup-")) {
            h.seedWishlist(1L, 10L, 100L);
            h.seedWishlist(2L, 10L, 100L);
            h.seedCollection(1L, 11L, 100L);
            h.seedProgress(3L, 12L, true, 100L);

            SnapshotInfo snap = h.backup.snapshot("nightly", 5_000L);

            Assertions.assertTrue(snap.snapshotId().startsWith("snap_"));
            Assertions.assertTrue(snap.verified());
            Assertions.assertTrue(snap.usable());
            Assertions.assertEquals("nightly", snap.label());
            Assertions.assertEquals(5_000L, snap.createdAtMs());
            Assertions.assertEquals(2, snap.rowsFor(StateKind.WISHLIST));
            Assertions.assertEquals(1, snap.rowsFor(StateKind.COLLECTION));
            Assertions.assertEquals(1, snap.rowsFor(StateKind.PROGRESS));
            Assertions.assertEquals(4, snap.totalRows());
        }
    }

    @Test
    void laterLiveDeletesDoNotChangeTheSnapshot() throws Exception {
        try (EngineHarness h = EngineHarness.create("gamevault-backup-isolated-")) {
            h.seedWishlist(1L, 10L, 100L);
            SnapshotInfo snap = h.backup.snapshot("pre", 5_000L);

            h.tracking.removeFromWishlist(1L, 10L);

            try (Connection c = h.database.openConnection()) {
                Assertions.assertEquals(1, h.snapshotStore.countBackupRows(c, StateKind.WISHLIST, snap.snapshotId()));
            }
            Assertions.assertEquals(0, h.rowCounts().get(StateKind.WISHLIST));
        }
    }

    @Test
    void latestUsableSkipsDiscardedSnapshots() throws Exception {
        try (EngineHarness h = EngineHarness.create("gamevault-backup-latest-")) {
            SnapshotInfo older = h.backup.snapshot("a", 1_000L);
            SnapshotInfo newer = h.backup.snapshot("b", 2_000L);
            Assertions.assertEquals(newer.snapshotId(), h.backup.latestUsable().orElseThrow().snapshotId());

            Assertions.assertTrue(h.backup.discard(newer.snapshotId(), 3_000L));
            Assertions.assertFalse(h.backup.discard(newer.snapshotId(), 4_000L));
            Assertions.assertEquals(older.snapshotId(), h.backup.latestUsable().orElseThrow().snapshotId());
            Assertions.assertEquals(2, h.backup.list(10).size());
            Assertions.assertThrows(IllegalArgumentException.class, () -> h.backup.discard("snap_unknown", 5_000L));
        }
    }

    @Test
    void storageFailureIsReportedAsBackupFailure() throws Exception {
        try (EngineHarness h = EngineHarness.create("gamevault-backup-fail-")) {
            h.seedCollection(1L, 10L, 100L);
            try (Connection c = h.database.openConnection()) {
                c.createStatement().execute("DROP TABLE backup_collection");
            }

            BackupFailureException ex = Assertions.assertThrows(BackupFailureException.class, () -> h.backup.snapshot("x", 1L));
            Assertions.assertEquals("BackupFailure", ex.kind());
            Assertions.assertTrue(h.backup.list(10).isEmpty());
            Assertions.assertTrue(h.backup.latestUsable().isEmpty());
        }
    }
}
