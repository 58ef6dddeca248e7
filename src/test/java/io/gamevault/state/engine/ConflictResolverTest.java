package io.gamevault.state.engine;

import io.gamevault.state.model.ConflictLogEntry;
import io.gamevault.state.model.SnapshotInfo;
import io.gamevault.state.model.StateKind;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.Statement;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

final class ConflictResolverTest {

    @Test
    void higherPriorityRecordSurvivesAndOneEntryIsLogged() throws Exception {
        try (EngineHarness h = EngineHarness.create("gamevault-resolve-priority-")) {
            long t0 = 500_000L;
            long t1 = 600_000L;
            long progressId = h.seedProgress(7L, 100L, false, t0);
            h.seedWishlist(7L, 100L, t1);
            SnapshotInfo snap = h.backup.snapshot("pre", h.clock.millis());

            ConflictResolver.ResolveOutcome out = h.resolver.resolve(snap.snapshotId(), 100, null);

            Assertions.assertEquals(1, out.pairsResolved());
            Assertions.assertEquals(1, out.logEntriesWritten());
            Assertions.assertEquals(0, h.rowsFor(StateKind.WISHLIST, 7L, 100L));
            Assertions.assertEquals(1, h.rowsFor(StateKind.PROGRESS, 7L, 100L));
            Assertions.assertEquals(progressId, h.tracking.listByState(7L, StateKind.PROGRESS).get(0).recordId());

            List<ConflictLogEntry> log = h.auditTrail.listConflictLog(7L, out.runId(), 10);
            Assertions.assertEquals(1, log.size());
            Assertions.assertEquals("Wishlist-Progress", log.get(0).conflictType());
            Assertions.assertEquals(StateKind.WISHLIST, log.get(0).originalState());
            Assertions.assertEquals(StateKind.PROGRESS, log.get(0).resolvedState());
            Assertions.assertEquals(ConflictLogEntry.REASON_HIGHER_PRIORITY, log.get(0).reason());
        }
    }

    @Test
    void secondRunIsANoOp() throws Exception {
        try (EngineHarness h = EngineHarness.create("gamevault-resolve-idem-")) {
            h.seedWishlist(1L, 10L, 100L);
            h.seedCollection(1L, 10L, 200L);
            h.seedWishlist(2L, 20L, 100L);
            h.seedProgress(2L, 20L, true, 50L);
            h.seedCollection(3L, 30L, 100L);
            h.seedProgress(3L, 30L, false, 300L);
            h.seedWishlist(4L, 40L, 100L);
            Assertions.assertEquals(3, h.auditor.audit(h.clock.millis()).conflictingKeys());
            SnapshotInfo snap = h.backup.snapshot("pre", h.clock.millis());

            ConflictResolver.ResolveOutcome first = h.resolver.resolve(snap.snapshotId(), 100, null);
            long logRows = h.auditTrail.countConflictLog();
            ConflictResolver.ResolveOutcome second = h.resolver.resolve(snap.snapshotId(), 100, null);

            Assertions.assertEquals(3, first.pairsResolved());
            Assertions.assertEquals(0, second.pairsResolved());
            Assertions.assertEquals(0, second.logEntriesWritten());
            Assertions.assertEquals(logRows, h.auditTrail.countConflictLog());
            ConflictAuditor.AuditReport after = h.auditor.audit(h.clock.millis());
            Assertions.assertTrue(after.clean());
            Assertions.assertEquals(0, after.pairCount("Wishlist-Collection"));
            Assertions.assertEquals(0, after.pairCount("Collection-Progress"));
            Assertions.assertEquals(0, after.pairCount("Wishlist-Progress"));
            Assertions.assertEquals(1, h.rowsFor(StateKind.WISHLIST, 4L, 40L));
        }
    }

    @Test
    void sameSetDuplicatesKeepTheMostRecentRow() throws Exception {
        try (EngineHarness h = EngineHarness.create("gamevault-resolve-dup-")) {
            h.seedCollection(9L, 90L, 100L);
            long newest = h.seedCollection(9L, 90L, 300L);
            h.seedCollection(9L, 90L, 200L);
            SnapshotInfo snap = h.backup.snapshot("pre", h.clock.millis());

            ConflictResolver.ResolveOutcome out = h.resolver.resolve(snap.snapshotId(), 10, null);

            Assertions.assertEquals(1, out.pairsResolved());
            Assertions.assertEquals(2, out.logEntriesWritten());
            var rows = h.tracking.listByState(9L, StateKind.COLLECTION);
            Assertions.assertEquals(1, rows.size());
            Assertions.assertEquals(newest, rows.get(0).recordId());
            for (ConflictLogEntry entry : h.auditTrail.listConflictLog(9L, out.runId(), 10)) {
                Assertions.assertEquals("Collection-Collection", entry.conflictType());
                Assertions.assertEquals(ConflictLogEntry.REASON_DUPLICATE, entry.reason());
            }
        }
    }

    @Test
    void refusesToRunWithoutAUsableSnapshot() throws Exception {
        try (EngineHarness h = EngineHarness.create("gamevault-resolve-nosnap-")) {
            h.seedWishlist(1L, 1L, 100L);
            h.seedCollection(1L, 1L, 200L);

            Assertions.assertThrows(BackupFailureException.class, () -> h.resolver.resolve(null, 10, null));
            Assertions.assertThrows(BackupFailureException.class, () -> h.resolver.resolve("snap_missing", 10, null));

            SnapshotInfo snap = h.backup.snapshot("pre", h.clock.millis());
            Assertions.assertTrue(h.backup.discard(snap.snapshotId(), h.clock.millis()));
            Assertions.assertThrows(BackupFailureException.class, () -> h.resolver.resolve(snap.snapshotId(), 10, null));
            Assertions.assertEquals(1, h.rowsFor(StateKind.WISHLIST, 1L, 1L));
            Assertions.assertEquals(0L, h.auditTrail.countConflictLog());
        }
    }

    @Test
    void recordsWrittenAfterTheSnapshotAreNotDeleted() throws Exception {
        try (EngineHarness h = EngineHarness.create("gamevault-resolve-stale-")) {
            SnapshotInfo stale = h.backup.snapshot("empty", h.clock.millis());
            h.seedProgress(7L, 100L, false, 500L);
            h.seedWishlist(7L, 100L, 600L);

            Assertions.assertThrows(BackupFailureException.class, () -> h.resolver.resolve(stale.snapshotId(), 10, null));
            Assertions.assertEquals(1, h.rowsFor(StateKind.WISHLIST, 7L, 100L));
            Assertions.assertEquals(1, h.rowsFor(StateKind.PROGRESS, 7L, 100L));
            Assertions.assertEquals(0L, h.auditTrail.countConflictLog());

            SnapshotInfo fresh = h.backup.snapshot("pre", h.clock.millis());
            Assertions.assertEquals(1, h.resolver.resolve(fresh.snapshotId(), 10, null).pairsResolved());
            Assertions.assertEquals(0, h.rowsFor(StateKind.WISHLIST, 7L, 100L));
        }
    }

    @Test
    void cancelledRunKeepsCommittedChunksAndNextRunFinishes() throws Exception {
        try (EngineHarness h = EngineHarness.create("gamevault-resolve-chunks-")) {
            for (long user = 1; user <= 5; user++) {
                h.seedWishlist(user, 50L, 100L);
                h.seedCollection(user, 50L, 200L);
            }
            SnapshotInfo snap = h.backup.snapshot("pre", h.clock.millis());
            AtomicInteger checks = new AtomicInteger();

            ConflictResolver.ResolveOutcome partial = h.resolver.resolve(snap.snapshotId(), 2, () -> checks.incrementAndGet() > 1);

            Assertions.assertTrue(partial.cancelled());
            Assertions.assertEquals(1, partial.chunksCommitted());
            Assertions.assertEquals(2, partial.pairsResolved());
            Assertions.assertEquals(3, h.auditor.audit(h.clock.millis()).conflictingKeys());

            ConflictResolver.ResolveOutcome rest = h.resolver.resolve(snap.snapshotId(), 2, null);
            Assertions.assertFalse(rest.cancelled());
            Assertions.assertEquals(3, rest.pairsResolved());
            Assertions.assertEquals(2, rest.chunksCommitted());
            Assertions.assertTrue(h.auditor.audit(h.clock.millis()).clean());
            Assertions.assertEquals(5L, h.auditTrail.countConflictLog());
        }
    }

    @Test
    void failedChunkRollsBackItsDeletions() throws Exception {
        try (EngineHarness h = EngineHarness.create("gamevault-resolve-fail-")) {
            h.seedWishlist(7L, 100L, 100L);
            h.seedProgress(7L, 100L, false, 50L);
            SnapshotInfo snap = h.backup.snapshot("pre", h.clock.millis());
            Map<StateKind, Integer> before = h.rowCounts();
            try (Connection c = h.database.openConnection(); Statement st = c.createStatement()) {
                st.execute("DROP TRIGGER IF EXISTS trg_conflict_log_no_update");
                st.execute("DROP TRIGGER IF EXISTS trg_conflict_log_no_delete");
                st.execute("DROP TABLE conflict_resolution_log");
            }

            ResolutionFailureException ex = Assertions.assertThrows(
                    ResolutionFailureException.class,
                    () -> h.resolver.resolve(snap.snapshotId(), 10, null)
            );

            Assertions.assertEquals(1, ex.failedChunk());
            Assertions.assertEquals(0, ex.pairsResolvedBefore());
            Assertions.assertEquals("ResolutionFailure", ex.kind());
            Assertions.assertEquals(before, h.rowCounts());
        }
    }
}
