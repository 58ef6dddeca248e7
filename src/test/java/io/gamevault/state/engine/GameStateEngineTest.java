package io.gamevault.state.engine;

import io.gamevault.state.config.EngineSettings;
import io.gamevault.state.config.GameStateConfig;
import io.gamevault.state.model.SnapshotInfo;
import io.gamevault.state.model.StateKind;
import io.gamevault.state.model.TrackingRecord;
import io.gamevault.state.observability.AuditLogger;
import io.gamevault.state.observability.PrometheusFormatter;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class GameStateEngineTest {

    @Test
    void cleanupRunsAuditSnapshotResolveAndVerifies() throws Exception {
        Path root = Files.createTempDirectory("gamevault-engine-cleanup-");
        try {
            GameStateEngine engine = new GameStateEngine(GameStateConfig.fromRoot(root.toString()),
                    EngineSettings.defaults().withResolveChunkSize(1), new TestClock(10_000L));
            engine.init();
            engine.tracking().write(TrackingWrite.wishlist(7L, 100L, null, null).withOptions(WriteOptions.bypass("seed")));
            engine.tracking().write(TrackingWrite.started(7L, 100L).withOptions(WriteOptions.bypass("seed")));
            engine.tracking().write(TrackingWrite.collection(8L, 200L).withOptions(WriteOptions.bypass("seed")));
            engine.tracking().write(TrackingWrite.collection(8L, 200L).withOptions(WriteOptions.bypass("seed")));

            GameStateEngine.CleanupOutcome out = engine.cleanup("test");

            Assertions.assertEquals(1, out.before().conflictingKeys());
            Assertions.assertTrue(out.snapshot().verified());
            Assertions.assertEquals(1, out.resolution().pairsResolved());
            Assertions.assertTrue(out.after().clean());
            Assertions.assertTrue(out.clean());
            Assertions.assertEquals(1, engine.conflictLog(7L, null, 10).size());
            Assertions.assertEquals(StateKind.PROGRESS, engine.tracking().currentState(7L, 100L).currentKind());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void resolveSnapshotsFirstSoDeletedRowsCanBeRestored() throws Exception {
        Path root = Files.createTempDirectory("gamevault-engine-resolve-");
        try {
            GameStateEngine engine = new GameStateEngine(GameStateConfig.fromRoot(root.toString()),
                    EngineSettings.defaults(), new TestClock(10_000L));
            engine.init();
            SnapshotInfo old = engine.snapshot("before-writes");
            engine.tracking().markStarted(7L, 100L);
            engine.tracking().write(TrackingWrite.wishlist(7L, 100L, 3, "gift").withOptions(WriteOptions.bypass("import")));

            Assertions.assertThrows(BackupFailureException.class, () -> engine.resolve(old.snapshotId(), 0, null));
            Assertions.assertEquals(1, engine.tracking().listByState(7L, StateKind.WISHLIST).size());

            ConflictResolver.ResolveOutcome out = engine.resolve();
            Assertions.assertNotEquals(old.snapshotId(), out.snapshotId());
            Assertions.assertEquals(1, out.pairsResolved());
            Assertions.assertTrue(engine.tracking().listByState(7L, StateKind.WISHLIST).isEmpty());

            engine.hardRollback(out.snapshotId());
            List<TrackingRecord> restored = engine.tracking().listByState(7L, StateKind.WISHLIST);
            Assertions.assertEquals(1, restored.size());
            Assertions.assertEquals(Integer.valueOf(3), restored.get(0).wishlistPriority());
            Assertions.assertEquals("gift", restored.get(0).notes());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void statsCountWritesAndAuditChainVerifies() throws Exception {
        Path root = Files.createTempDirectory("gamevault-engine-stats-");
        try {
            GameStateEngine engine = new GameStateEngine(GameStateConfig.fromRoot(root.toString()),
                    EngineSettings.defaults(), new TestClock(10_000L));
            engine.init();
            engine.tracking().addToWishlist(1L, 1L);
            engine.tracking().addToCollection(1L, 1L);
            Assertions.assertThrows(StateConflictException.class, () -> engine.tracking().addToWishlist(1L, 1L));

            GameStateEngine.StatsOutcome stats = engine.stats();
            Assertions.assertEquals(2L, stats.writesAccepted());
            Assertions.assertEquals(1L, stats.writesRejected());
            Assertions.assertEquals(1L, stats.promotions());
            Assertions.assertEquals(1, stats.trackedRows().get("Collection"));
            Assertions.assertEquals(0, stats.conflictingKeys());
            Assertions.assertEquals(1, stats.enforcementEnabled());
            Assertions.assertEquals(2L, stats.historyEntries());

            String metrics = PrometheusFormatter.format(stats, "default");
            Assertions.assertTrue(metrics.contains("gamevault_tracked_rows{set=\"Collection\"} 1"));
            Assertions.assertTrue(metrics.contains("gamevault_tracking_writes_total{result=\"rejected\"} 1"));
            Assertions.assertTrue(metrics.contains("gamevault_namespace_info{namespace=\"default\"} 1"));

            AuditLogger.IntegrityReport report = engine.auditVerify();
            Assertions.assertTrue(report.ok());
            Assertions.assertTrue(report.checkedRows() >= 4);
            Assertions.assertTrue(Files.exists(root.resolve("security").resolve("audit-signing.key")));
            Assertions.assertFalse(engine.auditTail(2).isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void identitiesResolveThroughTheUserDirectory() throws Exception {
        Path root = Files.createTempDirectory("gamevault-engine-identity-");
        try {
            GameStateEngine engine = new GameStateEngine(GameStateConfig.fromRoot(root.toString()),
                    EngineSettings.defaults(), new TestClock(10_000L));
            engine.init();
            engine.userDirectory().link("auth0|abc", 77L);

            Assertions.assertEquals(77L, engine.resolveUserId("auth0|abc"));
            Assertions.assertThrows(IllegalArgumentException.class, () -> engine.resolveUserId("auth0|missing"));
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
