package io.gamevault.state.engine;

import io.gamevault.state.config.GameStateConfig;
import io.gamevault.state.directory.SqliteGameCatalog;
import io.gamevault.state.model.StateKind;
import io.gamevault.state.observability.AuditLogger;
import io.gamevault.state.storage.AuditTrailStore;
import io.gamevault.state.storage.Database;
import io.gamevault.state.storage.EngineStateStore;
import io.gamevault.state.storage.SnapshotStore;
import io.gamevault.state.storage.TrackingStore;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Engine components over a throwaway SQLite root. Seeding goes straight to the store, the way
 * rows written before enforcement existed would look.
 */
final class EngineHarness implements AutoCloseable {
    final Path root;
    final TestClock clock;
    final Database database;
    final TrackingStore trackingStore;
    final AuditTrailStore auditTrail;
    final SnapshotStore snapshotStore;
    final EngineStateStore engineState;
    final SqliteGameCatalog catalog;
    final StateHistoryRecorder history;
    final ExclusivityGuard guard;
    final AuditLogger auditLogger;
    final TrackingService tracking;
    final ConflictAuditor auditor;
    final StateBackupService backup;
    final ConflictResolver resolver;
    final RollbackManager rollback;

    private EngineHarness(Path root, long startMs, boolean requireCatalogEntry) {
        this.root = root;
        this.clock = new TestClock(startMs);
        GameStateConfig config = GameStateConfig.fromRoot(root.toString());
        this.database = new Database(config);
        database.init();
        this.trackingStore = new TrackingStore(database);
        this.auditTrail = new AuditTrailStore(database);
        this.snapshotStore = new SnapshotStore(database);
        this.engineState = new EngineStateStore(database);
        this.catalog = new SqliteGameCatalog(database);
        this.history = new StateHistoryRecorder(auditTrail);
        this.guard = new ExclusivityGuard(trackingStore, engineState, history);
        this.auditLogger = new AuditLogger(config.auditFile(), config.namespace(), "test-secret", clock);
        this.tracking = new TrackingService(trackingStore, guard, new AdvisoryLocks(5_000L), catalog, auditLogger, clock,
                requireCatalogEntry);
        this.auditor = new ConflictAuditor(trackingStore);
        this.backup = new StateBackupService(trackingStore, snapshotStore);
        this.resolver = new ConflictResolver(trackingStore, auditTrail, backup, clock);
        this.rollback = new RollbackManager(trackingStore, snapshotStore, engineState, clock);
    }

    static EngineHarness create(String prefix) throws IOException {
        return new EngineHarness(Files.createTempDirectory(prefix), 1_000_000L, false);
    }

    static EngineHarness createRequiringCatalog(String prefix) throws IOException {
        return new EngineHarness(Files.createTempDirectory(prefix), 1_000_000L, true);
    }

    long seedWishlist(long userId, long gameKey, long addedAtMs) throws SQLException {
        try (Connection c = database.openConnection()) {
            return trackingStore.insertWishlist(c, userId, gameKey, addedAtMs, null, null);
        }
    }

    long seedCollection(long userId, long gameKey, long addedAtMs) throws SQLException {
        try (Connection c = database.openConnection()) {
            return trackingStore.insertCollection(c, userId, gameKey, addedAtMs);
        }
    }

    long seedProgress(long userId, long gameKey, boolean completed, long atMs) throws SQLException {
        try (Connection c = database.openConnection()) {
            return trackingStore.insertProgress(c, userId, gameKey, completed, atMs);
        }
    }

    void seedInertProgress(long userId, long gameKey, long atMs) throws SQLException {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "INSERT INTO game_progress(user_id,game_key,started,completed,updated_at_ms) VALUES(?,?,0,0,?)")) {
            ps.setLong(1, userId);
            ps.setLong(2, gameKey);
            ps.setLong(3, atMs);
            ps.executeUpdate();
        }
    }

    Map<StateKind, Integer> rowCounts() {
        return trackingStore.countRows();
    }

    int rowsFor(StateKind kind, long userId, long gameKey) throws SQLException {
        try (Connection c = database.openConnection()) {
            return trackingStore.findByKind(c, kind, userId, gameKey).size();
        }
    }

    @Override
    public void close() throws IOException {
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
