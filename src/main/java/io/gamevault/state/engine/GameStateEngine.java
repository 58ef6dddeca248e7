package io.gamevault.state.engine;

import io.gamevault.state.config.EngineSettings;
import io.gamevault.state.config.GameStateConfig;
import io.gamevault.state.directory.SqliteGameCatalog;
import io.gamevault.state.directory.SqliteUserDirectory;
import io.gamevault.state.model.ConflictLogEntry;
import io.gamevault.state.model.SnapshotInfo;
import io.gamevault.state.model.StateHistoryEntry;
import io.gamevault.state.model.StateKind;
import io.gamevault.state.observability.AuditLogger;
import io.gamevault.state.storage.AuditTrailStore;
import io.gamevault.state.storage.Database;
import io.gamevault.state.storage.EngineStateStore;
import io.gamevault.state.storage.SnapshotStore;
import io.gamevault.state.storage.TrackingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * Wires the engine together for one runtime root and exposes the maintenance operations used by
 * the CLI. Maintenance steps are meant to run in the order audit, snapshot, resolve, audit;
 * {@link #cleanup(String)} runs exactly that sequence.
 */
public final class GameStateEngine {
    private static final Logger LOG = LoggerFactory.getLogger(GameStateEngine.class);

    private final GameStateConfig config;
    private final EngineSettings settings;
    private final boolean settingsFileExists;
    private final Clock clock;
    private final Database database;
    private final TrackingStore trackingStore;
    private final AuditTrailStore auditTrail;
    private final SnapshotStore snapshotStore;
    private final EngineStateStore engineState;
    private final SqliteGameCatalog catalog;
    private final SqliteUserDirectory userDirectory;
    private final StateHistoryRecorder historyRecorder;
    private final ConflictAuditor auditor;
    private final StateBackupService backupService;
    private final ConflictResolver resolver;
    private final RollbackManager rollbackManager;
    private final TrackingService trackingService;
    private final AuditLogger auditLogger;

    public GameStateEngine(GameStateConfig config) {
        this(config, EngineSettings.load(config.settingsFile()), Clock.systemUTC());
    }

    public GameStateEngine(GameStateConfig config, EngineSettings settings, Clock clock) {
        this.config = config;
        this.settings = settings == null ? EngineSettings.defaults() : settings;
        this.settingsFileExists = Files.exists(config.settingsFile());
        this.clock = clock;
        this.database = new Database(config, this.settings.busyTimeoutMs());
        this.trackingStore = new TrackingStore(database);
        this.auditTrail = new AuditTrailStore(database);
        this.snapshotStore = new SnapshotStore(database);
        this.engineState = new EngineStateStore(database);
        this.catalog = new SqliteGameCatalog(database);
        this.userDirectory = new SqliteUserDirectory(database);
        this.historyRecorder = new StateHistoryRecorder(auditTrail);
        this.auditor = new ConflictAuditor(trackingStore);
        this.backupService = new StateBackupService(trackingStore, snapshotStore);
        this.resolver = new ConflictResolver(trackingStore, auditTrail, backupService, clock);
        this.rollbackManager = new RollbackManager(trackingStore, snapshotStore, engineState, clock);
        String signingSecret = this.settings.auditSigningEnabled()
                ? loadOrCreateAuditSigningSecret(config.auditSigningKeyFile())
                : "";
        this.auditLogger = new AuditLogger(config.auditFile(), config.namespace(), signingSecret, clock);
        this.trackingService = new TrackingService(
                trackingStore,
                new ExclusivityGuard(trackingStore, engineState, historyRecorder),
                new AdvisoryLocks(this.settings.lockTimeoutMs()),
                catalog,
                auditLogger,
                clock,
                this.settings.requireCatalogEntry()
        );
    }

    public void init() {
        database.init();
        List<String> overrides = settings.diff(EngineSettings.defaults());
        if (!overrides.isEmpty()) {
            LOG.info("Engine settings loaded from {} with overrides {}", config.settingsFile(), overrides);
        }
        auditLogger.log(AuditLogger.AuditEvent.of(
                "engine.init",
                "cli",
                "engine/" + config.namespace(),
                "ok",
                Map.of("settings_overrides", overrides, "enforcement", rollbackManager.enforcementEnabled())
        ));
    }

    public TrackingService tracking() {
        return trackingService;
    }

    public SqliteGameCatalog catalog() {
        return catalog;
    }

    public SqliteUserDirectory userDirectory() {
        return userDirectory;
    }

    public Database database() {
        return database;
    }

    public long resolveUserId(String authIdentity) {
        return userDirectory.resolveUserId(authIdentity)
                .orElseThrow(() -> new IllegalArgumentException("Unknown identity: " + authIdentity));
    }

    public ConflictAuditor.AuditReport audit() {
        ConflictAuditor.AuditReport report = auditor.audit(clock.millis());
        auditLogger.log(AuditLogger.AuditEvent.of(
                "conflicts.audit",
                "cli",
                "tracking/*",
                report.clean() ? "clean" : "conflicts",
                Map.of("conflicting_keys", report.conflictingKeys())
        ));
        return report;
    }

    public SnapshotInfo snapshot(String label) {
        try {
            SnapshotInfo info = backupService.snapshot(label, clock.millis());
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "snapshot.create",
                    "cli",
                    "snapshot/" + info.snapshotId(),
                    "verified",
                    Map.of("rows", info.totalRows(), "label", info.label())
            ));
            return info;
        } catch (BackupFailureException e) {
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "snapshot.create", "cli", "snapshot/*", "failed", Map.of("error", String.valueOf(e.getMessage()))));
            throw e;
        }
    }

    public List<SnapshotInfo> snapshots(int limit) {
        return backupService.list(limit);
    }

    public boolean discardSnapshot(String snapshotId) {
        boolean discarded = backupService.discard(snapshotId, clock.millis());
        auditLogger.log(AuditLogger.AuditEvent.of(
                "snapshot.discard", "cli", "snapshot/" + snapshotId, discarded ? "discarded" : "noop", Map.of()));
        return discarded;
    }

    public ConflictResolver.ResolveOutcome resolve() {
        return resolve(settings.resolveChunkSize(), null);
    }

    /**
     * Takes a new verified snapshot and resolves against it, so every record the run deletes has a
     * copy to restore from.
     */
    public ConflictResolver.ResolveOutcome resolve(int chunkSize, BooleanSupplier cancelRequested) {
        SnapshotInfo snapshot = snapshot("resolve");
        return resolve(snapshot.snapshotId(), chunkSize, cancelRequested);
    }

    public ConflictResolver.ResolveOutcome resolve(String snapshotId, int chunkSize, BooleanSupplier cancelRequested) {
        int chunk = chunkSize <= 0 ? settings.resolveChunkSize() : Math.min(chunkSize, EngineSettings.MAX_RESOLVE_CHUNK_SIZE);
        try {
            ConflictResolver.ResolveOutcome out = resolver.resolve(snapshotId, chunk, cancelRequested);
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "conflicts.resolve",
                    "cli",
                    "snapshot/" + out.snapshotId(),
                    out.cancelled() ? "cancelled" : "ok",
                    Map.of("run_id", out.runId(), "pairs", out.pairsResolved(), "log_entries", out.logEntriesWritten(),
                            "chunks", out.chunksCommitted())
            ));
            return out;
        } catch (ResolutionFailureException e) {
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "conflicts.resolve",
                    "cli",
                    "snapshot/" + snapshotId,
                    "failed",
                    Map.of("run_id", e.runId(), "failed_chunk", e.failedChunk(), "pairs_before", e.pairsResolvedBefore())
            ));
            throw e;
        } catch (BackupFailureException e) {
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "conflicts.resolve",
                    "cli",
                    "snapshot/" + snapshotId,
                    "refused",
                    Map.of("reason", String.valueOf(e.getMessage()))
            ));
            throw e;
        }
    }

    public CleanupOutcome cleanup(String label) {
        ConflictAuditor.AuditReport before = audit();
        SnapshotInfo snapshot = snapshot(label == null || label.isBlank() ? "cleanup" : label);
        ConflictResolver.ResolveOutcome resolved = resolve(snapshot.snapshotId(), settings.resolveChunkSize(), null);
        ConflictAuditor.AuditReport after = audit();
        if (!after.clean()) {
            LOG.warn("Cleanup left {} conflicting keys after run {}", after.conflictingKeys(), resolved.runId());
        }
        return new CleanupOutcome(before, snapshot, resolved, after, after.clean());
    }

    public RollbackManager.EnforcementChange softRollback() {
        RollbackManager.EnforcementChange change = rollbackManager.softRollback();
        auditLogger.log(AuditLogger.AuditEvent.of(
                "rollback.soft", "cli", "engine/enforcement", change.changed() ? "disabled" : "noop",
                Map.of("previous", change.previous())));
        return change;
    }

    public RollbackManager.EnforcementChange enableEnforcement() {
        RollbackManager.EnforcementChange change = rollbackManager.enableEnforcement();
        auditLogger.log(AuditLogger.AuditEvent.of(
                "enforcement.enable", "cli", "engine/enforcement", change.changed() ? "enabled" : "noop",
                Map.of("previous", change.previous())));
        return change;
    }

    public boolean enforcementEnabled() {
        return rollbackManager.enforcementEnabled();
    }

    public RollbackManager.HardRollbackOutcome hardRollback(String snapshotId) {
        try {
            RollbackManager.HardRollbackOutcome out = rollbackManager.hardRollback(snapshotId);
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "rollback.hard",
                    "cli",
                    "snapshot/" + out.snapshotId(),
                    out.previouslyRestored() ? "restored_again" : "restored",
                    Map.of("deleted", labelled(out.deletedRows()), "restored", labelled(out.restoredRows()))
            ));
            return out;
        } catch (RollbackFailureException e) {
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "rollback.hard", "cli", "snapshot/" + snapshotId, "failed", Map.of("error", String.valueOf(e.getMessage()))));
            throw e;
        }
    }

    public List<StateHistoryEntry> timeline(long userId, long gameKey) {
        return historyRecorder.timeline(userId, gameKey);
    }

    public List<ConflictLogEntry> conflictLog(Long userId, String runId, int limit) {
        return auditTrail.listConflictLog(userId, runId, limit);
    }

    public List<Database.SchemaMigrationRow> schemaMigrations(int limit) {
        return database.listSchemaMigrations(limit);
    }

    public Database.RollbackOutcome rollbackSchemaMigration(String version) {
        Database.RollbackOutcome out = database.rollbackMigration(version);
        auditLogger.log(AuditLogger.AuditEvent.of(
                "schema.rollback", "cli", "schema/" + version, "ok", Map.of("statements", out.statements())));
        return out;
    }

    public SettingsView settings() {
        return new SettingsView(config.settingsFile().toString(), settingsFileExists, settings,
                settings.diff(EngineSettings.defaults()));
    }

    public StatsOutcome stats() {
        Map<StateKind, Integer> rows = trackingStore.countRows();
        int conflicting;
        try (Connection c = database.openConnection()) {
            conflicting = trackingStore.countConflictingKeys(c);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count conflicting keys", e);
        }
        TrackingService.WriteCounters counters = trackingService.counters();
        return new StatsOutcome(
                labelled(rows),
                conflicting,
                rollbackManager.enforcementEnabled() ? 1 : 0,
                counters.accepted(),
                counters.rejected(),
                counters.promotions(),
                counters.bypassed(),
                counters.removals(),
                auditTrail.countConflictLog(),
                auditTrail.countHistory(),
                backupService.latestUsable().isPresent() ? 1 : 0
        );
    }

    public List<String> auditTail(int lines) {
        return auditLogger.tail(lines);
    }

    public AuditLogger.IntegrityReport auditVerify() {
        AuditLogger.IntegrityReport report = auditLogger.verify();
        auditLogger.log(AuditLogger.AuditEvent.of(
                "audit.verify",
                "cli",
                "engine/audit",
                report.ok() ? "ok" : "failed",
                Map.of("checked_rows", report.checkedRows(), "broken_line", report.brokenLine(), "reason", report.reason())
        ));
        return report;
    }

    private static Map<String, Integer> labelled(Map<StateKind, Integer> byKind) {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (StateKind kind : StateKind.values()) {
            out.put(kind.label(), byKind.getOrDefault(kind, 0));
        }
        return out;
    }

    private static String loadOrCreateAuditSigningSecret(Path keyFile) {
        try {
            if (keyFile.getParent() != null) {
                Files.createDirectories(keyFile.getParent());
            }
            if (Files.exists(keyFile)) {
                String existing = Files.readString(keyFile, StandardCharsets.UTF_8).trim();
                if (!existing.isBlank()) {
                    return existing;
                }
            }
            byte[] random = new byte[32];
            new SecureRandom().nextBytes(random);
            String generated = Base64.getEncoder().encodeToString(random);
            Files.writeString(keyFile, generated, StandardCharsets.UTF_8);
            return generated;
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit signing secret: " + keyFile, e);
        }
    }

    public record CleanupOutcome(
            ConflictAuditor.AuditReport before,
            SnapshotInfo snapshot,
            ConflictResolver.ResolveOutcome resolution,
            ConflictAuditor.AuditReport after,
            boolean clean
    ) {
    }

    public record SettingsView(String sourcePath, boolean configExists, EngineSettings settings, List<String> overrides) {
    }

    public record StatsOutcome(
            Map<String, Integer> trackedRows,
            int conflictingKeys,
            int enforcementEnabled,
            long writesAccepted,
            long writesRejected,
            long promotions,
            long bypassedWrites,
            long removals,
            long conflictLogEntries,
            long historyEntries,
            int usableSnapshot
    ) {
    }
}
