package io.gamevault.state.engine;

import io.gamevault.state.model.ConflictLogEntry;
import io.gamevault.state.model.GameKeyRef;
import io.gamevault.state.model.SnapshotInfo;
import io.gamevault.state.model.StateKind;
import io.gamevault.state.model.TrackingRecord;
import io.gamevault.state.storage.AuditTrailStore;
import io.gamevault.state.storage.TrackingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.function.BooleanSupplier;

/**
 * Collapses every key tracked more than once to a single surviving record.
 *
 * <p>The survivor is the record of the highest kind; among records of the same kind the most
 * recent one wins, then the highest id. Work is done in chunks of at most {@code chunkSize} keys,
 * one transaction per chunk, and each deletion is committed together with its log entry. A run
 * stopped between chunks leaves the remaining keys for the next run.
 *
 * <p>Only records copied into the run's snapshot are deleted. A record written after the snapshot
 * fails its chunk with {@link BackupFailureException} and leaves that chunk untouched.
 */
public final class ConflictResolver {
    private static final Logger LOG = LoggerFactory.getLogger(ConflictResolver.class);
    private static final Comparator<TrackingRecord> SURVIVOR_ORDER = Comparator
            .comparingInt((TrackingRecord r) -> r.kind().priority())
            .thenComparingLong(TrackingRecord::recordedAtMs)
            .thenComparingLong(TrackingRecord::recordId);

    private final TrackingStore trackingStore;
    private final AuditTrailStore auditTrail;
    private final StateBackupService backupService;
    private final Clock clock;

    public ConflictResolver(TrackingStore trackingStore, AuditTrailStore auditTrail, StateBackupService backupService,
                            Clock clock) {
        this.trackingStore = trackingStore;
        this.auditTrail = auditTrail;
        this.backupService = backupService;
        this.clock = clock;
    }

    public ResolveOutcome resolve(String snapshotId, int chunkSize, BooleanSupplier cancelRequested) {
        SnapshotInfo snapshot = backupService.requireUsable(snapshotId);
        int safeChunk = Math.max(1, chunkSize);
        BooleanSupplier cancel = cancelRequested == null ? () -> false : cancelRequested;
        String runId = "res_" + UUID.randomUUID();
        long startedAtMs = clock.millis();
        int chunks = 0;
        int pairs = 0;
        int entries = 0;
        boolean cancelled = false;
        LOG.info("Resolution run {} started against snapshot {} (chunkSize={})", runId, snapshot.snapshotId(), safeChunk);
        while (true) {
            if (cancel.getAsBoolean()) {
                cancelled = true;
                break;
            }
            ChunkResult chunk;
            try {
                chunk = resolveChunk(runId, snapshot.snapshotId(), safeChunk);
            } catch (BackupFailureException e) {
                LOG.error("Resolution run {} stopped in chunk {}: {}", runId, chunks + 1, e.getMessage());
                throw e;
            } catch (SQLException | RuntimeException e) {
                LOG.error("Resolution run {} failed in chunk {}", runId, chunks + 1, e);
                throw new ResolutionFailureException(runId, chunks + 1, pairs, entries, e);
            }
            if (chunk.pairs() == 0) {
                break;
            }
            chunks++;
            pairs += chunk.pairs();
            entries += chunk.logEntries();
            LOG.debug("Resolution run {} committed chunk {}: pairs={}, logEntries={}", runId, chunks, chunk.pairs(), chunk.logEntries());
        }
        LOG.info("Resolution run {} finished: pairs={}, logEntries={}, chunks={}, cancelled={}",
                runId, pairs, entries, chunks, cancelled);
        return new ResolveOutcome(runId, snapshot.snapshotId(), pairs, entries, chunks, cancelled, startedAtMs, clock.millis());
    }

    private ChunkResult resolveChunk(String runId, String snapshotId, int chunkSize) throws SQLException {
        try (Connection c = trackingStore.database().openConnection()) {
            c.setAutoCommit(false);
            try {
                List<GameKeyRef> keys = trackingStore.findConflictingKeys(c, chunkSize);
                int pairs = 0;
                int entries = 0;
                long nowMs = clock.millis();
                for (GameKeyRef key : keys) {
                    int written = resolveKey(c, runId, snapshotId, key, nowMs);
                    if (written > 0) {
                        pairs++;
                        entries += written;
                    }
                }
                c.commit();
                return new ChunkResult(pairs, entries);
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        }
    }

    private int resolveKey(Connection c, String runId, String snapshotId, GameKeyRef key, long nowMs) throws SQLException {
        List<TrackingRecord> records = trackingStore.findByKey(c, key.userId(), key.gameKey()).stream()
                .filter(TrackingRecord::active)
                .toList();
        if (records.size() < 2) {
            return 0;
        }
        TrackingRecord survivor = records.stream().max(SURVIVOR_ORDER).orElseThrow();
        int written = 0;
        for (TrackingRecord loser : records) {
            if (loser.recordId() == survivor.recordId() && loser.kind() == survivor.kind()) {
                continue;
            }
            backupService.requireCovered(c, snapshotId, loser);
            boolean duplicate = loser.kind() == survivor.kind();
            int deleted = trackingStore.delete(c, loser.kind(), loser.recordId());
            if (deleted != 1) {
                throw new SQLException("Expected to delete " + loser.kind().label() + " record " + loser.recordId()
                        + " for " + key + ", deleted " + deleted);
            }
            auditTrail.appendConflictLog(
                    c,
                    runId,
                    key.userId(),
                    key.gameKey(),
                    StateKind.pairLabel(loser.kind(), survivor.kind()),
                    loser.kind(),
                    survivor.kind(),
                    duplicate ? ConflictLogEntry.REASON_DUPLICATE : ConflictLogEntry.REASON_HIGHER_PRIORITY,
                    nowMs
            );
            written++;
        }
        return written;
    }

    private record ChunkResult(int pairs, int logEntries) {
    }

    public record ResolveOutcome(
            String runId,
            String snapshotId,
            int pairsResolved,
            int logEntriesWritten,
            int chunksCommitted,
            boolean cancelled,
            long startedAtMs,
            long finishedAtMs
    ) {
    }
}
