package io.gamevault.state.engine;

import io.gamevault.state.directory.GameCatalog;
import io.gamevault.state.model.GameKeyRef;
import io.gamevault.state.model.GameStateView;
import io.gamevault.state.model.StateKind;
import io.gamevault.state.model.TrackingRecord;
import io.gamevault.state.observability.AuditLogger;
import io.gamevault.state.storage.TrackingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Write API of the tracking sets. Every add or mark goes through {@link ExclusivityGuard} while
 * the key's advisory lock is held, in its own transaction.
 */
public final class TrackingService {
    private static final Logger LOG = LoggerFactory.getLogger(TrackingService.class);

    private final TrackingStore trackingStore;
    private final ExclusivityGuard guard;
    private final AdvisoryLocks locks;
    private final GameCatalog catalog;
    private final AuditLogger auditLogger;
    private final Clock clock;
    private final boolean requireCatalogEntry;
    private final AtomicLong acceptedTotal = new AtomicLong(0L);
    private final AtomicLong rejectedTotal = new AtomicLong(0L);
    private final AtomicLong promotionTotal = new AtomicLong(0L);
    private final AtomicLong bypassTotal = new AtomicLong(0L);
    private final AtomicLong removalTotal = new AtomicLong(0L);

    public TrackingService(TrackingStore trackingStore, ExclusivityGuard guard, AdvisoryLocks locks, GameCatalog catalog,
                           AuditLogger auditLogger, Clock clock, boolean requireCatalogEntry) {
        this.trackingStore = trackingStore;
        this.guard = guard;
        this.locks = locks;
        this.catalog = catalog;
        this.auditLogger = auditLogger;
        this.clock = clock;
        this.requireCatalogEntry = requireCatalogEntry;
    }

    public GuardOutcome addToWishlist(long userId, long gameKey) {
        return write(TrackingWrite.wishlist(userId, gameKey, null, null));
    }

    public GuardOutcome addToWishlist(long userId, long gameKey, Integer priority, String notes) {
        return write(TrackingWrite.wishlist(userId, gameKey, priority, notes));
    }

    public GuardOutcome addToCollection(long userId, long gameKey) {
        return write(TrackingWrite.collection(userId, gameKey));
    }

    public GuardOutcome markStarted(long userId, long gameKey) {
        return write(TrackingWrite.started(userId, gameKey));
    }

    public GuardOutcome markCompleted(long userId, long gameKey) {
        return write(TrackingWrite.completed(userId, gameKey));
    }

    public GuardOutcome write(TrackingWrite write) {
        GameKeyRef key = write.key();
        if (requireCatalogEntry && catalog.find(key.gameKey()).isEmpty()) {
            throw new IllegalArgumentException("Unknown game: " + key.gameKey());
        }
        GuardOutcome outcome;
        try (AdvisoryLocks.Held held = locks.acquire(key); Connection c = trackingStore.database().openConnection()) {
            c.setAutoCommit(false);
            try {
                outcome = guard.apply(c, write, clock.millis());
                c.commit();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (StateConflictException e) {
            rejectedTotal.incrementAndGet();
            LOG.debug("Rejected {} write for {}: blocked by {}", e.requested().label(), key, e.blocking().label());
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "tracking.write",
                    "service",
                    resource(key),
                    "rejected",
                    Map.of("requested", e.requested().label(), "blocking", e.blocking().label())
            ));
            throw e;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to write " + write.target().label() + " record for " + key, e);
        }

        acceptedTotal.incrementAndGet();
        if (outcome.promoted()) {
            promotionTotal.incrementAndGet();
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("state", write.target().label());
        details.put("previous", outcome.previous() == null ? "" : outcome.previous().label());
        details.put("record_id", outcome.recordId());
        details.put("demoted", outcome.demoted().size());
        details.put("duplicates_removed", outcome.duplicates().size());
        details.put("enforced", outcome.enforced());
        if (write.options().bypass()) {
            bypassTotal.incrementAndGet();
            details.put("bypass_reason", write.options().bypassReason());
            LOG.warn("Exclusivity bypassed for {}: {}", key, write.options().bypassReason());
        }
        auditLogger.log(AuditLogger.AuditEvent.of(
                "tracking.write",
                "service",
                resource(key),
                outcome.promoted() ? "promoted" : "accepted",
                details
        ));
        return outcome;
    }

    public RemovalOutcome removeFromWishlist(long userId, long gameKey) {
        return remove(new GameKeyRef(userId, gameKey), EnumSet.of(StateKind.WISHLIST));
    }

    public RemovalOutcome removeFromCollection(long userId, long gameKey) {
        return remove(new GameKeyRef(userId, gameKey), EnumSet.of(StateKind.COLLECTION));
    }

    public RemovalOutcome clearProgress(long userId, long gameKey) {
        return remove(new GameKeyRef(userId, gameKey), EnumSet.of(StateKind.PROGRESS));
    }

    public RemovalOutcome removeFromAllStates(long userId, long gameKey) {
        return remove(new GameKeyRef(userId, gameKey), EnumSet.allOf(StateKind.class));
    }

    private RemovalOutcome remove(GameKeyRef key, Set<StateKind> kinds) {
        Map<StateKind, Integer> removed = new EnumMap<>(StateKind.class);
        long nowMs = clock.millis();
        try (AdvisoryLocks.Held held = locks.acquire(key); Connection c = trackingStore.database().openConnection()) {
            c.setAutoCommit(false);
            try {
                for (StateKind kind : kinds) {
                    removed.put(kind, trackingStore.deleteByKey(c, kind, key.userId(), key.gameKey()));
                }
                c.commit();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to remove tracking records for " + key, e);
        }
        RemovalOutcome outcome = new RemovalOutcome(key, removed, nowMs);
        if (outcome.total() > 0) {
            removalTotal.incrementAndGet();
        }
        Map<String, Object> details = new LinkedHashMap<>();
        for (Map.Entry<StateKind, Integer> e : removed.entrySet()) {
            details.put(e.getKey().label(), e.getValue());
        }
        auditLogger.log(AuditLogger.AuditEvent.of(
                "tracking.remove",
                "service",
                resource(key),
                outcome.total() > 0 ? "removed" : "noop",
                details
        ));
        return outcome;
    }

    public GameStateView currentState(long userId, long gameKey) {
        GameKeyRef key = new GameKeyRef(userId, gameKey);
        List<TrackingRecord> active;
        try (Connection c = trackingStore.database().openConnection()) {
            active = trackingStore.findByKey(c, key.userId(), key.gameKey()).stream()
                    .filter(TrackingRecord::active)
                    .toList();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read tracking state for " + key, e);
        }
        boolean inWishlist = false;
        boolean inCollection = false;
        boolean started = false;
        boolean completed = false;
        StateKind current = null;
        for (TrackingRecord r : active) {
            switch (r.kind()) {
                case WISHLIST -> inWishlist = true;
                case COLLECTION -> inCollection = true;
                case PROGRESS -> {
                    started |= r.started();
                    completed |= r.completed();
                }
            }
            if (r.kind().outranks(current)) {
                current = r.kind();
            }
        }
        List<StateKind> allowed = new ArrayList<>();
        for (StateKind kind : StateKind.values()) {
            if (current == null || kind.priority() >= current.priority()) {
                allowed.add(kind);
            }
        }
        return new GameStateView(userId, gameKey, inWishlist, inCollection, started, completed, current, List.copyOf(allowed));
    }

    public List<TrackingRecord> listByState(long userId, StateKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("kind is required");
        }
        return trackingStore.listByUser(userId, kind);
    }

    public WriteCounters counters() {
        return new WriteCounters(
                acceptedTotal.get(),
                rejectedTotal.get(),
                promotionTotal.get(),
                bypassTotal.get(),
                removalTotal.get()
        );
    }

    private static String resource(GameKeyRef key) {
        return "user/" + key.userId() + "/game/" + key.gameKey();
    }

    public record RemovalOutcome(GameKeyRef key, Map<StateKind, Integer> removed, long atMs) {
        public int total() {
            return removed.values().stream().mapToInt(Integer::intValue).sum();
        }
    }

    public record WriteCounters(long accepted, long rejected, long promotions, long bypassed, long removals) {
    }
}
