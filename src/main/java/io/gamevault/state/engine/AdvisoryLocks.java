package io.gamevault.state.engine;

import io.gamevault.state.model.GameKeyRef;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Application-level locks keyed by (user, game). Writers for the same key are strictly ordered;
 * writers for different keys never wait on each other here. Entries are reference counted and
 * dropped once no thread holds or waits for them.
 */
public final class AdvisoryLocks {
    private final ConcurrentMap<GameKeyRef, LockEntry> locks = new ConcurrentHashMap<>();
    private final long timeoutMs;

    public AdvisoryLocks(long timeoutMs) {
        this.timeoutMs = Math.max(1L, timeoutMs);
    }

    public Held acquire(GameKeyRef key) {
        LockEntry entry = locks.compute(key, (k, current) -> {
            LockEntry next = current == null ? new LockEntry() : current;
            next.refs++;
            return next;
        });
        boolean acquired = false;
        try {
            acquired = entry.lock.tryLock(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for lock on " + key, e);
        } finally {
            if (!acquired) {
                unref(key);
            }
        }
        if (!acquired) {
            throw new IllegalStateException("Timed out after " + timeoutMs + "ms waiting for lock on " + key);
        }
        return new Held(key, entry);
    }

    int trackedKeys() {
        return locks.size();
    }

    private void unref(GameKeyRef key) {
        locks.computeIfPresent(key, (k, current) -> --current.refs <= 0 ? null : current);
    }

    private static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock(true);
        private int refs;
    }

    public final class Held implements AutoCloseable {
        private final GameKeyRef key;
        private final LockEntry entry;
        private boolean released;

        private Held(GameKeyRef key, LockEntry entry) {
            this.key = key;
            this.entry = entry;
        }

        public GameKeyRef key() {
            return key;
        }

        @Override
        public void close() {
            if (released) {
                return;
            }
            released = true;
            entry.lock.unlock();
            unref(key);
        }
    }
}
