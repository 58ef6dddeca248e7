package io.gamevault.state.engine;

import io.gamevault.state.model.GameKeyRef;
import io.gamevault.state.model.StateKind;

/**
 * A guarded write asked for a lower-priority state while a higher-priority record exists for the
 * same key. Nothing was written.
 */
public final class StateConflictException extends GameStateException {
    private final GameKeyRef key;
    private final StateKind requested;
    private final StateKind blocking;
    private final long blockingRecordId;

    public StateConflictException(GameKeyRef key, StateKind requested, StateKind blocking, long blockingRecordId) {
        super("Already tracking game " + key.gameKey() + " for user " + key.userId() + " as " + blocking.label()
                + "; cannot add it as " + requested.label());
        this.key = key;
        this.requested = requested;
        this.blocking = blocking;
        this.blockingRecordId = blockingRecordId;
    }

    @Override
    public String kind() {
        return "StateConflict";
    }

    public GameKeyRef key() {
        return key;
    }

    public StateKind requested() {
        return requested;
    }

    public StateKind blocking() {
        return blocking;
    }

    public long blockingRecordId() {
        return blockingRecordId;
    }
}
