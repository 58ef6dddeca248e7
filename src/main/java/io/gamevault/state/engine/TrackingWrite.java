package io.gamevault.state.engine;

import io.gamevault.state.model.GameKeyRef;
import io.gamevault.state.model.StateKind;

/**
 * An incoming insert or update against one tracking set.
 *
 * @param completed for {@link StateKind#PROGRESS}: also mark the game completed
 * @param priority  wishlist priority, or null to keep the stored one
 * @param notes     wishlist notes, or null to keep the stored ones
 */
public record TrackingWrite(
        GameKeyRef key,
        StateKind target,
        boolean completed,
        Integer priority,
        String notes,
        WriteOptions options
) {
    public TrackingWrite {
        if (key == null || target == null) {
            throw new IllegalArgumentException("key and target are required");
        }
        if (completed && target != StateKind.PROGRESS) {
            throw new IllegalArgumentException("Only progress writes can mark a game completed");
        }
        options = options == null ? WriteOptions.GUARDED : options;
    }

    public static TrackingWrite wishlist(long userId, long gameKey, Integer priority, String notes) {
        return new TrackingWrite(new GameKeyRef(userId, gameKey), StateKind.WISHLIST, false, priority, notes, WriteOptions.GUARDED);
    }

    public static TrackingWrite collection(long userId, long gameKey) {
        return new TrackingWrite(new GameKeyRef(userId, gameKey), StateKind.COLLECTION, false, null, null, WriteOptions.GUARDED);
    }

    public static TrackingWrite started(long userId, long gameKey) {
        return new TrackingWrite(new GameKeyRef(userId, gameKey), StateKind.PROGRESS, false, null, null, WriteOptions.GUARDED);
    }

    public static TrackingWrite completed(long userId, long gameKey) {
        return new TrackingWrite(new GameKeyRef(userId, gameKey), StateKind.PROGRESS, true, null, null, WriteOptions.GUARDED);
    }

    public TrackingWrite withOptions(WriteOptions next) {
        return new TrackingWrite(key, target, completed, priority, notes, next);
    }
}
