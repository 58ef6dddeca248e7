package io.gamevault.state.model;

/**
 * One row of a tracking set. Kind-specific columns that do not apply are null.
 */
public record TrackingRecord(
        long recordId,
        StateKind kind,
        long userId,
        long gameKey,
        long recordedAtMs,
        Integer wishlistPriority,
        String notes,
        boolean started,
        Long startedAtMs,
        boolean completed,
        Long completedAtMs
) {
    public static TrackingRecord wishlist(long id, long userId, long gameKey, long addedAtMs, Integer priority, String notes) {
        return new TrackingRecord(id, StateKind.WISHLIST, userId, gameKey, addedAtMs, priority, notes, false, null, false, null);
    }

    public static TrackingRecord collection(long id, long userId, long gameKey, long addedAtMs) {
        return new TrackingRecord(id, StateKind.COLLECTION, userId, gameKey, addedAtMs, null, null, false, null, false, null);
    }

    public static TrackingRecord progress(long id, long userId, long gameKey, boolean started, Long startedAtMs,
                                          boolean completed, Long completedAtMs, long updatedAtMs) {
        return new TrackingRecord(id, StateKind.PROGRESS, userId, gameKey, updatedAtMs, null, null,
                started, startedAtMs, completed, completedAtMs);
    }

    /**
     * Progress rows with neither flag set are inert leftovers and do not count as a tracked state.
     */
    public boolean active() {
        return kind != StateKind.PROGRESS || started || completed;
    }

    public GameKeyRef key() {
        return new GameKeyRef(userId, gameKey);
    }
}
