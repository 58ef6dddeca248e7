package io.gamevault.state.model;

public record SnapshotInfo(
        String snapshotId,
        String label,
        long createdAtMs,
        int wishlistRows,
        int collectionRows,
        int progressRows,
        boolean verified,
        Long restoredAtMs,
        int restoreCount,
        Long discardedAtMs
) {
    public int totalRows() {
        return wishlistRows + collectionRows + progressRows;
    }

    public int rowsFor(StateKind kind) {
        return switch (kind) {
            case WISHLIST -> wishlistRows;
            case COLLECTION -> collectionRows;
            case PROGRESS -> progressRows;
        };
    }

    public boolean usable() {
        return verified && discardedAtMs == null;
    }
}
