package io.gamevault.state.model;

public record ConflictLogEntry(
        long id,
        String runId,
        long userId,
        long gameKey,
        String conflictType,
        StateKind originalState,
        StateKind resolvedState,
        String reason,
        long resolvedAtMs
) {
    public static final String REASON_HIGHER_PRIORITY = "higher priority state exists";
    public static final String REASON_DUPLICATE = "duplicate, most recent retained";
}
