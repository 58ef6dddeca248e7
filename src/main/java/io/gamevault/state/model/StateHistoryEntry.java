package io.gamevault.state.model;

public record StateHistoryEntry(
        long id,
        long userId,
        long gameKey,
        StateKind previousState,
        StateKind newState,
        long changedAtMs
) {
}
