package io.gamevault.state.model;

import java.util.List;

/**
 * What a user currently tracks for one game, and which kinds a guarded write may still move it to.
 */
public record GameStateView(
        long userId,
        long gameKey,
        boolean inWishlist,
        boolean inCollection,
        boolean started,
        boolean completed,
        StateKind currentKind,
        List<StateKind> allowedTargets
) {
}
