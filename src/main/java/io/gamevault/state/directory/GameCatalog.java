package io.gamevault.state.directory;

import java.util.Optional;

/**
 * Read-only view of the game catalog owned by the ingestion subsystem.
 */
public interface GameCatalog {
    Optional<CatalogGame> find(long gameKey);

    record CatalogGame(long gameKey, Long internalId, String title, String slug) {
    }
}
