package io.gamevault.state.directory;

import io.gamevault.state.storage.Database;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.Optional;

/**
 * Catalog backed by the {@code catalog_games} mirror table. {@link #register} exists for the
 * sync job that keeps the mirror current; the engine itself only reads.
 */
public final class SqliteGameCatalog implements GameCatalog {
    private final Database database;

    public SqliteGameCatalog(Database database) {
        this.database = database;
    }

    @Override
    public Optional<CatalogGame> find(long gameKey) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT game_key,internal_id,title,slug FROM catalog_games WHERE game_key=?")) {
            ps.setLong(1, gameKey);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                long internal = rs.getLong("internal_id");
                Long internalId = rs.wasNull() ? null : internal;
                return Optional.of(new CatalogGame(rs.getLong("game_key"), internalId, rs.getString("title"), rs.getString("slug")));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to look up catalog game " + gameKey, e);
        }
    }

    public void register(CatalogGame game) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "INSERT OR REPLACE INTO catalog_games(game_key,internal_id,title,slug) VALUES(?,?,?,?)")) {
            ps.setLong(1, game.gameKey());
            if (game.internalId() == null) {
                ps.setNull(2, Types.BIGINT);
            } else {
                ps.setLong(2, game.internalId());
            }
            ps.setString(3, game.title() == null ? "" : game.title());
            ps.setString(4, game.slug());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to register catalog game " + game.gameKey(), e);
        }
    }
}
