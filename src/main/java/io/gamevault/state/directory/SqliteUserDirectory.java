package io.gamevault.state.directory;

import io.gamevault.state.storage.Database;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

public final class SqliteUserDirectory implements UserDirectory {
    private final Database database;

    public SqliteUserDirectory(Database database) {
        this.database = database;
    }

    @Override
    public Optional<Long> resolveUserId(String authIdentity) {
        if (authIdentity == null || authIdentity.isBlank()) {
            return Optional.empty();
        }
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT user_id FROM user_identities WHERE auth_identity=?")) {
            ps.setString(1, authIdentity.trim());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(rs.getLong(1)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to resolve identity " + authIdentity, e);
        }
    }

    public void link(String authIdentity, long userId) {
        if (authIdentity == null || authIdentity.isBlank()) {
            throw new IllegalArgumentException("authIdentity must not be blank");
        }
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "INSERT OR REPLACE INTO user_identities(auth_identity,user_id) VALUES(?,?)")) {
            ps.setString(1, authIdentity.trim());
            ps.setLong(2, userId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to link identity " + authIdentity, e);
        }
    }
}
