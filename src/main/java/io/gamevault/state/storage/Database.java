package io.gamevault.state.storage;

import io.gamevault.state.config.GameStateConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Owns the SQLite file: directories, versioned schema migrations and connection pragmas.
 *
 * <p>Every connection opens its transactions with {@code BEGIN IMMEDIATE}, so the reserved
 * write lock is taken before the first read of a transaction. Cross-set checks made by the
 * exclusivity guard therefore cannot interleave with another process writing the same file.
 */
public final class Database {
    private static final Logger LOG = LoggerFactory.getLogger(Database.class);
    private static final String MIGRATION_SCHEMA_VERSION = "gamevault.state.migration.v1";
    public static final int DEFAULT_BUSY_TIMEOUT_MS = 5_000;

    private final GameStateConfig config;
    private final String jdbcUrl;
    private final int busyTimeoutMs;

    public Database(GameStateConfig config) {
        this(config, DEFAULT_BUSY_TIMEOUT_MS);
    }

    public Database(GameStateConfig config, int busyTimeoutMs) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
        this.busyTimeoutMs = Math.max(0, busyTimeoutMs);
    }

    public String namespace() {
        return config.namespace();
    }

    public void init() {
        initDirectories();
        applyAndValidatePragmas();
        initSchema();
    }

    public Connection openConnection() throws SQLException {
        SQLiteConfig sqlite = new SQLiteConfig();
        sqlite.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        sqlite.setBusyTimeout(busyTimeoutMs);
        sqlite.enforceForeignKeys(true);
        return DriverManager.getConnection(jdbcUrl, sqlite.toProperties());
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
            Files.createDirectories(config.securityRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection()) {
            ensureSchemaMigrationsTable(conn);
            int applied = 0;
            for (MigrationStep step : migrations()) {
                if (isMigrationApplied(conn, step.version())) {
                    continue;
                }
                applyMigration(conn, step);
                applied++;
            }
            if (applied > 0) {
                LOG.info("Applied {} schema migration(s) to {}", applied, config.dbFile());
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite schema", e);
        }
    }

    static List<MigrationStep> migrations() {
        List<MigrationStep> steps = new ArrayList<>();
        steps.add(new MigrationStep(
                "20250801_001_tracking_sets",
                "Create wishlist, collection and progress tracking sets",
                List.of(
                        """
                        CREATE TABLE IF NOT EXISTS user_wishlist (
                            id INTEGER PRIMARY KEY AUTOINCREMENT,
                            user_id INTEGER NOT NULL,
                            game_key INTEGER NOT NULL,
                            added_at_ms INTEGER NOT NULL,
                            priority INTEGER,
                            notes TEXT
                        )
                        """,
                        """
                        CREATE TABLE IF NOT EXISTS user_collection (
                            id INTEGER PRIMARY KEY AUTOINCREMENT,
                            user_id INTEGER NOT NULL,
                            game_key INTEGER NOT NULL,
                            added_at_ms INTEGER NOT NULL
                        )
                        """,
                        """
                        CREATE TABLE IF NOT EXISTS game_progress (
                            id INTEGER PRIMARY KEY AUTOINCREMENT,
                            user_id INTEGER NOT NULL,
                            game_key INTEGER NOT NULL,
                            started INTEGER NOT NULL DEFAULT 0,
                            started_at_ms INTEGER,
                            completed INTEGER NOT NULL DEFAULT 0,
                            completed_at_ms INTEGER,
                            updated_at_ms INTEGER NOT NULL
                        )
                        """,
                        "CREATE INDEX IF NOT EXISTS idx_user_wishlist_user_game ON user_wishlist(user_id, game_key)",
                        "CREATE INDEX IF NOT EXISTS idx_user_collection_user_game ON user_collection(user_id, game_key)",
                        "CREATE INDEX IF NOT EXISTS idx_game_progress_user_game ON game_progress(user_id, game_key)"
                ),
                List.of(
                        "DROP TABLE IF EXISTS user_wishlist",
                        "DROP TABLE IF EXISTS user_collection",
                        "DROP TABLE IF EXISTS game_progress"
                )
        ));
        steps.add(new MigrationStep(
                "20250801_002_audit_trail",
                "Create append-only conflict resolution log and state history",
                List.of(
                        """
                        CREATE TABLE IF NOT EXISTS conflict_resolution_log (
                            id INTEGER PRIMARY KEY AUTOINCREMENT,
                            run_id TEXT NOT NULL,
                            user_id INTEGER NOT NULL,
                            game_key INTEGER NOT NULL,
                            conflict_type TEXT NOT NULL,
                            original_state TEXT NOT NULL,
                            resolved_state TEXT NOT NULL,
                            reason TEXT NOT NULL,
                            resolved_at_ms INTEGER NOT NULL
                        )
                        """,
                        """
                        CREATE TABLE IF NOT EXISTS game_state_history (
                            id INTEGER PRIMARY KEY AUTOINCREMENT,
                            user_id INTEGER NOT NULL,
                            game_key INTEGER NOT NULL,
                            previous_state TEXT,
                            new_state TEXT NOT NULL,
                            changed_at_ms INTEGER NOT NULL
                        )
                        """,
                        "CREATE INDEX IF NOT EXISTS idx_conflict_log_user_game ON conflict_resolution_log(user_id, game_key)",
                        "CREATE INDEX IF NOT EXISTS idx_conflict_log_run ON conflict_resolution_log(run_id)",
                        "CREATE INDEX IF NOT EXISTS idx_state_history_user_game_time ON game_state_history(user_id, game_key, changed_at_ms)",
                        """
                        CREATE TRIGGER IF NOT EXISTS trg_conflict_log_no_update
                        BEFORE UPDATE ON conflict_resolution_log
                        BEGIN
                            SELECT RAISE(ABORT, 'conflict_resolution_log is append-only');
                        END
                        """,
                        """
                        CREATE TRIGGER IF NOT EXISTS trg_conflict_log_no_delete
                        BEFORE DELETE ON conflict_resolution_log
                        BEGIN
                            SELECT RAISE(ABORT, 'conflict_resolution_log is append-only');
                        END
                        """,
                        """
                        CREATE TRIGGER IF NOT EXISTS trg_state_history_no_update
                        BEFORE UPDATE ON game_state_history
                        BEGIN
                            SELECT RAISE(ABORT, 'game_state_history is append-only');
                        END
                        """,
                        """
                        CREATE TRIGGER IF NOT EXISTS trg_state_history_no_delete
                        BEFORE DELETE ON game_state_history
                        BEGIN
                            SELECT RAISE(ABORT, 'game_state_history is append-only');
                        END
                        """
                ),
                List.of(
                        "DROP TRIGGER IF EXISTS trg_conflict_log_no_update",
                        "DROP TRIGGER IF EXISTS trg_conflict_log_no_delete",
                        "DROP TRIGGER IF EXISTS trg_state_history_no_update",
                        "DROP TRIGGER IF EXISTS trg_state_history_no_delete",
                        "DROP TABLE IF EXISTS conflict_resolution_log",
                        "DROP TABLE IF EXISTS game_state_history"
                )
        ));
        steps.add(new MigrationStep(
                "20250801_003_backup_snapshots",
                "Create snapshot header and per-set backup tables",
                List.of(
                        """
                        CREATE TABLE IF NOT EXISTS backup_snapshots (
                            snapshot_id TEXT PRIMARY KEY,
                            label TEXT NOT NULL DEFAULT '',
                            created_at_ms INTEGER NOT NULL,
                            wishlist_rows INTEGER NOT NULL DEFAULT 0,
                            collection_rows INTEGER NOT NULL DEFAULT 0,
                            progress_rows INTEGER NOT NULL DEFAULT 0,
                            verified INTEGER NOT NULL DEFAULT 0,
                            restored_at_ms INTEGER,
                            restore_count INTEGER NOT NULL DEFAULT 0,
                            discarded_at_ms INTEGER
                        )
                        """,
                        """
                        CREATE TABLE IF NOT EXISTS backup_wishlist (
                            snapshot_id TEXT NOT NULL,
                            snapshot_at_ms INTEGER NOT NULL,
                            id INTEGER NOT NULL,
                            user_id INTEGER NOT NULL,
                            game_key INTEGER NOT NULL,
                            added_at_ms INTEGER NOT NULL,
                            priority INTEGER,
                            notes TEXT,
                            PRIMARY KEY(snapshot_id, id),
                            FOREIGN KEY(snapshot_id) REFERENCES backup_snapshots(snapshot_id)
                        )
                        """,
                        """
                        CREATE TABLE IF NOT EXISTS backup_collection (
                            snapshot_id TEXT NOT NULL,
                            snapshot_at_ms INTEGER NOT NULL,
                            id INTEGER NOT NULL,
                            user_id INTEGER NOT NULL,
                            game_key INTEGER NOT NULL,
                            added_at_ms INTEGER NOT NULL,
                            PRIMARY KEY(snapshot_id, id),
                            FOREIGN KEY(snapshot_id) REFERENCES backup_snapshots(snapshot_id)
                        )
                        """,
                        """
                        CREATE TABLE IF NOT EXISTS backup_progress (
                            snapshot_id TEXT NOT NULL,
                            snapshot_at_ms INTEGER NOT NULL,
                            id INTEGER NOT NULL,
                            user_id INTEGER NOT NULL,
                            game_key INTEGER NOT NULL,
                            started INTEGER NOT NULL,
                            started_at_ms INTEGER,
                            completed INTEGER NOT NULL,
                            completed_at_ms INTEGER,
                            updated_at_ms INTEGER NOT NULL,
                            PRIMARY KEY(snapshot_id, id),
                            FOREIGN KEY(snapshot_id) REFERENCES backup_snapshots(snapshot_id)
                        )
                        """,
                        "CREATE INDEX IF NOT EXISTS idx_backup_snapshots_created ON backup_snapshots(created_at_ms)"
                ),
                List.of(
                        "DROP TABLE IF EXISTS backup_wishlist",
                        "DROP TABLE IF EXISTS backup_collection",
                        "DROP TABLE IF EXISTS backup_progress",
                        "DROP TABLE IF EXISTS backup_snapshots"
                )
        ));
        steps.add(new MigrationStep(
                "20250801_004_engine_state",
                "Create engine state and install exclusivity enforcement",
                List.of(
                        """
                        CREATE TABLE IF NOT EXISTS engine_state (
                            state_key TEXT PRIMARY KEY,
                            state_value TEXT NOT NULL,
                            version INTEGER NOT NULL,
                            updated_at_ms INTEGER NOT NULL
                        )
                        """,
                        """
                        INSERT OR IGNORE INTO engine_state(state_key,state_value,version,updated_at_ms)
                        VALUES('exclusivity_enforcement','enabled',1,CAST(strftime('%s','now') AS INTEGER) * 1000)
                        """
                ),
                List.of("DROP TABLE IF EXISTS engine_state")
        ));
        steps.add(new MigrationStep(
                "20250801_005_reference_data",
                "Create read-only game catalog and identity directory mirrors",
                List.of(
                        """
                        CREATE TABLE IF NOT EXISTS catalog_games (
                            game_key INTEGER PRIMARY KEY,
                            internal_id INTEGER,
                            title TEXT NOT NULL,
                            slug TEXT
                        )
                        """,
                        """
                        CREATE TABLE IF NOT EXISTS user_identities (
                            auth_identity TEXT PRIMARY KEY,
                            user_id INTEGER NOT NULL
                        )
                        """,
                        "CREATE INDEX IF NOT EXISTS idx_user_identities_user ON user_identities(user_id)"
                ),
                List.of(
                        "DROP TABLE IF EXISTS catalog_games",
                        "DROP TABLE IF EXISTS user_identities"
                )
        ));
        return steps;
    }

    private void ensureSchemaMigrationsTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL,
                        success INTEGER NOT NULL
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_schema_migrations_applied ON schema_migrations(applied_at_ms)");
        }
    }

    private boolean isMigrationApplied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM schema_migrations WHERE version=? AND success=1 LIMIT 1")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void applyMigration(Connection conn, MigrationStep step) throws SQLException {
        String checksum = checksum(step);
        conn.setAutoCommit(false);
        try {
            try (Statement st = conn.createStatement()) {
                for (String sql : step.up()) {
                    st.execute(sql);
                }
            }
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
                ps.setString(1, step.version());
                ps.setString(2, step.description());
                ps.setString(3, checksum);
                ps.setLong(4, Instant.now().toEpochMilli());
                ps.executeUpdate();
            }
            conn.commit();
        } catch (SQLException e) {
            conn.rollback();
            throw new SQLException("Migration " + step.version() + " failed", e);
        } finally {
            conn.setAutoCommit(true);
        }
    }

    private String checksum(MigrationStep step) {
        StringBuilder sb = new StringBuilder();
        sb.append(MIGRATION_SCHEMA_VERSION).append('|')
                .append(step.version()).append('|')
                .append(step.description()).append('|');
        for (String sql : step.up()) {
            sb.append(sql).append(';');
        }
        return Integer.toHexString(sb.toString().hashCode());
    }

    record MigrationStep(String version, String description, List<String> up, List<String> down) {
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
            validatePragma(st, "foreign_keys", "1");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }

    public List<SchemaMigrationRow> listSchemaMigrations(int limit) {
        String sql = """
                SELECT version,description,checksum,applied_at_ms,success
                FROM schema_migrations
                ORDER BY applied_at_ms DESC, version DESC
                LIMIT ?
                """;
        int safeLimit = Math.max(1, limit);
        List<SchemaMigrationRow> out = new ArrayList<>();
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, safeLimit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new SchemaMigrationRow(
                            rs.getString("version"),
                            rs.getString("description"),
                            rs.getString("checksum"),
                            rs.getLong("applied_at_ms"),
                            rs.getInt("success") == 1
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list schema migrations", e);
        }
    }

    /**
     * Runs the backward SQL of one applied migration and forgets it. Rolling back a version that
     * a later applied version builds on is refused; roll back newest first.
     */
    public RollbackOutcome rollbackMigration(String version) {
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("version must not be blank");
        }
        String v = version.trim();
        List<MigrationStep> all = migrations();
        Optional<MigrationStep> match = all.stream().filter(s -> s.version().equals(v)).findFirst();
        if (match.isEmpty()) {
            throw new IllegalArgumentException("Unsupported rollback migration version: " + version);
        }
        MigrationStep step = match.get();
        try (Connection c = openConnection()) {
            for (MigrationStep later : all.subList(all.indexOf(step) + 1, all.size())) {
                if (isMigrationApplied(c, later.version())) {
                    throw new IllegalStateException(
                            "Migration " + later.version() + " is still applied; roll it back before " + v
                    );
                }
            }
            c.setAutoCommit(false);
            try (Statement st = c.createStatement();
                 PreparedStatement del = c.prepareStatement("DELETE FROM schema_migrations WHERE version=?")) {
                for (String sql : step.down()) {
                    st.execute(sql);
                }
                del.setString(1, v);
                int removed = del.executeUpdate();
                c.commit();
                LOG.warn("Rolled back schema migration {}", v);
                return new RollbackOutcome(v, step.down().size(), removed > 0);
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (IllegalStateException e) {
            throw e;
        } catch (Exception e) {
            throw new RuntimeException("Failed to rollback migration: " + version, e);
        }
    }

    public record SchemaMigrationRow(
            String version,
            String description,
            String checksum,
            long appliedAtMs,
            boolean success
    ) {
    }

    public record RollbackOutcome(String version, int statements, boolean removedMigrationRow) {
    }
}
