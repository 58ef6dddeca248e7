package io.gamevault.state.cli;

import io.gamevault.state.config.GameStateConfig;
import io.gamevault.state.engine.GameStateEngine;
import io.gamevault.state.engine.GameStateException;
import io.gamevault.state.engine.GuardOutcome;
import io.gamevault.state.engine.TrackingService;
import io.gamevault.state.engine.TrackingWrite;
import io.gamevault.state.engine.WriteOptions;
import io.gamevault.state.model.StateKind;
import io.gamevault.state.observability.AuditLogger;
import io.gamevault.state.observability.PrometheusFormatter;
import io.gamevault.state.storage.Database;
import io.gamevault.state.util.Jsons;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "gamevault-state",
        mixinStandardHelpOptions = true,
        description = "Game state exclusivity engine maintenance CLI",
        subcommands = {
                GameStateCommand.InitCommand.class,
                GameStateCommand.AuditCommand.class,
                GameStateCommand.SnapshotCommand.class,
                GameStateCommand.SnapshotsCommand.class,
                GameStateCommand.SnapshotDiscardCommand.class,
                GameStateCommand.ResolveCommand.class,
                GameStateCommand.CleanupCommand.class,
                GameStateCommand.SoftRollbackCommand.class,
                GameStateCommand.EnforcementCommand.class,
                GameStateCommand.HardRollbackCommand.class,
                GameStateCommand.ConflictLogCommand.class,
                GameStateCommand.TimelineCommand.class,
                GameStateCommand.StateCommand.class,
                GameStateCommand.ListCommand.class,
                GameStateCommand.TrackCommand.class,
                GameStateCommand.UntrackCommand.class,
                GameStateCommand.MetricsCommand.class,
                GameStateCommand.SettingsCommand.class,
                GameStateCommand.AuditTailCommand.class,
                GameStateCommand.AuditVerifyCommand.class,
                GameStateCommand.SchemaMigrationsCommand.class,
                GameStateCommand.SchemaRollbackCommand.class
        }
)
public final class GameStateCommand implements Runnable {
    static final int EXIT_INVALID = 1;
    static final int EXIT_ENGINE_ERROR = 2;

    @Option(names = {"--root"}, description = "Runtime data root directory", defaultValue = "data")
    String root;

    @Option(names = {"--namespace"}, description = "Runtime namespace", defaultValue = "default")
    String namespace;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | audit | snapshot | snapshots | snapshot-discard | resolve | cleanup | soft-rollback | enforcement | hard-rollback | conflict-log | timeline | state | list | track | untrack | metrics | settings | audit-tail | audit-verify | schema-migrations | schema-rollback");
    }

    /**
     * Command line with engine errors mapped to a JSON line on stderr and exit code 2, and
     * argument or validation errors to exit code 1.
     */
    public static CommandLine commandLine() {
        CommandLine cmd = new CommandLine(new GameStateCommand());
        cmd.setParameterExceptionHandler((ex, args) -> {
            CommandLine invalid = ex.getCommandLine();
            PrintWriter err = invalid.getErr();
            err.println(ex.getMessage());
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, err);
            invalid.usage(err);
            return EXIT_INVALID;
        });
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof GameStateException gse) {
                System.err.println(Jsons.toCompactJson(errorBody(gse.getMessage(), gse.kind())));
                return EXIT_ENGINE_ERROR;
            }
            if (ex instanceof IllegalArgumentException || ex instanceof IllegalStateException) {
                System.err.println(Jsons.toCompactJson(errorBody(ex.getMessage(), "InvalidRequest")));
                return EXIT_INVALID;
            }
            throw ex;
        });
        return cmd;
    }

    private static Map<String, Object> errorBody(String message, String kind) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message == null ? "" : message);
        body.put("kind", kind);
        return body;
    }

    GameStateEngine engine() {
        GameStateEngine engine = new GameStateEngine(GameStateConfig.fromRoot(root, namespace));
        engine.init();
        return engine;
    }

    static long userId(GameStateEngine engine, String raw, boolean identity) {
        if (identity) {
            return engine.resolveUserId(raw);
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("User must be a numeric id (use --identity for auth identities): " + raw);
        }
    }

    @Command(name = "init", description = "Initialize directories and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        GameStateCommand parent;

        @Override
        public Integer call() {
            parent.engine();
            System.out.println("Initialized gamevault-state at: " + GameStateConfig.fromRoot(parent.root, parent.namespace).rootDir());
            return 0;
        }
    }

    @Command(name = "audit", description = "Report keys tracked in more than one set (read-only)")
    static final class AuditCommand implements Callable<Integer> {
        @ParentCommand
        GameStateCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.engine().audit()));
            return 0;
        }
    }

    @Command(name = "snapshot", description = "Copy all tracking sets into a verified backup snapshot")
    static final class SnapshotCommand implements Callable<Integer> {
        @ParentCommand
        GameStateCommand parent;

        @Option(names = {"--label"}, defaultValue = "", description = "Free-form label stored with the snapshot")
        String label;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.engine().snapshot(label)));
            return 0;
        }
    }

    @Command(name = "snapshots", description = "List snapshots, newest first")
    static final class SnapshotsCommand implements Callable<Integer> {
        @ParentCommand
        GameStateCommand parent;

        @Option(names = {"--limit"}, defaultValue = "20", description = "Max rows to print")
        int limit;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.engine().snapshots(limit)));
            return 0;
        }
    }

    @Command(name = "snapshot-discard", description = "Drop the rows of a snapshot once it is no longer needed")
    static final class SnapshotDiscardCommand implements Callable<Integer> {
        @ParentCommand
        GameStateCommand parent;

        @Parameters(index = "0", description = "Snapshot id")
        String snapshotId;

        @Override
        public Integer call() {
            boolean discarded = parent.engine().discardSnapshot(snapshotId);
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("snapshotId", snapshotId);
            out.put("discarded", discarded);
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "resolve", description = "Collapse conflicting keys to one record each")
    static final class ResolveCommand implements Callable<Integer> {
        @ParentCommand
        GameStateCommand parent;

        @Option(names = {"--snapshot"}, description = "Snapshot id to resolve against (default: take a new snapshot)")
        String snapshotId;

        @Option(names = {"--chunk-size"}, defaultValue = "0", description = "Keys per transaction (0 = configured)")
        int chunkSize;

        @Override
        public Integer call() {
            GameStateEngine engine = parent.engine();
            var out = snapshotId == null || snapshotId.isBlank()
                    ? engine.resolve(chunkSize, null)
                    : engine.resolve(snapshotId, chunkSize, null);
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "cleanup", description = "Run audit, snapshot, resolve and a verifying audit")
    static final class CleanupCommand implements Callable<Integer> {
        @ParentCommand
        GameStateCommand parent;

        @Option(names = {"--label"}, defaultValue = "cleanup", description = "Label of the pre-resolution snapshot")
        String label;

        @Override
        public Integer call() {
            GameStateEngine.CleanupOutcome out = parent.engine().cleanup(label);
            System.out.println(Jsons.toJson(out));
            return out.clean() ? 0 : 1;
        }
    }

    @Command(name = "soft-rollback", description = "Disable write-time enforcement; data is left untouched")
    static final class SoftRollbackCommand implements Callable<Integer> {
        @ParentCommand
        GameStateCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.engine().softRollback()));
            return 0;
        }
    }

    @Command(name = "enforcement", description = "Show or switch write-time enforcement: enable|disable|status")
    static final class EnforcementCommand implements Callable<Integer> {
        @ParentCommand
        GameStateCommand parent;

        @Parameters(index = "0", defaultValue = "status", description = "enable|disable|status")
        String action;

        @Override
        public Integer call() {
            GameStateEngine engine = parent.engine();
            String normalized = action == null ? "status" : action.trim().toLowerCase(Locale.ROOT);
            switch (normalized) {
                case "enable" -> System.out.println(Jsons.toJson(engine.enableEnforcement()));
                case "disable" -> System.out.println(Jsons.toJson(engine.softRollback()));
                case "status" -> {
                    Map<String, Object> out = new LinkedHashMap<>();
                    out.put("enforcementEnabled", engine.enforcementEnabled());
                    System.out.println(Jsons.toJson(out));
                }
                default -> throw new IllegalArgumentException("Unknown enforcement action: " + action);
            }
            return 0;
        }
    }

    @Command(name = "hard-rollback", description = "Replace all tracking sets with a snapshot. Loses every later write.")
    static final class HardRollbackCommand implements Callable<Integer> {
        @ParentCommand
        GameStateCommand parent;

        @Parameters(index = "0", description = "Snapshot id")
        String snapshotId;

        @Option(names = {"--confirm-data-loss"}, description = "Required acknowledgement that later writes are discarded")
        boolean confirmDataLoss;

        @Override
        public Integer call() {
            if (!confirmDataLoss) {
                System.err.println("hard-rollback discards every tracking write made after the snapshot; re-run with --confirm-data-loss");
                return EXIT_INVALID;
            }
            System.out.println(Jsons.toJson(parent.engine().hardRollback(snapshotId)));
            return 0;
        }
    }

    @Command(name = "conflict-log", description = "Show conflict resolution log entries, newest first")
    static final class ConflictLogCommand implements Callable<Integer> {
        @ParentCommand
        GameStateCommand parent;

        @Option(names = {"--user"}, description = "Optional user id filter")
        Long userId;

        @Option(names = {"--run-id"}, description = "Optional resolution run filter")
        String runId;

        @Option(names = {"--limit"}, defaultValue = "100", description = "Max rows to print")
        int limit;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.engine().conflictLog(userId, runId, limit)));
            return 0;
        }
    }

    @Command(name = "timeline", description = "Show the recorded state transitions of one game for one user")
    static final class TimelineCommand implements Callable<Integer> {
        @ParentCommand
        GameStateCommand parent;

        @Parameters(index = "0", description = "User id, or auth identity with --identity")
        String user;

        @Parameters(index = "1", description = "Game key")
        long gameKey;

        @Option(names = {"--identity"}, description = "Treat the user argument as an auth identity")
        boolean identity;

        @Override
        public Integer call() {
            GameStateEngine engine = parent.engine();
            System.out.println(Jsons.toJson(engine.timeline(userId(engine, user, identity), gameKey)));
            return 0;
        }
    }

    @Command(name = "state", description = "Show what a user currently tracks for one game")
    static final class StateCommand implements Callable<Integer> {
        @ParentCommand
        GameStateCommand parent;

        @Parameters(index = "0", description = "User id, or auth identity with --identity")
        String user;

        @Parameters(index = "1", description = "Game key")
        long gameKey;

        @Option(names = {"--identity"}, description = "Treat the user argument as an auth identity")
        boolean identity;

        @Override
        public Integer call() {
            GameStateEngine engine = parent.engine();
            System.out.println(Jsons.toJson(engine.tracking().currentState(userId(engine, user, identity), gameKey)));
            return 0;
        }
    }

    @Command(name = "list", description = "List a user's records in one tracking set")
    static final class ListCommand implements Callable<Integer> {
        @ParentCommand
        GameStateCommand parent;

        @Parameters(index = "0", description = "User id, or auth identity with --identity")
        String user;

        @Parameters(index = "1", description = "wishlist|collection|progress")
        String kind;

        @Option(names = {"--identity"}, description = "Treat the user argument as an auth identity")
        boolean identity;

        @Override
        public Integer call() {
            GameStateEngine engine = parent.engine();
            StateKind stateKind = StateKind.fromString(kind);
            System.out.println(Jsons.toJson(engine.tracking().listByState(userId(engine, user, identity), stateKind)));
            return 0;
        }
    }

    @Command(name = "track", description = "Add or move a game: wishlist|collection|started|completed")
    static final class TrackCommand implements Callable<Integer> {
        @ParentCommand
        GameStateCommand parent;

        @Parameters(index = "0", description = "wishlist|collection|started|completed")
        String target;

        @Parameters(index = "1", description = "User id, or auth identity with --identity")
        String user;

        @Parameters(index = "2", description = "Game key")
        long gameKey;

        @Option(names = {"--identity"}, description = "Treat the user argument as an auth identity")
        boolean identity;

        @Option(names = {"--priority"}, description = "Wishlist priority")
        Integer priority;

        @Option(names = {"--notes"}, description = "Wishlist notes")
        String notes;

        @Option(names = {"--bypass-reason"}, description = "Skip exclusivity enforcement for this write, stating why")
        String bypassReason;

        @Override
        public Integer call() {
            GameStateEngine engine = parent.engine();
            long userId = userId(engine, user, identity);
            TrackingWrite write = switch (target == null ? "" : target.trim().toLowerCase(Locale.ROOT)) {
                case "wishlist" -> TrackingWrite.wishlist(userId, gameKey, priority, notes);
                case "collection" -> TrackingWrite.collection(userId, gameKey);
                case "started" -> TrackingWrite.started(userId, gameKey);
                case "completed" -> TrackingWrite.completed(userId, gameKey);
                default -> throw new IllegalArgumentException("Unknown track target: " + target);
            };
            if (bypassReason != null) {
                write = write.withOptions(WriteOptions.bypass(bypassReason));
            }
            GuardOutcome out = engine.tracking().write(write);
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "untrack", description = "Remove a game from one set, or from all of them: wishlist|collection|progress|all")
    static final class UntrackCommand implements Callable<Integer> {
        @ParentCommand
        GameStateCommand parent;

        @Parameters(index = "0", description = "wishlist|collection|progress|all")
        String target;

        @Parameters(index = "1", description = "User id, or auth identity with --identity")
        String user;

        @Parameters(index = "2", description = "Game key")
        long gameKey;

        @Option(names = {"--identity"}, description = "Treat the user argument as an auth identity")
        boolean identity;

        @Override
        public Integer call() {
            GameStateEngine engine = parent.engine();
            TrackingService tracking = engine.tracking();
            long userId = userId(engine, user, identity);
            TrackingService.RemovalOutcome out = switch (target == null ? "" : target.trim().toLowerCase(Locale.ROOT)) {
                case "wishlist" -> tracking.removeFromWishlist(userId, gameKey);
                case "collection" -> tracking.removeFromCollection(userId, gameKey);
                case "progress" -> tracking.clearProgress(userId, gameKey);
                case "all" -> tracking.removeFromAllStates(userId, gameKey);
                default -> throw new IllegalArgumentException("Unknown untrack target: " + target);
            };
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "metrics", description = "Print engine metrics in Prometheus text format")
    static final class MetricsCommand implements Callable<Integer> {
        @ParentCommand
        GameStateCommand parent;

        @Override
        public Integer call() {
            GameStateEngine engine = parent.engine();
            System.out.print(PrometheusFormatter.format(engine.stats(), parent.namespace));
            return 0;
        }
    }

    @Command(name = "settings", description = "Show effective engine settings")
    static final class SettingsCommand implements Callable<Integer> {
        @ParentCommand
        GameStateCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.engine().settings()));
            return 0;
        }
    }

    @Command(name = "audit-tail", description = "Print the last audit log lines")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        GameStateCommand parent;

        @Option(names = {"--lines"}, defaultValue = "20", description = "Number of lines")
        int lines;

        @Override
        public Integer call() {
            for (String line : parent.engine().auditTail(lines)) {
                System.out.println(line);
            }
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit log hash chain and signatures")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        GameStateCommand parent;

        @Override
        public Integer call() {
            AuditLogger.IntegrityReport out = parent.engine().auditVerify();
            System.out.println(Jsons.toJson(out));
            return out.ok() ? 0 : 1;
        }
    }

    @Command(name = "schema-migrations", description = "Show applied schema migration versions")
    static final class SchemaMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        GameStateCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows to print")
        int limit;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.engine().schemaMigrations(limit)));
            return 0;
        }
    }

    @Command(name = "schema-rollback", description = "Roll back the most recent applied migration version")
    static final class SchemaRollbackCommand implements Callable<Integer> {
        @ParentCommand
        GameStateCommand parent;

        @Option(names = {"--version"}, required = true, description = "Migration version to roll back")
        String version;

        @Override
        public Integer call() {
            Database.RollbackOutcome out = parent.engine().rollbackSchemaMigration(version);
            System.out.println(Jsons.toJson(out));
            return out.removedMigrationRow() ? 0 : 1;
        }
    }
}
