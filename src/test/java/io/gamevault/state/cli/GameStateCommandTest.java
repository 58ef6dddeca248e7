package io.gamevault.state.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.gamevault.state.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class GameStateCommandTest {

    @Test
    void trackRejectionPrintsJsonErrorWithExitCodeTwo() throws Exception {
        Path root = Files.createTempDirectory("gamevault-cli-reject-");
        try {
            Assertions.assertEquals(0, run(root, "track", "completed", "5", "42").exitCode());

            Result rejected = run(root, "track", "wishlist", "5", "42");

            Assertions.assertEquals(GameStateCommand.EXIT_ENGINE_ERROR, rejected.exitCode());
            Assertions.assertTrue(rejected.err().contains("\"kind\":\"StateConflict\""));

            JsonNode state = Jsons.mapper().readTree(run(root, "state", "5", "42").out());
            Assertions.assertEquals("PROGRESS", state.path("currentKind").asText());
            Assertions.assertTrue(state.path("completed").asBoolean());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void cleanupExitsZeroWhenNothingRemains() throws Exception {
        Path root = Files.createTempDirectory("gamevault-cli-cleanup-");
        try {
            run(root, "track", "wishlist", "7", "100", "--bypass-reason", "seed");
            run(root, "enforcement", "disable");
            run(root, "track", "collection", "7", "100");

            JsonNode audit = Jsons.mapper().readTree(run(root, "audit").out());
            Assertions.assertEquals(1, audit.path("conflictingKeys").asInt());

            Result cleanup = run(root, "cleanup", "--label", "cli");
            Assertions.assertEquals(0, cleanup.exitCode());
            JsonNode out = Jsons.mapper().readTree(cleanup.out());
            Assertions.assertTrue(out.path("clean").asBoolean());
            Assertions.assertEquals(1, out.path("resolution").path("pairsResolved").asInt());

            JsonNode log = Jsons.mapper().readTree(run(root, "conflict-log", "--user", "7").out());
            Assertions.assertEquals(1, log.size());
            Assertions.assertEquals("Wishlist-Collection", log.get(0).path("conflictType").asText());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void resolveTakesItsOwnSnapshotUnlessOneIsNamed() throws Exception {
        Path root = Files.createTempDirectory("gamevault-cli-resolve-");
        try {
            Result missing = run(root, "resolve", "--snapshot", "snap_missing");
            Assertions.assertEquals(GameStateCommand.EXIT_ENGINE_ERROR, missing.exitCode());
            Assertions.assertTrue(missing.err().contains("\"kind\":\"BackupFailure\""));

            Result out = run(root, "resolve", "--chunk-size", "5");
            Assertions.assertEquals(0, out.exitCode());
            Assertions.assertTrue(Jsons.mapper().readTree(out.out()).path("snapshotId").asText().startsWith("snap_"));
            Assertions.assertEquals(1, Jsons.mapper().readTree(run(root, "snapshots").out()).size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void hardRollbackRequiresConfirmation() throws Exception {
        Path root = Files.createTempDirectory("gamevault-cli-hard-rollback-");
        try {
            run(root, "track", "collection", "1", "1");
            String snapshotId = Jsons.mapper().readTree(run(root, "snapshot").out()).path("snapshotId").asText();
            run(root, "track", "collection", "2", "2");

            Assertions.assertEquals(GameStateCommand.EXIT_INVALID, run(root, "hard-rollback", snapshotId).exitCode());

            Result restored = run(root, "hard-rollback", snapshotId, "--confirm-data-loss");
            Assertions.assertEquals(0, restored.exitCode());
            Assertions.assertEquals(0, Jsons.mapper().readTree(run(root, "list", "2", "collection").out()).size());
            JsonNode status = Jsons.mapper().readTree(run(root, "enforcement", "status").out());
            Assertions.assertFalse(status.path("enforcementEnabled").asBoolean());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void invalidArgumentsExitWithOne() throws Exception {
        Path root = Files.createTempDirectory("gamevault-cli-invalid-");
        try {
            Assertions.assertEquals(GameStateCommand.EXIT_INVALID, run(root, "track", "shelf", "1", "1").exitCode());
            Assertions.assertEquals(GameStateCommand.EXIT_INVALID, run(root, "state", "alice", "1").exitCode());
            Result missingParams = run(root, "track", "wishlist");
            Assertions.assertEquals(GameStateCommand.EXIT_INVALID, missingParams.exitCode());
            Assertions.assertTrue(missingParams.err().contains("Missing required parameter"));
            Assertions.assertEquals(GameStateCommand.EXIT_INVALID, run(root, "snapshots", "--bogus").exitCode());
            Assertions.assertEquals(GameStateCommand.EXIT_INVALID, run(root, "resolve", "--chunk-size", "many").exitCode());
            Assertions.assertEquals(GameStateCommand.EXIT_INVALID, run(root, "state", "nobody", "1", "--identity").exitCode());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void auditVerifyAndMetricsSucceedOnFreshRoot() throws Exception {
        Path root = Files.createTempDirectory("gamevault-cli-ops-");
        try {
            Assertions.assertEquals(0, run(root, "init").exitCode());
            Result metrics = run(root, "metrics");
            Assertions.assertEquals(0, metrics.exitCode());
            Assertions.assertTrue(metrics.out().contains("gamevault_enforcement_enabled 1"));
            Result verify = run(root, "audit-verify");
            Assertions.assertEquals(0, verify.exitCode());
            Assertions.assertTrue(Jsons.mapper().readTree(verify.out()).path("ok").asBoolean());
            Assertions.assertEquals(0, run(root, "schema-migrations").exitCode());
        } finally {
            deleteRecursively(root);
        }
    }

    private static Result run(Path root, String... args) {
        String[] full = new String[args.length + 2];
        full[0] = "--root";
        full[1] = root.toString();
        System.arraycopy(args, 0, full, 2, args.length);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
            int code = GameStateCommand.commandLine().execute(full);
            return new Result(code, out.toString(StandardCharsets.UTF_8), err.toString(StandardCharsets.UTF_8));
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private record Result(int exitCode, String out, String err) {
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
