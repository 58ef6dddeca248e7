package io.gamevault.state.observability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.gamevault.state.util.Hashing;
import io.gamevault.state.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSON-lines log of operator and writer actions. Each row carries the hash of the
 * row before it, and an HMAC of its own hash when a signing secret is configured.
 */
public final class AuditLogger {
    private static final Logger LOG = LoggerFactory.getLogger(AuditLogger.class);

    private final Path auditFile;
    private final String namespace;
    private final String signingSecret;
    private final Clock clock;
    private String previousHash;

    public AuditLogger(Path auditFile, String namespace, String signingSecret, Clock clock) {
        this.auditFile = auditFile;
        this.namespace = namespace == null || namespace.isBlank() ? "default" : namespace.trim();
        this.signingSecret = signingSecret == null ? "" : signingSecret.trim();
        this.clock = clock == null ? Clock.systemUTC() : clock;
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Created by another process between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", clock.instant().toString());
        row.put("namespace", namespace);
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("details", event.details() == null ? Map.of() : event.details());
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        if (!signingSecret.isBlank()) {
            row.put("signature", Hashing.hmacSha256Hex(signingSecret, rowHash));
        }
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public List<String> tail(int lines) {
        if (!Files.exists(auditFile)) {
            return List.of();
        }
        try {
            List<String> all = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
            int n = Math.max(1, lines);
            int from = Math.max(0, all.size() - n);
            return new ArrayList<>(all.subList(from, all.size()));
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit tail", e);
        }
    }

    /**
     * Recomputes the chain from the first row. Stops at the first row whose JSON, link, hash or
     * signature does not match.
     */
    public synchronized IntegrityReport verify() {
        if (!Files.exists(auditFile)) {
            return new IntegrityReport(true, 0, 0, "", "");
        }
        int checked = 0;
        int brokenLine = 0;
        String reason = "";
        String expectedPrev = "";
        try {
            List<String> lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
            for (int i = 0; i < lines.size(); i++) {
                String line = lines.get(i);
                if (line == null || line.isBlank()) {
                    continue;
                }
                JsonNode parsed;
                try {
                    parsed = Jsons.mapper().readTree(line);
                } catch (IOException e) {
                    brokenLine = i + 1;
                    reason = "invalid_json";
                    break;
                }
                String hash = parsed.path("hash").asText("");
                if (!parsed.path("prev_hash").asText("").equals(expectedPrev)) {
                    brokenLine = i + 1;
                    reason = "prev_hash_mismatch";
                    break;
                }
                ObjectNode canonical = parsed.deepCopy();
                canonical.remove("hash");
                canonical.remove("signature");
                if (!Hashing.sha256Hex(Jsons.toCompactJson(canonical)).equals(hash)) {
                    brokenLine = i + 1;
                    reason = "hash_mismatch";
                    break;
                }
                String signature = parsed.path("signature").asText("");
                if (!signature.isBlank() && !signingSecret.isBlank()
                        && !Hashing.hmacSha256Hex(signingSecret, hash).equals(signature)) {
                    brokenLine = i + 1;
                    reason = "signature_mismatch";
                    break;
                }
                checked++;
                expectedPrev = hash;
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to verify audit log", e);
        }
        if (brokenLine > 0) {
            LOG.warn("Audit chain broken at line {}: {}", brokenLine, reason);
        }
        return new IntegrityReport(brokenLine == 0, checked, brokenLine, reason, expectedPrev);
    }

    private String loadLastHash() {
        try {
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            return Jsons.mapper().readTree(last).path("hash").asText("");
        } catch (IOException e) {
            LOG.warn("Audit log {} has an unreadable tail, starting a new chain", auditFile, e);
            return "";
        }
    }

    public record AuditEvent(String action, String actor, String resource, String result, Map<String, Object> details) {
        public static AuditEvent of(String action, String actor, String resource, String result, Map<String, Object> details) {
            return new AuditEvent(action, actor, resource, result, details == null ? Map.of() : details);
        }
    }

    public record IntegrityReport(boolean ok, int checkedRows, int brokenLine, String reason, String tailHash) {
    }
}
