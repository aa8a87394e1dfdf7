package io.tagkeeper.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.tagkeeper.util.Hashing;
import io.tagkeeper.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSONL event log. Each row carries the hash of the previous row,
 * and an HMAC signature when a signing secret is configured, so that
 * {@link #verifyChain()} can detect edited or dropped lines.
 */
public final class AuditLogger {
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
            if (auditFile.getParent() != null) {
                Files.createDirectories(auditFile.getParent());
            }
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public AuditLogger(Path auditFile, String namespace, String signingSecret) {
        this(auditFile, namespace, signingSecret, Clock.systemUTC());
    }

    public synchronized void log(AuditEvent event) {
        ObjectNode row = Jsons.compactMapper().createObjectNode();
        row.put("timestamp", clock.instant().toString());
        row.put("namespace", namespace);
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("subject", event.subject());
        row.put("result", event.result());
        row.set("details", Jsons.compactMapper().valueToTree(event.details()));
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(toCompactJson(row));
        row.put("hash", rowHash);
        if (!signingSecret.isBlank()) {
            row.put("signature", Hashing.hmacSha256Hex(signingSecret, rowHash));
        }
        String line = toCompactJson(row) + System.lineSeparator();
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

    public Path auditFile() {
        return auditFile;
    }

    /** Last {@code limit} rows, oldest first. Unparseable lines are skipped. */
    public synchronized List<JsonNode> tail(int limit) {
        List<String> lines = readLines();
        int safeLimit = Math.max(1, limit);
        int from = Math.max(0, lines.size() - safeLimit);
        List<JsonNode> out = new ArrayList<>();
        for (String line : lines.subList(from, lines.size())) {
            try {
                out.add(Jsons.compactMapper().readTree(line));
            } catch (JsonProcessingException ignored) {
                // verifyChain() reports malformed rows; tail only shows readable ones.
            }
        }
        return out;
    }

    public synchronized AuditVerifyOutcome verifyChain() {
        List<String> lines = readLines();
        String expectedPrev = "";
        int row = 0;
        for (String line : lines) {
            row++;
            JsonNode node;
            try {
                node = Jsons.compactMapper().readTree(line);
            } catch (JsonProcessingException e) {
                return AuditVerifyOutcome.broken(row, "malformed_json");
            }
            if (!node.isObject()) {
                return AuditVerifyOutcome.broken(row, "not_an_object");
            }
            ObjectNode obj = (ObjectNode) node;
            String hash = obj.path("hash").asText("");
            String signature = obj.path("signature").asText("");
            if (!expectedPrev.equals(obj.path("prev_hash").asText(""))) {
                return AuditVerifyOutcome.broken(row, "prev_hash_mismatch");
            }
            ObjectNode unsigned = obj.deepCopy();
            unsigned.remove("hash");
            unsigned.remove("signature");
            if (!Hashing.sha256Hex(toCompactJson(unsigned)).equals(hash)) {
                return AuditVerifyOutcome.broken(row, "hash_mismatch");
            }
            if (!signingSecret.isBlank()
                    && !Hashing.constantTimeEquals(Hashing.hmacSha256Hex(signingSecret, hash), signature)) {
                return AuditVerifyOutcome.broken(row, "signature_mismatch");
            }
            expectedPrev = hash;
        }
        return new AuditVerifyOutcome(true, row, 0, "ok");
    }

    private List<String> readLines() {
        try {
            if (!Files.exists(auditFile)) {
                return List.of();
            }
            List<String> out = new ArrayList<>();
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    out.add(line);
                }
            }
            return out;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
    }

    private String loadLastHash() {
        List<String> lines = readLines();
        if (lines.isEmpty()) {
            return "";
        }
        try {
            JsonNode node = Jsons.compactMapper().readTree(lines.get(lines.size() - 1));
            return node.path("hash").asText("");
        } catch (JsonProcessingException e) {
            return "";
        }
    }

    private static String toCompactJson(JsonNode row) {
        try {
            return Jsons.compactMapper().writeValueAsString(row);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize audit row", e);
        }
    }

    public record AuditEvent(
            String action,
            String actor,
            String subject,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String subject, String result, Map<String, Object> details) {
            return new AuditEvent(action, "system", subject, result, details == null ? Map.of() : details);
        }

        public static AuditEvent ofActor(String action, String actor, String subject, String result,
                                         Map<String, Object> details) {
            return new AuditEvent(
                    action,
                    actor == null || actor.isBlank() ? "system" : actor.trim(),
                    subject,
                    result,
                    details == null ? Map.of() : details
            );
        }
    }

    public record AuditVerifyOutcome(boolean ok, int rows, int brokenAtRow, String reason) {
        static AuditVerifyOutcome broken(int row, String reason) {
            return new AuditVerifyOutcome(false, row, row, reason);
        }
    }
}
