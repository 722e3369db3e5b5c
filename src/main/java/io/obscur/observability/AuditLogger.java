package io.obscur.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.obscur.error.StorageException;
import io.obscur.security.SecurityUtils;
import io.obscur.util.Hashing;
import io.obscur.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSON-lines audit trail. Rows are hash-chained and optionally
 * HMAC-signed; every {@code details} map is redacted before it is written.
 */
public final class AuditLogger {
    private final Path auditFile;
    private final String identity;
    private final String signingSecret;
    private final Clock clock;
    private String previousHash;

    public AuditLogger(Path auditFile, String identity, String signingSecret) {
        this(auditFile, identity, signingSecret, Clock.systemUTC());
    }

    public AuditLogger(Path auditFile, String identity, String signingSecret, Clock clock) {
        this.auditFile = auditFile;
        this.identity = identity == null || identity.isBlank() ? "default" : identity.trim();
        this.signingSecret = signingSecret == null ? "" : signingSecret.trim();
        this.clock = clock;
        this.previousHash = "";
        if (auditFile != null) {
            try {
                Files.createDirectories(auditFile.getParent());
            } catch (IOException e) {
                throw new StorageException("Failed to initialize audit log file: " + auditFile, e);
            }
            this.previousHash = loadLastHash();
        }
    }

    public static AuditLogger disabled() {
        return new AuditLogger(null, "default", "", Clock.systemUTC());
    }

    public boolean enabled() {
        return auditFile != null;
    }

    public synchronized void log(AuditEvent event) {
        if (auditFile == null) {
            return;
        }
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", clock.instant().toString());
        row.put("identity", identity);
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("details", SecurityUtils.sanitizeForLogging(event.details()));
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
            throw new StorageException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    /**
     * Recomputes the hash chain (and signatures when a secret is configured).
     * Returns the number of intact rows, or -1 when the chain is broken.
     */
    public synchronized int verifyChain() {
        if (auditFile == null) {
            return 0;
        }
        String expectedPrev = "";
        int rows = 0;
        for (String line : readLines()) {
            if (line.isBlank()) {
                continue;
            }
            JsonNode node = Jsons.fromJson(line, JsonNode.class);
            String hash = node.path("hash").asText("");
            String signature = node.path("signature").asText("");
            if (!expectedPrev.equals(node.path("prev_hash").asText(""))) {
                return -1;
            }
            Map<String, Object> unsigned = new LinkedHashMap<>();
            node.fields().forEachRemaining(entry -> {
                if (!"hash".equals(entry.getKey()) && !"signature".equals(entry.getKey())) {
                    unsigned.put(entry.getKey(), entry.getValue());
                }
            });
            if (!Hashing.sha256Hex(Jsons.toCompactJson(unsigned)).equals(hash)) {
                return -1;
            }
            if (!signingSecret.isBlank()
                    && !SecurityUtils.constantTimeStringCompare(Hashing.hmacSha256Hex(signingSecret, hash), signature)) {
                return -1;
            }
            expectedPrev = hash;
            rows++;
        }
        return rows;
    }

    private String loadLastHash() {
        String last = "";
        for (String line : readLines()) {
            if (line != null && !line.isBlank()) {
                last = line;
            }
        }
        if (last.isBlank()) {
            return "";
        }
        return Jsons.fromJson(last, JsonNode.class).path("hash").asText("");
    }

    private List<String> readLines() {
        if (!Files.exists(auditFile)) {
            return List.of();
        }
        try {
            return Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StorageException("Failed to read audit log: " + auditFile, e);
        }
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String actor, String resource, String result, Map<String, Object> details) {
            return new AuditEvent(action, actor, resource, result, details == null ? Map.of() : details);
        }

        public static AuditEvent system(String action, String resource, String result, Map<String, Object> details) {
            return of(action, "system", resource, result, details);
        }
    }
}
