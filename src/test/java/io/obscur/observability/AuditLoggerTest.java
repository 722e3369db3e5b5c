package io.obscur.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.obscur.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class AuditLoggerTest {
    private static final String PRIVATE_KEY = "5a".repeat(32);
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

    @Test
    void rowsAreChainedAndRedacted() throws Exception {
        Path dir = Files.createTempDirectory("obscur-audit-");
        try {
            Path file = dir.resolve("audit").resolve("audit.log");
            AuditLogger audit = new AuditLogger(file, " Alice ", "", CLOCK);
            audit.log(AuditLogger.AuditEvent.system("crypto.sign", "event", "ok", sensitiveDetails()));
            audit.log(AuditLogger.AuditEvent.of("store.cleanup", "user", "messages", "ok", Map.of("deleted", 3)));
            audit.log(AuditLogger.AuditEvent.system("relay.breaker.open", "wss://relay.one", "open", null));

            String text = Files.readString(file, StandardCharsets.UTF_8);
            Assertions.assertFalse(text.contains(PRIVATE_KEY));
            Assertions.assertFalse(text.contains("meet at the docks"));

            List<JsonNode> rows = rows(file);
            Assertions.assertEquals(3, rows.size());
            Assertions.assertEquals("Alice", rows.get(0).path("identity").asText());
            Assertions.assertEquals("2026-03-01T10:00:00Z", rows.get(0).path("timestamp").asText());
            Assertions.assertEquals("", rows.get(0).path("prev_hash").asText());
            Assertions.assertEquals(rows.get(0).path("hash").asText(), rows.get(1).path("prev_hash").asText());
            Assertions.assertEquals(rows.get(1).path("hash").asText(), rows.get(2).path("prev_hash").asText());
            Assertions.assertEquals("user", rows.get(1).path("actor").asText());
            Assertions.assertEquals("wss://relay.one", rows.get(0).path("details").path("relay").asText());
            Assertions.assertFalse(rows.get(0).has("signature"));
            Assertions.assertEquals(rows.get(2).path("hash").asText(), audit.currentHash());
            Assertions.assertEquals(3, audit.verifyChain());
        } finally {
            deleteRecursively(dir);
        }
    }

    @Test
    void reopenedLoggerContinuesTheChain() throws Exception {
        Path dir = Files.createTempDirectory("obscur-audit-");
        try {
            Path file = dir.resolve("audit.log");
            AuditLogger first = new AuditLogger(file, "alice", "", CLOCK);
            first.log(AuditLogger.AuditEvent.system("runtime.settings.load", "alice", "ok", Map.of()));
            String tail = first.currentHash();

            AuditLogger second = new AuditLogger(file, "alice", "", CLOCK);
            Assertions.assertEquals(tail, second.currentHash());
            second.log(AuditLogger.AuditEvent.system("store.at_rest.toggle", "alice", "ok", Map.of("encryptStorageAtRest", false)));

            Assertions.assertEquals(2, second.verifyChain());
            Assertions.assertEquals(tail, rows(file).get(1).path("prev_hash").asText());
        } finally {
            deleteRecursively(dir);
        }
    }

    @Test
    void editedRowBreaksVerification() throws Exception {
        Path dir = Files.createTempDirectory("obscur-audit-");
        try {
            Path file = dir.resolve("audit.log");
            AuditLogger audit = new AuditLogger(file, "alice", "", CLOCK);
            audit.log(AuditLogger.AuditEvent.system("retry.exhausted", "m-1", "failed", Map.of("retryCount", 5)));
            audit.log(AuditLogger.AuditEvent.system("retry.scheduled", "m-2", "ok", Map.of("delayMs", 1000)));

            List<String> lines = new ArrayList<>(Files.readAllLines(file, StandardCharsets.UTF_8));
            lines.set(0, lines.get(0).replace("\"result\":\"failed\"", "\"result\":\"ok\""));
            Files.write(file, lines, StandardCharsets.UTF_8);

            Assertions.assertEquals(-1, audit.verifyChain());
        } finally {
            deleteRecursively(dir);
        }
    }

    @Test
    void signedRowsRequireTheSameSecret() throws Exception {
        Path dir = Files.createTempDirectory("obscur-audit-");
        try {
            Path file = dir.resolve("audit.log");
            AuditLogger audit = new AuditLogger(file, "alice", "audit-secret", CLOCK);
            audit.log(AuditLogger.AuditEvent.system("crypto.decrypt", "dm", "ok", Map.of()));
            audit.log(AuditLogger.AuditEvent.system("crypto.decrypt", "dm", "error", Map.of("error", "bad mac")));

            Assertions.assertEquals(64, rows(file).get(0).path("signature").asText().length());
            Assertions.assertEquals(2, audit.verifyChain());
            Assertions.assertEquals(2, new AuditLogger(file, "alice", "", CLOCK).verifyChain());
            Assertions.assertEquals(-1, new AuditLogger(file, "alice", "other-secret", CLOCK).verifyChain());
        } finally {
            deleteRecursively(dir);
        }
    }

    @Test
    void disabledLoggerWritesNothing() {
        AuditLogger audit = AuditLogger.disabled();
        audit.log(AuditLogger.AuditEvent.system("crypto.sign", "event", "ok", sensitiveDetails()));

        Assertions.assertFalse(audit.enabled());
        Assertions.assertEquals("", audit.currentHash());
        Assertions.assertEquals(0, audit.verifyChain());
    }

    private static Map<String, Object> sensitiveDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("privateKey", PRIVATE_KEY);
        details.put("content", "meet at the docks");
        details.put("relay", "wss://relay.one");
        return details;
    }

    private static List<JsonNode> rows(Path file) throws IOException {
        List<JsonNode> out = new ArrayList<>();
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            if (!line.isBlank()) {
                out.add(Jsons.fromJson(line, JsonNode.class));
            }
        }
        return out;
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
