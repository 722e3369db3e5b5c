package io.obscur.storage;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.obscur.config.ObscurConfig;
import io.obscur.config.ObscurSettings;
import io.obscur.crypto.SoftwareCryptoService;
import io.obscur.error.ValidationException;
import io.obscur.model.Message;
import io.obscur.model.MessageStatus;
import io.obscur.model.PaginationOptions;
import io.obscur.observability.AuditLogger;
import io.obscur.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.util.List;
import java.util.stream.Stream;

final class SqliteDocumentStoreTest {

    @Test
    void indexQueriesFollowIndexOrderAndBounds() throws Exception {
        Path root = Files.createTempDirectory("obscur-sqlite-index-");
        try {
            SqliteDocumentStore store = new SqliteDocumentStore(initDatabase(ObscurConfig.fromRoot(root.toString())));
            store.put(StoreName.MESSAGES, "m-3", doc("m-3", "conv-a", 3_000L));
            store.put(StoreName.MESSAGES, "m-1", doc("m-1", "conv-a", 1_000L));
            store.put(StoreName.MESSAGES, "m-2", doc("m-2", "conv-b", 2_000L));
            store.put(StoreName.MESSAGES, "m-1", doc("m-1", "conv-a", 1_500L));

            List<ObjectNode> convA = store.getAllByIndex(IndexName.CONVERSATION_ID, IndexQuery.only("conv-a"));
            Assertions.assertEquals(2, convA.size());
            Assertions.assertEquals(1_500L, store.get(StoreName.MESSAGES, "m-1").orElseThrow().path("timestamp").asLong());

            List<ObjectNode> byTime = store.getAllByIndex(IndexName.TIMESTAMP, IndexQuery.range(1_500L, true, 3_000L, false));
            Assertions.assertEquals(List.of("m-2", "m-3"), ids(byTime));
            Assertions.assertEquals(List.of("m-1", "m-2"), ids(store.getAllByIndex(IndexName.TIMESTAMP, IndexQuery.below(3_000L))));
            Assertions.assertEquals(3L, store.countByIndex(IndexName.TIMESTAMP, IndexQuery.all()));
            Assertions.assertEquals(1L, store.countByIndex(IndexName.CONVERSATION_ID, IndexQuery.only("conv-b")));

            Assertions.assertTrue(store.delete(StoreName.MESSAGES, "m-3"));
            Assertions.assertFalse(store.delete(StoreName.MESSAGES, "m-3"));
            Assertions.assertTrue(store.get(StoreName.MESSAGES, "m-3").isEmpty());
            Assertions.assertEquals(2, store.getAll(StoreName.MESSAGES).size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void documentsWithoutIndexFieldsAreRejected() throws Exception {
        Path root = Files.createTempDirectory("obscur-sqlite-reject-");
        try {
            SqliteDocumentStore store = new SqliteDocumentStore(initDatabase(ObscurConfig.fromRoot(root.toString())));
            ObjectNode noConversation = Jsons.mapper().createObjectNode().put("id", "x").put("timestamp", 1L);
            ObjectNode noRetryTime = Jsons.mapper().createObjectNode().put("id", "q");

            Assertions.assertThrows(ValidationException.class, () -> store.put(StoreName.MESSAGES, "x", noConversation));
            Assertions.assertThrows(ValidationException.class, () -> store.put(StoreName.QUEUE, "q", noRetryTime));
            Assertions.assertThrows(ValidationException.class, () -> store.put(StoreName.QUEUE, " ", noRetryTime));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void identitiesSharingAFileNeverSeeEachOther() throws Exception {
        Path root = Files.createTempDirectory("obscur-sqlite-identity-");
        try {
            Path base = root.toAbsolutePath().normalize();
            SqliteDocumentStore alice = new SqliteDocumentStore(initDatabase(new ObscurConfig(base, base, "alice")));
            SqliteDocumentStore bob = new SqliteDocumentStore(initDatabase(new ObscurConfig(base, base, "bob")));

            alice.put(StoreName.MESSAGES, "shared-id", doc("shared-id", "conv", 1L));
            bob.put(StoreName.MESSAGES, "shared-id", doc("shared-id", "conv", 2L));

            Assertions.assertEquals(1L, alice.get(StoreName.MESSAGES, "shared-id").orElseThrow().path("timestamp").asLong());
            Assertions.assertEquals(2L, bob.get(StoreName.MESSAGES, "shared-id").orElseThrow().path("timestamp").asLong());
            Assertions.assertEquals(1L, alice.countByIndex(IndexName.CONVERSATION_ID, IndexQuery.only("conv")));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void encryptedMessagesSurviveReopen() throws Exception {
        Path root = Files.createTempDirectory("obscur-sqlite-reopen-");
        try {
            ObscurConfig config = ObscurConfig.fromRoot(root.toString(), "a".repeat(64));
            Message message = Message.builder()
                    .id("m-1")
                    .conversationId("group:friends")
                    .content("durable")
                    .timestamp(42L)
                    .build();

            MessageStore first = openStore(config);
            first.persistMessage(message);
            first.updateMessageStatus("m-1", MessageStatus.ACCEPTED);

            MessageStore second = openStore(config);
            Message reloaded = second.getMessage("m-1").orElseThrow();
            Assertions.assertEquals("durable", reloaded.content());
            Assertions.assertEquals(MessageStatus.ACCEPTED, reloaded.status());
            Assertions.assertEquals(1, second.getMessages("group:friends", PaginationOptions.latest(10)).size());
            Assertions.assertTrue(Files.exists(config.dbFile()));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void reinitKeepsDataAndDurablePragmas() throws Exception {
        Path root = Files.createTempDirectory("obscur-sqlite-init-");
        try {
            Database database = initDatabase(ObscurConfig.fromRoot(root.toString()));
            SqliteDocumentStore store = new SqliteDocumentStore(database);
            store.put(StoreName.MESSAGES, "m-1", doc("m-1", "conv-a", 1_000L));

            database.init();

            Assertions.assertTrue(store.get(StoreName.MESSAGES, "m-1").isPresent());
            try (Connection conn = database.openConnection(); Statement st = conn.createStatement()) {
                Assertions.assertEquals("wal", pragma(st, "journal_mode").toLowerCase());
                Assertions.assertEquals("2", pragma(st, "synchronous"));
                Assertions.assertEquals("1", pragma(st, "foreign_keys"));
            }
        } finally {
            deleteRecursively(root);
        }
    }

    private static String pragma(Statement st, String name) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + name)) {
            Assertions.assertTrue(rs.next());
            return rs.getString(1);
        }
    }

    private static MessageStore openStore(ObscurConfig config) {
        return new MessageStore(
                new SqliteDocumentStore(initDatabase(config)),
                new SoftwareCryptoService(),
                "identity-secret",
                () -> true,
                ObscurSettings.defaults(),
                Clock.systemUTC(),
                AuditLogger.disabled()
        );
    }

    private static Database initDatabase(ObscurConfig config) {
        Database database = new Database(config);
        database.init();
        return database;
    }

    private static ObjectNode doc(String id, String conversationId, long timestamp) {
        return Jsons.mapper().createObjectNode()
                .put("id", id)
                .put("conversationId", conversationId)
                .put("timestamp", timestamp);
    }

    private static List<String> ids(List<ObjectNode> docs) {
        return docs.stream().map(d -> d.path("id").asText()).toList();
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
