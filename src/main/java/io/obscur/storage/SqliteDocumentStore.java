package io.obscur.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.obscur.error.StorageException;
import io.obscur.error.ValidationException;
import io.obscur.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * SQLite-backed {@link DocumentStore}. Each store is a table keyed by
 * (identity, id); documents are kept as JSON text next to their extracted
 * index columns.
 */
public final class SqliteDocumentStore implements DocumentStore {
    private final Database database;
    private final Clock clock;

    public SqliteDocumentStore(Database database) {
        this(database, Clock.systemUTC());
    }

    public SqliteDocumentStore(Database database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    @Override
    public Optional<ObjectNode> get(StoreName store, String id) {
        requireId(id);
        String sql = "SELECT doc FROM " + store.table() + " WHERE identity=? AND id=?";
        List<ObjectNode> rows = query(sql, ps -> {
            ps.setString(1, database.identity());
            ps.setString(2, id);
        });
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public void put(StoreName store, String id, ObjectNode document) {
        requireId(id);
        if (document == null) {
            throw new ValidationException("document must not be null");
        }
        String json = Jsons.toCompactJson(document);
        long now = clock.millis();
        switch (store) {
            case MESSAGES -> {
                String conversationId = requireText(document, IndexName.CONVERSATION_ID);
                long timestamp = requireLong(document, IndexName.TIMESTAMP);
                exec("""
                        INSERT INTO messages(id, identity, conversation_id, timestamp_ms, doc, updated_at_ms)
                        VALUES(?,?,?,?,?,?)
                        ON CONFLICT(identity, id) DO UPDATE SET
                            conversation_id=excluded.conversation_id,
                            timestamp_ms=excluded.timestamp_ms,
                            doc=excluded.doc,
                            updated_at_ms=excluded.updated_at_ms
                        """, ps -> {
                    ps.setString(1, id);
                    ps.setString(2, database.identity());
                    ps.setString(3, conversationId);
                    ps.setLong(4, timestamp);
                    ps.setString(5, json);
                    ps.setLong(6, now);
                });
            }
            case QUEUE -> {
                long nextRetryAt = requireLong(document, IndexName.NEXT_RETRY_AT);
                exec("""
                        INSERT INTO queue(id, identity, next_retry_at_ms, doc, updated_at_ms)
                        VALUES(?,?,?,?,?)
                        ON CONFLICT(identity, id) DO UPDATE SET
                            next_retry_at_ms=excluded.next_retry_at_ms,
                            doc=excluded.doc,
                            updated_at_ms=excluded.updated_at_ms
                        """, ps -> {
                    ps.setString(1, id);
                    ps.setString(2, database.identity());
                    ps.setLong(3, nextRetryAt);
                    ps.setString(4, json);
                    ps.setLong(5, now);
                });
            }
        }
    }

    @Override
    public boolean delete(StoreName store, String id) {
        requireId(id);
        return exec("DELETE FROM " + store.table() + " WHERE identity=? AND id=?", ps -> {
            ps.setString(1, database.identity());
            ps.setString(2, id);
        }) > 0;
    }

    @Override
    public List<ObjectNode> getAllByIndex(IndexName index, IndexQuery query) {
        StringBuilder sql = new StringBuilder("SELECT doc FROM ")
                .append(index.store().table())
                .append(" WHERE identity=?");
        List<Object> args = new ArrayList<>();
        args.add(database.identity());
        appendCondition(sql, args, index, query);
        sql.append(" ORDER BY ").append(index.column()).append(" ASC, id ASC");
        return query(sql.toString(), ps -> bindAll(ps, args));
    }

    @Override
    public long countByIndex(IndexName index, IndexQuery query) {
        StringBuilder sql = new StringBuilder("SELECT COUNT(*) FROM ")
                .append(index.store().table())
                .append(" WHERE identity=?");
        List<Object> args = new ArrayList<>();
        args.add(database.identity());
        appendCondition(sql, args, index, query);
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql.toString())) {
            bindAll(ps, args);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to count " + index.store().table() + " by " + index.field(), e);
        }
    }

    @Override
    public List<ObjectNode> getAll(StoreName store) {
        return query("SELECT doc FROM " + store.table() + " WHERE identity=? ORDER BY id ASC",
                ps -> ps.setString(1, database.identity()));
    }

    private void appendCondition(StringBuilder sql, List<Object> args, IndexName index, IndexQuery query) {
        if (query == null) {
            return;
        }
        String column = index.column();
        if (query.isExact()) {
            sql.append(" AND ").append(column).append("=?");
            args.add(index.numeric() ? (Object) Long.parseLong(query.equalTo()) : query.equalTo());
            return;
        }
        if (!index.numeric()) {
            return;
        }
        if (query.lower() != null) {
            sql.append(" AND ").append(column).append(query.lowerOpen() ? ">?" : ">=?");
            args.add(query.lower());
        }
        if (query.upper() != null) {
            sql.append(" AND ").append(column).append(query.upperOpen() ? "<?" : "<=?");
            args.add(query.upper());
        }
    }

    private void bindAll(PreparedStatement ps, List<Object> args) throws SQLException {
        for (int i = 0; i < args.size(); i++) {
            Object arg = args.get(i);
            if (arg instanceof Long l) {
                ps.setLong(i + 1, l);
            } else {
                ps.setString(i + 1, String.valueOf(arg));
            }
        }
    }

    private List<ObjectNode> query(String sql, Binder binder) {
        List<ObjectNode> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(parse(rs.getString("doc")));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StorageException("DB query failed", e);
        }
    }

    private int exec(String sql, Binder binder) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            binder.bind(ps);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("DB exec failed", e);
        }
    }

    private ObjectNode parse(String json) {
        JsonNode node = Jsons.fromJson(json, JsonNode.class);
        if (!(node instanceof ObjectNode object)) {
            throw new StorageException("Stored document is not a JSON object");
        }
        return object;
    }

    private static void requireId(String id) {
        if (id == null || id.isBlank()) {
            throw new ValidationException("document id must not be blank");
        }
    }

    private static String requireText(ObjectNode document, IndexName index) {
        JsonNode value = document.get(index.field());
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new ValidationException("document is missing index field " + index.field());
        }
        return value.asText();
    }

    private static long requireLong(ObjectNode document, IndexName index) {
        JsonNode value = document.get(index.field());
        if (value == null || !value.isNumber()) {
            throw new ValidationException("document is missing numeric index field " + index.field());
        }
        return value.asLong();
    }

    private interface Binder { void bind(PreparedStatement ps) throws SQLException; }
}
