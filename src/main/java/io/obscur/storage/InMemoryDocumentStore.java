package io.obscur.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.obscur.error.ValidationException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/** Volatile {@link DocumentStore} for tests and ephemeral identities. */
public final class InMemoryDocumentStore implements DocumentStore {
    private final Map<StoreName, ConcurrentSkipListMap<String, ObjectNode>> stores = new EnumMap<>(StoreName.class);

    public InMemoryDocumentStore() {
        for (StoreName store : StoreName.values()) {
            stores.put(store, new ConcurrentSkipListMap<>());
        }
    }

    @Override
    public Optional<ObjectNode> get(StoreName store, String id) {
        requireId(id);
        ObjectNode doc = stores.get(store).get(id);
        return doc == null ? Optional.empty() : Optional.of(doc.deepCopy());
    }

    @Override
    public void put(StoreName store, String id, ObjectNode document) {
        requireId(id);
        if (document == null) {
            throw new ValidationException("document must not be null");
        }
        for (IndexName index : IndexName.values()) {
            if (index.store() != store) {
                continue;
            }
            JsonNode value = document.get(index.field());
            boolean ok = index.numeric()
                    ? value != null && value.isNumber()
                    : value != null && value.isTextual() && !value.asText().isBlank();
            if (!ok) {
                throw new ValidationException("document is missing index field " + index.field());
            }
        }
        stores.get(store).put(id, document.deepCopy());
    }

    @Override
    public boolean delete(StoreName store, String id) {
        requireId(id);
        return stores.get(store).remove(id) != null;
    }

    @Override
    public List<ObjectNode> getAllByIndex(IndexName index, IndexQuery query) {
        IndexQuery effective = query == null ? IndexQuery.all() : query;
        List<ObjectNode> out = new ArrayList<>();
        for (Map.Entry<String, ObjectNode> entry : stores.get(index.store()).entrySet()) {
            if (effective.matches(entry.getValue().get(index.field()), index.numeric())) {
                out.add(entry.getValue().deepCopy());
            }
        }
        Comparator<ObjectNode> byIndex = index.numeric()
                ? Comparator.comparingLong(doc -> doc.get(index.field()).asLong())
                : Comparator.comparing(doc -> doc.get(index.field()).asText());
        out.sort(byIndex.thenComparing(doc -> doc.path("id").asText()));
        return out;
    }

    @Override
    public long countByIndex(IndexName index, IndexQuery query) {
        IndexQuery effective = query == null ? IndexQuery.all() : query;
        return stores.get(index.store()).values().stream()
                .filter(doc -> effective.matches(doc.get(index.field()), index.numeric()))
                .count();
    }

    @Override
    public List<ObjectNode> getAll(StoreName store) {
        List<ObjectNode> out = new ArrayList<>();
        for (ObjectNode doc : stores.get(store).values()) {
            out.add(doc.deepCopy());
        }
        return out;
    }

    private static void requireId(String id) {
        if (id == null || id.isBlank()) {
            throw new ValidationException("document id must not be blank");
        }
    }
}
