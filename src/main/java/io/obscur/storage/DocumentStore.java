package io.obscur.storage;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Optional;

/**
 * Keyed JSON document storage with the secondary indexes of {@link IndexName}.
 * A completed {@code put} or {@code delete} is durable; implementations do not
 * buffer writes. Documents returned are copies the caller may modify.
 */
public interface DocumentStore {

    Optional<ObjectNode> get(StoreName store, String id);

    void put(StoreName store, String id, ObjectNode document);

    boolean delete(StoreName store, String id);

    /** Matching documents ordered by the index value, then by id. */
    List<ObjectNode> getAllByIndex(IndexName index, IndexQuery query);

    long countByIndex(IndexName index, IndexQuery query);

    List<ObjectNode> getAll(StoreName store);
}
