package io.obscur.storage;

/**
 * Secondary indexes a {@link DocumentStore} must answer queries on. Each one
 * is read from a top-level document field when the document is written.
 */
public enum IndexName {
    CONVERSATION_ID(StoreName.MESSAGES, "conversationId", "conversation_id", false),
    TIMESTAMP(StoreName.MESSAGES, "timestamp", "timestamp_ms", true),
    NEXT_RETRY_AT(StoreName.QUEUE, "nextRetryAt", "next_retry_at_ms", true);

    private final StoreName store;
    private final String field;
    private final String column;
    private final boolean numeric;

    IndexName(StoreName store, String field, String column, boolean numeric) {
        this.store = store;
        this.field = field;
        this.column = column;
        this.numeric = numeric;
    }

    public StoreName store() {
        return store;
    }

    public String field() {
        return field;
    }

    public String column() {
        return column;
    }

    public boolean numeric() {
        return numeric;
    }
}
