package io.obscur.storage;

public enum StoreName {
    MESSAGES("messages"),
    QUEUE("queue");

    private final String table;

    StoreName(String table) {
        this.table = table;
    }

    public String table() {
        return table;
    }
}
