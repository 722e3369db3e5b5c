package io.obscur.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record UnsignedEvent(
        String pubkey,
        @JsonProperty("created_at") long createdAt,
        int kind,
        List<List<String>> tags,
        String content
) {
    public UnsignedEvent {
        tags = tags == null ? List.of() : List.copyOf(tags);
        content = content == null ? "" : content;
    }

    public static UnsignedEvent of(int kind, String content, List<List<String>> tags, long createdAtSeconds) {
        return new UnsignedEvent(null, createdAtSeconds, kind, tags, content);
    }

    public UnsignedEvent withPubkey(String value) {
        return new UnsignedEvent(value, createdAt, kind, tags, content);
    }

    public UnsignedEvent withCreatedAt(long value) {
        return new UnsignedEvent(pubkey, value, kind, tags, content);
    }
}
