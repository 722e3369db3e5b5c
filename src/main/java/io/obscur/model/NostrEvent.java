package io.obscur.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"id", "pubkey", "created_at", "kind", "tags", "content", "sig"})
public record NostrEvent(
        String id,
        String pubkey,
        @JsonProperty("created_at") long createdAt,
        int kind,
        List<List<String>> tags,
        String content,
        String sig
) {
    public NostrEvent {
        tags = tags == null ? List.of() : tags;
        content = content == null ? "" : content;
    }

    public String firstTagValue(String name) {
        for (List<String> tag : tags) {
            if (tag.size() >= 2 && name.equals(tag.get(0))) {
                return tag.get(1);
            }
        }
        return null;
    }

    public UnsignedEvent unsigned() {
        return new UnsignedEvent(pubkey, createdAt, kind, tags, content);
    }
}
