package io.obscur.crypto;

import com.fasterxml.jackson.databind.node.ArrayNode;
import io.obscur.model.NostrEvent;
import io.obscur.model.UnsignedEvent;
import io.obscur.util.Hashing;
import io.obscur.util.Jsons;

import java.util.List;

public final class NostrEvents {
    private NostrEvents() {
    }

    /**
     * Canonical form hashed into the event id:
     * {@code [0, pubkey, created_at, kind, tags, content]} as compact JSON.
     */
    public static String serializeForId(String pubkey, long createdAt, int kind, List<List<String>> tags, String content) {
        ArrayNode array = Jsons.compact().createArrayNode();
        array.add(0);
        array.add(pubkey);
        array.add(createdAt);
        array.add(kind);
        ArrayNode tagArray = array.addArray();
        for (List<String> tag : tags) {
            ArrayNode entry = tagArray.addArray();
            for (String value : tag) {
                entry.add(value);
            }
        }
        array.add(content);
        return Jsons.toCompactJson(array);
    }

    public static byte[] computeIdBytes(UnsignedEvent event) {
        return Hashing.sha256(serializeForId(event.pubkey(), event.createdAt(), event.kind(), event.tags(), event.content()));
    }

    public static String computeId(UnsignedEvent event) {
        return Hashing.toHex(computeIdBytes(event));
    }

    public static NostrEvent assemble(UnsignedEvent event, byte[] idBytes, byte[] signature) {
        return new NostrEvent(
                Hashing.toHex(idBytes),
                event.pubkey(),
                event.createdAt(),
                event.kind(),
                event.tags(),
                event.content(),
                Hashing.toHex(signature)
        );
    }

    public static boolean verify(NostrEvent event) {
        if (event == null || event.id() == null || event.sig() == null || event.pubkey() == null) {
            return false;
        }
        try {
            String expectedId = computeId(event.unsigned());
            if (!expectedId.equalsIgnoreCase(event.id())) {
                return false;
            }
            return Secp256k1.verify(
                    Hashing.fromHex(event.id()),
                    Hashing.fromHex(event.pubkey()),
                    Hashing.fromHex(event.sig())
            );
        } catch (RuntimeException e) {
            return false;
        }
    }

    public static String toJson(NostrEvent event) {
        return Jsons.toCompactJson(event);
    }

    public static NostrEvent fromJson(String json) {
        return Jsons.fromJson(json, NostrEvent.class);
    }
}
