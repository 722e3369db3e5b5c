package io.obscur.crypto;

import com.fasterxml.jackson.databind.JsonNode;
import io.obscur.model.InvitePayload;
import io.obscur.util.Hashing;
import io.obscur.util.Jsons;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.StringJoiner;

final class Invites {
    private Invites() {
    }

    // Fields sorted by name, rendered name:value and joined with '|'.
    static String canonicalize(InvitePayload payload) {
        JsonNode node = Jsons.compact().valueToTree(payload);
        List<String> names = new ArrayList<>();
        Iterator<String> it = node.fieldNames();
        while (it.hasNext()) {
            names.add(it.next());
        }
        Collections.sort(names);
        StringJoiner joiner = new StringJoiner("|");
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value == null || value.isNull()) {
                continue;
            }
            String rendered = value.isContainerNode() ? Jsons.toCompactJson(value) : value.asText();
            joiner.add(name + ":" + rendered);
        }
        return joiner.toString();
    }

    static byte[] digest(InvitePayload payload) {
        return Hashing.sha256(canonicalize(payload));
    }
}
