package io.obscur.model;

import io.obscur.error.ValidationException;

import java.util.Locale;

public final class ConversationIds {
    private static final String GROUP_PREFIX = "group:";

    private ConversationIds() {
    }

    public static String direct(String pubkeyA, String pubkeyB) {
        String a = requirePubkey(pubkeyA);
        String b = requirePubkey(pubkeyB);
        return a.compareTo(b) <= 0 ? a + ":" + b : b + ":" + a;
    }

    public static String group(String groupId) {
        if (groupId == null || groupId.isBlank()) {
            throw new ValidationException("groupId must not be blank");
        }
        return GROUP_PREFIX + groupId.trim();
    }

    public static boolean isGroup(String conversationId) {
        return conversationId != null && conversationId.startsWith(GROUP_PREFIX);
    }

    private static String requirePubkey(String raw) {
        String value = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        if (!value.matches("^[0-9a-f]{64}$")) {
            throw new ValidationException("conversation participant must be a 64-char hex pubkey");
        }
        return value;
    }
}
