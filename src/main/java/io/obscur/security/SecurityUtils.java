package io.obscur.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.obscur.util.Jsons;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Key-material hygiene and log redaction shared by every crypto backend.
 */
public final class SecurityUtils {
    public static final String MASK = "[REDACTED]";
    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "privatekey", "privkey", "private_key", "secret", "token", "password", "passphrase",
            "seed", "mnemonic", "content", "plaintext", "ciphertext", "encrypted", "signature", "nsec"
    );
    private static final Set<String> SENSITIVE_EXACT = Set.of("sk", "sig", "key", "keys");
    private static final Pattern HEX_64 = Pattern.compile("^[0-9a-fA-F]{64}$");
    private static final Pattern EMBEDDED_HEX_64 = Pattern.compile("(?<![0-9a-fA-F])[0-9a-fA-F]{64}(?![0-9a-fA-F])");
    private static final Pattern EMBEDDED_NSEC = Pattern.compile("nsec1[0-9a-z]+");
    private static final SecureRandom RANDOM = new SecureRandom();

    private SecurityUtils() {
    }

    public static void clearSensitiveBuffer(byte[] buffer) {
        if (buffer == null) {
            return;
        }
        Arrays.fill(buffer, (byte) 0);
        RANDOM.nextBytes(buffer);
        Arrays.fill(buffer, (byte) 0);
    }

    public static void clearSensitiveChars(char[] chars) {
        if (chars == null) {
            return;
        }
        Arrays.fill(chars, '\0');
    }

    public static void clearSensitiveString(StringBuilder value) {
        if (value == null) {
            return;
        }
        for (int i = 0; i < value.length(); i++) {
            value.setCharAt(i, '\0');
        }
        value.setLength(0);
    }

    // Scans max(len) bytes whatever the first mismatch.
    public static boolean constantTimeCompare(byte[] a, byte[] b) {
        if (a == null || b == null) {
            return false;
        }
        int length = Math.max(a.length, b.length);
        int diff = a.length ^ b.length;
        for (int i = 0; i < length; i++) {
            int x = i < a.length ? a[i] : 0;
            int y = i < b.length ? b[i] : 0;
            diff |= x ^ y;
        }
        return diff == 0;
    }

    public static boolean constantTimeStringCompare(String a, String b) {
        if (a == null || b == null) {
            return false;
        }
        return constantTimeCompare(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
    }

    public static JsonNode sanitizeForLogging(Object value) {
        if (value == null) {
            return Jsons.mapper().nullNode();
        }
        if (value instanceof JsonNode node) {
            return masked(node, null);
        }
        if (value instanceof Throwable error) {
            ObjectNode out = Jsons.mapper().createObjectNode();
            out.put("name", error.getClass().getSimpleName());
            out.put("message", error.getMessage() == null ? "" : redactText(error.getMessage(), null));
            return out;
        }
        if (value instanceof Map<?, ?> map) {
            ObjectNode out = Jsons.mapper().createObjectNode();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = String.valueOf(entry.getKey());
                if (isSensitiveKey(key)) {
                    out.put(key, MASK);
                } else {
                    out.set(key, sanitizeValue(entry.getValue(), key));
                }
            }
            return out;
        }
        if (value instanceof Iterable<?> items) {
            ArrayNode out = Jsons.mapper().createArrayNode();
            for (Object item : items) {
                out.add(sanitizeForLogging(item));
            }
            return out;
        }
        if (value instanceof Object[] items) {
            ArrayNode out = Jsons.mapper().createArrayNode();
            for (Object item : items) {
                out.add(sanitizeForLogging(item));
            }
            return out;
        }
        if (value instanceof byte[] || value instanceof char[]) {
            return Jsons.mapper().getNodeFactory().textNode(MASK);
        }
        if (value instanceof CharSequence text) {
            return Jsons.mapper().getNodeFactory().textNode(redactText(text.toString(), null));
        }
        return masked(Jsons.mapper().valueToTree(value), null);
    }

    private static JsonNode sanitizeValue(Object value, String key) {
        if (value instanceof CharSequence text) {
            return Jsons.mapper().getNodeFactory().textNode(redactText(text.toString(), key));
        }
        return sanitizeForLogging(value);
    }

    private static JsonNode masked(JsonNode input, String key) {
        if (input == null || input.isNull()) {
            return Jsons.mapper().nullNode();
        }
        if (input.isObject()) {
            ObjectNode out = Jsons.mapper().createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> it = input.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                if (isSensitiveKey(entry.getKey())) {
                    out.put(entry.getKey(), MASK);
                } else {
                    out.set(entry.getKey(), masked(entry.getValue(), entry.getKey()));
                }
            }
            return out;
        }
        if (input.isArray()) {
            ArrayNode out = Jsons.mapper().createArrayNode();
            for (JsonNode value : input) {
                out.add(masked(value, key));
            }
            return out;
        }
        if (input.isTextual()) {
            return Jsons.mapper().getNodeFactory().textNode(redactText(input.asText(""), key));
        }
        return input;
    }

    static boolean isSensitiveKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT);
        if (SENSITIVE_EXACT.contains(key)) {
            return true;
        }
        for (String hint : SENSITIVE_HINTS) {
            if (key.contains(hint)) {
                return true;
            }
        }
        return false;
    }

    // Public keys and event ids are 64-hex too, so they stay readable under identifying keys.
    private static String redactText(String value, String key) {
        String v = value.trim();
        if (v.startsWith("nsec1")) {
            return MASK;
        }
        boolean identifier = isPublicIdentifierKey(key);
        if (HEX_64.matcher(v).matches()) {
            return identifier ? value : MASK;
        }
        // Secrets quoted inside longer text, e.g. exception messages.
        String masked = EMBEDDED_NSEC.matcher(value).replaceAll(MASK);
        if (!identifier) {
            masked = EMBEDDED_HEX_64.matcher(masked).replaceAll(MASK);
        }
        return masked;
    }

    private static boolean isPublicIdentifierKey(String rawKey) {
        if (rawKey == null) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT);
        return key.contains("pubkey") || key.contains("publickey") || key.equals("id") || key.endsWith("id");
    }
}
