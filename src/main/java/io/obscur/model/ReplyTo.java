package io.obscur.model;

public record ReplyTo(String messageId, String previewText) {
}
