package io.obscur.model;

public record Attachment(String kind, String url, String contentType, String fileName) {
}
