package io.obscur.model;

public record StorageStats(long totalMessages, long totalSizeBytes, Long oldestMessage, Long newestMessage) {
}
