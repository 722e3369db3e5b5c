package io.obscur.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.obscur.error.StorageException;
import io.obscur.error.ValidationException;
import io.obscur.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public record ObscurSettings(
        int maxRetries,
        long baseDelayMs,
        long maxDelayMs,
        double backoffMultiplier,
        long jitterMs,
        int failureThreshold,
        long breakerRetentionMs,
        boolean encryptStorageAtRest,
        int maxMessagesPerConversation,
        long bridgeTimeoutMs,
        String cryptoBackend,
        String auditSigningSecret
) {
    public static final int DEFAULT_MAX_RETRIES = 5;
    public static final long DEFAULT_BASE_DELAY_MS = 1_000L;
    public static final long DEFAULT_MAX_DELAY_MS = 300_000L;
    public static final double DEFAULT_BACKOFF_MULTIPLIER = 2.0d;
    public static final long DEFAULT_JITTER_MS = 1_000L;
    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final long DEFAULT_BREAKER_RETENTION_MS = 24L * 60L * 60L * 1000L;
    public static final int DEFAULT_MAX_MESSAGES_PER_CONVERSATION = 5_000;
    public static final long DEFAULT_BRIDGE_TIMEOUT_MS = 5_000L;
    public static final String DEFAULT_CRYPTO_BACKEND = "software";

    public static ObscurSettings defaults() {
        return new ObscurSettings(
                DEFAULT_MAX_RETRIES,
                DEFAULT_BASE_DELAY_MS,
                DEFAULT_MAX_DELAY_MS,
                DEFAULT_BACKOFF_MULTIPLIER,
                DEFAULT_JITTER_MS,
                DEFAULT_FAILURE_THRESHOLD,
                DEFAULT_BREAKER_RETENTION_MS,
                true,
                DEFAULT_MAX_MESSAGES_PER_CONVERSATION,
                DEFAULT_BRIDGE_TIMEOUT_MS,
                DEFAULT_CRYPTO_BACKEND,
                ""
        );
    }

    /**
     * Reads the settings file if present. A missing file yields the defaults;
     * a malformed one is rejected rather than silently ignored.
     */
    public static ObscurSettings load(Path file) {
        if (file == null || !Files.exists(file)) {
            return defaults();
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults());
        } catch (JsonProcessingException e) {
            throw new ValidationException("Malformed settings file: " + file, e);
        } catch (IOException e) {
            throw new StorageException("Failed to load settings: " + file, e);
        }
    }

    static ObscurSettings fromFile(SettingsFile file, ObscurSettings defaults) {
        if (file == null) {
            return defaults;
        }
        int maxRetries = sanitizeInt(file.maxRetries(), defaults.maxRetries(), 0);
        long baseDelay = sanitizeLong(file.baseDelayMs(), defaults.baseDelayMs(), 1L);
        long maxDelay = sanitizeLong(file.maxDelayMs(), defaults.maxDelayMs(), baseDelay);
        if (maxDelay < baseDelay) {
            maxDelay = baseDelay;
        }
        double multiplier = file.backoffMultiplier() == null
                ? defaults.backoffMultiplier()
                : Math.max(1.0d, file.backoffMultiplier());
        long jitter = sanitizeLong(file.jitterMs(), defaults.jitterMs(), 0L);
        int threshold = sanitizeInt(file.failureThreshold(), defaults.failureThreshold(), 1);
        long retention = sanitizeLong(file.breakerRetentionMs(), defaults.breakerRetentionMs(), 0L);
        boolean encrypt = file.encryptStorageAtRest() == null
                ? defaults.encryptStorageAtRest()
                : file.encryptStorageAtRest();
        int perConversation = sanitizeInt(
                file.maxMessagesPerConversation(), defaults.maxMessagesPerConversation(), 1);
        long bridgeTimeout = sanitizeLong(file.bridgeTimeoutMs(), defaults.bridgeTimeoutMs(), 1L);
        String backend = file.cryptoBackend() == null || file.cryptoBackend().isBlank()
                ? defaults.cryptoBackend()
                : file.cryptoBackend().trim();
        String secret = file.auditSigningSecret() == null
                ? defaults.auditSigningSecret()
                : file.auditSigningSecret().trim();
        return new ObscurSettings(maxRetries, baseDelay, maxDelay, multiplier, jitter, threshold, retention,
                encrypt, perConversation, bridgeTimeout, backend, secret);
    }

    public ObscurSettings withEncryptStorageAtRest(boolean value) {
        return new ObscurSettings(maxRetries, baseDelayMs, maxDelayMs, backoffMultiplier, jitterMs,
                failureThreshold, breakerRetentionMs, value, maxMessagesPerConversation, bridgeTimeoutMs,
                cryptoBackend, auditSigningSecret);
    }

    public ObscurSettings withCryptoBackend(String value) {
        return new ObscurSettings(maxRetries, baseDelayMs, maxDelayMs, backoffMultiplier, jitterMs,
                failureThreshold, breakerRetentionMs, encryptStorageAtRest, maxMessagesPerConversation,
                bridgeTimeoutMs, value, auditSigningSecret);
    }

    @Override
    public String toString() {
        return "ObscurSettings[maxRetries=" + maxRetries
                + ", baseDelayMs=" + baseDelayMs
                + ", maxDelayMs=" + maxDelayMs
                + ", backoffMultiplier=" + backoffMultiplier
                + ", jitterMs=" + jitterMs
                + ", failureThreshold=" + failureThreshold
                + ", breakerRetentionMs=" + breakerRetentionMs
                + ", encryptStorageAtRest=" + encryptStorageAtRest
                + ", maxMessagesPerConversation=" + maxMessagesPerConversation
                + ", bridgeTimeoutMs=" + bridgeTimeoutMs
                + ", cryptoBackend=" + cryptoBackend
                + ", auditSigningSecret=" + (auditSigningSecret.isBlank() ? "" : "[REDACTED]") + "]";
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    record SettingsFile(
            Integer maxRetries,
            Long baseDelayMs,
            Long maxDelayMs,
            Double backoffMultiplier,
            Long jitterMs,
            Integer failureThreshold,
            Long breakerRetentionMs,
            Boolean encryptStorageAtRest,
            Integer maxMessagesPerConversation,
            Long bridgeTimeoutMs,
            String cryptoBackend,
            String auditSigningSecret
    ) {
    }
}
