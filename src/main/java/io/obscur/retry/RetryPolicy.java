package io.obscur.retry;

import io.obscur.config.ObscurSettings;
import io.obscur.error.ValidationException;

public record RetryPolicy(
        int maxRetries,
        long baseDelayMs,
        long maxDelayMs,
        double backoffMultiplier,
        long jitterMs,
        int failureThreshold,
        long breakerRetentionMs
) {
    public RetryPolicy {
        if (maxRetries < 0) {
            throw new ValidationException("maxRetries must be >= 0");
        }
        if (baseDelayMs < 0 || maxDelayMs < baseDelayMs) {
            throw new ValidationException("delays must satisfy 0 <= baseDelayMs <= maxDelayMs");
        }
        if (backoffMultiplier < 1.0d) {
            throw new ValidationException("backoffMultiplier must be >= 1");
        }
        if (jitterMs < 0) {
            throw new ValidationException("jitterMs must be >= 0");
        }
        if (failureThreshold < 1) {
            throw new ValidationException("failureThreshold must be >= 1");
        }
        if (breakerRetentionMs < 0) {
            throw new ValidationException("breakerRetentionMs must be >= 0");
        }
    }

    public static RetryPolicy defaults() {
        return from(ObscurSettings.defaults());
    }

    public static RetryPolicy from(ObscurSettings settings) {
        return new RetryPolicy(
                settings.maxRetries(),
                settings.baseDelayMs(),
                settings.maxDelayMs(),
                settings.backoffMultiplier(),
                settings.jitterMs(),
                settings.failureThreshold(),
                settings.breakerRetentionMs()
        );
    }

    public RetryPolicy withJitterMs(long value) {
        return new RetryPolicy(maxRetries, baseDelayMs, maxDelayMs, backoffMultiplier, value, failureThreshold, breakerRetentionMs);
    }

    public RetryPolicy withMaxRetries(int value) {
        return new RetryPolicy(value, baseDelayMs, maxDelayMs, backoffMultiplier, jitterMs, failureThreshold, breakerRetentionMs);
    }
}
