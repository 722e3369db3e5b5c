package io.obscur.retry;

public record RetryDecision(boolean shouldRetry, Long nextRetryAt, String error) {
    public static final String MAX_RETRIES_EXCEEDED = "Max retries exceeded";

    public static RetryDecision retryAt(long nextRetryAt) {
        return new RetryDecision(true, nextRetryAt, null);
    }

    public static RetryDecision giveUp(String error) {
        return new RetryDecision(false, null, error);
    }
}
