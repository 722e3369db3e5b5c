package io.obscur.retry;

public record CircuitBreakerSnapshot(
        String relayUrl,
        int failureCount,
        long successCount,
        BreakerState state,
        long lastChangeAt,
        long lastActivityAt
) {
    public static CircuitBreakerSnapshot fresh(String relayUrl, long now) {
        return new CircuitBreakerSnapshot(relayUrl, 0, 0L, BreakerState.CLOSED, now, now);
    }

    public boolean isOpen() {
        return state == BreakerState.OPEN;
    }
}
