package io.obscur.error;

public class BridgeTimeoutException extends ObscurException {
    private final String operation;
    private final long timeoutMs;

    public BridgeTimeoutException(String operation, long timeoutMs) {
        super("Crypto bridge call " + operation + " timed out after " + timeoutMs + "ms");
        this.operation = operation;
        this.timeoutMs = timeoutMs;
    }

    public String operation() {
        return operation;
    }

    public long timeoutMs() {
        return timeoutMs;
    }
}
