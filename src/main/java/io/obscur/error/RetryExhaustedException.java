package io.obscur.error;

public class RetryExhaustedException extends ObscurException {
    private final String messageId;
    private final int retryCount;

    public RetryExhaustedException(String messageId, int retryCount, String reason) {
        super("Max retries exceeded for " + messageId + " after " + retryCount + " attempts"
                + (reason == null || reason.isBlank() ? "" : ": " + reason));
        this.messageId = messageId;
        this.retryCount = retryCount;
    }

    public String messageId() {
        return messageId;
    }

    public int retryCount() {
        return retryCount;
    }
}
