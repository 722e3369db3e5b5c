package io.obscur.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record OutgoingMessage(
        String id,
        String conversationId,
        String content,
        String recipientPubkey,
        long createdAt,
        int retryCount,
        long nextRetryAt,
        NostrEvent signedEvent
) {
    public OutgoingMessage withRetry(int count, long at) {
        return new OutgoingMessage(id, conversationId, content, recipientPubkey, createdAt, count, at, signedEvent);
    }
}
