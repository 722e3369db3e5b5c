package io.obscur.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Message(
        String id,
        String conversationId,
        String content,
        MessageKind kind,
        long timestamp,
        @JsonProperty("isOutgoing") boolean outgoing,
        MessageStatus status,
        DmFormat dmFormat,
        String eventId,
        Long eventCreatedAt,
        String senderPubkey,
        String recipientPubkey,
        String encryptedContent,
        List<RelayResult> relayResults,
        Long syncedAt,
        Integer retryCount,
        List<Attachment> attachments,
        ReplyTo replyTo,
        Map<String, Integer> reactions,
        Long deletedAt
) {
    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .conversationId(conversationId)
                .content(content)
                .kind(kind)
                .timestamp(timestamp)
                .outgoing(outgoing)
                .status(status)
                .dmFormat(dmFormat)
                .eventId(eventId)
                .eventCreatedAt(eventCreatedAt)
                .senderPubkey(senderPubkey)
                .recipientPubkey(recipientPubkey)
                .encryptedContent(encryptedContent)
                .relayResults(relayResults)
                .syncedAt(syncedAt)
                .retryCount(retryCount)
                .attachments(attachments)
                .replyTo(replyTo)
                .reactions(reactions)
                .deletedAt(deletedAt);
    }

    public Message withStatus(MessageStatus value) {
        return toBuilder().status(value).build();
    }

    public Message withSyncedAt(long value) {
        return toBuilder().syncedAt(value).build();
    }

    public Message withRetryCount(int value) {
        return toBuilder().retryCount(value).build();
    }

    public static final class Builder {
        private String id;
        private String conversationId;
        private String content;
        private MessageKind kind = MessageKind.USER;
        private long timestamp;
        private boolean outgoing;
        private MessageStatus status = MessageStatus.SENDING;
        private DmFormat dmFormat;
        private String eventId;
        private Long eventCreatedAt;
        private String senderPubkey;
        private String recipientPubkey;
        private String encryptedContent;
        private List<RelayResult> relayResults;
        private Long syncedAt;
        private Integer retryCount;
        private List<Attachment> attachments;
        private ReplyTo replyTo;
        private Map<String, Integer> reactions;
        private Long deletedAt;

        private Builder() {
        }

        public Builder id(String value) {
            this.id = value;
            return this;
        }

        public Builder conversationId(String value) {
            this.conversationId = value;
            return this;
        }

        public Builder content(String value) {
            this.content = value;
            return this;
        }

        public Builder kind(MessageKind value) {
            this.kind = value;
            return this;
        }

        public Builder timestamp(long value) {
            this.timestamp = value;
            return this;
        }

        public Builder outgoing(boolean value) {
            this.outgoing = value;
            return this;
        }

        public Builder status(MessageStatus value) {
            this.status = value;
            return this;
        }

        public Builder dmFormat(DmFormat value) {
            this.dmFormat = value;
            return this;
        }

        public Builder eventId(String value) {
            this.eventId = value;
            return this;
        }

        public Builder eventCreatedAt(Long value) {
            this.eventCreatedAt = value;
            return this;
        }

        public Builder senderPubkey(String value) {
            this.senderPubkey = value;
            return this;
        }

        public Builder recipientPubkey(String value) {
            this.recipientPubkey = value;
            return this;
        }

        public Builder encryptedContent(String value) {
            this.encryptedContent = value;
            return this;
        }

        public Builder relayResults(List<RelayResult> value) {
            this.relayResults = value;
            return this;
        }

        public Builder syncedAt(Long value) {
            this.syncedAt = value;
            return this;
        }

        public Builder retryCount(Integer value) {
            this.retryCount = value;
            return this;
        }

        public Builder attachments(List<Attachment> value) {
            this.attachments = value;
            return this;
        }

        public Builder replyTo(ReplyTo value) {
            this.replyTo = value;
            return this;
        }

        public Builder reactions(Map<String, Integer> value) {
            this.reactions = value;
            return this;
        }

        public Builder deletedAt(Long value) {
            this.deletedAt = value;
            return this;
        }

        public Message build() {
            return new Message(id, conversationId, content, kind, timestamp, outgoing, status, dmFormat,
                    eventId, eventCreatedAt, senderPubkey, recipientPubkey, encryptedContent, relayResults,
                    syncedAt, retryCount, attachments, replyTo, reactions, deletedAt);
        }
    }
}
