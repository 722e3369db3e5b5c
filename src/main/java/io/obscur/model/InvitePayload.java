package io.obscur.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record InvitePayload(
        String publicKey,
        String displayName,
        String avatar,
        String message,
        long timestamp,
        Long expirationTime,
        String inviteId
) {
    public static InvitePayload of(String publicKey, long timestamp) {
        return new InvitePayload(publicKey, null, null, null, timestamp, null, null);
    }
}
