package io.obscur.crypto.worker;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CryptoResponse(
        String correlationId,
        boolean ok,
        JsonNode result,
        String errorType,
        String errorMessage
) {
    public static CryptoResponse success(String correlationId, JsonNode result) {
        return new CryptoResponse(correlationId, true, result, null, null);
    }

    public static CryptoResponse failure(String correlationId, String errorType, String errorMessage) {
        return new CryptoResponse(correlationId, false, null, errorType, errorMessage);
    }
}
