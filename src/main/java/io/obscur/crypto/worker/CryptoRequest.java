package io.obscur.crypto.worker;

import com.fasterxml.jackson.databind.JsonNode;

public record CryptoRequest(String correlationId, CryptoOperation operation, JsonNode args) {
}
