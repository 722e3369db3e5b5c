package io.obscur.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RelayResult(String relayUrl, boolean success, String error, Long latencyMs) {
    public static RelayResult ok(String relayUrl, long latencyMs) {
        return new RelayResult(relayUrl, true, null, latencyMs);
    }

    public static RelayResult failed(String relayUrl, String error) {
        return new RelayResult(relayUrl, false, error, null);
    }
}
