package io.obscur.retry;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum BreakerState {
    CLOSED,
    OPEN;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
