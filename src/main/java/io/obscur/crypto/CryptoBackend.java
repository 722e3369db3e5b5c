package io.obscur.crypto;

import io.obscur.error.ValidationException;

import java.util.Locale;

public enum CryptoBackend {
    SOFTWARE,
    WORKER,
    NATIVE;

    public static CryptoBackend fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return SOFTWARE;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown crypto backend: " + raw, e);
        }
    }
}
