package io.obscur.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.obscur.error.ValidationException;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public enum MessageStatus {
    SENDING,
    QUEUED,
    ACCEPTED,
    REJECTED,
    DELIVERED,
    FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static MessageStatus fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException("message status must not be blank");
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown message status: " + raw, e);
        }
    }

    public boolean isTerminal() {
        return this == DELIVERED || this == FAILED;
    }

    public boolean canTransitionTo(MessageStatus next) {
        return next == this || allowedNext().contains(next);
    }

    // A rejected message may go back to the queue for another relay round.
    private Set<MessageStatus> allowedNext() {
        return switch (this) {
            case SENDING -> EnumSet.of(QUEUED, ACCEPTED, REJECTED, DELIVERED, FAILED);
            case QUEUED -> EnumSet.of(ACCEPTED, REJECTED, DELIVERED, FAILED);
            case REJECTED -> EnumSet.of(QUEUED, ACCEPTED, FAILED);
            case ACCEPTED -> EnumSet.of(DELIVERED, FAILED);
            case DELIVERED, FAILED -> EnumSet.noneOf(MessageStatus.class);
        };
    }
}
