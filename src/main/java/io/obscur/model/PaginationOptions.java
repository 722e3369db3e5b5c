package io.obscur.model;

import io.obscur.error.ValidationException;

/**
 * Window over a conversation. {@code before}/{@code after} are exclusive
 * timestamp bounds; {@code limit} keeps the most recent entries of the window
 * after skipping {@code offset} newer ones.
 */
public record PaginationOptions(Integer limit, Integer offset, Long before, Long after) {
    public PaginationOptions {
        if (limit != null && limit < 0) {
            throw new ValidationException("limit must be >= 0");
        }
        if (offset != null && offset < 0) {
            throw new ValidationException("offset must be >= 0");
        }
    }

    public static PaginationOptions all() {
        return new PaginationOptions(null, null, null, null);
    }

    public static PaginationOptions latest(int limit) {
        return new PaginationOptions(limit, null, null, null);
    }

    public PaginationOptions withOffset(int value) {
        return new PaginationOptions(limit, value, before, after);
    }

    public PaginationOptions withBefore(long value) {
        return new PaginationOptions(limit, offset, value, after);
    }

    public PaginationOptions withAfter(long value) {
        return new PaginationOptions(limit, offset, before, value);
    }
}
