package io.obscur.storage;

import com.fasterxml.jackson.databind.JsonNode;
import io.obscur.error.ValidationException;

/**
 * Exact match (text or numeric index) or a numeric range with independently
 * open or closed bounds.
 */
public record IndexQuery(String equalTo, Long lower, boolean lowerOpen, Long upper, boolean upperOpen) {

    public static IndexQuery all() {
        return new IndexQuery(null, null, false, null, false);
    }

    public static IndexQuery only(String value) {
        if (value == null) {
            throw new ValidationException("index key must not be null");
        }
        return new IndexQuery(value, null, false, null, false);
    }

    public static IndexQuery atMost(long upper) {
        return new IndexQuery(null, null, false, upper, false);
    }

    public static IndexQuery below(long upper) {
        return new IndexQuery(null, null, false, upper, true);
    }

    public static IndexQuery range(Long lower, boolean lowerOpen, Long upper, boolean upperOpen) {
        return new IndexQuery(null, lower, lowerOpen, upper, upperOpen);
    }

    public boolean isExact() {
        return equalTo != null;
    }

    boolean matches(JsonNode value, boolean numeric) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return false;
        }
        if (equalTo != null) {
            return numeric ? value.asLong() == Long.parseLong(equalTo) : equalTo.equals(value.asText());
        }
        if (!numeric) {
            return true;
        }
        long v = value.asLong();
        if (lower != null && (lowerOpen ? v <= lower : v < lower)) {
            return false;
        }
        return upper == null || (upperOpen ? v < upper : v <= upper);
    }
}
