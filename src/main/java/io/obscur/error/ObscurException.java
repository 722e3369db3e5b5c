package io.obscur.error;

/**
 * Root of the unchecked failures raised by the messaging core.
 *
 * <p>Producing operations (encrypt, decrypt, sign, derive, persist) throw a
 * subclass; predicate operations such as signature verification collapse
 * every failure to {@code false} instead.
 */
public class ObscurException extends RuntimeException {
    public ObscurException(String message) {
        super(message);
    }

    public ObscurException(String message, Throwable cause) {
        super(message, cause);
    }
}
