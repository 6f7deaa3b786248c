package io.anchorbase.core.error;

/**
 * Base type for every failure reported by the anchor storage engine.
 * <p>
 * Unchecked, like the rest of the code base: callers catch the specific subtype they can act on.
 * Local I/O failures are not wrapped in this type; they surface as
 * {@link java.io.UncheckedIOException} so the original cause stays untouched.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
