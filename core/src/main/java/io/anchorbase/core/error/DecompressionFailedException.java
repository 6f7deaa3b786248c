package io.anchorbase.core.error;

/**
 * Compressed bytes could not be restored: malformed or truncated input, or the
 * output ceiling was reached before the stream ended.
 */
public class DecompressionFailedException extends StorageException {

    public DecompressionFailedException(String message) {
        super("Failed to decompress data: " + message);
    }

    public DecompressionFailedException(String message, Throwable cause) {
        super("Failed to decompress data: " + message, cause);
    }
}
