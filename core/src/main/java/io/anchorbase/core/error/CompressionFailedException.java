package io.anchorbase.core.error;

/** The encoder produced no usable output. Fatal for the call, never retried. */
public class CompressionFailedException extends StorageException {

    public CompressionFailedException(String message) {
        super("Failed to compress data: " + message);
    }
}
