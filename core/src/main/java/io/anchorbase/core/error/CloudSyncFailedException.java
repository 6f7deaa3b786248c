package io.anchorbase.core.error;

/**
 * The remote side of an operation failed.
 * <p>
 * When thrown from a write, the local write has already succeeded and the
 * operation sits in the retry queue: the data is locally safe, not yet replicated.
 */
public class CloudSyncFailedException extends StorageException {

    public CloudSyncFailedException(Throwable cause) {
        super("Cloud sync failed: " + (cause == null ? "unknown cause" : cause.getMessage()), cause);
    }
}
