package io.anchorbase.core.error;

/** A remote operation was requested but the engine runs with the local-only backend. */
public class CloudNotConfiguredException extends StorageException {

    public CloudNotConfiguredException() {
        super("Cloud sync is not configured. Use a remote backend to enable sync.");
    }
}
