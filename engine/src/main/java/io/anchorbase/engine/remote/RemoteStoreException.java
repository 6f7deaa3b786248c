package io.anchorbase.engine.remote;

/** A remote replica could not be reached or rejected a request. */
public class RemoteStoreException extends RuntimeException {

    public RemoteStoreException(String message) {
        super(message);
    }

    public RemoteStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
