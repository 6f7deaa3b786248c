package io.anchorbase.core.error;

/** A record points at the wrong parent, e.g. an anchor saved under a different space than it was created in. */
public class InvalidReferenceException extends StorageException {

    public InvalidReferenceException(String message) {
        super("Invalid reference: " + message);
    }
}
