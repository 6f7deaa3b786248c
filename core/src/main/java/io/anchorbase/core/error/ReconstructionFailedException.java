package io.anchorbase.core.error;

import java.util.UUID;

/** The anchor's history cannot be folded into a state, typically because it does not start with CREATED. */
public class ReconstructionFailedException extends StorageException {
    private final UUID anchorId;

    public ReconstructionFailedException(UUID anchorId) {
        super("Failed to reconstruct anchor state for " + anchorId);
        this.anchorId = anchorId;
    }

    public UUID anchorId() { return anchorId; }
}
