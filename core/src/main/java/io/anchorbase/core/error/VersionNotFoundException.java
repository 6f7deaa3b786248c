package io.anchorbase.core.error;

import java.util.UUID;

/** Rollback target version does not exist in the anchor's history. */
public class VersionNotFoundException extends StorageException {
    private final UUID anchorId;
    private final int version;

    public VersionNotFoundException(UUID anchorId, int version) {
        super("Version " + version + " not found for anchor " + anchorId);
        this.anchorId = anchorId;
        this.version = version;
    }

    public UUID anchorId() { return anchorId; }

    public int version() { return version; }
}
