package io.anchorbase.core.error;

import java.util.UUID;

/** A space's event log failed a structural check (bad frame in the middle of the log). */
public class EventLogCorruptedException extends StorageException {
    private final UUID spaceId;

    public EventLogCorruptedException(UUID spaceId, String detail) {
        super("Event log corrupted for space " + spaceId + ": " + detail);
        this.spaceId = spaceId;
    }

    public UUID spaceId() { return spaceId; }
}
