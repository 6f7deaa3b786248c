package io.anchorbase.storage;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A remote write that failed and waits in the retry queue.
 * The record it refers to is re-read from the local store at replay time.
 */
public record PendingOperation(
        UUID id,
        OperationKind kind,
        UUID targetId,
        int retryCount,
        Instant createdAt
) {
    public PendingOperation {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(targetId, "targetId");
        Objects.requireNonNull(createdAt, "createdAt");
        if (retryCount < 0) throw new IllegalArgumentException("retryCount must be >= 0");
    }

    public static PendingOperation create(OperationKind kind, UUID targetId, Instant at) {
        return new PendingOperation(UUID.randomUUID(), kind, targetId, 0, at);
    }

    /** Copy with one more failed attempt recorded. */
    public PendingOperation retried() {
        return new PendingOperation(id, kind, targetId, retryCount + 1, createdAt);
    }
}
