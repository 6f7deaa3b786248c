package io.anchorbase.core;

import java.time.Instant;
import java.util.UUID;

/**
 * Anything that is reconciled by id and modification time.
 * Both anchors and stored spaces cross the remote boundary with at least these two fields.
 */
public interface Timestamped {

    UUID id();

    Instant updatedAt();
}
