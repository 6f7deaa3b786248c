package io.anchorbase.storage;

import io.anchorbase.core.AnchorEvent;

import java.util.List;
import java.util.UUID;

/**
 * Append-only log of anchor events, partitioned by space.
 * Events are returned in append order.
 */
public interface EventLog {

    /** Append and make durable before returning. */
    void append(AnchorEvent event);

    List<AnchorEvent> read(UUID spaceId);

    /** Ids of every space that has at least one log file. */
    List<UUID> spaces();

    /** Bytes used on disk by all logs. */
    long sizeBytes();

    /** Remove every log. */
    void clear();
}
