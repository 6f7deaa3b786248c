// file: src/main/java/io/anchorbase/core/AnchorEvent.java
package io.anchorbase.core;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Immutable record of one state transition of one anchor; the unit of the append-only log.
 * <p>
 * Invariants:
 *  - version is positive; for a given anchorId versions run 1..N without gaps.
 *  - transform is present exactly when {@link EventType#carriesTransform()} is true,
 *    metadata exactly when {@link EventType#carriesMetadata()} is true.
 *  - actorId is optional and informational only.
 * <p>
 * Use the static factories; they fill in the right fields for each type.
 */
public record AnchorEvent(
        UUID id,
        UUID anchorId,
        UUID spaceId,
        EventType type,
        Instant timestamp,
        int version,
        Transform transform,                 // nullable
        Map<String, MetadataValue> metadata, // nullable
        String actorId                       // nullable
) {

    public AnchorEvent {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(anchorId, "anchorId");
        Objects.requireNonNull(spaceId, "spaceId");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(timestamp, "timestamp");
        if (version <= 0) throw new IllegalArgumentException("version must be > 0, got " + version);
        if (type.carriesTransform() != (transform != null)) {
            throw new IllegalArgumentException(type + " event " + (transform == null ? "requires" : "must not carry") + " a transform");
        }
        if (type.carriesMetadata() != (metadata != null)) {
            throw new IllegalArgumentException(type + " event " + (metadata == null ? "requires" : "must not carry") + " metadata");
        }
        if (metadata != null) metadata = MetadataValue.copyOrdered(metadata);
    }

    public static AnchorEvent created(Anchor anchor, int version, Instant at) {
        return of(anchor, EventType.CREATED, version, at);
    }

    public static AnchorEvent moved(Anchor anchor, int version, Instant at) {
        return of(anchor, EventType.MOVED, version, at);
    }

    public static AnchorEvent updated(Anchor anchor, int version, Instant at) {
        return of(anchor, EventType.UPDATED, version, at);
    }

    public static AnchorEvent deleted(Anchor anchor, int version, Instant at) {
        return of(anchor, EventType.DELETED, version, at);
    }

    public static AnchorEvent restored(Anchor anchor, int version, Instant at) {
        return of(anchor, EventType.RESTORED, version, at);
    }

    /** Build an event of the given type, copying only the fields that type carries. */
    public static AnchorEvent of(Anchor anchor, EventType type, int version, Instant at) {
        return new AnchorEvent(
                UUID.randomUUID(),
                anchor.id(),
                anchor.spaceId(),
                type,
                at,
                version,
                type.carriesTransform() ? anchor.transform() : null,
                type.carriesMetadata() ? anchor.metadata() : null,
                null
        );
    }

    /** Copy of this event attributed to an actor. */
    public AnchorEvent withActor(String actor) {
        return new AnchorEvent(id, anchorId, spaceId, type, timestamp, version, transform, metadata, actor);
    }

    public Optional<Transform> transformOptional() { return Optional.ofNullable(transform); }

    public Optional<Map<String, MetadataValue>> metadataOptional() { return Optional.ofNullable(metadata); }

    public Optional<String> actor() { return Optional.ofNullable(actorId); }

    /** False only for DELETED: every other event leaves the anchor visible. */
    public boolean isActiveState() { return type != EventType.DELETED; }
}
