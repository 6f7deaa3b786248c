// file: src/main/java/io/anchorbase/core/Anchor.java
package io.anchorbase.core;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * A positioned, annotated object that belongs to exactly one space.
 * <p>
 * Fields:
 *  - id, spaceId:  identity and immutable parent reference.
 *  - transform:    column-major 4x4 matrix.
 *  - metadata:     insertion-ordered, unmodifiable map of dynamic values.
 *  - createdAt / updatedAt: wall-clock timestamps.
 *  - deletedAt:    soft-delete marker, null while the anchor is live.
 * <p>
 * Every "mutation" returns a new Anchor with a fresh updatedAt; nothing is changed in place.
 */
public record Anchor(
        UUID id,
        UUID spaceId,
        Transform transform,
        Map<String, MetadataValue> metadata,
        Instant createdAt,
        Instant updatedAt,
        Instant deletedAt
) implements Timestamped {

    public Anchor {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(spaceId, "spaceId");
        Objects.requireNonNull(transform, "transform");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(updatedAt, "updatedAt");
        metadata = MetadataValue.copyOrdered(metadata == null ? Map.of() : metadata);
    }

    /** New live anchor with a random id, created now. */
    public static Anchor create(UUID spaceId, Transform transform, Map<String, MetadataValue> metadata) {
        return create(UUID.randomUUID(), spaceId, transform, metadata, Instant.now());
    }

    public static Anchor create(UUID id, UUID spaceId, Transform transform,
                                Map<String, MetadataValue> metadata, Instant at) {
        return new Anchor(id, spaceId, transform, metadata, at, at, null);
    }

    public Anchor withTransform(Transform newTransform) { return withTransform(newTransform, Instant.now()); }

    public Anchor withTransform(Transform newTransform, Instant at) {
        return new Anchor(id, spaceId, newTransform, metadata, createdAt, at, deletedAt);
    }

    /** Replace all metadata. */
    public Anchor withMetadata(Map<String, MetadataValue> newMetadata) {
        return withMetadata(newMetadata, Instant.now());
    }

    public Anchor withMetadata(Map<String, MetadataValue> newMetadata, Instant at) {
        return new Anchor(id, spaceId, transform, newMetadata, createdAt, at, deletedAt);
    }

    /** Set a single metadata key, keeping the position of an existing key. */
    public Anchor withMetadataValue(String key, MetadataValue value) {
        return withMetadataValue(key, value, Instant.now());
    }

    public Anchor withMetadataValue(String key, MetadataValue value, Instant at) {
        var m = new LinkedHashMap<>(metadata);
        m.put(key, value);
        return withMetadata(m, at);
    }

    public Anchor withoutMetadataValue(String key) { return withoutMetadataValue(key, Instant.now()); }

    public Anchor withoutMetadataValue(String key, Instant at) {
        var m = new LinkedHashMap<>(metadata);
        m.remove(key);
        return withMetadata(m, at);
    }

    /** Soft delete: deletedAt and updatedAt both become {@code at}. */
    public Anchor markDeleted() { return markDeleted(Instant.now()); }

    public Anchor markDeleted(Instant at) {
        return new Anchor(id, spaceId, transform, metadata, createdAt, at, at);
    }

    public Anchor restore() { return restore(Instant.now()); }

    public Anchor restore(Instant at) {
        return new Anchor(id, spaceId, transform, metadata, createdAt, at, null);
    }

    public boolean isDeleted() { return deletedAt != null; }

    public Optional<Instant> deletedAtOptional() { return Optional.ofNullable(deletedAt); }

    public Position position() { return transform.position(); }

    public boolean hasMetadata() { return !metadata.isEmpty(); }

    public Optional<MetadataValue> metadata(String key) { return Optional.ofNullable(metadata.get(key)); }

    public Optional<String> stringMetadata(String key) { return metadata(key).flatMap(MetadataValue::asString); }

    public Optional<Long> longMetadata(String key) { return metadata(key).flatMap(MetadataValue::asLong); }

    public Optional<Double> doubleMetadata(String key) { return metadata(key).flatMap(MetadataValue::asDouble); }

    public Optional<Boolean> booleanMetadata(String key) { return metadata(key).flatMap(MetadataValue::asBoolean); }
}
