package io.anchorbase.storage;

import io.anchorbase.core.Space;
import io.anchorbase.core.Timestamped;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Persisted form of a {@link Space}: the same fields, with the payload possibly deflated.
 * This is also what travels to and from a remote replica.
 */
public final class StoredSpace implements Timestamped {
    private final UUID id;
    private final String name; // nullable
    private final byte[] payload;
    private final boolean compressed;
    private final Instant createdAt;
    private final Instant updatedAt;

    public StoredSpace(UUID id, String name, byte[] payload, boolean compressed,
                       Instant createdAt, Instant updatedAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name;
        this.payload = Arrays.copyOf(Objects.requireNonNull(payload, "payload"), payload.length);
        this.compressed = compressed;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.updatedAt = Objects.requireNonNull(updatedAt, "updatedAt");
    }

    /** Wrap a space whose payload has already been encoded into {@code storedPayload}. */
    public static StoredSpace of(Space space, byte[] storedPayload, boolean compressed) {
        return new StoredSpace(space.id(), space.name().orElse(null), storedPayload, compressed,
                space.createdAt(), space.updatedAt());
    }

    /** Rebuild the domain space around an already decoded payload. */
    public Space toSpace(byte[] decodedPayload) {
        return new Space(id, name, decodedPayload, createdAt, updatedAt);
    }

    @Override public UUID id() { return id; }

    public Optional<String> name() { return Optional.ofNullable(name); }

    public byte[] payload() { return Arrays.copyOf(payload, payload.length); }

    public int payloadSize() { return payload.length; }

    public boolean compressed() { return compressed; }

    public Instant createdAt() { return createdAt; }

    @Override public Instant updatedAt() { return updatedAt; }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StoredSpace s)) return false;
        return id.equals(s.id)
                && Objects.equals(name, s.name)
                && compressed == s.compressed
                && Arrays.equals(payload, s.payload)
                && createdAt.equals(s.createdAt)
                && updatedAt.equals(s.updatedAt);
    }

    @Override public int hashCode() {
        return Objects.hash(id, name, compressed, Arrays.hashCode(payload), createdAt, updatedAt);
    }

    @Override public String toString() {
        return "StoredSpace{id=" + id + ", name=" + name + ", bytes=" + payload.length
                + ", compressed=" + compressed + ", updatedAt=" + updatedAt + "}";
    }
}
