package io.anchorbase.core;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Container for one opaque spatial payload and, by reference, its anchors.
 * <p>
 * The payload bytes are never interpreted here. Defensive copies are taken on
 * input and output so instances stay immutable.
 */
public final class Space implements Timestamped {
    private final UUID id;
    private final String name;   // nullable
    private final byte[] payload;
    private final Instant createdAt;
    private final Instant updatedAt;

    public Space(UUID id, String name, byte[] payload, Instant createdAt, Instant updatedAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name;
        Objects.requireNonNull(payload, "payload");
        this.payload = Arrays.copyOf(payload, payload.length);
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.updatedAt = Objects.requireNonNull(updatedAt, "updatedAt");
    }

    public static Space create(String name, byte[] payload) {
        Instant now = Instant.now();
        return new Space(UUID.randomUUID(), name, payload, now, now);
    }

    @Override public UUID id() { return id; }

    public Optional<String> name() { return Optional.ofNullable(name); }

    public byte[] payload() { return Arrays.copyOf(payload, payload.length); }

    public int payloadSize() { return payload.length; }

    public Instant createdAt() { return createdAt; }

    @Override public Instant updatedAt() { return updatedAt; }

    public Space withName(String newName) { return withName(newName, Instant.now()); }

    public Space withName(String newName, Instant at) {
        return new Space(id, newName, payload, createdAt, at);
    }

    public Space withPayload(byte[] newPayload) { return withPayload(newPayload, Instant.now()); }

    public Space withPayload(byte[] newPayload, Instant at) {
        return new Space(id, name, newPayload, createdAt, at);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Space s)) return false;
        return id.equals(s.id)
                && Objects.equals(name, s.name)
                && Arrays.equals(payload, s.payload)
                && createdAt.equals(s.createdAt)
                && updatedAt.equals(s.updatedAt);
    }

    @Override public int hashCode() {
        return Objects.hash(id, name, Arrays.hashCode(payload), createdAt, updatedAt);
    }

    @Override public String toString() {
        return "Space{id=" + id + ", name=" + name + ", payloadBytes=" + payload.length
                + ", updatedAt=" + updatedAt + "}";
    }
}
