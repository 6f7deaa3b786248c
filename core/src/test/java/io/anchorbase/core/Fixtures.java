package io.anchorbase.core;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/** Small builders shared by the core tests. */
final class Fixtures {
    static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private Fixtures() {
    }

    static Instant at(long secondsAfterT0) {
        return T0.plusSeconds(secondsAfterT0);
    }

    static Anchor anchor(UUID spaceId, Transform t, Map<String, MetadataValue> md, Instant at) {
        return Anchor.create(UUID.randomUUID(), spaceId, t, md, at);
    }

    static Map<String, MetadataValue> text(String value) {
        return Map.of("text", MetadataValue.of(value));
    }
}
