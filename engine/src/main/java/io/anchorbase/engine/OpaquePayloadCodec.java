package io.anchorbase.engine;

import java.util.Objects;

/** Accepts any non-empty payload without looking inside it. */
public final class OpaquePayloadCodec implements SpatialPayloadCodec {

    @Override
    public void validate(byte[] payload) {
        Objects.requireNonNull(payload, "payload");
        if (payload.length == 0) {
            throw new IllegalArgumentException("space payload must not be empty");
        }
    }

    @Override
    public int size(byte[] payload) {
        return payload.length;
    }
}
