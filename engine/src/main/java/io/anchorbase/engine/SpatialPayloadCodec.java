package io.anchorbase.engine;

/**
 * Boundary to whatever produces space payloads (e.g. a serialized world map).
 * The engine only asks whether a payload is acceptable and how big it is.
 */
public interface SpatialPayloadCodec {

    /** @throws IllegalArgumentException when the payload must not be stored */
    void validate(byte[] payload);

    int size(byte[] payload);
}
