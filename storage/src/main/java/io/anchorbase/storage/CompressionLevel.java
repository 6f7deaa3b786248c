package io.anchorbase.storage;

/** How space payloads are compressed before they are stored or uploaded. */
public enum CompressionLevel {
    /** Store bytes as given. */
    NONE,
    /** zlib deflate at the library default level. */
    BALANCED
}
