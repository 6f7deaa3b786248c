package io.anchorbase.engine;

import io.anchorbase.storage.CompressionLevel;

import java.util.Objects;

/**
 * Engine configuration.
 *
 * @param backend          where records live besides the local store
 * @param syncStrategy     when local writes are pushed to the remote
 * @param compressionLevel how space payloads are stored
 */
public record StorageConfig(Backend backend, SyncStrategy syncStrategy, CompressionLevel compressionLevel) {

    public enum Backend {
        LOCAL_ONLY,
        REMOTE
    }

    public enum SyncStrategy {
        /** Only {@link StorageEngine#sync()} talks to the remote. */
        MANUAL,
        /** Every local write is also pushed immediately; failures go to the retry queue. */
        ON_SAVE
    }

    public StorageConfig {
        Objects.requireNonNull(backend, "backend");
        Objects.requireNonNull(syncStrategy, "syncStrategy");
        Objects.requireNonNull(compressionLevel, "compressionLevel");
    }

    /** Local only, manual sync, balanced compression. */
    public static StorageConfig defaults() {
        return new StorageConfig(Backend.LOCAL_ONLY, SyncStrategy.MANUAL, CompressionLevel.BALANCED);
    }

    public static StorageConfig remote(SyncStrategy strategy) {
        return new StorageConfig(Backend.REMOTE, strategy, CompressionLevel.BALANCED);
    }

    public StorageConfig withCompression(CompressionLevel level) {
        return new StorageConfig(backend, syncStrategy, level);
    }

    public boolean isRemote() { return backend == Backend.REMOTE; }

    public boolean syncsOnSave() { return syncStrategy == SyncStrategy.ON_SAVE; }
}
